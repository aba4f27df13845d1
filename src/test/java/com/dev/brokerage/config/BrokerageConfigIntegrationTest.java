package com.dev.brokerage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dev.brokerage.StartupDataLoader;
import com.dev.brokerage.model.Order;
import com.dev.brokerage.service.BrokerClient;
import com.dev.brokerage.service.LedgerReconciler;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * Boots the application context with the test profile and checks that the account
 * bean is seeded from configuration.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class BrokerageConfigIntegrationTest {

  @Autowired
  private BrokerClient brokerClient;

  @Autowired
  private LedgerReconciler ledgerReconciler;

  @Autowired
  private ApplicationContext context;

  @Test
  void brokerClient_startsWithConfiguredCashAndNoDemoActivity() {
    assertEquals(0, new BigDecimal("5000").compareTo(brokerClient.getInitialCashBalance()));
    assertTrue(brokerClient.getTransactions().isEmpty());
    assertTrue(context.getBeansOfType(StartupDataLoader.class).isEmpty());
  }

  @Test
  void brokerClient_tradesAndReconcilesThroughContextBeans() {
    assertEquals(50, brokerClient.submitOrder(Order.buy("IBM", 60, new BigDecimal("100"))));

    assertTrue(ledgerReconciler.reconcile(brokerClient).isClean());
  }
}
