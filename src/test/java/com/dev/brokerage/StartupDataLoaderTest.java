package com.dev.brokerage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dev.brokerage.model.Order;
import com.dev.brokerage.model.ReconciliationReport;
import com.dev.brokerage.model.SecurityPosition;
import com.dev.brokerage.service.BrokerClient;
import com.dev.brokerage.service.LedgerReconciler;
import java.math.BigDecimal;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartupDataLoaderTest {

  @Mock
  private BrokerClient brokerClient;

  @Mock
  private LedgerReconciler ledgerReconciler;

  @Test
  void init_submitsEveryDemoOrderAndReconciles() {
    when(brokerClient.submitOrder(any(Order.class))).thenReturn(1);
    when(brokerClient.getPositions()).thenReturn(Collections.emptyList());
    when(brokerClient.getCashBalance()).thenReturn(BigDecimal.TEN);
    when(ledgerReconciler.reconcile(brokerClient)).thenReturn(
        new ReconciliationReport(BigDecimal.TEN, BigDecimal.TEN, Collections.emptyList()));

    new StartupDataLoader(brokerClient, ledgerReconciler).init();

    verify(brokerClient, times(StartupDataLoader.demoOrders().size()))
        .submitOrder(any(Order.class));
    verify(ledgerReconciler).reconcile(brokerClient);
  }

  @Test
  void demoOrders_leaveARealAccountConsistent() {
    BrokerClient real = new BrokerClient(new BigDecimal("10000"));

    new StartupDataLoader(real, new LedgerReconciler()).init();

    assertTrue(new LedgerReconciler().reconcile(real).isClean());
    // AAPL 10 @ 42.5 plus 49 @ 190 from the clamped final buy
    SecurityPosition aapl = real.getPosition("AAPL");
    assertEquals(59, aapl.getQuantity());
    assertEquals(new SecurityPosition("AMZN", 5, new BigDecimal("140")),
        real.getPosition("AMZN"));
    assertEquals(0, new BigDecimal("165").compareTo(real.getCashBalance()));
  }
}
