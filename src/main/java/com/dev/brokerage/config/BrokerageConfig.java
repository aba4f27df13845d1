package com.dev.brokerage.config;

import com.dev.brokerage.service.BrokerClient;
import com.dev.brokerage.service.FifoLotConsumer;
import com.dev.brokerage.service.LedgerReconciler;
import com.dev.brokerage.service.OrderValidator;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the brokerage account and its collaborators.
 *
 * <p>The starting cash comes from {@code brokerage.initial-cash-balance}.</p>
 */
@Configuration
public class BrokerageConfig {

  @Bean
  public OrderValidator orderValidator() {
    return new OrderValidator();
  }

  @Bean
  public FifoLotConsumer fifoLotConsumer() {
    return new FifoLotConsumer();
  }

  @Bean
  public LedgerReconciler ledgerReconciler() {
    return new LedgerReconciler();
  }

  /**
   * Creates the account used by the application.
   *
   * @param initialCashBalance starting cash
   * @param orderValidator order shape validation
   * @param fifoLotConsumer lot consumption for sells
   * @return the account
   */
  @Bean
  public BrokerClient brokerClient(
      @Value("${brokerage.initial-cash-balance:10000}") BigDecimal initialCashBalance,
      OrderValidator orderValidator,
      FifoLotConsumer fifoLotConsumer) {
    return new BrokerClient(initialCashBalance, orderValidator, fifoLotConsumer);
  }
}
