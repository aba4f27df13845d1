package com.dev.brokerage;

import com.dev.brokerage.model.Order;
import com.dev.brokerage.model.ReconciliationReport;
import com.dev.brokerage.model.SecurityPosition;
import com.dev.brokerage.service.BrokerClient;
import com.dev.brokerage.service.LedgerReconciler;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Replays a short demo order sequence against the account at startup.
 * Enabled with {@code brokerage.demo.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "brokerage.demo", name = "enabled", havingValue = "true")
public class StartupDataLoader {

  private static final Logger log = LoggerFactory.getLogger(StartupDataLoader.class);

  private final BrokerClient brokerClient;
  private final LedgerReconciler ledgerReconciler;

  /**
   * Creates a new data loader used to seed demo trading data.
   *
   * @param brokerClient the account orders are submitted to
   * @param ledgerReconciler checks the account after the demo run
   */
  public StartupDataLoader(BrokerClient brokerClient, LedgerReconciler ledgerReconciler) {
    this.brokerClient = brokerClient;
    this.ledgerReconciler = ledgerReconciler;
  }

  /**
   * Demo orders, in submission order. The last AAPL buy and the MSFT sell exercise
   * the partial-fill and nothing-held paths.
   *
   * @return the demo orders
   */
  static List<Order> demoOrders() {
    return List.of(
        Order.buy("AAPL", 10, new BigDecimal("10")),
        Order.buy("AAPL", 10, new BigDecimal("40")),
        Order.sell("AAPL", 5, new BigDecimal("60")),
        Order.buy("AMZN", 5, new BigDecimal("140")),
        Order.sell("AAPL", 10, new BigDecimal("60")),
        Order.buy("AAPL", 5, new BigDecimal("45")),
        Order.sell("MSFT", 3, new BigDecimal("300")),
        Order.buy("AAPL", 1_000_000, new BigDecimal("190")));
  }

  /**
   * Submits the demo orders and logs the resulting account state.
   */
  @PostConstruct
  public void init() {
    log.info("=== Demo run, starting cash {} ===", brokerClient.getCashBalance());

    for (Order order : demoOrders()) {
      int filled = brokerClient.submitOrder(order);
      log.info("{} {} x{} @ {} -> filled {}", order.getKind(),
          order.getPosition().getIdentifier(), order.getPosition().getQuantity(),
          order.getPosition().getPrice(), filled);
    }

    for (SecurityPosition position : brokerClient.getPositions()) {
      log.info("{} qty = {} @ avg {}", position.getIdentifier(), position.getQuantity(),
          position.getPrice().stripTrailingZeros().toPlainString());
    }
    log.info("cash = {}", brokerClient.getCashBalance());

    ReconciliationReport report = ledgerReconciler.reconcile(brokerClient);
    if (report.isClean()) {
      log.info("Ledger reconciles across {} transactions",
          brokerClient.getTransactions().size());
    } else {
      log.warn("Ledger breaks after demo run: {}", report.getBreaks());
    }
  }
}
