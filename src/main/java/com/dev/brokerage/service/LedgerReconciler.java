package com.dev.brokerage.service;

import com.dev.brokerage.model.Lot;
import com.dev.brokerage.model.Order;
import com.dev.brokerage.model.OrderKind;
import com.dev.brokerage.model.ReconciliationReport;
import com.dev.brokerage.model.SecurityPosition;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * <b>LedgerReconciler</b>: cross-checks the records a {@link BrokerClient} keeps.
 *
 * <p>Checks performed:</p>
 * <ul>
 *   <li>Cash equals the initial balance minus buys plus sells over the transaction log</li>
 *   <li>Each holding's quantity equals the sum of its outstanding lots</li>
 *   <li>A traded security that is no longer held has no outstanding lots</li>
 *   <li>No logged transaction has a zero quantity</li>
 * </ul>
 */
public class LedgerReconciler {

  /**
   * Reconciles an account.
   *
   * @param client the account to check
   * @return report listing every break found
   */
  public ReconciliationReport reconcile(BrokerClient client) {
    List<String> breaks = new ArrayList<>();

    BigDecimal expectedCash = client.getInitialCashBalance();
    Set<String> traded = new LinkedHashSet<>();
    for (Order tx : client.getTransactions()) {
      SecurityPosition p = tx.getPosition();
      traded.add(p.getIdentifier());
      if (p.getQuantity() == 0) {
        breaks.add("Zero-quantity transaction logged: " + tx);
      }
      expectedCash = tx.getKind() == OrderKind.BUY
          ? expectedCash.subtract(p.notional())
          : expectedCash.add(p.notional());
    }

    BigDecimal actualCash = client.getCashBalance();
    if (expectedCash.compareTo(actualCash) != 0) {
      breaks.add("Cash balance " + actualCash + " does not match " + expectedCash
          + " implied by transactions");
    }

    for (SecurityPosition held : client.getPositions()) {
      traded.remove(held.getIdentifier());
      long lotQty = lotQuantity(client.getOutstandingLots(held.getIdentifier()));
      if (lotQty != held.getQuantity()) {
        breaks.add(held.getIdentifier() + " holds " + held.getQuantity()
            + " shares but outstanding lots total " + lotQty);
      }
    }

    for (String identifier : traded) {
      long lotQty = lotQuantity(client.getOutstandingLots(identifier));
      if (lotQty != 0) {
        breaks.add(identifier + " is not held but outstanding lots total " + lotQty);
      }
    }

    return new ReconciliationReport(expectedCash, actualCash, breaks);
  }

  private static long lotQuantity(List<Lot> lots) {
    long total = 0;
    for (Lot lot : lots) {
      total += lot.getQuantity();
    }
    return total;
  }
}
