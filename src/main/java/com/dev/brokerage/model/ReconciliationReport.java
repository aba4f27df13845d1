package com.dev.brokerage.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of checking a ledger for internal consistency.
 */
public class ReconciliationReport {

  private final BigDecimal expectedCashBalance;
  private final BigDecimal actualCashBalance;
  private final List<String> breaks;

  /**
   * Constructs a ReconciliationReport.
   *
   * @param expectedCashBalance cash implied by the initial balance and the transaction log
   * @param actualCashBalance cash the account reports
   * @param breaks descriptions of every inconsistency found
   */
  public ReconciliationReport(BigDecimal expectedCashBalance, BigDecimal actualCashBalance,
                              List<String> breaks) {
    this.expectedCashBalance = expectedCashBalance;
    this.actualCashBalance = actualCashBalance;
    this.breaks = Collections.unmodifiableList(new ArrayList<>(breaks));
  }

  public BigDecimal getExpectedCashBalance() {
    return expectedCashBalance;
  }

  public BigDecimal getActualCashBalance() {
    return actualCashBalance;
  }

  public List<String> getBreaks() {
    return breaks;
  }

  /**
   * Returns whether no inconsistency was found.
   *
   * @return true if the ledger reconciles
   */
  public boolean isClean() {
    return breaks.isEmpty();
  }

  @Override
  public String toString() {
    return "ReconciliationReport{"
        + "expectedCashBalance=" + expectedCashBalance
        + ", actualCashBalance=" + actualCashBalance
        + ", breaks=" + breaks
        + '}';
  }
}
