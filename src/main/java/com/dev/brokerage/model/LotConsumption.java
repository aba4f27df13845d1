package com.dev.brokerage.model;

import java.math.BigDecimal;

/**
 * Outcome of consuming shares from a FIFO lot queue: how many shares were taken
 * and their total purchase value.
 */
public class LotConsumption {

  private final BigDecimal valueRemoved;
  private final int quantityRemoved;

  /**
   * Constructs a LotConsumption.
   *
   * @param valueRemoved sum of consumed shares times their lot price
   * @param quantityRemoved number of shares consumed
   */
  public LotConsumption(BigDecimal valueRemoved, int quantityRemoved) {
    this.valueRemoved = valueRemoved;
    this.quantityRemoved = quantityRemoved;
  }

  public BigDecimal getValueRemoved() {
    return valueRemoved;
  }

  public int getQuantityRemoved() {
    return quantityRemoved;
  }

  @Override
  public String toString() {
    return "LotConsumption{"
        + "valueRemoved=" + valueRemoved
        + ", quantityRemoved=" + quantityRemoved
        + '}';
  }
}
