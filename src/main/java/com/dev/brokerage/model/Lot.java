package com.dev.brokerage.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An unconsumed batch of shares from a single buy.
 *
 * <p>Lots are kept per security in purchase order and consumed oldest first when
 * shares are sold. A lot is a value: partial consumption produces a smaller copy.</p>
 */
public class Lot {

  private final String identifier;
  private final int quantity;
  private final BigDecimal price;

  /**
   * Constructs a Lot.
   *
   * @param identifier security ticker
   * @param quantity shares still unconsumed in this lot
   * @param price purchase price per share
   */
  public Lot(String identifier, int quantity, BigDecimal price) {
    this.identifier = identifier;
    this.quantity = quantity;
    this.price = price;
  }

  /**
   * Creates the lot recorded for an executed buy order.
   *
   * @param executedBuy the executed buy
   * @return a lot with the order's identifier, quantity and price
   */
  public static Lot fromOrder(Order executedBuy) {
    SecurityPosition p = executedBuy.getPosition();
    return new Lot(p.getIdentifier(), p.getQuantity(), p.getPrice());
  }

  public String getIdentifier() {
    return identifier;
  }

  public int getQuantity() {
    return quantity;
  }

  public BigDecimal getPrice() {
    return price;
  }

  /**
   * Returns a copy of this lot holding fewer shares.
   *
   * @param remaining shares left after consumption
   * @return the reduced lot
   */
  public Lot withQuantity(int remaining) {
    return new Lot(identifier, remaining, price);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Lot)) {
      return false;
    }
    Lot lot = (Lot) o;
    return quantity == lot.quantity
        && Objects.equals(identifier, lot.identifier)
        && (price == null ? lot.price == null
            : lot.price != null && price.compareTo(lot.price) == 0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, quantity,
        price == null ? null : price.stripTrailingZeros());
  }

  @Override
  public String toString() {
    return "Lot{"
        + "identifier='" + identifier + '\''
        + ", quantity=" + quantity
        + ", price=" + price
        + '}';
  }
}
