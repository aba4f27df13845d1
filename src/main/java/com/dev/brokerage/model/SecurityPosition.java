package com.dev.brokerage.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * This class defines the SecurityPosition model.
 *
 * <p>The meaning of the price depends on where the position appears: for a portfolio
 * holding it is the weighted-average cost basis, for an order it is the price per share
 * the order was requested or executed at.</p>
 */
public class SecurityPosition {

  private final String identifier;
  private final int quantity;
  private final BigDecimal price;

  /**
   * Constructs a new SecurityPosition object.
   *
   * @param identifier the ticker of the security, e.g. "AAPL"
   * @param quantity number of shares
   * @param price price per share
   */
  public SecurityPosition(String identifier, int quantity, BigDecimal price) {
    this.identifier = identifier;
    this.quantity = quantity;
    this.price = price;
  }

  /**
   * Returns the ticker identifying this security.
   * Identifiers are case-sensitive and assumed globally unique.
   *
   * @return the security identifier
   */
  public String getIdentifier() {
    return identifier;
  }

  /**
   * Returns the number of whole shares in this position.
   *
   * @return the share quantity
   */
  public int getQuantity() {
    return quantity;
  }

  /**
   * Returns the price per share.
   *
   * @return the price per share
   */
  public BigDecimal getPrice() {
    return price;
  }

  /**
   * Returns a copy of this position carrying a different quantity.
   *
   * @param newQuantity the quantity of the copy
   * @return a new position with the same identifier and price
   */
  public SecurityPosition withQuantity(int newQuantity) {
    return new SecurityPosition(identifier, newQuantity, price);
  }

  /**
   * Returns the total value of this position, price times quantity.
   *
   * @return the notional value
   */
  public BigDecimal notional() {
    return price.multiply(BigDecimal.valueOf(quantity));
  }

  // Prices compare numerically so 42.5 equals 42.5000000000.
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SecurityPosition)) {
      return false;
    }
    SecurityPosition that = (SecurityPosition) o;
    return quantity == that.quantity
        && Objects.equals(identifier, that.identifier)
        && (price == null ? that.price == null
            : that.price != null && price.compareTo(that.price) == 0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, quantity,
        price == null ? null : price.stripTrailingZeros());
  }

  @Override
  public String toString() {
    return "SecurityPosition{"
        + "identifier='" + identifier + '\''
        + ", quantity=" + quantity
        + ", price=" + price
        + '}';
  }
}
