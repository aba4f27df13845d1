package com.dev.brokerage.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Represents a buy or sell order for a single security.
 *
 * <p>Orders are immutable. The transaction log holds the executed order, whose quantity
 * may be smaller than the one originally requested.</p>
 */
public class Order {

  private final OrderKind kind;
  private final SecurityPosition position;

  /**
   * Constructs an Order.
   *
   * @param kind buy or sell
   * @param position the security, requested quantity and price per share
   */
  public Order(OrderKind kind, SecurityPosition position) {
    this.kind = kind;
    this.position = position;
  }

  /**
   * Creates a buy order.
   *
   * @param identifier security ticker
   * @param quantity requested shares
   * @param price price per share
   * @return the order
   */
  public static Order buy(String identifier, int quantity, BigDecimal price) {
    return new Order(OrderKind.BUY, new SecurityPosition(identifier, quantity, price));
  }

  /**
   * Creates a sell order.
   *
   * @param identifier security ticker
   * @param quantity requested shares
   * @param price price per share
   * @return the order
   */
  public static Order sell(String identifier, int quantity, BigDecimal price) {
    return new Order(OrderKind.SELL, new SecurityPosition(identifier, quantity, price));
  }

  /**
   * Gets the order kind.
   *
   * @return buy or sell
   */
  public OrderKind getKind() {
    return kind;
  }

  /**
   * Gets the security, quantity and price of this order.
   *
   * @return the order position
   */
  public SecurityPosition getPosition() {
    return position;
  }

  /**
   * Returns a copy of this order with the given quantity, used to record the
   * portion of a request that was actually executed.
   *
   * @param executedQuantity shares actually transacted
   * @return the executed order
   */
  public Order withQuantity(int executedQuantity) {
    return new Order(kind, position.withQuantity(executedQuantity));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Order)) {
      return false;
    }
    Order that = (Order) o;
    return kind == that.kind && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, position);
  }

  @Override
  public String toString() {
    return "Order{"
        + "kind=" + kind
        + ", position=" + position
        + '}';
  }
}
