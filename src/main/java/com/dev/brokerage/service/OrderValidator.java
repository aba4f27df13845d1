package com.dev.brokerage.service;

import com.dev.brokerage.exception.InvalidOrderException;
import com.dev.brokerage.model.Order;
import com.dev.brokerage.model.SecurityPosition;
import java.math.BigDecimal;

/**
 * Validates the shape of an order before it reaches the ledger.
 *
 * <p>Only malformed input is rejected. Whether the account can afford or hold enough
 * shares is decided later by clamping, not here.</p>
 */
public class OrderValidator {

  /**
   * Validates an order.
   *
   * @param order the order to validate
   * @throws InvalidOrderException if the order is malformed
   */
  public void validate(Order order) {
    if (order == null) {
      throw new InvalidOrderException("Order must not be null");
    }
    if (order.getKind() == null) {
      throw new InvalidOrderException("Order kind must be BUY or SELL");
    }

    SecurityPosition position = order.getPosition();
    if (position == null) {
      throw new InvalidOrderException("Order must specify a security position");
    }

    String identifier = position.getIdentifier();
    if (identifier == null || identifier.isEmpty()) {
      throw new InvalidOrderException("Security identifier must not be empty");
    }

    if (position.getQuantity() < 0) {
      throw new InvalidOrderException("Order quantity " + position.getQuantity()
          + " for " + identifier + " must not be negative");
    }

    // A zero price would let a buy fill without any cash constraint.
    BigDecimal price = position.getPrice();
    if (price == null || price.signum() <= 0) {
      throw new InvalidOrderException("Order price " + price
          + " for " + identifier + " must be positive");
    }
  }
}
