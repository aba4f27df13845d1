package com.dev.brokerage.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class OrderTest {

  @Test
  void withQuantity_keepsKindIdentifierAndPrice() {
    Order requested = Order.sell("AAPL", 10, new BigDecimal("60"));

    Order executed = requested.withQuantity(4);

    assertEquals(OrderKind.SELL, executed.getKind());
    assertEquals("AAPL", executed.getPosition().getIdentifier());
    assertEquals(4, executed.getPosition().getQuantity());
    assertEquals(10, requested.getPosition().getQuantity());
  }

  @Test
  void equals_comparesPricesNumerically() {
    SecurityPosition a = new SecurityPosition("AAPL", 10, new BigDecimal("42.5"));
    SecurityPosition b = new SecurityPosition("AAPL", 10, new BigDecimal("42.5000000000"));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(Order.buy("AAPL", 1, BigDecimal.ONE), Order.sell("AAPL", 1, BigDecimal.ONE));
  }

  @Test
  void notional_isPriceTimesQuantity() {
    SecurityPosition p = new SecurityPosition("AMZN", 5, new BigDecimal("140.20"));

    assertEquals(0, new BigDecimal("701.00").compareTo(p.notional()));
  }
}
