package com.dev.brokerage.service;

import com.dev.brokerage.model.Lot;
import com.dev.brokerage.model.LotConsumption;
import java.math.BigDecimal;
import java.util.Deque;

/**
 * Removes shares from a per-security lot queue, oldest lot first.
 *
 * <p>Whole lots are popped off the front of the queue. When a sale only needs part of
 * the front lot, that lot is replaced by a copy holding the remaining shares and
 * consumption stops.</p>
 */
public class FifoLotConsumer {

  /**
   * Consumes {@code quantity} shares from the front of {@code queue}.
   *
   * @param queue lots for one security, oldest first; modified in place
   * @param quantity shares to consume
   * @return total quantity and purchase value consumed
   * @throws IllegalStateException if the queue holds fewer than {@code quantity} shares
   */
  public LotConsumption consume(Deque<Lot> queue, int quantity) {
    BigDecimal valueRemoved = BigDecimal.ZERO;
    int quantityRemoved = 0;

    while (quantityRemoved < quantity) {
      Lot front = queue.peekFirst();
      if (front == null) {
        throw new IllegalStateException("Lot queue exhausted after " + quantityRemoved
            + " of " + quantity + " shares");
      }

      int remaining = quantity - quantityRemoved;
      int taken = Math.min(remaining, front.getQuantity());
      valueRemoved = valueRemoved.add(front.getPrice().multiply(BigDecimal.valueOf(taken)));
      quantityRemoved += taken;

      queue.pollFirst();
      if (taken < front.getQuantity()) {
        queue.offerFirst(front.withQuantity(front.getQuantity() - taken));
      }
    }

    return new LotConsumption(valueRemoved, quantityRemoved);
  }
}
