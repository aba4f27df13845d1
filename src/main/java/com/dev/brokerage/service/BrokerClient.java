package com.dev.brokerage.service;

import com.dev.brokerage.exception.InvalidOrderException;
import com.dev.brokerage.model.Lot;
import com.dev.brokerage.model.LotConsumption;
import com.dev.brokerage.model.Order;
import com.dev.brokerage.model.OrderKind;
import com.dev.brokerage.model.SecurityPosition;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <b>BrokerClient</b>: a single brokerage account that buys and sells securities
 * in whole shares against a cash balance that can never be overdrawn.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Clamp each order to what the account can afford (buy) or holds (sell)</li>
 *   <li>Keep a weighted-average cost basis per security, recomputed on sells by
 *   consuming the oldest buy lots first</li>
 *   <li>Keep cash, portfolio, lot queues and the transaction log consistent</li>
 * </ul>
 *
 * <p>Orders that cannot be filled in full are filled partially rather than rejected;
 * an order that fills nothing changes nothing and is not logged.</p>
 *
 * <p>Instances are not thread-safe. Callers sharing an account across threads must
 * serialize every call, since a fill updates cash, portfolio and lots together.</p>
 */
public class BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(BrokerClient.class);

  private static final int SCALE = 10;

  private final BigDecimal initialCashBalance;
  private final OrderValidator orderValidator;
  private final FifoLotConsumer lotConsumer;

  private BigDecimal cashBalance;

  /** Current holdings keyed by identifier; prices are average cost. */
  private final Map<String, SecurityPosition> portfolio = new TreeMap<>();

  /** Exact purchase cost of the shares held, per identifier; averages are derived from it. */
  private final Map<String, BigDecimal> heldCost = new TreeMap<>();

  /** Unconsumed buy lots per identifier, oldest first. Queues are never removed. */
  private final Map<String, Deque<Lot>> lotQueues = new TreeMap<>();

  /** Executed orders in processing order. */
  private final List<Order> transactions = new ArrayList<>();

  /**
   * Creates an account with the given starting cash.
   *
   * @param initialCashBalance starting cash, must be zero or more
   */
  public BrokerClient(BigDecimal initialCashBalance) {
    this(initialCashBalance, new OrderValidator(), new FifoLotConsumer());
  }

  /**
   * Creates an account with explicit collaborators.
   *
   * @param initialCashBalance starting cash, must be zero or more
   * @param orderValidator rejects malformed orders
   * @param lotConsumer FIFO lot consumption used on sells
   */
  public BrokerClient(BigDecimal initialCashBalance, OrderValidator orderValidator,
                      FifoLotConsumer lotConsumer) {
    if (initialCashBalance == null || initialCashBalance.signum() < 0) {
      throw new IllegalArgumentException("Initial cash balance must be non-negative: "
          + initialCashBalance);
    }
    this.initialCashBalance = initialCashBalance;
    this.cashBalance = initialCashBalance;
    this.orderValidator = orderValidator;
    this.lotConsumer = lotConsumer;
  }

  /**
   * Submits an order to buy or sell a security.
   *
   * <p>A buy fills as many shares as the cash balance covers, a sell as many as the
   * account holds. Only whole shares are transacted. A single holding is capped at
   * {@link Integer#MAX_VALUE} shares, so a buy also fills no more than the room left
   * below that cap.</p>
   *
   * @param order the requested order
   * @return the number of shares actually bought or sold, possibly 0
   * @throws InvalidOrderException if the order is malformed
   */
  public int submitOrder(Order order) {
    try {
      orderValidator.validate(order);
    } catch (InvalidOrderException e) {
      log.warn("Rejected order {}: {}", order, e.getMessage());
      throw e;
    }

    int executedQty = order.getKind() == OrderKind.BUY
        ? affordableQuantity(order.getPosition())
        : sellableQuantity(order.getPosition());

    if (executedQty == 0) {
      log.debug("Order {} filled 0 shares, nothing recorded", order);
      return 0;
    }

    Order executed = order.withQuantity(executedQty);
    if (executed.getKind() == OrderKind.BUY) {
      handleBuy(executed);
    } else {
      handleSell(executed);
    }

    if (executedQty < order.getPosition().getQuantity()) {
      log.debug("Partial fill {} of {} shares for {}", executedQty,
          order.getPosition().getQuantity(), order);
    } else {
      log.debug("Filled {}", executed);
    }
    return executedQty;
  }

  private int affordableQuantity(SecurityPosition requested) {
    BigDecimal affordable = cashBalance.divide(requested.getPrice(), 0, RoundingMode.FLOOR);
    SecurityPosition held = portfolio.get(requested.getIdentifier());
    int room = held == null ? Integer.MAX_VALUE : Integer.MAX_VALUE - held.getQuantity();
    BigDecimal wanted = BigDecimal.valueOf(Math.min(requested.getQuantity(), room));
    return affordable.min(wanted).intValueExact();
  }

  private int sellableQuantity(SecurityPosition requested) {
    SecurityPosition held = portfolio.get(requested.getIdentifier());
    if (held == null) {
      return 0;
    }
    return Math.min(requested.getQuantity(), held.getQuantity());
  }

  /**
   * Applies an executed buy. The order must already be clamped to the cash balance.
   */
  private void handleBuy(Order order) {
    SecurityPosition bought = order.getPosition();
    String identifier = bought.getIdentifier();

    SecurityPosition existing = portfolio.get(identifier);
    if (existing == null) {
      portfolio.put(identifier, bought);
      heldCost.put(identifier, bought.notional());
    } else {
      int newQty = Math.addExact(existing.getQuantity(), bought.getQuantity());
      BigDecimal newCost = heldCost.get(identifier).add(bought.notional());
      portfolio.put(identifier, new SecurityPosition(identifier, newQty, average(newCost, newQty)));
      heldCost.put(identifier, newCost);
    }

    lotQueues.computeIfAbsent(identifier, k -> new ArrayDeque<>()).offerLast(Lot.fromOrder(order));

    cashBalance = cashBalance.subtract(bought.notional());
    transactions.add(order);
  }

  /**
   * Applies an executed sell. The order must already be clamped to the held quantity.
   */
  private void handleSell(Order order) {
    SecurityPosition sold = order.getPosition();
    String identifier = sold.getIdentifier();
    SecurityPosition existing = portfolio.get(identifier);

    LotConsumption consumed = lotConsumer.consume(lotQueues.get(identifier), sold.getQuantity());

    int newQty = existing.getQuantity() - sold.getQuantity();
    if (newQty == 0) {
      // full liquidation; the lot queue stays behind, empty
      portfolio.remove(identifier);
      heldCost.remove(identifier);
    } else {
      BigDecimal newCost = heldCost.get(identifier).subtract(consumed.getValueRemoved());
      portfolio.put(identifier, new SecurityPosition(identifier, newQty, average(newCost, newQty)));
      heldCost.put(identifier, newCost);
    }

    cashBalance = cashBalance.add(sold.notional());
    transactions.add(order);
  }

  private static BigDecimal average(BigDecimal totalCost, int quantity) {
    return totalCost.divide(BigDecimal.valueOf(quantity), SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Returns a snapshot of the current holdings, ordered by identifier.
   * Prices are the weighted-average cost of the shares still held.
   *
   * @return current positions (empty if none)
   */
  public List<SecurityPosition> getPositions() {
    return new ArrayList<>(portfolio.values());
  }

  /**
   * Returns the holding for one security.
   *
   * @param identifier security ticker
   * @return the position, or null if none is held
   */
  public SecurityPosition getPosition(String identifier) {
    return portfolio.get(identifier);
  }

  /**
   * Returns the unconsumed buy lots for a security, oldest first.
   *
   * @param identifier security ticker
   * @return snapshot of the lot queue (empty if the security was never bought)
   */
  public List<Lot> getOutstandingLots(String identifier) {
    Deque<Lot> queue = lotQueues.get(identifier);
    return queue == null ? Collections.emptyList() : new ArrayList<>(queue);
  }

  /**
   * Returns every executed order in processing order. Executed quantities may be
   * smaller than what was requested; orders that filled nothing are absent.
   *
   * @return the transaction log
   */
  public List<Order> getTransactions() {
    return Collections.unmodifiableList(new ArrayList<>(transactions));
  }

  public BigDecimal getCashBalance() {
    return cashBalance;
  }

  public BigDecimal getInitialCashBalance() {
    return initialCashBalance;
  }
}
