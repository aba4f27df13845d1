package com.dev.brokerage.model;

/**
 * The varieties of order that may be submitted to a {@code BrokerClient}.
 */
public enum OrderKind {
  /** Purchase of a security. */
  BUY,

  /** Sale of a security. */
  SELL
}
