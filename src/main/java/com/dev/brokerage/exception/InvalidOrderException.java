package com.dev.brokerage.exception;

/**
 * Thrown when a submitted order is malformed, for example a negative quantity or a
 * missing price. An order that simply cannot be filled in full is not an error and
 * never raises this exception.
 */
public class InvalidOrderException extends RuntimeException {

  /**
   * Constructs an InvalidOrderException with the specified detail message.
   *
   * @param message the detail message
   */
  public InvalidOrderException(String message) {
    super(message);
  }
}
