package net.viktorc.dx4j.api;

import java.util.concurrent.TimeoutException;

/**
 * An exception thrown by a {@link ResultIterator} if its results could not all be produced before the deadline of the mapping.
 *
 * @author Viktor Csomor
 */
public class UncheckedTimeoutException extends RuntimeException {

  /**
   * Constructs a wrapper for the specified exception.
   *
   * @param e The source exception.
   */
  public UncheckedTimeoutException(TimeoutException e) {
    super(e.getMessage(), e);
  }

  @Override
  public synchronized TimeoutException getCause() {
    return (TimeoutException) super.getCause();
  }

}
