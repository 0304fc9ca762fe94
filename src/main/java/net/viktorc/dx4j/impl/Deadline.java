package net.viktorc.dx4j.impl;

import java.util.concurrent.TimeUnit;

/**
 * An optional point in time, measured by {@link System#nanoTime()}, by which an operation spanning multiple waits has to complete.
 *
 * @author Viktor Csomor
 */
final class Deadline {

  private static final Deadline NONE = new Deadline(false, 0L);

  private final boolean set;
  private final long nanoTime;

  /**
   * Constructs a deadline.
   *
   * @param set Whether there is a deadline.
   * @param nanoTime The value of {@link System#nanoTime()} at the deadline.
   */
  private Deadline(boolean set, long nanoTime) {
    this.set = set;
    this.nanoTime = nanoTime;
  }

  /**
   * Returns a deadline the specified amount of time from now or no deadline if the amount is negative.
   *
   * @param timeout The amount of time until the deadline.
   * @param unit The time unit of the amount.
   * @return The deadline.
   */
  static Deadline after(long timeout, TimeUnit unit) {
    if (timeout < 0) {
      return NONE;
    }
    // Capped to keep the sum from overflowing.
    long timeoutNs = Math.min(unit.toNanos(timeout), Long.MAX_VALUE / 4);
    return new Deadline(true, System.nanoTime() + timeoutNs);
  }

  /**
   * Returns whether there is a deadline.
   *
   * @return Whether the deadline is set.
   */
  boolean isSet() {
    return set;
  }

  /**
   * Returns the number of nanoseconds left until the deadline. It is negative if the deadline has passed.
   *
   * @return The remaining time.
   */
  long getRemainingNanos() {
    return nanoTime - System.nanoTime();
  }

}
