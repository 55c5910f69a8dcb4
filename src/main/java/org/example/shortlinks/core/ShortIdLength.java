package org.example.shortlinks.core;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide length of newly generated short ids.
 *
 * <p>The value only grows. Concurrent creators that escalate at the same time both end up at the
 * larger of their values; a slower caller can never lower it.
 */
public final class ShortIdLength {

  private final AtomicInteger value;

  /**
   * @param initial starting length, at least 1
   */
  public ShortIdLength(int initial) {
    if (initial < 1) throw new IllegalArgumentException("shortIdLength must be >= 1: " + initial);
    this.value = new AtomicInteger(initial);
  }

  public int get() {
    return value.get();
  }

  /**
   * Sets the length to {@code candidate} if that is larger than the current value.
   *
   * @param candidate proposed length
   * @return the length after the update, never smaller than {@code candidate}
   */
  public int raiseTo(int candidate) {
    return value.accumulateAndGet(candidate, Math::max);
  }

  @Override
  public String toString() {
    return String.valueOf(value.get());
  }
}
