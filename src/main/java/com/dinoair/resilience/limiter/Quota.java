package com.dinoair.resilience.limiter;

import java.time.Duration;

/**
 * {@code limit} requests per {@code window}.
 */
public final class Quota {
  private final int limit;
  private final Duration window;

  public Quota(int limit, Duration window) {
    if (limit <= 0)
      throw new IllegalArgumentException("limit must be positive: " + limit);
    if (window.isNegative() || window.isZero())
      throw new IllegalArgumentException("window must be positive: " + window);
    this.limit = limit;
    this.window = window;
  }

  public static Quota perMinute(int limit) {
    return new Quota(limit, Duration.ofMinutes(1));
  }

  public static Quota of(int limit, Duration window) {
    return new Quota(limit, window);
  }

  public int getLimit() { return limit; }
  public Duration getWindow() { return window; }

  public long getWindowMs() {
    return window.toMillis();
  }

  @Override
  public String toString() {
    return limit + "/" + window;
  }
}
