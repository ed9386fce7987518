package com.dinoair.resilience.health;

import com.dinoair.resilience.breaker.CircuitBreakerSnapshot;

/**
 * One dependency's entry in a {@link HealthReport}: the cached probe record next to the state of
 * its breaker.
 */
public final class DependencyHealth {
  private final DependencyHealthRecord record;
  private final CircuitBreakerSnapshot breaker;
  private final boolean stale;

  DependencyHealth(DependencyHealthRecord record, CircuitBreakerSnapshot breaker, boolean stale) {
    this.record = record;
    this.breaker = breaker;
    this.stale = stale;
  }

  public DependencyHealthRecord getRecord() { return record; }
  public CircuitBreakerSnapshot getBreaker() { return breaker; }

  public HealthStatus getStatus() {
    return record.getStatus();
  }

  /** True when no probe has refreshed the record for longer than twice the TTL. */
  public boolean isStale() { return stale; }
}
