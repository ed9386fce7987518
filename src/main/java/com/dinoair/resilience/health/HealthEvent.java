package com.dinoair.resilience.health;

import java.time.Instant;

/**
 * One probe outcome in the aggregator's event history.
 */
public final class HealthEvent {
  private final String dependency;
  private final HealthStatus previous;
  private final HealthStatus status;
  private final String message;
  private final Instant timestamp;

  public HealthEvent(String dependency, HealthStatus previous, HealthStatus status, String message,
      Instant timestamp) {
    this.dependency = dependency;
    this.previous = previous;
    this.status = status;
    this.message = message;
    this.timestamp = timestamp;
  }

  public String getDependency() { return dependency; }
  public HealthStatus getPrevious() { return previous; }
  public HealthStatus getStatus() { return status; }
  public String getMessage() { return message; }
  public Instant getTimestamp() { return timestamp; }

  public boolean isStatusChange() {
    return previous != status;
  }

  @Override
  public String toString() {
    return timestamp + " " + dependency + " " + previous + "->" + status + ": " + message;
  }
}
