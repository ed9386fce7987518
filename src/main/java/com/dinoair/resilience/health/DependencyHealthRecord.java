package com.dinoair.resilience.health;

import java.time.Instant;

/**
 * Cached result of the last probe of one dependency.
 */
public final class DependencyHealthRecord {
  private final String dependency;
  private final HealthStatus status;
  private final String lastMessage;
  private final long responseTimeMs;
  private final Instant timestamp;
  private final int consecutiveFailures;

  public DependencyHealthRecord(String dependency, HealthStatus status, String lastMessage, long responseTimeMs,
      Instant timestamp, int consecutiveFailures) {
    this.dependency = dependency;
    this.status = status;
    this.lastMessage = lastMessage;
    this.responseTimeMs = responseTimeMs;
    this.timestamp = timestamp;
    this.consecutiveFailures = consecutiveFailures;
  }

  static DependencyHealthRecord unknown(String dependency, Instant now) {
    return new DependencyHealthRecord(dependency, HealthStatus.UNKNOWN, "Not probed yet", 0, now, 0);
  }

  public String getDependency() { return dependency; }
  public HealthStatus getStatus() { return status; }
  public String getLastMessage() { return lastMessage; }
  public long getResponseTimeMs() { return responseTimeMs; }
  public Instant getTimestamp() { return timestamp; }
  public int getConsecutiveFailures() { return consecutiveFailures; }

  @Override
  public String toString() {
    return dependency + "=" + status + " (" + lastMessage + ", " + responseTimeMs + "ms at " + timestamp + ")";
  }
}
