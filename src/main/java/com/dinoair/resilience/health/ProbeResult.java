package com.dinoair.resilience.health;

/**
 * What a {@link HealthProbe} found. A probe that cannot reach its dependency should fail its future
 * instead, so the breaker counts it.
 */
public final class ProbeResult {
  private final boolean healthy;
  private final String message;

  private ProbeResult(boolean healthy, String message) {
    this.healthy = healthy;
    this.message = message;
  }

  public static ProbeResult healthy(String message) {
    return new ProbeResult(true, message);
  }

  public static ProbeResult unhealthy(String message) {
    return new ProbeResult(false, message);
  }

  public boolean isHealthy() { return healthy; }
  public String getMessage() { return message; }
}
