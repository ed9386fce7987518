package com.dinoair.resilience.health;

public enum HealthStatus {
  HEALTHY,
  /** Some dependencies are down but most are up. Only used for the overall status. */
  DEGRADED,
  UNHEALTHY,
  /** Not probed yet. */
  UNKNOWN
}
