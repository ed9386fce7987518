package com.dinoair.resilience.health;

/** Told when the aggregate status of all monitored dependencies changes. */
@FunctionalInterface
public interface OverallStatusListener {

  void onOverallStatusChange(HealthStatus previous, HealthStatus current);
}
