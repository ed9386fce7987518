package com.dinoair.resilience.health;

@FunctionalInterface
public interface HealthChangeListener {

  void onStatusChange(String dependency, HealthStatus previous, HealthStatus current);
}
