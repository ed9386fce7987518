package com.dinoair.resilience.health;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class HealthReport {
  private final HealthStatus overallStatus;
  private final Instant timestamp;
  private final Map<String, DependencyHealth> dependencies;
  private final List<HealthEvent> recentEvents;

  HealthReport(HealthStatus overallStatus, Instant timestamp, Map<String, DependencyHealth> dependencies,
      List<HealthEvent> recentEvents) {
    this.overallStatus = overallStatus;
    this.timestamp = timestamp;
    this.dependencies = Collections.unmodifiableMap(dependencies);
    this.recentEvents = Collections.unmodifiableList(recentEvents);
  }

  public HealthStatus getOverallStatus() { return overallStatus; }
  public Instant getTimestamp() { return timestamp; }

  /** Keyed by dependency name, in registration order. */
  public Map<String, DependencyHealth> getDependencies() { return dependencies; }

  /** Latest probe outcomes, oldest first, at most {@link DependencyHealthAggregator#MAX_EVENTS}. */
  public List<HealthEvent> getRecentEvents() { return recentEvents; }

  public long count(HealthStatus status) {
    return dependencies.values().stream().filter(d -> d.getStatus() == status).count();
  }

  @Override
  public String toString() {
    return "HealthReport{" + overallStatus + ", " + dependencies.keySet() + " at " + timestamp + "}";
  }
}
