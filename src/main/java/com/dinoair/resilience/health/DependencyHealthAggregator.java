package com.dinoair.resilience.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.breaker.CallResult;
import com.dinoair.resilience.breaker.CircuitBreaker;
import com.dinoair.resilience.breaker.CircuitBreakerRegistry;
import com.dinoair.resilience.metrics.MetricNames;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.scheduling.ScheduledTask;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * Probes each dependency on a timer and serves the cached results.
 *
 * <p>The cycle runs every half TTL. A healthy record is re-probed once it is a TTL old, a failed one
 * after half a TTL. Probes go through the dependency's breaker; when the circuit is open the probe
 * is not sent and the record says so. {@link #getReport()} never waits on a probe.
 *
 * <p>Every probe outcome is appended to a history of the last {@link #MAX_EVENTS} events.
 */
public class DependencyHealthAggregator implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(DependencyHealthAggregator.class);
  public static final int MAX_EVENTS = 50;

  private final CircuitBreakerRegistry breakers;
  private final Scheduler scheduler;
  private final Clock clock;
  private final long ttlMs;
  private final MetricPublisher metrics;
  private final HealthChangeListener listener;
  private final OverallStatusListener overallListener;

  private final Map<String, HealthProbe> probes = new LinkedHashMap<>();
  private final ConcurrentHashMap<String, DependencyHealthRecord> records = new ConcurrentHashMap<>();
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
  private final Deque<HealthEvent> events = new ArrayDeque<>();
  // guarded by events
  private HealthStatus lastOverall = HealthStatus.UNKNOWN;
  private volatile ScheduledTask cycle;

  private DependencyHealthAggregator(Builder builder) {
    this.breakers = Objects.requireNonNull(builder.breakers, "breakers");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.clock = scheduler.clock();
    this.ttlMs = builder.ttl.toMillis();
    this.metrics = builder.metrics;
    this.listener = builder.listener;
    this.overallListener = builder.overallListener;
    if (ttlMs < 2)
      throw new IllegalArgumentException("ttl too short: " + builder.ttl);
  }

  public static Builder newBuilder(CircuitBreakerRegistry breakers, Scheduler scheduler) {
    return new Builder(breakers, scheduler);
  }

  /**
   * Adds a dependency to the probe cycle.
   *
   * @throws IllegalArgumentException if the registry has no breaker for it
   */
  public synchronized DependencyHealthAggregator register(String dependency, HealthProbe probe) {
    breakers.get(dependency);
    probes.put(dependency, Objects.requireNonNull(probe, "probe"));
    records.putIfAbsent(dependency, DependencyHealthRecord.unknown(dependency, clock.instant()));
    return this;
  }

  /** Probes everything once, then keeps the cycle running. */
  public synchronized void start() {
    if (cycle != null)
      return;
    cycle = scheduler.scheduleAtFixedRate(this::runCycle, ttlMs / 2);
    probeAll();
  }

  public synchronized void stop() {
    if (cycle != null) {
      cycle.cancel();
      cycle = null;
    }
  }

  @Override
  public void close() {
    stop();
  }

  /** Probes every dependency whose record has expired. */
  void runCycle() {
    long now = clock.millis();
    for (Map.Entry<String, HealthProbe> e : probeEntries()) {
      DependencyHealthRecord record = records.get(e.getKey());
      if (record == null || isExpired(record, now))
        probe(e.getKey(), e.getValue());
    }
  }

  /** Probes every dependency now, regardless of age. Completes when all probes have settled. */
  public CompletableFuture<Void> probeAll() {
    List<CompletableFuture<Void>> pending = new ArrayList<>();
    for (Map.Entry<String, HealthProbe> e : probeEntries())
      pending.add(probe(e.getKey(), e.getValue()));
    return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
  }

  private synchronized List<Map.Entry<String, HealthProbe>> probeEntries() {
    return new ArrayList<>(probes.entrySet());
  }

  private boolean isExpired(DependencyHealthRecord record, long now) {
    long age = now - record.getTimestamp().toEpochMilli();
    if (record.getStatus() == HealthStatus.UNKNOWN)
      return true;
    return record.getStatus() == HealthStatus.HEALTHY ? age >= ttlMs : age >= ttlMs / 2;
  }

  private CompletableFuture<Void> probe(String dependency, HealthProbe probe) {
    if (!inFlight.add(dependency))
      return CompletableFuture.completedFuture(null);
    CircuitBreaker breaker = breakers.get(dependency);
    long started = clock.millis();
    return breaker.<ProbeResult>call(probe::check,
            () -> CompletableFuture.completedFuture(ProbeResult.unhealthy("Circuit open, probe skipped")))
        .thenAccept(result -> {
          long elapsed = clock.millis() - started;
          update(dependency, toStatus(result), toMessage(result), elapsed);
        })
        .whenComplete((v, error) -> {
          inFlight.remove(dependency);
          if (error != null)
            logger.warn("Health probe bookkeeping for {} failed", dependency, error);
        });
  }

  private static HealthStatus toStatus(CallResult<ProbeResult> result) {
    switch (result.getKind()) {
      case SUCCESS:
        return result.getValue() != null && result.getValue().isHealthy() ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
      default:
        return HealthStatus.UNHEALTHY;
    }
  }

  private static String toMessage(CallResult<ProbeResult> result) {
    switch (result.getKind()) {
      case SUCCESS:
      case FALLBACK:
        return result.getValue() == null ? "No probe result" : result.getValue().getMessage();
      case REJECTED:
        return result.getRejection().toString();
      default:
        Throwable cause = result.getCause();
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
  }

  private void update(String dependency, HealthStatus status, String message, long responseTimeMs) {
    DependencyHealthRecord previous = records.get(dependency);
    int failures = status == HealthStatus.HEALTHY ? 0
        : (previous == null ? 0 : previous.getConsecutiveFailures()) + 1;
    DependencyHealthRecord next = new DependencyHealthRecord(dependency, status, message, responseTimeMs,
        clock.instant(), failures);
    records.put(dependency, next);
    metrics.gauge(MetricNames.DEPENDENCY_HEALTHY, dependency, status == HealthStatus.HEALTHY ? 1 : 0);

    HealthStatus before = previous == null ? HealthStatus.UNKNOWN : previous.getStatus();
    HealthStatus overallBefore;
    HealthStatus overallNow;
    List<Map.Entry<String, HealthProbe>> monitored = probeEntries();
    synchronized (events) {
      events.addLast(new HealthEvent(dependency, before, status, message, next.getTimestamp()));
      while (events.size() > MAX_EVENTS)
        events.removeFirst();
      overallBefore = lastOverall;
      overallNow = overallOf(currentStatuses(monitored));
      lastOverall = overallNow;
    }
    if (before != status) {
      if (status == HealthStatus.HEALTHY)
        logger.info("Dependency {} is healthy again ({}ms)", dependency, responseTimeMs);
      else
        logger.warn("Dependency {} is {}: {}", dependency, status, message);
      try {
        listener.onStatusChange(dependency, before, status);
      } catch (RuntimeException e) {
        logger.warn("Health change listener failed for {}", dependency, e);
      }
    }
    if (overallBefore != overallNow) {
      logger.info("Overall dependency health {} -> {}", overallBefore, overallNow);
      try {
        overallListener.onOverallStatusChange(overallBefore, overallNow);
      } catch (RuntimeException e) {
        logger.warn("Overall health listener failed", e);
      }
    }
  }

  private List<HealthStatus> currentStatuses(List<Map.Entry<String, HealthProbe>> monitored) {
    List<HealthStatus> statuses = new ArrayList<>();
    for (Map.Entry<String, HealthProbe> e : monitored) {
      DependencyHealthRecord record = records.get(e.getKey());
      statuses.add(record == null ? HealthStatus.UNKNOWN : record.getStatus());
    }
    return statuses;
  }

  /** Probe outcomes, oldest first. */
  public List<HealthEvent> recentEvents() {
    synchronized (events) {
      return new ArrayList<>(events);
    }
  }

  /** Last cached state of every registered dependency. Never blocks on a probe. */
  public HealthReport getReport() {
    long now = clock.millis();
    Map<String, DependencyHealth> entries = new LinkedHashMap<>();
    for (Map.Entry<String, HealthProbe> e : probeEntries()) {
      String dependency = e.getKey();
      DependencyHealthRecord record = records.get(dependency);
      if (record == null)
        record = DependencyHealthRecord.unknown(dependency, clock.instant());
      boolean stale = record.getStatus() != HealthStatus.UNKNOWN
          && now - record.getTimestamp().toEpochMilli() > 2 * ttlMs;
      entries.put(dependency, new DependencyHealth(record, breakers.get(dependency).snapshot(), stale));
    }
    return new HealthReport(overallStatus(entries.values()), Instant.ofEpochMilli(now), entries, recentEvents());
  }

  /**
   * All healthy: HEALTHY. Healthy ones a strict majority: DEGRADED. Otherwise UNHEALTHY. Nothing
   * probed yet: UNKNOWN.
   */
  static HealthStatus overallStatus(Collection<DependencyHealth> dependencies) {
    List<HealthStatus> statuses = new ArrayList<>(dependencies.size());
    for (DependencyHealth d : dependencies)
      statuses.add(d.getStatus());
    return overallOf(statuses);
  }

  private static HealthStatus overallOf(Collection<HealthStatus> statuses) {
    int healthy = 0;
    int unknown = 0;
    for (HealthStatus status : statuses) {
      if (status == HealthStatus.HEALTHY)
        healthy++;
      else if (status == HealthStatus.UNKNOWN)
        unknown++;
    }
    int total = statuses.size();
    if (total == 0 || unknown == total)
      return HealthStatus.UNKNOWN;
    if (healthy == total)
      return HealthStatus.HEALTHY;
    return healthy > total - healthy ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
  }

  public static class Builder {
    private final CircuitBreakerRegistry breakers;
    private final Scheduler scheduler;
    private Duration ttl = Duration.ofSeconds(5);
    private MetricPublisher metrics = NoOpMetricPublisher.INSTANCE;
    private HealthChangeListener listener = (dependency, previous, current) -> { };
    private OverallStatusListener overallListener = (previous, current) -> { };

    Builder(CircuitBreakerRegistry breakers, Scheduler scheduler) {
      this.breakers = breakers;
      this.scheduler = scheduler;
    }

    public Builder ttl(Duration ttl) {
      this.ttl = Objects.requireNonNull(ttl, "ttl");
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metrics = mp == null ? NoOpMetricPublisher.INSTANCE : mp;
      return this;
    }

    public Builder listener(HealthChangeListener listener) {
      this.listener = Objects.requireNonNull(listener, "listener");
      return this;
    }

    public Builder overallListener(OverallStatusListener listener) {
      this.overallListener = Objects.requireNonNull(listener, "listener");
      return this;
    }

    public DependencyHealthAggregator build() {
      return new DependencyHealthAggregator(this);
    }
  }
}
