package com.dinoair.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.breaker.CircuitBreakerConfig;
import com.dinoair.resilience.breaker.CircuitBreakerRegistry;
import com.dinoair.resilience.breaker.DependencyPresets;
import com.dinoair.resilience.config.ResilienceSettings;
import com.dinoair.resilience.health.DependencyHealthAggregator;
import com.dinoair.resilience.health.HealthProbe;
import com.dinoair.resilience.limiter.PlanTier;
import com.dinoair.resilience.limiter.RateLimitDecision;
import com.dinoair.resilience.limiter.RateLimitTable;
import com.dinoair.resilience.limiter.TieredRateLimiter;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.reliability.RetryPolicy;
import com.dinoair.resilience.scheduling.Scheduler;
import com.dinoair.resilience.stream.ChunkStream;
import com.dinoair.resilience.stream.StreamingRequest;
import com.dinoair.resilience.stream.StreamingRequestSupervisor;

/**
 * Wires the rate limiter, the breakers, the streaming supervisor and the health aggregator.
 *
 * <p>A request first passes the rate limiter (in memory, no I/O); only an admitted request gets a
 * supervised stream, which then goes through the dependency's breaker on every attempt.
 */
public class ResilienceLayer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ResilienceLayer.class);

  private final CircuitBreakerRegistry breakers;
  private final TieredRateLimiter rateLimiter;
  private final StreamingRequestSupervisor supervisor;
  private final DependencyHealthAggregator health;

  private ResilienceLayer(Builder builder) {
    Scheduler scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    ResilienceSettings settings = builder.settings;

    this.breakers = new CircuitBreakerRegistry(scheduler, builder.metrics);
    registerBreaker(DependencyPresets.OLLAMA, DependencyPresets.ollama(), settings);
    registerBreaker(DependencyPresets.COMFYUI, DependencyPresets.comfyUi(), settings);
    registerBreaker(DependencyPresets.MODEL_DOWNLOAD, DependencyPresets.modelDownload(), settings);
    for (String name : settings.breakerNames()) {
      if (breakers.find(name).isEmpty())
        registerBreaker(name, CircuitBreakerConfig.defaults(), settings);
    }

    this.rateLimiter = TieredRateLimiter.newBuilder(scheduler)
        .table(settings.rateLimitTable(RateLimitTable.defaults()))
        .tierResolver(builder.tierResolver)
        .metricPublisher(builder.metrics)
        .build();
    this.supervisor = StreamingRequestSupervisor.newBuilder(breakers, scheduler)
        .retryPolicy(settings.retryPolicy(RetryPolicy.defaults()))
        .metricPublisher(builder.metrics)
        .build();
    this.health = DependencyHealthAggregator.newBuilder(breakers, scheduler)
        .ttl(settings.healthTtl(Duration.ofSeconds(5)))
        .metricPublisher(builder.metrics)
        .build();
  }

  public static Builder newBuilder(Scheduler scheduler) {
    return new Builder(scheduler);
  }

  private void registerBreaker(String name, CircuitBreakerConfig preset, ResilienceSettings settings) {
    CircuitBreakerConfig config = settings.breakerConfig(name, preset);
    breakers.register(name, config);
    logger.debug("Registered circuit breaker {} (failureThreshold={}, timeout={}ms)", name,
        config.getFailureThreshold(), config.getTimeoutMs());
  }

  /**
   * Admits the request against {@code identity}'s quota for {@code category}, then hands back the
   * supervised stream. A refused request never reaches the breaker.
   */
  public <C> GuardedStream<C> stream(String identity, String category, StreamingRequest<C> request) {
    RateLimitDecision decision = rateLimiter.admit(identity, category);
    if (!decision.isAllowed()) {
      logger.debug("Rate limited {} on {} for {}s", identity, category, decision.getRetryAfterSeconds());
      return new GuardedStream<>(decision, null);
    }
    ChunkStream<C> stream = supervisor.execute(request);
    return new GuardedStream<>(decision, stream);
  }

  /** Adds {@code dependency} to the health cycle; it must have a breaker. */
  public ResilienceLayer monitor(String dependency, HealthProbe probe) {
    health.register(dependency, probe);
    return this;
  }

  public void start() {
    health.start();
  }

  public CircuitBreakerRegistry getBreakers() { return breakers; }

  public TieredRateLimiter getRateLimiter() { return rateLimiter; }

  public StreamingRequestSupervisor getSupervisor() { return supervisor; }

  public DependencyHealthAggregator getHealth() { return health; }

  @Override
  public void close() {
    health.close();
    rateLimiter.close();
    breakers.close();
  }

  public static class Builder {
    private final Scheduler scheduler;
    private ResilienceSettings settings = ResilienceSettings.empty();
    private MetricPublisher metrics = NoOpMetricPublisher.INSTANCE;
    private Function<String, PlanTier> tierResolver = identity -> PlanTier.FREE;

    Builder(Scheduler scheduler) {
      this.scheduler = scheduler;
    }

    public Builder settings(ResilienceSettings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metrics = mp == null ? NoOpMetricPublisher.INSTANCE : mp;
      return this;
    }

    public Builder tierResolver(Function<String, PlanTier> resolver) {
      this.tierResolver = Objects.requireNonNull(resolver, "resolver");
      return this;
    }

    public ResilienceLayer build() {
      return new ResilienceLayer(this);
    }
  }
}
