package com.dinoair.resilience.limiter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.metrics.MetricNames;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.scheduling.ScheduledTask;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * In-process admission gate keyed by (identity, category), checked before any breaker or external
 * call.
 *
 * - Fixed window per key: the first request of a window starts it, the count resets once it has
 * elapsed. Reset and increment happen in one {@code compute} so concurrent requests for the same
 * key cannot both take the last slot.
 * - The quota comes from the {@link RateLimitTable} for the category and the caller's plan tier.
 * - Buckets are created lazily and a background sweep drops the ones whose window is over.
 * - Never performs I/O.
 */
public class TieredRateLimiter implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TieredRateLimiter.class);

  private final RateLimitTable table;
  private final Clock clock;
  private final Function<String, PlanTier> tierResolver;
  private final MetricPublisher metricPublisher;
  private final ScheduledTask sweeper;

  private final ConcurrentHashMap<BucketKey, RateLimitBucket> buckets = new ConcurrentHashMap<>();

  private TieredRateLimiter(Builder builder) {
    this.table = Objects.requireNonNull(builder.table, "table");
    this.clock = builder.scheduler.clock();
    this.tierResolver = builder.tierResolver;
    this.metricPublisher = builder.metricPublisher == null ? NoOpMetricPublisher.INSTANCE : builder.metricPublisher;
    this.sweeper = builder.scheduler.scheduleAtFixedRate(this::evictExpired, builder.sweepInterval.toMillis());
  }

  public static Builder newBuilder(Scheduler scheduler) {
    return new Builder(scheduler);
  }

  /** Admission with the tier looked up from the identity. */
  public RateLimitDecision admit(String identity, String category) {
    return admit(identity, category, resolveTier(identity));
  }

  public RateLimitDecision admit(String identity, String category, PlanTier tier) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(category, "category");
    PlanTier effectiveTier = tier == null ? PlanTier.FREE : tier;
    Quota quota = table.quotaFor(category, effectiveTier);
    long now = clock.millis();

    RateLimitDecision[] decision = new RateLimitDecision[1];
    buckets.compute(new BucketKey(identity, category), (k, existing) -> {
      RateLimitBucket bucket = existing == null ? new RateLimitBucket(now, quota) : existing;
      decision[0] = bucket.tryAcquire(now, quota, category, effectiveTier);
      return bucket;
    });

    if (!decision[0].isAllowed()) {
      metricPublisher.incrementCounter(MetricNames.RATE_LIMIT_REJECTED, category, 1);
      logger.warn("Rate limit exceeded: category={} tier={} identity={} limit={} retryAfter={}s",
          category, effectiveTier, identity, quota.getLimit(), decision[0].getRetryAfterSeconds());
    }
    return decision[0];
  }

  /** Current standing without consuming a request. */
  public RateLimitDecision status(String identity, String category, PlanTier tier) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(category, "category");
    PlanTier effectiveTier = tier == null ? PlanTier.FREE : tier;
    Quota quota = table.quotaFor(category, effectiveTier);
    long now = clock.millis();
    RateLimitDecision[] decision = new RateLimitDecision[1];
    buckets.computeIfPresent(new BucketKey(identity, category), (k, bucket) -> {
      decision[0] = bucket.peek(now, quota, category, effectiveTier);
      return bucket;
    });
    if (decision[0] != null)
      return decision[0];
    return new RateLimitBucket(now, quota).peek(now, quota, category, effectiveTier);
  }

  public PlanTier resolveTier(String identity) {
    PlanTier tier = tierResolver.apply(identity);
    return tier == null ? PlanTier.FREE : tier;
  }

  /** Drops the counters of a key, e.g. after an administrator lifts a block. */
  public void reset(String identity, String category) {
    buckets.remove(new BucketKey(identity, category));
  }

  public int trackedKeys() {
    return buckets.size();
  }

  void evictExpired() {
    long now = clock.millis();
    int before = buckets.size();
    for (BucketKey key : buckets.keySet())
      buckets.computeIfPresent(key, (k, bucket) -> bucket.isExpired(now) ? null : bucket);
    int evicted = before - buckets.size();
    if (evicted > 0)
      logger.debug("Evicted {} expired rate limit buckets", evicted);
  }

  public RateLimitTable getTable() {
    return table;
  }

  @Override
  public void close() {
    sweeper.cancel();
    buckets.clear();
  }

  private static final class BucketKey {
    private final String identity;
    private final String category;

    BucketKey(String identity, String category) {
      this.identity = identity;
      this.category = category;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o)
        return true;
      if (!(o instanceof BucketKey))
        return false;
      BucketKey other = (BucketKey) o;
      return identity.equals(other.identity) && category.equals(other.category);
    }

    @Override
    public int hashCode() {
      return 31 * identity.hashCode() + category.hashCode();
    }
  }

  public static class Builder {
    private final Scheduler scheduler;
    private RateLimitTable table = RateLimitTable.defaults();
    private Function<String, PlanTier> tierResolver = identity -> PlanTier.FREE;
    private Duration sweepInterval = Duration.ofMinutes(5);
    private MetricPublisher metricPublisher = null;

    public Builder(Scheduler scheduler) {
      this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public Builder table(RateLimitTable table) {
      this.table = table;
      return this;
    }

    public Builder tierResolver(Function<String, PlanTier> resolver) {
      this.tierResolver = Objects.requireNonNull(resolver, "resolver");
      return this;
    }

    public Builder sweepInterval(Duration interval) {
      this.sweepInterval = interval;
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metricPublisher = mp;
      return this;
    }

    public TieredRateLimiter build() {
      return new TieredRateLimiter(this);
    }
  }
}
