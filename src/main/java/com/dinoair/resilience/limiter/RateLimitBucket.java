package com.dinoair.resilience.limiter;

/**
 * Fixed-window counter for one (identity, category). Only touched inside
 * {@code ConcurrentHashMap.compute} so reset and increment are atomic per key.
 */
final class RateLimitBucket {
  private long windowStart;
  private long windowDurationMs;
  private int limit;
  private int count;

  RateLimitBucket(long now, Quota quota) {
    this.windowStart = now;
    this.windowDurationMs = quota.getWindowMs();
    this.limit = quota.getLimit();
  }

  boolean isExpired(long now) {
    return now >= windowStart + windowDurationMs;
  }

  RateLimitDecision tryAcquire(long now, Quota quota, String category, PlanTier tier) {
    if (isExpired(now)) {
      windowStart = now;
      windowDurationMs = quota.getWindowMs();
      count = 0;
    }
    // a plan change takes effect immediately for the limit, at the next window for its length
    limit = quota.getLimit();
    if (count < limit) {
      count++;
      return RateLimitDecision.allowed(limit, limit - count, resetAt(), category, tier);
    }
    return RateLimitDecision.rejected(limit, resetAt(), retryAfterSeconds(now), category, tier);
  }

  RateLimitDecision peek(long now, Quota quota, String category, PlanTier tier) {
    if (isExpired(now))
      return RateLimitDecision.allowed(quota.getLimit(), quota.getLimit(),
          ceilSeconds(now + quota.getWindowMs()), category, tier);
    int currentLimit = quota.getLimit();
    int remaining = Math.max(0, currentLimit - count);
    if (remaining > 0)
      return RateLimitDecision.allowed(currentLimit, remaining, resetAt(), category, tier);
    return RateLimitDecision.rejected(currentLimit, resetAt(), retryAfterSeconds(now), category, tier);
  }

  int getCount() {
    return count;
  }

  private long resetAt() {
    return ceilSeconds(windowStart + windowDurationMs);
  }

  private long retryAfterSeconds(long now) {
    long remainingMs = windowStart + windowDurationMs - now;
    return Math.max(1, (remainingMs + 999) / 1000);
  }

  private static long ceilSeconds(long epochMillis) {
    return (epochMillis + 999) / 1000;
  }
}
