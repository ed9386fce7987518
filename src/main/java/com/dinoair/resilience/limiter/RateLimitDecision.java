package com.dinoair.resilience.limiter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Result of one admission check, with everything the caller needs for the response headers.
 */
public final class RateLimitDecision {
  private final boolean allowed;
  private final int limit;
  private final int remaining;
  private final long resetAtEpochSeconds;
  private final long retryAfterSeconds;
  private final String category;
  private final PlanTier tier;

  private RateLimitDecision(boolean allowed, int limit, int remaining, long resetAtEpochSeconds,
      long retryAfterSeconds, String category, PlanTier tier) {
    this.allowed = allowed;
    this.limit = limit;
    this.remaining = remaining;
    this.resetAtEpochSeconds = resetAtEpochSeconds;
    this.retryAfterSeconds = retryAfterSeconds;
    this.category = category;
    this.tier = tier;
  }

  static RateLimitDecision allowed(int limit, int remaining, long resetAt, String category, PlanTier tier) {
    return new RateLimitDecision(true, limit, remaining, resetAt, 0, category, tier);
  }

  static RateLimitDecision rejected(int limit, long resetAt, long retryAfter, String category, PlanTier tier) {
    return new RateLimitDecision(false, limit, 0, resetAt, retryAfter, category, tier);
  }

  public boolean isAllowed() { return allowed; }
  public int getLimit() { return limit; }
  public int getRemaining() { return remaining; }
  public long getResetAtEpochSeconds() { return resetAtEpochSeconds; }

  /** Seconds until the window resets; 0 when allowed. */
  public long getRetryAfterSeconds() { return retryAfterSeconds; }

  public String getCategory() { return category; }
  public PlanTier getTier() { return tier; }

  /** {@code X-RateLimit-*} headers, plus {@code Retry-After} on rejection. */
  public Map<String, String> toHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("X-RateLimit-Limit", Integer.toString(limit));
    headers.put("X-RateLimit-Remaining", Integer.toString(remaining));
    headers.put("X-RateLimit-Reset", Long.toString(resetAtEpochSeconds));
    headers.put("X-RateLimit-Category", category);
    headers.put("X-RateLimit-Tier", tier.name().toLowerCase(Locale.ROOT));
    if (!allowed)
      headers.put("Retry-After", Long.toString(retryAfterSeconds));
    return headers;
  }

  @Override
  public String toString() {
    return "RateLimitDecision{" + (allowed ? "allowed" : "rejected") + ", " + category + "/" + tier
        + ", remaining=" + remaining + "/" + limit + ", reset=" + resetAtEpochSeconds
        + (allowed ? "" : ", retryAfter=" + retryAfterSeconds + "s") + "}";
  }
}
