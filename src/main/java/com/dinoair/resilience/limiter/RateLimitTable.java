package com.dinoair.resilience.limiter;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Quota per (category, plan tier). Lookups for an unknown category or a tier missing from a
 * category fall back to {@code api}/{@code FREE}.
 */
public final class RateLimitTable {
  public static final String AUTH = "auth";
  public static final String UPLOAD = "upload";
  public static final String API = "api";
  public static final String CHAT = "chat";
  public static final String EXPORT = "export";

  private static final Quota LAST_RESORT = new Quota(100, Duration.ofMinutes(15));

  private final Map<String, Map<PlanTier, Quota>> quotas;

  private RateLimitTable(Map<String, Map<PlanTier, Quota>> quotas) {
    this.quotas = quotas;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static RateLimitTable defaults() {
    Duration quarterHour = Duration.ofMinutes(15);
    return newBuilder()
        .category(AUTH, Quota.of(5, quarterHour), Quota.of(10, quarterHour), Quota.of(20, quarterHour))
        .category(UPLOAD, Quota.perMinute(5), Quota.perMinute(20), Quota.perMinute(50))
        .category(API, Quota.of(100, quarterHour), Quota.of(500, quarterHour), Quota.of(2000, quarterHour))
        .category(CHAT, Quota.perMinute(30), Quota.perMinute(100), Quota.perMinute(200))
        .category(EXPORT, Quota.perMinute(10), Quota.perMinute(50), Quota.perMinute(100))
        .build();
  }

  public Quota quotaFor(String category, PlanTier tier) {
    Map<PlanTier, Quota> byTier = quotas.get(category);
    if (byTier != null && byTier.containsKey(tier))
      return byTier.get(tier);
    Map<PlanTier, Quota> api = quotas.get(API);
    if (api != null && api.containsKey(PlanTier.FREE))
      return api.get(PlanTier.FREE);
    return LAST_RESORT;
  }

  public Set<String> categories() {
    return Collections.unmodifiableSet(quotas.keySet());
  }

  public static class Builder {
    private final Map<String, Map<PlanTier, Quota>> quotas = new LinkedHashMap<>();

    public Builder put(String category, PlanTier tier, Quota quota) {
      quotas.computeIfAbsent(category, c -> new EnumMap<>(PlanTier.class)).put(tier, quota);
      return this;
    }

    public Builder category(String category, Quota free, Quota premium, Quota enterprise) {
      return put(category, PlanTier.FREE, free)
          .put(category, PlanTier.PREMIUM, premium)
          .put(category, PlanTier.ENTERPRISE, enterprise);
    }

    /** Starts from an existing table, e.g. the defaults, to override some entries. */
    public Builder putAll(RateLimitTable table) {
      table.quotas.forEach((category, byTier) -> byTier.forEach((tier, q) -> put(category, tier, q)));
      return this;
    }

    public RateLimitTable build() {
      Map<String, Map<PlanTier, Quota>> copy = new LinkedHashMap<>();
      quotas.forEach((c, byTier) -> copy.put(c, Collections.unmodifiableMap(new EnumMap<>(byTier))));
      return new RateLimitTable(Collections.unmodifiableMap(copy));
    }
  }
}
