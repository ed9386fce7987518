package com.dinoair.resilience.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.breaker.CircuitBreakerConfig;
import com.dinoair.resilience.limiter.PlanTier;
import com.dinoair.resilience.limiter.Quota;
import com.dinoair.resilience.limiter.RateLimitTable;
import com.dinoair.resilience.reliability.RetryPolicy;

/**
 * Overrides read from {@code resilience.properties}. Every key is optional; anything absent keeps
 * the built-in default.
 *
 * <pre>
 * resilience.breaker.ollama.failureThreshold=5
 * resilience.breaker.ollama.timeoutMs=60000
 * resilience.ratelimit.chat.free.limit=30
 * resilience.ratelimit.chat.free.windowSeconds=60
 * resilience.retry.maxRetries=2
 * resilience.health.ttlMs=5000
 * </pre>
 */
public final class ResilienceSettings {
  private static final Logger logger = LoggerFactory.getLogger(ResilienceSettings.class);

  public static final String DEFAULT_RESOURCE = "resilience.properties";
  private static final String BREAKER = "resilience.breaker.";
  private static final String RATE_LIMIT = "resilience.ratelimit.";
  private static final String RETRY = "resilience.retry.";
  private static final String HEALTH = "resilience.health.";

  private final Properties properties;

  public ResilienceSettings(Properties properties) {
    this.properties = properties;
  }

  public static ResilienceSettings empty() {
    return new ResilienceSettings(new Properties());
  }

  /** Loads {@code resource} from the classpath; a missing resource yields empty settings. */
  public static ResilienceSettings fromClasspath(String resource) {
    Properties props = new Properties();
    ClassLoader loader = ResilienceSettings.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        logger.info("No {} on the classpath, using defaults", resource);
        return new ResilienceSettings(props);
      }
      props.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + resource, e);
    }
    return new ResilienceSettings(props);
  }

  /** Dependency names that have at least one breaker key. */
  public Set<String> breakerNames() {
    Set<String> names = new LinkedHashSet<>();
    for (String key : properties.stringPropertyNames()) {
      if (key.startsWith(BREAKER)) {
        String rest = key.substring(BREAKER.length());
        int dot = rest.indexOf('.');
        if (dot > 0)
          names.add(rest.substring(0, dot));
      }
    }
    return names;
  }

  /** {@code base} with the overrides for {@code dependency} applied. */
  public CircuitBreakerConfig breakerConfig(String dependency, CircuitBreakerConfig base) {
    String p = BREAKER + dependency + ".";
    CircuitBreakerConfig.Builder b = base.toBuilder();
    Integer i;
    Long l;
    Double d;
    if ((i = intValue(p + "failureThreshold")) != null)
      b.failureThreshold(i);
    if ((i = intValue(p + "successThreshold")) != null)
      b.successThreshold(i);
    if ((l = longValue(p + "timeoutMs")) != null)
      b.timeout(Duration.ofMillis(l));
    if ((l = longValue(p + "resetTimeoutMs")) != null)
      b.resetTimeout(Duration.ofMillis(l));
    if ((l = longValue(p + "windowSizeMs")) != null)
      b.windowSize(Duration.ofMillis(l));
    if ((i = intValue(p + "windowBuckets")) != null)
      b.windowBuckets(i);
    if ((l = longValue(p + "slowCallDurationMs")) != null)
      b.slowCallDuration(Duration.ofMillis(l));
    if ((d = doubleValue(p + "slowCallRateThreshold")) != null)
      b.slowCallRateThreshold(d);
    if ((d = doubleValue(p + "failureRateThreshold")) != null)
      b.failureRateThreshold(d);
    if ((i = intValue(p + "minimumWindowCalls")) != null)
      b.minimumWindowCalls(i);
    return b.build();
  }

  /** {@code base} with every {@code resilience.ratelimit.<category>.<tier>.*} entry applied. */
  /**
   * Applies {@code limit} and {@code windowSeconds} overrides; either may be given without the other.
   *
   * @throws IllegalArgumentException on a malformed key or an unknown tier
   */
  public RateLimitTable rateLimitTable(RateLimitTable base) {
    Set<String> overridden = new TreeSet<>();
    for (String key : properties.stringPropertyNames()) {
      if (!key.startsWith(RATE_LIMIT))
        continue;
      String[] parts = key.substring(RATE_LIMIT.length()).split("\\.");
      if (parts.length != 3 || !(parts[2].equals("limit") || parts[2].equals("windowSeconds")))
        throw new IllegalArgumentException(
            "Expected " + RATE_LIMIT + "<category>.<tier>.limit or .windowSeconds: " + key);
      parseTier(parts[1], key);
      overridden.add(parts[0] + "." + parts[1]);
    }
    RateLimitTable.Builder b = RateLimitTable.newBuilder().putAll(base);
    for (String categoryAndTier : overridden) {
      String prefix = RATE_LIMIT + categoryAndTier;
      int dot = categoryAndTier.indexOf('.');
      String category = categoryAndTier.substring(0, dot);
      PlanTier tier = parseTier(categoryAndTier.substring(dot + 1), prefix);
      Quota current = base.quotaFor(category, tier);
      Integer limit = intValue(prefix + ".limit");
      Long windowSeconds = longValue(prefix + ".windowSeconds");
      b.put(category, tier, Quota.of(
          limit != null ? limit : current.getLimit(),
          windowSeconds != null ? Duration.ofSeconds(windowSeconds) : current.getWindow()));
    }
    return b.build();
  }

  public RetryPolicy retryPolicy(RetryPolicy base) {
    Integer maxRetries = intValue(RETRY + "maxRetries");
    Long baseDelay = longValue(RETRY + "baseDelayMs");
    Long maxDelay = longValue(RETRY + "maxDelayMs");
    String jitter = properties.getProperty(RETRY + "jitter");
    return new RetryPolicy(
        maxRetries != null ? maxRetries : base.getMaxRetries(),
        baseDelay != null ? Duration.ofMillis(baseDelay) : base.getBaseDelay(),
        maxDelay != null ? Duration.ofMillis(maxDelay) : base.getMaxDelay(),
        jitter != null ? Boolean.parseBoolean(jitter.trim()) : base.isJitter());
  }

  public Duration healthTtl(Duration base) {
    Long ttl = longValue(HEALTH + "ttlMs");
    return ttl != null ? Duration.ofMillis(ttl) : base;
  }

  private static PlanTier parseTier(String tier, String key) {
    try {
      return PlanTier.valueOf(tier.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown plan tier '" + tier + "' in " + key, e);
    }
  }

  private Integer intValue(String key) {
    String v = properties.getProperty(key);
    if (v == null)
      return null;
    try {
      return Integer.valueOf(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not an integer: " + key + "=" + v, e);
    }
  }

  private Long longValue(String key) {
    String v = properties.getProperty(key);
    if (v == null)
      return null;
    try {
      return Long.valueOf(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + key + "=" + v, e);
    }
  }

  private Double doubleValue(String key) {
    String v = properties.getProperty(key);
    if (v == null)
      return null;
    try {
      return Double.valueOf(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + key + "=" + v, e);
    }
  }
}
