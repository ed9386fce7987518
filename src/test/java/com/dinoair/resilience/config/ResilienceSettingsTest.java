package com.dinoair.resilience.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.dinoair.resilience.breaker.CircuitBreakerConfig;
import com.dinoair.resilience.breaker.DependencyPresets;
import com.dinoair.resilience.limiter.PlanTier;
import com.dinoair.resilience.limiter.RateLimitTable;
import com.dinoair.resilience.reliability.RetryPolicy;

public class ResilienceSettingsTest {

  private static ResilienceSettings settings(String... pairs) {
    Properties props = new Properties();
    for (int i = 0; i < pairs.length; i += 2)
      props.setProperty(pairs[i], pairs[i + 1]);
    return new ResilienceSettings(props);
  }

  @Test
  public void breakerOverridesKeepThePresetForUnsetFields() {
    ResilienceSettings settings = settings(
        "resilience.breaker.ollama.failureThreshold", "8",
        "resilience.breaker.ollama.timeoutMs", "90000",
        "resilience.breaker.comfyui.successThreshold", "4");

    CircuitBreakerConfig ollama = settings.breakerConfig(DependencyPresets.OLLAMA, DependencyPresets.ollama());
    assertEquals(8, ollama.getFailureThreshold());
    assertEquals(90_000, ollama.getTimeoutMs());
    assertEquals(20_000, ollama.getResetTimeoutMs());
    assertEquals(3, ollama.getSuccessThreshold());
    assertEquals(2, settings.breakerNames().size());
  }

  @Test
  public void rateLimitOverridesReplaceSingleEntries() {
    ResilienceSettings settings = settings(
        "resilience.ratelimit.chat.free.limit", "10",
        "resilience.ratelimit.chat.free.windowSeconds", "30",
        "resilience.ratelimit.search.premium.limit", "300");

    RateLimitTable table = settings.rateLimitTable(RateLimitTable.defaults());
    assertEquals(10, table.quotaFor("chat", PlanTier.FREE).getLimit());
    assertEquals(Duration.ofSeconds(30), table.quotaFor("chat", PlanTier.FREE).getWindow());
    assertEquals(100, table.quotaFor("chat", PlanTier.PREMIUM).getLimit());
    assertEquals(300, table.quotaFor("search", PlanTier.PREMIUM).getLimit());
    // a new category inherits the fallback window
    assertEquals(Duration.ofMinutes(15), table.quotaFor("search", PlanTier.PREMIUM).getWindow());
  }

  @Test
  public void retryAndHealthOverrides() {
    ResilienceSettings settings = settings(
        "resilience.retry.maxRetries", "4",
        "resilience.retry.jitter", "false",
        "resilience.health.ttlMs", "10000");

    RetryPolicy policy = settings.retryPolicy(RetryPolicy.defaults());
    assertEquals(4, policy.getMaxRetries());
    assertFalse(policy.isJitter());
    assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
    assertEquals(Duration.ofSeconds(10), settings.healthTtl(Duration.ofSeconds(5)));
  }

  @Test
  public void emptySettingsChangeNothing() {
    ResilienceSettings settings = ResilienceSettings.empty();
    assertEquals(Duration.ofSeconds(5), settings.healthTtl(Duration.ofSeconds(5)));
    assertEquals(30, settings.rateLimitTable(RateLimitTable.defaults()).quotaFor("chat", PlanTier.FREE).getLimit());
    assertTrue(settings.breakerNames().isEmpty());
  }

  @Test
  public void windowOverrideAppliesWithoutALimit() {
    RateLimitTable table = settings("resilience.ratelimit.chat.free.windowSeconds", "120")
        .rateLimitTable(RateLimitTable.defaults());

    assertEquals(30, table.quotaFor("chat", PlanTier.FREE).getLimit());
    assertEquals(Duration.ofSeconds(120), table.quotaFor("chat", PlanTier.FREE).getWindow());
    assertEquals(Duration.ofSeconds(60), table.quotaFor("chat", PlanTier.PREMIUM).getWindow());
  }

  @Test
  public void unknownRateLimitFieldsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> settings("resilience.ratelimit.chat.free.window", "120")
        .rateLimitTable(RateLimitTable.defaults()));
    assertThrows(IllegalArgumentException.class, () -> settings("resilience.ratelimit.chat.limit", "5")
        .rateLimitTable(RateLimitTable.defaults()));
  }

  @Test
  public void classpathResourceIsLoaded() {
    ResilienceSettings settings = ResilienceSettings.fromClasspath("resilience-test.properties");
    assertEquals(1, settings.breakerConfig(DependencyPresets.MODEL_DOWNLOAD, DependencyPresets.modelDownload())
        .getFailureThreshold());
    assertEquals(0, settings.retryPolicy(RetryPolicy.defaults()).getMaxRetries());
  }

  @Test
  public void missingResourceMeansDefaults() {
    ResilienceSettings settings = ResilienceSettings.fromClasspath("does-not-exist.properties");
    assertTrue(settings.breakerNames().isEmpty());
  }

  @Test
  public void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> settings("resilience.breaker.ollama.failureThreshold", "five")
        .breakerConfig("ollama", CircuitBreakerConfig.defaults()));
    assertThrows(IllegalArgumentException.class, () -> settings("resilience.ratelimit.chat.gold.limit", "5")
        .rateLimitTable(RateLimitTable.defaults()));
    assertThrows(IllegalArgumentException.class, () -> settings("resilience.breaker.ollama.failureRateThreshold", "2.0")
        .breakerConfig("ollama", CircuitBreakerConfig.defaults()));
  }
}
