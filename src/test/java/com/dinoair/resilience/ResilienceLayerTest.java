package com.dinoair.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.dinoair.resilience.breaker.DependencyPresets;
import com.dinoair.resilience.config.ResilienceSettings;
import com.dinoair.resilience.health.HealthStatus;
import com.dinoair.resilience.health.ProbeResult;
import com.dinoair.resilience.limiter.PlanTier;
import com.dinoair.resilience.limiter.RateLimitTable;
import com.dinoair.resilience.scheduling.ManualScheduler;
import com.dinoair.resilience.stream.StreamResult;
import com.dinoair.resilience.stream.StreamingRequest;

public class ResilienceLayerTest {
  private final ManualScheduler scheduler = new ManualScheduler();
  private final AtomicInteger upstreamCalls = new AtomicInteger();
  private ResilienceLayer layer;

  @AfterEach
  public void tearDown() {
    if (layer != null)
      layer.close();
  }

  private ResilienceLayer layer(Properties props) {
    layer = ResilienceLayer.newBuilder(scheduler)
        .settings(new ResilienceSettings(props))
        .tierResolver(identity -> identity.equals("vip") ? PlanTier.ENTERPRISE : PlanTier.FREE)
        .build();
    return layer;
  }

  private StreamingRequest<String> generate() {
    return StreamingRequest.<String>newBuilder(DependencyPresets.OLLAMA, (sink, token) -> {
      upstreamCalls.incrementAndGet();
      sink.emit("hi");
      return CompletableFuture.completedFuture(null);
    }).target("POST /api/generate").build();
  }

  @Test
  public void admittedRequestsAreStreamedThroughTheBreaker() {
    layer(new Properties());
    GuardedStream<String> guarded = layer.stream("user-1", RateLimitTable.CHAT, generate());

    assertTrue(guarded.isAllowed());
    List<String> chunks = new ArrayList<>();
    StreamResult result = guarded.getStream().get().forEach(chunks::add).join();
    assertEquals(StreamResult.Status.COMPLETED, result.getStatus());
    assertEquals(List.of("hi"), chunks);
    assertEquals(1, layer.getBreakers().get(DependencyPresets.OLLAMA).getStats().getSuccessfulCalls());
  }

  @Test
  public void rateLimitedRequestsNeverReachTheBreaker() {
    Properties props = new Properties();
    props.setProperty("resilience.ratelimit.chat.free.limit", "1");
    layer(props);

    layer.stream("user-1", RateLimitTable.CHAT, generate()).getStream().get().forEach(chunk -> { }).join();
    GuardedStream<String> refused = layer.stream("user-1", RateLimitTable.CHAT, generate());

    assertFalse(refused.isAllowed());
    assertFalse(refused.getStream().isPresent());
    assertEquals(60, refused.getDecision().getRetryAfterSeconds());
    assertEquals(1, upstreamCalls.get());
    assertEquals(1, layer.getBreakers().get(DependencyPresets.OLLAMA).getStats().getTotalCalls());

    assertTrue(layer.stream("vip", RateLimitTable.CHAT, generate()).isAllowed());
  }

  @Test
  public void settingsShapeTheBreakers() {
    Properties props = new Properties();
    props.setProperty("resilience.breaker.ollama.failureThreshold", "9");
    props.setProperty("resilience.breaker.search.timeoutMs", "2500");
    layer(props);

    assertEquals(9, layer.getBreakers().get("ollama").getConfig().getFailureThreshold());
    assertEquals(2500, layer.getBreakers().get("search").getConfig().getTimeoutMs());
    assertEquals(4, layer.getBreakers().all().size());
  }

  @Test
  public void monitoredDependenciesShowUpInTheHealthReport() {
    layer(new Properties());
    layer.monitor(DependencyPresets.OLLAMA, () -> CompletableFuture.completedFuture(ProbeResult.healthy("up")))
        .monitor(DependencyPresets.COMFYUI, () -> CompletableFuture.completedFuture(ProbeResult.unhealthy("no GPU")));
    layer.start();

    assertEquals(HealthStatus.UNHEALTHY, layer.getHealth().getReport().getOverallStatus());
    assertEquals(1, layer.getHealth().getReport().count(HealthStatus.HEALTHY));
  }

  @Test
  public void closeCancelsEveryTimer() {
    layer(new Properties());
    layer.start();
    layer.close();
    assertEquals(0, scheduler.pendingTasks());
    layer = null;
  }
}
