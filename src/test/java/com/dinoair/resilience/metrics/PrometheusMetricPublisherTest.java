package com.dinoair.resilience.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.prometheus.client.CollectorRegistry;

public class PrometheusMetricPublisherTest {
  private static final String[] LABELS = { PrometheusMetricPublisher.LABEL };

  private PrometheusMetricPublisher publisher;

  @AfterEach
  public void tearDown() {
    if (publisher != null)
      publisher.close();
  }

  private static double value(CollectorRegistry registry, String name, String target) {
    Double v = registry.getSampleValue(name, LABELS, new String[] { target });
    return v == null ? 0.0 : v;
  }

  @Test
  public void bufferedCountersAreFlushedPerTarget() throws Exception {
    CollectorRegistry registry = new CollectorRegistry();
    publisher = new PrometheusMetricPublisher(registry, "TestNS");

    publisher.incrementCounter(MetricNames.CALLS_REJECTED, "ollama", 5);
    publisher.incrementCounter(MetricNames.CALLS_REJECTED, "comfyui", 2);
    publisher.incrementCounter(MetricNames.RATE_LIMIT_REJECTED, "chat", 1);
    publisher.gauge(MetricNames.CIRCUIT_OPEN, "ollama", 1);

    // wait for the background flush (runs every 1s)
    Thread.sleep(1200);

    assertEquals(5.0, value(registry, "TestNS_calls_rejected_total", "ollama"), 0.0001);
    assertEquals(2.0, value(registry, "TestNS_calls_rejected_total", "comfyui"), 0.0001);
    assertEquals(1.0, value(registry, "TestNS_rate_limit_rejected_total", "chat"), 0.0001);
    assertEquals(1.0, value(registry, "TestNS_circuit_open", "ollama"), 0.0001);
  }

  @Test
  public void explicitFlushPublishesImmediately() {
    CollectorRegistry registry = new CollectorRegistry();
    publisher = new PrometheusMetricPublisher(registry, "TestNS");

    publisher.incrementCounter(MetricNames.STREAM_RETRIES, "ollama", 3);
    publisher.flush();
    assertEquals(3.0, value(registry, "TestNS_stream_retries_total", "ollama"), 0.0001);

    publisher.incrementCounter(MetricNames.STREAM_RETRIES, "ollama", 1);
    publisher.flush();
    assertEquals(4.0, value(registry, "TestNS_stream_retries_total", "ollama"), 0.0001);
  }

  @Test
  public void gaugeKeepsLatestValue() {
    CollectorRegistry registry = new CollectorRegistry();
    publisher = new PrometheusMetricPublisher(registry, "TestNS");

    publisher.gauge(MetricNames.DEPENDENCY_HEALTHY, "comfyui", 1);
    publisher.gauge(MetricNames.DEPENDENCY_HEALTHY, "comfyui", 0);

    assertEquals(0.0, value(registry, "TestNS_dependency_healthy", "comfyui"), 0.0001);
  }

  @Test
  public void metricNamesBecomeSnakeCase() {
    assertEquals("calls_rejected", PrometheusMetricPublisher.toSnakeCase("CallsRejected"));
    assertEquals("dependency_healthy", PrometheusMetricPublisher.toSnakeCase("DependencyHealthy"));
  }
}
