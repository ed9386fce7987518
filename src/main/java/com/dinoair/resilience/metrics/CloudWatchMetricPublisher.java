package com.dinoair.resilience.metrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.scheduling.ScheduledTask;
import com.dinoair.resilience.scheduling.Scheduler;

import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

/**
 * CloudWatch-backed MetricPublisher. Counter increments and gauge readings are buffered in memory
 * and sent as batched PutMetricData calls once a second from the injected scheduler, so recording a
 * metric never touches the network. The dependency or rate-limit category goes in a {@code Target}
 * dimension.
 */
public class CloudWatchMetricPublisher implements MetricPublisher {
  private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricPublisher.class);
  static final String DIMENSION = "Target";
  static final String DEFAULT_NAMESPACE = "DinoAirResilience";
  static final long FLUSH_INTERVAL_MS = 1000;
  // PutMetricData accepts at most this many data points per request
  static final int MAX_BATCH = 20;

  private final CloudWatchClient client;
  private final String namespace;
  private final Scheduler scheduler;
  private final Map<MetricKey, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<MetricKey, Double> gauges = new ConcurrentHashMap<>();
  private final ScheduledTask flushTask;

  public CloudWatchMetricPublisher(CloudWatchClient client, String namespace, Scheduler scheduler) {
    this.client = client;
    this.namespace = namespace == null ? DEFAULT_NAMESPACE : namespace;
    this.scheduler = scheduler;
    this.flushTask = scheduler.scheduleAtFixedRate(this::flush, FLUSH_INTERVAL_MS);
  }

  @Override
  public void incrementCounter(String name, String dimension, long delta) {
    counters.computeIfAbsent(new MetricKey(name, dimension), k -> new AtomicLong()).addAndGet(delta);
  }

  @Override
  public void gauge(String name, String dimension, double value) {
    gauges.put(new MetricKey(name, dimension), value);
  }

  @Override
  public void flush() {
    Instant now = scheduler.clock().instant();
    List<MetricDatum> data = new ArrayList<>();
    for (Map.Entry<MetricKey, AtomicLong> e : counters.entrySet()) {
      long delta = e.getValue().getAndSet(0);
      if (delta > 0)
        data.add(datum(e.getKey(), delta, StandardUnit.COUNT, now));
    }
    for (MetricKey key : gauges.keySet()) {
      Double value = gauges.remove(key);
      if (value != null)
        data.add(datum(key, value, StandardUnit.NONE, now));
    }
    for (int from = 0; from < data.size(); from += MAX_BATCH)
      put(data.subList(from, Math.min(from + MAX_BATCH, data.size())));
  }

  public void close() {
    flushTask.cancel();
    // flush remaining
    flush();
  }

  private static MetricDatum datum(MetricKey key, double value, StandardUnit unit, Instant timestamp) {
    MetricDatum.Builder b = MetricDatum.builder()
        .metricName(key.getName())
        .timestamp(timestamp)
        .value(value)
        .unit(unit);
    if (!key.getDimension().isEmpty())
      b.dimensions(Dimension.builder().name(DIMENSION).value(key.getDimension()).build());
    return b.build();
  }

  private void put(List<MetricDatum> batch) {
    try {
      client.putMetricData(PutMetricDataRequest.builder()
          .namespace(namespace)
          .metricData(batch)
          .build());
    } catch (RuntimeException e) {
      // metrics are best effort
      logger.warn("Failed to publish {} CloudWatch metrics to {}", batch.size(), namespace, e);
    }
  }
}
