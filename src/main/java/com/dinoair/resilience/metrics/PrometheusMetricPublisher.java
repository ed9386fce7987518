package com.dinoair.resilience.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus-backed MetricPublisher. Counters are buffered in memory and pushed into the Prometheus
 * collectors once a second so the call path only touches an AtomicLong. Every collector carries a
 * {@code target} label holding the dimension.
 */
public class PrometheusMetricPublisher implements MetricPublisher {
  private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricPublisher.class);
  static final String LABEL = "target";

  private final CollectorRegistry registry;
  private final String namespace;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
  private final Map<MetricKey, AtomicLong> buffered = new ConcurrentHashMap<>();
  private final ScheduledExecutorService scheduler;

  public PrometheusMetricPublisher(CollectorRegistry registry, String namespace) {
    this.registry = registry == null ? CollectorRegistry.defaultRegistry : registry;
    this.namespace = namespace;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "prometheus-metric-flusher");
      t.setDaemon(true);
      return t;
    });
    // periodic flush from buffers to actual Prometheus counters (1s)
    this.scheduler.scheduleAtFixedRate(this::flushBuffers, 1, 1, TimeUnit.SECONDS);
  }

  @Override
  public void incrementCounter(String name, String dimension, long delta) {
    buffered.computeIfAbsent(new MetricKey(name, dimension), k -> new AtomicLong()).addAndGet(delta);
  }

  @Override
  public void gauge(String name, String dimension, double value) {
    try {
      gauges.computeIfAbsent(name, n -> Gauge.build()
          .namespace(namespace)
          .name(toSnakeCase(n))
          .help(MetricNames.help(n))
          .labelNames(LABEL)
          .register(registry))
          .labels(dimension)
          .set(value);
    } catch (RuntimeException e) {
      logger.warn("Failed to set Prometheus gauge {}", name, e);
    }
  }

  @Override
  public void flush() {
    flushBuffers();
  }

  public void close() {
    try {
      scheduler.shutdown();
      scheduler.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    // flush remaining
    flushBuffers();
  }

  private void flushBuffers() {
    try {
      for (Map.Entry<MetricKey, AtomicLong> e : buffered.entrySet()) {
        long delta = e.getValue().getAndSet(0);
        if (delta > 0)
          counter(e.getKey().getName()).labels(e.getKey().getDimension()).inc(delta);
      }
    } catch (Throwable t) {
      logger.warn("Error flushing Prometheus buffers", t);
    }
  }

  private Counter counter(String name) {
    return counters.computeIfAbsent(name, n -> Counter.build()
        .namespace(namespace)
        .name(toSnakeCase(n) + "_total")
        .help(MetricNames.help(n))
        .labelNames(LABEL)
        .register(registry));
  }

  /** CallsRejected -> calls_rejected */
  static String toSnakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 8);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0)
          sb.append('_');
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
