package com.dinoair.resilience.metrics;

/**
 * Minimal metrics publishing interface used by the breakers, the supervisor, the rate limiter and
 * the health aggregator. {@code dimension} is the dependency name or rate-limit category the value
 * belongs to.
 */
public interface MetricPublisher {

  void incrementCounter(String name, String dimension, long delta);

  void gauge(String name, String dimension, double value);

  default void flush() {}
}
