package com.dinoair.resilience.metrics;

/**
 * No-op metric publisher (default) so the library runs without Prometheus or CloudWatch.
 */
public class NoOpMetricPublisher implements MetricPublisher {
    public static final NoOpMetricPublisher INSTANCE = new NoOpMetricPublisher();

    @Override public void incrementCounter(String name, String dimension, long delta) {}
    @Override public void gauge(String name, String dimension, double value) {}
}
