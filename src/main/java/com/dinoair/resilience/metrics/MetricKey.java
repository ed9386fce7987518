package com.dinoair.resilience.metrics;

/** Metric name plus dimension, used to buffer values between flushes. */
final class MetricKey {
  private final String name;
  private final String dimension;

  MetricKey(String name, String dimension) {
    this.name = name;
    this.dimension = dimension == null ? "" : dimension;
  }

  String getName() {
    return name;
  }

  String getDimension() {
    return dimension;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof MetricKey))
      return false;
    MetricKey other = (MetricKey) o;
    return name.equals(other.name) && dimension.equals(other.dimension);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + dimension.hashCode();
  }
}
