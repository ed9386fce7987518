package com.dinoair.resilience.metrics;

/**
 * Metric names published by this library.
 */
public final class MetricNames {
  public static final String CALLS_SUCCEEDED = "CallsSucceeded";
  public static final String CALLS_FAILED = "CallsFailed";
  public static final String CALLS_REJECTED = "CallsRejected";
  public static final String CIRCUIT_OPEN = "CircuitOpen";
  public static final String STREAM_RETRIES = "StreamRetries";
  public static final String STREAMS_ABORTED = "StreamsAborted";
  public static final String RATE_LIMIT_REJECTED = "RateLimitRejected";
  public static final String DEPENDENCY_HEALTHY = "DependencyHealthy";

  private MetricNames() {
  }

  static String help(String name) {
    switch (name) {
      case CALLS_SUCCEEDED:
        return "Calls admitted by the circuit breaker that succeeded";
      case CALLS_FAILED:
        return "Calls admitted by the circuit breaker that failed";
      case CALLS_REJECTED:
        return "Calls rejected by an open circuit breaker";
      case CIRCUIT_OPEN:
        return "1 if the circuit breaker is open, 0.5 if half-open, 0 if closed";
      case STREAM_RETRIES:
        return "Streaming request retries after a transient failure";
      case STREAMS_ABORTED:
        return "Streams that failed after delivering chunks";
      case RATE_LIMIT_REJECTED:
        return "Requests rejected by the rate limiter";
      case DEPENDENCY_HEALTHY:
        return "1 if the last health probe succeeded, 0 otherwise";
      default:
        return name;
    }
  }
}
