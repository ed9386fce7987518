package com.dinoair.resilience.failure;

/**
 * The call lost its race against the breaker's timeout.
 */
public class CallTimeoutException extends RuntimeException {
  private final long timeoutMs;

  public CallTimeoutException(long timeoutMs) {
    super("Timeout after " + timeoutMs + "ms");
    this.timeoutMs = timeoutMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}
