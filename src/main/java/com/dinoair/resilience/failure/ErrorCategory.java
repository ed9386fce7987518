package com.dinoair.resilience.failure;

/**
 * How a dependency error is treated by the retry policy.
 */
public enum ErrorCategory {
  /** Timeout, connection reset, 5xx. Retried with backoff. */
  TRANSIENT,
  /** 4xx validation, resource not found. Surfaced immediately. */
  NON_TRANSIENT,
  /** Aborted by the caller. Neither retried nor counted. */
  CANCELLED
}
