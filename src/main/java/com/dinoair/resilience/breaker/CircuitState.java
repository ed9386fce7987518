package com.dinoair.resilience.breaker;

public enum CircuitState {
    /** Normal operation, every call admitted. */
    CLOSED,
    /** Failing fast, no call reaches the dependency. */
    OPEN,
    /** Admitting a bounded number of probes to test recovery. */
    HALF_OPEN
}
