package com.dinoair.resilience.breaker;

/**
 * One time slice of the rolling window. Buckets are reused: rotation clears them in place.
 */
public final class WindowBucket {
    private int calls;
    private int failures;
    private int slowCalls;

    void record(boolean failure, boolean slow) {
        calls++;
        if (failure)
            failures++;
        if (slow)
            slowCalls++;
    }

    void clear() {
        calls = 0;
        failures = 0;
        slowCalls = 0;
    }

    public int getCalls() { return calls; }
    public int getFailures() { return failures; }
    public int getSlowCalls() { return slowCalls; }
}
