package com.dinoair.resilience.breaker;

/**
 * Totals over every bucket of a {@link SlidingWindowTracker} at one instant.
 */
public final class WindowStats {
    public static final WindowStats EMPTY = new WindowStats(0, 0, 0);

    private final int totalCalls;
    private final int failures;
    private final int slowCalls;

    public WindowStats(int totalCalls, int failures, int slowCalls) {
        this.totalCalls = totalCalls;
        this.failures = failures;
        this.slowCalls = slowCalls;
    }

    public int getTotalCalls() { return totalCalls; }
    public int getFailures() { return failures; }
    public int getSlowCalls() { return slowCalls; }

    public double getFailureRate() {
        return totalCalls > 0 ? (double) failures / totalCalls : 0.0;
    }

    public double getSlowCallRate() {
        return totalCalls > 0 ? (double) slowCalls / totalCalls : 0.0;
    }

    @Override
    public String toString() {
        return "WindowStats{calls=" + totalCalls + ", failures=" + failures + ", slow=" + slowCalls + "}";
    }
}
