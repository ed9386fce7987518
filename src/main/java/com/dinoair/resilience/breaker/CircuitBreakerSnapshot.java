package com.dinoair.resilience.breaker;

import java.util.List;

/**
 * Read-only view of one breaker for operational dashboards.
 */
public final class CircuitBreakerSnapshot {
    private final String name;
    private final CircuitState state;
    private final CircuitStats stats;
    private final WindowStats windowStats;
    private final long retryAfterMs;

    CircuitBreakerSnapshot(String name, CircuitState state, CircuitStats stats, WindowStats windowStats,
            long retryAfterMs) {
        this.name = name;
        this.state = state;
        this.stats = stats;
        this.windowStats = windowStats;
        this.retryAfterMs = retryAfterMs;
    }

    public String getName() { return name; }
    public CircuitState getState() { return state; }
    public CircuitStats getStats() { return stats; }
    public WindowStats getWindowStats() { return windowStats; }

    public double getWindowFailureRate() {
        return windowStats.getFailureRate();
    }

    public List<StateTransition> getLastStateChanges() {
        return stats.getStateChanges();
    }

    /** Time left before an open circuit will admit a probe, 0 otherwise. */
    public long getRetryAfterMs() { return retryAfterMs; }
}
