package com.dinoair.resilience.breaker;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Counters for one breaker. The breaker mutates its own instance under its lock and hands out
 * copies through {@link CircuitBreaker#getStats()}.
 */
public final class CircuitStats {
    static final int MAX_HISTORY = 10;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private long ignoredCalls;
    private long slowCalls;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long lastFailureTime;
    private long lastSuccessTime;
    private final ArrayDeque<StateTransition> stateChanges = new ArrayDeque<>(MAX_HISTORY);

    CircuitStats() {
    }

    private CircuitStats(CircuitStats other) {
        this.totalCalls = other.totalCalls;
        this.successfulCalls = other.successfulCalls;
        this.failedCalls = other.failedCalls;
        this.rejectedCalls = other.rejectedCalls;
        this.ignoredCalls = other.ignoredCalls;
        this.slowCalls = other.slowCalls;
        this.consecutiveFailures = other.consecutiveFailures;
        this.consecutiveSuccesses = other.consecutiveSuccesses;
        this.lastFailureTime = other.lastFailureTime;
        this.lastSuccessTime = other.lastSuccessTime;
        this.stateChanges.addAll(other.stateChanges);
    }

    void recordSuccess(long now, boolean slow) {
        totalCalls++;
        successfulCalls++;
        if (slow)
            slowCalls++;
        lastSuccessTime = now;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
    }

    void recordFailure(long now, boolean slow) {
        totalCalls++;
        failedCalls++;
        if (slow)
            slowCalls++;
        lastFailureTime = now;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
    }

    void recordRejected() {
        rejectedCalls++;
    }

    void recordIgnored() {
        ignoredCalls++;
    }

    void resetConsecutive() {
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
    }

    void resetConsecutiveSuccesses() {
        consecutiveSuccesses = 0;
    }

    void addTransition(StateTransition transition) {
        if (stateChanges.size() == MAX_HISTORY)
            stateChanges.removeFirst();
        stateChanges.addLast(transition);
    }

    void clear() {
        totalCalls = 0;
        successfulCalls = 0;
        failedCalls = 0;
        rejectedCalls = 0;
        ignoredCalls = 0;
        slowCalls = 0;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        lastFailureTime = 0;
        lastSuccessTime = 0;
        stateChanges.clear();
    }

    CircuitStats copy() {
        return new CircuitStats(this);
    }

    public long getTotalCalls() { return totalCalls; }
    public long getSuccessfulCalls() { return successfulCalls; }
    public long getFailedCalls() { return failedCalls; }
    public long getRejectedCalls() { return rejectedCalls; }
    public long getIgnoredCalls() { return ignoredCalls; }
    public long getSlowCalls() { return slowCalls; }
    public int getConsecutiveFailures() { return consecutiveFailures; }
    public int getConsecutiveSuccesses() { return consecutiveSuccesses; }

    public Optional<Instant> getLastFailureTime() {
        return lastFailureTime == 0 ? Optional.empty() : Optional.of(Instant.ofEpochMilli(lastFailureTime));
    }

    public Optional<Instant> getLastSuccessTime() {
        return lastSuccessTime == 0 ? Optional.empty() : Optional.of(Instant.ofEpochMilli(lastSuccessTime));
    }

    /** Oldest first, at most ten entries. */
    public List<StateTransition> getStateChanges() {
        return Collections.unmodifiableList(new ArrayList<>(stateChanges));
    }
}
