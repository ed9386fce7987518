package com.dinoair.resilience.breaker;

import java.time.Instant;

/**
 * One entry of a breaker's state-change history.
 */
public final class StateTransition {
    private final String breaker;
    private final CircuitState from;
    private final CircuitState to;
    private final Instant timestamp;
    private final String reason;

    public StateTransition(String breaker, CircuitState from, CircuitState to, Instant timestamp, String reason) {
        this.breaker = breaker;
        this.from = from;
        this.to = to;
        this.timestamp = timestamp;
        this.reason = reason;
    }

    public String getBreaker() { return breaker; }
    public CircuitState getFrom() { return from; }
    public CircuitState getTo() { return to; }
    public Instant getTimestamp() { return timestamp; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return breaker + ": " + from + " -> " + to + " at " + timestamp + " (" + reason + ")";
    }
}
