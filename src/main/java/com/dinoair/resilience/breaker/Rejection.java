package com.dinoair.resilience.breaker;

/**
 * Why a breaker refused admission and when the caller may try again.
 */
public final class Rejection {

    public enum Reason {
        CIRCUIT_OPEN,
        /** Half-open and every probe slot is taken. */
        PROBES_EXHAUSTED
    }

    private final String dependency;
    private final Reason reason;
    private final long retryAfterMs;

    public Rejection(String dependency, Reason reason, long retryAfterMs) {
        this.dependency = dependency;
        this.reason = reason;
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    public String getDependency() { return dependency; }
    public Reason getReason() { return reason; }
    public long getRetryAfterMs() { return retryAfterMs; }

    /** Whole seconds, never less than one, for a Retry-After header. */
    public long getRetryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }

    @Override
    public String toString() {
        return "Circuit " + dependency + " rejected call (" + reason + "), retry after " + getRetryAfterSeconds() + "s";
    }
}
