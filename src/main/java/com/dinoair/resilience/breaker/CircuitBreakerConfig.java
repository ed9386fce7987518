package com.dinoair.resilience.breaker;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

import com.dinoair.resilience.failure.CallCancelledException;
import com.dinoair.resilience.failure.DependencyException;

/**
 * Per-dependency breaker settings. Defaults match the general-purpose profile; see
 * {@link DependencyPresets} for the tuned ones.
 *
 * <p>{@code failureRateThreshold} and {@code minimumWindowCalls} are the window safety net and are
 * independent of {@code failureThreshold}, which counts consecutive failures only.
 */
public final class CircuitBreakerConfig {
    /**
     * Counts everything except caller cancellations and client errors (4xx other than 429): a bad
     * request says nothing about the dependency's health.
     */
    public static final Predicate<Throwable> DEFAULT_IS_FAILURE = error -> {
        if (error instanceof CallCancelledException)
            return false;
        if (error instanceof DependencyException) {
            int status = ((DependencyException) error).getStatusCode();
            return status < 400 || status > 499 || status == 429;
        }
        return true;
    };

    private final int failureThreshold;
    private final int successThreshold;
    private final long timeoutMs;
    private final long resetTimeoutMs;
    private final long windowSizeMs;
    private final int windowBuckets;
    private final long slowCallDurationMs;
    private final double slowCallRateThreshold;
    private final double failureRateThreshold;
    private final int minimumWindowCalls;
    private final Predicate<Throwable> isFailure;
    private final StateChangeListener onStateChange;

    private CircuitBreakerConfig(Builder b) {
        this.failureThreshold = b.failureThreshold;
        this.successThreshold = b.successThreshold;
        this.timeoutMs = b.timeoutMs;
        this.resetTimeoutMs = b.resetTimeoutMs;
        this.windowSizeMs = b.windowSizeMs;
        this.windowBuckets = b.windowBuckets;
        this.slowCallDurationMs = b.slowCallDurationMs;
        this.slowCallRateThreshold = b.slowCallRateThreshold;
        this.failureRateThreshold = b.failureRateThreshold;
        this.minimumWindowCalls = b.minimumWindowCalls;
        this.isFailure = b.isFailure;
        this.onStateChange = b.onStateChange;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static CircuitBreakerConfig defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .failureThreshold(failureThreshold)
            .successThreshold(successThreshold)
            .timeout(Duration.ofMillis(timeoutMs))
            .resetTimeout(Duration.ofMillis(resetTimeoutMs))
            .windowSize(Duration.ofMillis(windowSizeMs))
            .windowBuckets(windowBuckets)
            .slowCallDuration(Duration.ofMillis(slowCallDurationMs))
            .slowCallRateThreshold(slowCallRateThreshold)
            .failureRateThreshold(failureRateThreshold)
            .minimumWindowCalls(minimumWindowCalls)
            .isFailure(isFailure)
            .onStateChange(onStateChange);
    }

    public int getFailureThreshold() { return failureThreshold; }
    public int getSuccessThreshold() { return successThreshold; }
    public long getTimeoutMs() { return timeoutMs; }
    public long getResetTimeoutMs() { return resetTimeoutMs; }
    public long getWindowSizeMs() { return windowSizeMs; }
    public int getWindowBuckets() { return windowBuckets; }
    public long getSlowCallDurationMs() { return slowCallDurationMs; }
    public double getSlowCallRateThreshold() { return slowCallRateThreshold; }
    public double getFailureRateThreshold() { return failureRateThreshold; }
    public int getMinimumWindowCalls() { return minimumWindowCalls; }
    public Predicate<Throwable> getIsFailure() { return isFailure; }
    public StateChangeListener getOnStateChange() { return onStateChange; }

    /** Interval at which the window cursor advances. */
    public long getRotationIntervalMs() {
        return windowSizeMs / windowBuckets;
    }

    public static class Builder {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private long timeoutMs = 30_000;
        private long resetTimeoutMs = 60_000;
        private long windowSizeMs = 60_000;
        private int windowBuckets = 6;
        private long slowCallDurationMs = 5_000;
        private double slowCallRateThreshold = 0.5;
        private double failureRateThreshold = 0.5;
        private int minimumWindowCalls = 10;
        private Predicate<Throwable> isFailure = DEFAULT_IS_FAILURE;
        private StateChangeListener onStateChange = StateChangeListener.NONE;

        public Builder failureThreshold(int n) {
            this.failureThreshold = n;
            return this;
        }

        public Builder successThreshold(int n) {
            this.successThreshold = n;
            return this;
        }

        public Builder timeout(Duration d) {
            this.timeoutMs = d.toMillis();
            return this;
        }

        public Builder resetTimeout(Duration d) {
            this.resetTimeoutMs = d.toMillis();
            return this;
        }

        public Builder windowSize(Duration d) {
            this.windowSizeMs = d.toMillis();
            return this;
        }

        public Builder windowBuckets(int n) {
            this.windowBuckets = n;
            return this;
        }

        public Builder slowCallDuration(Duration d) {
            this.slowCallDurationMs = d.toMillis();
            return this;
        }

        public Builder slowCallRateThreshold(double rate) {
            this.slowCallRateThreshold = rate;
            return this;
        }

        public Builder failureRateThreshold(double rate) {
            this.failureRateThreshold = rate;
            return this;
        }

        public Builder minimumWindowCalls(int n) {
            this.minimumWindowCalls = n;
            return this;
        }

        public Builder isFailure(Predicate<Throwable> predicate) {
            this.isFailure = Objects.requireNonNull(predicate, "isFailure");
            return this;
        }

        public Builder onStateChange(StateChangeListener listener) {
            this.onStateChange = listener == null ? StateChangeListener.NONE : listener;
            return this;
        }

        public CircuitBreakerConfig build() {
            requirePositive(failureThreshold, "failureThreshold");
            requirePositive(successThreshold, "successThreshold");
            requirePositive(timeoutMs, "timeout");
            requirePositive(resetTimeoutMs, "resetTimeout");
            requirePositive(windowBuckets, "windowBuckets");
            requirePositive(minimumWindowCalls, "minimumWindowCalls");
            if (windowSizeMs < windowBuckets)
                throw new IllegalArgumentException("windowSize must cover at least 1ms per bucket");
            requireRate(slowCallRateThreshold, "slowCallRateThreshold");
            requireRate(failureRateThreshold, "failureRateThreshold");
            return new CircuitBreakerConfig(this);
        }

        private static void requirePositive(long value, String field) {
            if (value <= 0)
                throw new IllegalArgumentException(field + " must be positive: " + value);
        }

        private static void requireRate(double value, String field) {
            if (value <= 0.0 || value > 1.0)
                throw new IllegalArgumentException(field + " must be in (0, 1]: " + value);
        }
    }
}
