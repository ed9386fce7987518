package com.dinoair.resilience.reliability;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: the wait before retry {@code n} (1-based) is
 * {@code min(baseDelay * 2^(n-1), maxDelay)}, optionally spread by up to 25% either way.
 */
public class RetryPolicy {
    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO, Duration.ZERO, false);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter) {
        if (maxRetries < 0)
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        if (baseDelay.isNegative() || maxDelay.isNegative())
            throw new IllegalArgumentException("delays must not be negative");
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public boolean isJitter() { return jitter; }

    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /** Delay before retry number {@code attempt}, starting at 1. */
    public long backoffMillis(int attempt) {
        if (attempt < 1)
            throw new IllegalArgumentException("attempt starts at 1: " + attempt);
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        // 2^62 already overflows any sane cap
        int shift = Math.min(attempt - 1, 62);
        long delay = base > (cap >> shift) ? cap : Math.min(base << shift, cap);
        if (!jitter || delay == 0)
            return delay;
        double spread = delay * 0.25;
        long jittered = Math.round(delay + ThreadLocalRandom.current().nextDouble(-spread, spread));
        return Math.max(0, jittered);
    }

    public static RetryPolicy of(int maxRetries, Duration backoff) {
        return new RetryPolicy(maxRetries, backoff, Duration.ofSeconds(30), false);
    }

    /** Two retries from one second up to thirty, with jitter. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(2, Duration.ofSeconds(1), Duration.ofSeconds(30), true);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", base=" + baseDelay + ", cap=" + maxDelay
            + ", jitter=" + jitter + "}";
    }
}
