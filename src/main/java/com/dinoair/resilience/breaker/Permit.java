package com.dinoair.resilience.breaker;

import java.util.concurrent.atomic.AtomicBoolean;

import com.dinoair.resilience.failure.CallTimeoutException;

/**
 * Admission granted by {@link CircuitBreaker#tryAcquirePermission()}. Exactly one of
 * {@link #onSuccess()}, {@link #onError(Throwable)}, {@link #onTimeout()} or {@link #release()}
 * takes effect; later calls return {@code false} and change nothing.
 */
public final class Permit {
    private final CircuitBreaker breaker;
    private final long epoch;
    private final boolean probe;
    private final long admittedAt;
    private final AtomicBoolean settled = new AtomicBoolean();

    Permit(CircuitBreaker breaker, long epoch, boolean probe, long admittedAt) {
        this.breaker = breaker;
        this.epoch = epoch;
        this.probe = probe;
        this.admittedAt = admittedAt;
    }

    public boolean onSuccess() {
        if (!settled.compareAndSet(false, true))
            return false;
        breaker.recordSuccess(this, elapsedMillis());
        return true;
    }

    public boolean onError(Throwable error) {
        if (!settled.compareAndSet(false, true))
            return false;
        breaker.recordError(this, elapsedMillis(), error);
        return true;
    }

    /** Records a timeout; the duration is never below the configured timeout. */
    public CallTimeoutException onTimeout() {
        if (!settled.compareAndSet(false, true))
            return null;
        long timeout = breaker.getConfig().getTimeoutMs();
        CallTimeoutException error = new CallTimeoutException(timeout);
        breaker.recordError(this, Math.max(timeout, elapsedMillis()), error);
        return error;
    }

    /** Gives the permit back without recording an outcome, e.g. after a caller cancellation. */
    public boolean release() {
        if (!settled.compareAndSet(false, true))
            return false;
        breaker.releasePermit(this);
        return true;
    }

    public boolean isSettled() {
        return settled.get();
    }

    public long elapsedMillis() {
        return Math.max(0, breaker.currentTimeMillis() - admittedAt);
    }

    public String getBreakerName() {
        return breaker.getName();
    }

    boolean isProbe() {
        return probe;
    }

    long getEpoch() {
        return epoch;
    }
}
