package com.dinoair.resilience.breaker;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.failure.CallCancelledException;
import com.dinoair.resilience.failure.CallTimeoutException;
import com.dinoair.resilience.failure.ErrorClassifier;
import com.dinoair.resilience.metrics.MetricNames;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.scheduling.ScheduledTask;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * Admission policy for one external dependency.
 *
 * <pre>
 *     CLOSED ──(consecutive failures / window failure rate / slow rate)──> OPEN
 *        ^                                                                  │
 *        │                                                        (resetTimeout elapsed,
 *  (successThreshold                                               next admission check)
 *   probe successes)                                                        │
 *        │                                                                  v
 *        └──────────────────────────── HALF_OPEN ──(probe failure)──> OPEN
 * </pre>
 *
 * <p>Only probe permits issued in the current half-open state close or reopen the circuit; a permit
 * taken before the circuit opened is still counted in the stats when it settles.
 *
 * <p>Every outcome is recorded into the window bucket, the consecutive counters and the state
 * decision under the breaker's monitor, so two concurrent failures are both counted. Listeners are
 * notified after the monitor is released.
 *
 * <p>Two ways in: {@link #call} wraps a future-producing operation, races it against the timeout
 * and returns a {@link CallResult}; {@link #tryAcquirePermission()} hands out a {@link Permit} for
 * callers such as the streaming supervisor that run the call themselves.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Scheduler scheduler;
    private final Clock clock;
    private final MetricPublisher metrics;
    private final SlidingWindowTracker window;
    private final ScheduledTask rotation;

    private final CircuitStats stats = new CircuitStats();
    private final List<StateTransition> unpublished = new ArrayList<>();
    private CircuitState state = CircuitState.CLOSED;
    private long stateEnteredAt;
    private long epoch;
    private int probesInFlight;
    private int probeSuccesses;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Scheduler scheduler) {
        this(name, config, scheduler, NoOpMetricPublisher.INSTANCE);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Scheduler scheduler, MetricPublisher metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = scheduler.clock();
        this.metrics = metrics == null ? NoOpMetricPublisher.INSTANCE : metrics;
        this.window = new SlidingWindowTracker(config.getWindowBuckets());
        this.stateEnteredAt = clock.millis();
        this.rotation = scheduler.scheduleAtFixedRate(window::rotate, config.getRotationIntervalMs());
    }

    /**
     * Runs {@code operation} if admitted. When rejected, {@code fallback} (may be null) runs in its
     * place. The returned future never completes exceptionally.
     */
    public <T> CompletableFuture<CallResult<T>> call(Supplier<? extends CompletionStage<T>> operation,
            Supplier<? extends CompletionStage<T>> fallback) {
        Objects.requireNonNull(operation, "operation");
        Permit permit = tryAcquirePermission();
        if (permit == null) {
            Rejection rejection = currentRejection();
            if (fallback == null)
                return CompletableFuture.completedFuture(CallResult.rejected(rejection));
            return invokeFallback(fallback, rejection);
        }

        CompletableFuture<T> upstream;
        try {
            upstream = operation.get().toCompletableFuture();
        } catch (RuntimeException e) {
            upstream = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<CallResult<T>> result = new CompletableFuture<>();
        CompletableFuture<T> inFlight = upstream;
        ScheduledTask timer = scheduler.schedule(() -> {
            CallTimeoutException timeout = permit.onTimeout();
            if (timeout != null) {
                inFlight.cancel(true);
                result.complete(CallResult.failed(timeout));
            }
        }, config.getTimeoutMs());

        upstream.whenComplete((value, error) -> {
            if (error == null) {
                if (permit.onSuccess()) {
                    timer.cancel();
                    result.complete(CallResult.success(value));
                }
            } else if (permit.onError(error)) {
                timer.cancel();
                result.complete(CallResult.failed(ErrorClassifier.unwrap(error)));
            }
        });
        return result;
    }

    public <T> CompletableFuture<CallResult<T>> execute(Supplier<? extends CompletionStage<T>> operation) {
        return call(operation, null);
    }

    /**
     * Admission check. Returns null when the call must not be attempted; an open circuit whose reset
     * timeout has elapsed moves to half-open here and admits the caller as a probe.
     */
    public Permit tryAcquirePermission() {
        Permit permit;
        synchronized (this) {
            permit = admit(clock.millis());
            if (permit == null)
                stats.recordRejected();
        }
        publishTransitions();
        if (permit == null)
            metrics.incrementCounter(MetricNames.CALLS_REJECTED, name, 1);
        return permit;
    }

    private Permit admit(long now) {
        switch (state) {
            case CLOSED:
                return new Permit(this, epoch, false, now);
            case OPEN:
                if (now - stateEnteredAt < config.getResetTimeoutMs())
                    return null;
                transitionTo(CircuitState.HALF_OPEN, "Testing recovery", now);
                probesInFlight++;
                return new Permit(this, epoch, true, now);
            case HALF_OPEN:
                if (probesInFlight >= config.getSuccessThreshold())
                    return null;
                probesInFlight++;
                return new Permit(this, epoch, true, now);
            default:
                return null;
        }
    }

    void recordSuccess(Permit permit, long durationMs) {
        synchronized (this) {
            long now = clock.millis();
            boolean probe = isCurrentProbe(permit);
            releaseProbe(permit);
            boolean slow = durationMs > config.getSlowCallDurationMs();
            window.record(false, slow);
            stats.recordSuccess(now, slow);
            if (state == CircuitState.HALF_OPEN) {
                if (probe && ++probeSuccesses >= config.getSuccessThreshold())
                    transitionTo(CircuitState.CLOSED, "Service recovered", now);
            } else if (state == CircuitState.CLOSED) {
                evaluateWindow(now);
            }
        }
        publishTransitions();
        metrics.incrementCounter(MetricNames.CALLS_SUCCEEDED, name, 1);
    }

    void recordError(Permit permit, long durationMs, Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        // a timeout always counts, whatever the predicate says
        boolean timeout = cause instanceof CallTimeoutException;
        if (!timeout && (cause instanceof CallCancelledException || !config.getIsFailure().test(cause))) {
            synchronized (this) {
                releaseProbe(permit);
                stats.recordIgnored();
            }
            logger.debug("Circuit {} ignoring non-failure {}", name, cause.toString());
            return;
        }
        synchronized (this) {
            long now = clock.millis();
            boolean probe = isCurrentProbe(permit);
            releaseProbe(permit);
            boolean slow = durationMs > config.getSlowCallDurationMs();
            window.record(true, slow);
            stats.recordFailure(now, slow);
            if (state == CircuitState.HALF_OPEN) {
                if (probe)
                    transitionTo(CircuitState.OPEN, "Failure during recovery test", now);
            } else if (state == CircuitState.CLOSED) {
                if (stats.getConsecutiveFailures() >= config.getFailureThreshold())
                    transitionTo(CircuitState.OPEN,
                        "Failure threshold reached: " + stats.getConsecutiveFailures(), now);
                else
                    evaluateWindow(now);
            }
        }
        publishTransitions();
        metrics.incrementCounter(MetricNames.CALLS_FAILED, name, 1);
    }

    synchronized void releasePermit(Permit permit) {
        releaseProbe(permit);
        stats.recordIgnored();
    }

    // caller holds the monitor; permits issued before the current state never decide half-open
    private boolean isCurrentProbe(Permit permit) {
        return permit.isProbe() && permit.getEpoch() == epoch;
    }

    // caller holds the monitor
    private void releaseProbe(Permit permit) {
        if (isCurrentProbe(permit) && probesInFlight > 0)
            probesInFlight--;
    }

    // caller holds the monitor
    private void evaluateWindow(long now) {
        WindowStats ws = window.stats();
        if (ws.getTotalCalls() < config.getMinimumWindowCalls())
            return;
        if (ws.getFailureRate() > config.getFailureRateThreshold())
            transitionTo(CircuitState.OPEN,
                String.format("High failure rate: %.1f%%", ws.getFailureRate() * 100), now);
        else if (ws.getSlowCallRate() > config.getSlowCallRateThreshold())
            transitionTo(CircuitState.OPEN,
                String.format("High slow call rate: %.1f%%", ws.getSlowCallRate() * 100), now);
    }

    // caller holds the monitor
    private void transitionTo(CircuitState next, String reason, long now) {
        if (state == next)
            return;
        CircuitState previous = state;
        state = next;
        stateEnteredAt = now;
        epoch++;
        probesInFlight = 0;
        probeSuccesses = 0;
        if (next == CircuitState.CLOSED) {
            stats.resetConsecutive();
            window.clear();
        } else {
            stats.resetConsecutiveSuccesses();
        }
        StateTransition transition = new StateTransition(name, previous, next, Instant.ofEpochMilli(now), reason);
        stats.addTransition(transition);
        unpublished.add(transition);
    }

    private void publishTransitions() {
        List<StateTransition> pending;
        synchronized (this) {
            if (unpublished.isEmpty())
                return;
            pending = new ArrayList<>(unpublished);
            unpublished.clear();
        }
        for (StateTransition t : pending) {
            if (t.getTo() == CircuitState.OPEN)
                logger.warn("[CircuitBreaker {}] {} -> {}: {}", name, t.getFrom(), t.getTo(), t.getReason());
            else
                logger.info("[CircuitBreaker {}] {} -> {}: {}", name, t.getFrom(), t.getTo(), t.getReason());
            metrics.gauge(MetricNames.CIRCUIT_OPEN, name, gaugeValue(t.getTo()));
            try {
                config.getOnStateChange().onStateChange(t);
            } catch (RuntimeException e) {
                logger.warn("State change listener of circuit {} failed", name, e);
            }
        }
    }

    private <T> CompletableFuture<CallResult<T>> invokeFallback(Supplier<? extends CompletionStage<T>> fallback,
            Rejection rejection) {
        CompletableFuture<T> value;
        try {
            value = fallback.get().toCompletableFuture();
        } catch (RuntimeException e) {
            value = CompletableFuture.failedFuture(e);
        }
        return value.handle((v, error) -> error == null
            ? CallResult.fallback(v, rejection)
            : CallResult.failed(ErrorClassifier.unwrap(error)));
    }

    /** Rejection describing the current state, used after {@link #tryAcquirePermission()} returns null. */
    public synchronized Rejection currentRejection() {
        if (state == CircuitState.HALF_OPEN)
            return new Rejection(name, Rejection.Reason.PROBES_EXHAUSTED, 0);
        return new Rejection(name, Rejection.Reason.CIRCUIT_OPEN, remainingOpenMillis(clock.millis()));
    }

    private long remainingOpenMillis(long now) {
        if (state != CircuitState.OPEN)
            return 0;
        return Math.max(0, config.getResetTimeoutMs() - (now - stateEnteredAt));
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitStats getStats() {
        return stats.copy();
    }

    public WindowStats getWindowStats() {
        return window.stats();
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(name, state, stats.copy(), window.stats(),
            remainingOpenMillis(clock.millis()));
    }

    /** Back to CLOSED with every counter, bucket and the history cleared. Listeners are not notified. */
    public void reset() {
        synchronized (this) {
            state = CircuitState.CLOSED;
            stateEnteredAt = clock.millis();
            epoch++;
            probesInFlight = 0;
            probeSuccesses = 0;
            stats.clear();
            window.clear();
            unpublished.clear();
        }
        metrics.gauge(MetricNames.CIRCUIT_OPEN, name, 0);
        logger.info("[CircuitBreaker {}] Manually reset", name);
    }

    /** Cancels the window rotation timer. */
    public void stop() {
        rotation.cancel();
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    long currentTimeMillis() {
        return clock.millis();
    }

    private static double gaugeValue(CircuitState state) {
        switch (state) {
            case OPEN:
                return 1.0;
            case HALF_OPEN:
                return 0.5;
            default:
                return 0.0;
        }
    }
}
