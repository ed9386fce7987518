package com.dinoair.resilience.reliability;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation shared between the caller, the supervisor and the code holding the
 * network resource. Cancelling a token cancels its children; the first reason wins.
 */
public final class CancellationToken {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> listeners = new ArrayList<>();
    private CancellationReason reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Cancels the token. Listeners run on the calling thread.
     *
     * @return false if it was already cancelled
     */
    public boolean cancel(CancellationReason why) {
        List<Runnable> toRun;
        synchronized (this) {
            if (reason != null)
                return false;
            reason = why;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable r : toRun) {
            try {
                r.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation listener failed", e);
            }
        }
        return true;
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    /** Null while not cancelled. */
    public synchronized CancellationReason getReason() {
        return reason;
    }

    /** Runs {@code listener} on cancellation, immediately if already cancelled. */
    public void onCancel(Runnable listener) {
        synchronized (this) {
            if (reason == null) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    /** Token cancelled together with this one (same reason) but cancellable on its own. */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(() -> child.cancel(getReason()));
        return child;
    }
}
