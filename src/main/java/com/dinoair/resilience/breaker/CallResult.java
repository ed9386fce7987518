package com.dinoair.resilience.breaker;

import java.util.Objects;

/**
 * Outcome of {@link CircuitBreaker#call}. Callers switch on {@link #getKind()} instead of catching
 * exceptions: rejection is an expected outcome, not an error.
 *
 * @param <T> result type of the protected operation
 */
public final class CallResult<T> {

    public enum Kind {
        /** Admitted and the operation produced a value. */
        SUCCESS,
        /** Rejected, the fallback produced the value. */
        FALLBACK,
        /** Rejected without fallback. */
        REJECTED,
        /** Admitted and the operation failed or timed out. */
        FAILED
    }

    private final Kind kind;
    private final T value;
    private final Rejection rejection;
    private final Throwable cause;

    private CallResult(Kind kind, T value, Rejection rejection, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.rejection = rejection;
        this.cause = cause;
    }

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Kind.SUCCESS, value, null, null);
    }

    public static <T> CallResult<T> fallback(T value, Rejection rejection) {
        return new CallResult<>(Kind.FALLBACK, value, rejection, null);
    }

    public static <T> CallResult<T> rejected(Rejection rejection) {
        return new CallResult<>(Kind.REJECTED, null, Objects.requireNonNull(rejection), null);
    }

    public static <T> CallResult<T> failed(Throwable cause) {
        return new CallResult<>(Kind.FAILED, null, null, Objects.requireNonNull(cause));
    }

    public Kind getKind() { return kind; }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /** Value for {@code SUCCESS} and {@code FALLBACK}, otherwise null. */
    public T getValue() { return value; }

    /** Set for {@code REJECTED} and {@code FALLBACK}. */
    public Rejection getRejection() { return rejection; }

    /** Set for {@code FAILED}. */
    public Throwable getCause() { return cause; }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "CallResult{SUCCESS}";
            case FALLBACK:
            case REJECTED:
                return "CallResult{" + kind + ", " + rejection + "}";
            default:
                return "CallResult{FAILED, " + cause + "}";
        }
    }
}
