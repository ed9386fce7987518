package com.dinoair.resilience.stream;

import com.dinoair.resilience.breaker.Rejection;

/**
 * Terminal marker of a {@link ChunkStream}: tells a stream that completed apart from one that
 * stopped half way.
 */
public final class StreamResult {

  public enum Status {
    /** Upstream finished normally. */
    COMPLETED,
    /** Breaker rejected the call; the static fallback chunk was delivered instead. */
    FALLBACK,
    /** Breaker rejected the call before anything was sent. */
    REJECTED,
    /** Failed before any chunk was delivered, retries exhausted or not applicable. */
    FAILED,
    /** Failed after chunks were delivered. Never retried. */
    ABORTED,
    /** Aborted by the caller. */
    CANCELLED
  }

  private final Status status;
  private final int chunksDelivered;
  private final int attempts;
  private final Throwable cause;
  private final Rejection rejection;

  private StreamResult(Status status, int chunksDelivered, int attempts, Throwable cause, Rejection rejection) {
    this.status = status;
    this.chunksDelivered = chunksDelivered;
    this.attempts = attempts;
    this.cause = cause;
    this.rejection = rejection;
  }

  static StreamResult completed(int chunks, int attempts) {
    return new StreamResult(Status.COMPLETED, chunks, attempts, null, null);
  }

  static StreamResult fallback(Rejection rejection, int attempts) {
    return new StreamResult(Status.FALLBACK, 1, attempts, null, rejection);
  }

  static StreamResult rejected(Rejection rejection, int attempts) {
    return new StreamResult(Status.REJECTED, 0, attempts, null, rejection);
  }

  static StreamResult failed(Throwable cause, int attempts) {
    return new StreamResult(Status.FAILED, 0, attempts, cause, null);
  }

  static StreamResult aborted(Throwable cause, int chunks, int attempts) {
    return new StreamResult(Status.ABORTED, chunks, attempts, cause, null);
  }

  static StreamResult cancelled(int chunks, int attempts, Throwable cause) {
    return new StreamResult(Status.CANCELLED, chunks, attempts, cause, null);
  }

  public Status getStatus() { return status; }
  public int getChunksDelivered() { return chunksDelivered; }

  /** Attempts admitted by the breaker. */
  public int getAttempts() { return attempts; }

  /** Failure cause for {@code FAILED} and {@code ABORTED}; a consumer error for {@code CANCELLED}. */
  public Throwable getCause() { return cause; }

  /** Set for {@code REJECTED} and {@code FALLBACK}. */
  public Rejection getRejection() { return rejection; }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  @Override
  public String toString() {
    return "StreamResult{" + status + ", chunks=" + chunksDelivered + ", attempts=" + attempts
        + (cause != null ? ", cause=" + cause : "")
        + (rejection != null ? ", " + rejection : "") + "}";
  }
}
