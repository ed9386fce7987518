package com.dinoair.resilience;

import java.util.Optional;

import com.dinoair.resilience.limiter.RateLimitDecision;
import com.dinoair.resilience.stream.ChunkStream;

/** Rate-limit decision for one request plus the supervised stream when it was admitted. */
public final class GuardedStream<C> {
  private final RateLimitDecision decision;
  private final ChunkStream<C> stream;

  GuardedStream(RateLimitDecision decision, ChunkStream<C> stream) {
    this.decision = decision;
    this.stream = stream;
  }

  public RateLimitDecision getDecision() { return decision; }

  public boolean isAllowed() { return decision.isAllowed(); }

  /** Empty when the rate limiter refused the request; the operation was never opened. */
  public Optional<ChunkStream<C>> getStream() {
    return Optional.ofNullable(stream);
  }
}
