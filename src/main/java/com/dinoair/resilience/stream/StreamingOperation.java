package com.dinoair.resilience.stream;

import java.util.concurrent.CompletableFuture;

import com.dinoair.resilience.reliability.CancellationToken;

/**
 * One attempt at a streaming call to an external service. The implementation owns the wire format
 * (newline-delimited JSON, SSE, ...) and turns it into chunks.
 *
 * @param <C> chunk type, e.g. a generated token
 */
@FunctionalInterface
public interface StreamingOperation<C> {

  /**
   * Starts the call. Chunks go to {@code sink} in order; the returned future completes when the
   * upstream response ends, or exceptionally when it fails. Once {@code token} is cancelled the
   * implementation must release its connection; chunks emitted after that are dropped.
   */
  CompletableFuture<Void> open(ChunkSink<C> sink, CancellationToken token);
}
