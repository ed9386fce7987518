package com.dinoair.resilience.stream;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Lazy, finite, single-use sequence of response chunks. Nothing is sent to the dependency until
 * {@link #forEach} is called.
 */
public interface ChunkStream<C> {

  /**
   * Starts the call and forwards every chunk to {@code consumer} as soon as it arrives. The returned
   * future completes with the terminal marker of the sequence and never completes exceptionally.
   *
   * @throws IllegalStateException if the stream was already consumed
   */
  CompletableFuture<StreamResult> forEach(Consumer<? super C> consumer);

  /** Caller-initiated abort: stops chunk delivery and releases the in-flight request. */
  void cancel();
}
