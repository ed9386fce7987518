package com.dinoair.resilience.stream;

/**
 * Where a {@link StreamingOperation} pushes decoded chunks as they arrive.
 */
@FunctionalInterface
public interface ChunkSink<C> {

  void emit(C chunk);
}
