package com.dinoair.resilience.stream;

import java.util.Objects;

import com.dinoair.resilience.reliability.CancellationToken;
import com.dinoair.resilience.reliability.RetryPolicy;

/**
 * What to call and how: the dependency whose breaker guards the call, the operation, and the
 * optional knobs.
 */
public final class StreamingRequest<C> {
  private final String dependency;
  private final String target;
  private final StreamingOperation<C> operation;
  private final C fallbackChunk;
  private final CancellationToken cancellationToken;
  private final RetryPolicy retryPolicy;

  private StreamingRequest(Builder<C> b) {
    this.dependency = b.dependency;
    this.target = b.target == null ? b.dependency : b.target;
    this.operation = b.operation;
    this.fallbackChunk = b.fallbackChunk;
    this.cancellationToken = b.cancellationToken == null ? CancellationToken.create() : b.cancellationToken;
    this.retryPolicy = b.retryPolicy;
  }

  public static <C> Builder<C> newBuilder(String dependency, StreamingOperation<C> operation) {
    return new Builder<>(dependency, operation);
  }

  public String getDependency() { return dependency; }

  /** Free-form description of the call for logs, e.g. {@code POST /api/generate}. */
  public String getTarget() { return target; }

  public StreamingOperation<C> getOperation() { return operation; }

  /** Chunk delivered instead of the response when the breaker rejects the call, or null. */
  public C getFallbackChunk() { return fallbackChunk; }

  public CancellationToken getCancellationToken() { return cancellationToken; }

  /** Overrides the supervisor's policy when set. */
  public RetryPolicy getRetryPolicy() { return retryPolicy; }

  public static class Builder<C> {
    private final String dependency;
    private final StreamingOperation<C> operation;
    private String target;
    private C fallbackChunk;
    private CancellationToken cancellationToken;
    private RetryPolicy retryPolicy;

    Builder(String dependency, StreamingOperation<C> operation) {
      this.dependency = Objects.requireNonNull(dependency, "dependency");
      this.operation = Objects.requireNonNull(operation, "operation");
    }

    public Builder<C> target(String target) {
      this.target = target;
      return this;
    }

    public Builder<C> fallbackChunk(C chunk) {
      this.fallbackChunk = chunk;
      return this;
    }

    public Builder<C> cancellationToken(CancellationToken token) {
      this.cancellationToken = token;
      return this;
    }

    public Builder<C> retryPolicy(RetryPolicy policy) {
      this.retryPolicy = policy;
      return this;
    }

    public StreamingRequest<C> build() {
      return new StreamingRequest<>(this);
    }
  }
}
