package com.dinoair.resilience.stream;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.breaker.CallResult;
import com.dinoair.resilience.breaker.CircuitBreaker;
import com.dinoair.resilience.breaker.CircuitBreakerRegistry;
import com.dinoair.resilience.failure.CallCancelledException;
import com.dinoair.resilience.failure.DefaultErrorClassifier;
import com.dinoair.resilience.failure.ErrorCategory;
import com.dinoair.resilience.failure.ErrorClassifier;
import com.dinoair.resilience.metrics.MetricNames;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.reliability.CancellationToken;
import com.dinoair.resilience.reliability.RetryPolicy;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * Runs external calls through their dependency's breaker with a timeout race and retry on
 * transient failures.
 *
 * <ul>
 * <li>every attempt, retries included, passes breaker admission, so an open breaker stops a retry
 * storm;</li>
 * <li>every admitted attempt reports its outcome to the breaker exactly once;</li>
 * <li>caller cancellation never counts against the breaker and is never retried;</li>
 * <li>a failure after chunks were delivered ends the stream with {@code ABORTED}.</li>
 * </ul>
 */
public class StreamingRequestSupervisor {
  private static final Logger logger = LoggerFactory.getLogger(StreamingRequestSupervisor.class);

  private final CircuitBreakerRegistry breakers;
  private final Scheduler scheduler;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier classifier;
  private final MetricPublisher metrics;

  private StreamingRequestSupervisor(Builder builder) {
    this.breakers = Objects.requireNonNull(builder.breakers, "breakers");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.retryPolicy = builder.retryPolicy;
    this.classifier = builder.classifier;
    this.metrics = builder.metrics;
  }

  public static Builder newBuilder(CircuitBreakerRegistry breakers, Scheduler scheduler) {
    return new Builder(breakers, scheduler);
  }

  /**
   * Returns the supervised chunk sequence for {@code request}. Nothing happens until the caller
   * consumes it.
   *
   * @throws IllegalArgumentException if no breaker is registered for the request's dependency
   */
  public <C> ChunkStream<C> execute(StreamingRequest<C> request) {
    CircuitBreaker breaker = breakers.get(request.getDependency());
    RetryPolicy policy = request.getRetryPolicy() != null ? request.getRetryPolicy() : retryPolicy;
    return new SupervisedStream<>(request, breaker, scheduler, policy, classifier, metrics);
  }

  /**
   * Non-streaming variant with the same retry policy. Retries stop as soon as {@code token} is
   * cancelled; the in-flight attempt itself is not interrupted.
   */
  public <T> CompletableFuture<CallResult<T>> executeUnary(String dependency,
      Supplier<? extends CompletionStage<T>> operation, CancellationToken token) {
    CircuitBreaker breaker = breakers.get(dependency);
    CompletableFuture<CallResult<T>> out = new CompletableFuture<>();
    unaryAttempt(breaker, operation, token == null ? CancellationToken.create() : token, 1, out);
    return out;
  }

  private <T> void unaryAttempt(CircuitBreaker breaker, Supplier<? extends CompletionStage<T>> operation,
      CancellationToken token, int attempt, CompletableFuture<CallResult<T>> out) {
    if (token.isCancelled()) {
      out.complete(CallResult.failed(new CallCancelledException()));
      return;
    }
    breaker.execute(operation).thenAccept(result -> {
      if (result.getKind() == CallResult.Kind.FAILED
          && classifier.classify(result.getCause()) == ErrorCategory.TRANSIENT
          && retryPolicy.canRetry(attempt - 1)
          && !token.isCancelled()) {
        long delay = retryPolicy.backoffMillis(attempt);
        metrics.incrementCounter(MetricNames.STREAM_RETRIES, breaker.getName(), 1);
        logger.debug("{} attempt {} failed ({}), retrying in {}ms", breaker.getName(), attempt,
            result.getCause().toString(), delay);
        scheduler.schedule(() -> unaryAttempt(breaker, operation, token, attempt + 1, out), delay);
      } else {
        out.complete(result);
      }
    });
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public static class Builder {
    private final CircuitBreakerRegistry breakers;
    private final Scheduler scheduler;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private ErrorClassifier classifier = DefaultErrorClassifier.INSTANCE;
    private MetricPublisher metrics = NoOpMetricPublisher.INSTANCE;

    Builder(CircuitBreakerRegistry breakers, Scheduler scheduler) {
      this.breakers = breakers;
      this.scheduler = scheduler;
    }

    public Builder retryPolicy(RetryPolicy policy) {
      this.retryPolicy = Objects.requireNonNull(policy, "retryPolicy");
      return this;
    }

    public Builder errorClassifier(ErrorClassifier classifier) {
      this.classifier = Objects.requireNonNull(classifier, "classifier");
      return this;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metrics = mp == null ? NoOpMetricPublisher.INSTANCE : mp;
      return this;
    }

    public StreamingRequestSupervisor build() {
      return new StreamingRequestSupervisor(this);
    }
  }
}
