package com.dinoair.resilience.stream;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dinoair.resilience.breaker.CircuitBreaker;
import com.dinoair.resilience.breaker.Permit;
import com.dinoair.resilience.breaker.Rejection;
import com.dinoair.resilience.failure.CallCancelledException;
import com.dinoair.resilience.failure.CallTimeoutException;
import com.dinoair.resilience.failure.ErrorCategory;
import com.dinoair.resilience.failure.ErrorClassifier;
import com.dinoair.resilience.metrics.MetricNames;
import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.reliability.CancellationReason;
import com.dinoair.resilience.reliability.CancellationToken;
import com.dinoair.resilience.reliability.RetryPolicy;
import com.dinoair.resilience.scheduling.ScheduledTask;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * Attempt loop behind {@link StreamingRequestSupervisor#execute}. Each attempt passes breaker
 * admission, races the breaker timeout and settles exactly once; retries only happen while no
 * chunk has reached the consumer.
 */
final class SupervisedStream<C> implements ChunkStream<C> {
  private static final Logger logger = LoggerFactory.getLogger(SupervisedStream.class);

  private final StreamingRequest<C> request;
  private final CircuitBreaker breaker;
  private final Scheduler scheduler;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier classifier;
  private final MetricPublisher metrics;
  private final CancellationToken token;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean finished = new AtomicBoolean();
  private final AtomicInteger delivered = new AtomicInteger();
  private final CompletableFuture<StreamResult> result = new CompletableFuture<>();
  private volatile Consumer<? super C> consumer;
  private volatile Attempt current;
  private volatile ScheduledTask backoff;
  private volatile int admittedAttempts;

  SupervisedStream(StreamingRequest<C> request, CircuitBreaker breaker, Scheduler scheduler,
      RetryPolicy retryPolicy, ErrorClassifier classifier, MetricPublisher metrics) {
    this.request = request;
    this.breaker = breaker;
    this.scheduler = scheduler;
    this.retryPolicy = retryPolicy;
    this.classifier = classifier;
    this.metrics = metrics;
    this.token = request.getCancellationToken();
  }

  @Override
  public CompletableFuture<StreamResult> forEach(Consumer<? super C> consumer) {
    if (!started.compareAndSet(false, true))
      throw new IllegalStateException("Stream for " + request.getTarget() + " was already consumed");
    this.consumer = consumer;
    token.onCancel(this::onCallerCancel);
    runAttempt(1);
    return result;
  }

  @Override
  public void cancel() {
    token.cancel(CancellationReason.CALLER);
  }

  private void runAttempt(int number) {
    if (finished.get())
      return;
    if (token.isCancelled()) {
      finish(StreamResult.cancelled(delivered.get(), admittedAttempts, null));
      return;
    }
    Permit permit = breaker.tryAcquirePermission();
    if (permit == null) {
      Rejection rejection = breaker.currentRejection();
      C fallback = request.getFallbackChunk();
      if (fallback != null) {
        try {
          forward(fallback);
        } catch (RuntimeException e) {
          logger.warn("Consumer of {} rejected the fallback chunk", request.getTarget(), e);
          finish(StreamResult.cancelled(delivered.get(), admittedAttempts, e));
          return;
        }
        finish(StreamResult.fallback(rejection, admittedAttempts));
      } else {
        finish(StreamResult.rejected(rejection, admittedAttempts));
      }
      return;
    }
    admittedAttempts = number;
    Attempt attempt = new Attempt(number, permit, token.child());
    current = attempt;
    attempt.timer = scheduler.schedule(() -> onTimeout(attempt), breaker.getConfig().getTimeoutMs());

    CompletableFuture<Void> done;
    try {
      done = request.getOperation().open(attempt::emit, attempt.token);
      if (done == null)
        done = CompletableFuture.failedFuture(new IllegalStateException("operation returned no future"));
    } catch (RuntimeException e) {
      done = CompletableFuture.failedFuture(e);
    }
    done.whenComplete((v, error) -> settle(attempt, error == null ? null : ErrorClassifier.unwrap(error)));
  }

  private void onCallerCancel() {
    Attempt attempt = current;
    if (attempt != null)
      settle(attempt, new CallCancelledException());
    ScheduledTask pending = backoff;
    if (pending != null)
      pending.cancel();
    finish(StreamResult.cancelled(delivered.get(), admittedAttempts, null));
  }

  private void onTimeout(Attempt attempt) {
    if (!attempt.markSettled())
      return;
    CallTimeoutException timeout = attempt.permit.onTimeout();
    attempt.token.cancel(CancellationReason.TIMEOUT);
    logger.debug("{} attempt {} timed out after {}ms", request.getTarget(), attempt.number,
        breaker.getConfig().getTimeoutMs());
    afterFailure(attempt, timeout, ErrorCategory.TRANSIENT);
  }

  private void settle(Attempt attempt, Throwable error) {
    if (!attempt.markSettled())
      return;
    attempt.timer.cancel();
    if (error == null) {
      attempt.permit.onSuccess();
      finish(StreamResult.completed(delivered.get(), attempt.number));
      return;
    }
    ErrorCategory category = token.getReason() == CancellationReason.CALLER
        ? ErrorCategory.CANCELLED
        : classifier.classify(error);
    if (category == ErrorCategory.CANCELLED) {
      attempt.permit.release();
      attempt.token.cancel(CancellationReason.CALLER);
      finish(StreamResult.cancelled(delivered.get(), attempt.number, attempt.consumerError));
      return;
    }
    attempt.permit.onError(error);
    afterFailure(attempt, error, category);
  }

  private void afterFailure(Attempt attempt, Throwable error, ErrorCategory category) {
    if (attempt.delivered > 0) {
      // partial content already reached the caller, a retry would duplicate it
      metrics.incrementCounter(MetricNames.STREAMS_ABORTED, breaker.getName(), 1);
      logger.debug("{} aborted after {} chunks: {}", request.getTarget(), attempt.delivered, error.toString());
      finish(StreamResult.aborted(error, delivered.get(), attempt.number));
      return;
    }
    if (category == ErrorCategory.TRANSIENT && retryPolicy.canRetry(attempt.number - 1) && !token.isCancelled()) {
      long delay = retryPolicy.backoffMillis(attempt.number);
      metrics.incrementCounter(MetricNames.STREAM_RETRIES, breaker.getName(), 1);
      logger.debug("{} attempt {} failed ({}), retrying in {}ms", request.getTarget(), attempt.number,
          error.toString(), delay);
      backoff = scheduler.schedule(() -> runAttempt(attempt.number + 1), delay);
      return;
    }
    finish(StreamResult.failed(error, attempt.number));
  }

  private void forward(C chunk) {
    delivered.incrementAndGet();
    consumer.accept(chunk);
  }

  private void finish(StreamResult outcome) {
    if (finished.compareAndSet(false, true))
      result.complete(outcome);
  }

  private final class Attempt {
    private final int number;
    private final Permit permit;
    private final CancellationToken token;
    private ScheduledTask timer;
    private int delivered;
    private boolean settled;
    private RuntimeException consumerError;

    Attempt(int number, Permit permit, CancellationToken token) {
      this.number = number;
      this.permit = permit;
      this.token = token;
    }

    synchronized boolean markSettled() {
      if (settled)
        return false;
      settled = true;
      return true;
    }

    void emit(C chunk) {
      RuntimeException failure = null;
      synchronized (this) {
        if (settled || token.isCancelled())
          return;
        delivered++;
        try {
          forward(chunk);
        } catch (RuntimeException e) {
          consumerError = e;
          failure = e;
        }
      }
      if (failure != null) {
        logger.warn("Consumer of {} failed, cancelling the stream", request.getTarget(), failure);
        SupervisedStream.this.cancel();
      }
    }
  }
}
