package com.dinoair.resilience.scheduling;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Scheduler} backed by a single daemon thread. Tasks must be short: they share the thread
 * with every timeout, rotation and probe tick of the process.
 */
public class ExecutorScheduler implements Scheduler, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorScheduler.class);

  private final ScheduledExecutorService executor;
  private final Clock clock;

  public ExecutorScheduler() {
    this(Clock.systemUTC(), "resilience-scheduler");
  }

  public ExecutorScheduler(Clock clock, String threadName) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, threadName);
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public ScheduledTask schedule(Runnable task, long delayMs) {
    ScheduledFuture<?> future = executor.schedule(safely(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    return new FutureTask(future);
  }

  @Override
  public ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs) {
    if (periodMs <= 0)
      throw new IllegalArgumentException("periodMs must be positive: " + periodMs);
    ScheduledFuture<?> future = executor.scheduleAtFixedRate(safely(task), periodMs, periodMs,
        TimeUnit.MILLISECONDS);
    return new FutureTask(future);
  }

  @Override
  public Clock clock() {
    return clock;
  }

  // an exception escaping a fixed-rate task would silently stop it
  private Runnable safely(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        logger.warn("Scheduled task failed", e);
      }
    };
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static final class FutureTask implements ScheduledTask {
    private final ScheduledFuture<?> future;

    FutureTask(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
