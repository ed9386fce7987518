package com.dinoair.resilience.scheduling;

import java.time.Clock;

/**
 * Timer capability injected into the breakers, the supervisor, the rate limiter sweeper and the
 * health aggregator. Production code uses {@link ExecutorScheduler}; tests drive time by hand.
 */
public interface Scheduler {

  /** Runs {@code task} once after {@code delayMs}. */
  ScheduledTask schedule(Runnable task, long delayMs);

  /** Runs {@code task} every {@code periodMs}, first run after one period. */
  ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs);

  /** Clock used to timestamp the events this scheduler drives. */
  Clock clock();
}
