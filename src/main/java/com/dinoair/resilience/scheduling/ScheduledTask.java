package com.dinoair.resilience.scheduling;

/**
 * Handle to a task registered with a {@link Scheduler}.
 */
public interface ScheduledTask {

  /**
   * Cancels the task. Has no effect if it already ran (one-shot) or was cancelled.
   */
  void cancel();

  boolean isCancelled();
}
