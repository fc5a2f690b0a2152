package com.example.couchbaseconnect.core.connection;

import java.time.Duration;

/** Runs a task once after a delay. Used by {@link ConnectionManager} for idle eviction. */
@FunctionalInterface
public interface IdleScheduler {

  /**
   * Schedules {@code task} to run once after {@code delay}.
   *
   * @param task task to run
   * @param delay delay before running
   * @return handle that cancels the task if it has not run yet
   */
  ScheduledTask schedule(final Runnable task, final Duration delay);

  /** Cancellation handle for a scheduled task. */
  @FunctionalInterface
  interface ScheduledTask {
    void cancel();
  }
}
