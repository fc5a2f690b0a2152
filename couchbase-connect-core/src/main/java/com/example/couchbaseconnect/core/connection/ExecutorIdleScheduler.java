package com.example.couchbaseconnect.core.connection;

import java.time.Duration;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link IdleScheduler} backed by a single daemon thread. Cancelled timers leave the queue
 * immediately, since every reused connection reschedules its timer.
 */
public final class ExecutorIdleScheduler implements IdleScheduler, AutoCloseable {

  private final ScheduledThreadPoolExecutor executor;

  public ExecutorIdleScheduler(final String threadName) {
    this.executor =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              final var t = new Thread(r, threadName);
              t.setDaemon(true);
              return t;
            });
    executor.setRemoveOnCancelPolicy(true);
  }

  @Override
  public ScheduledTask schedule(final Runnable task, final Duration delay) {
    final var future = executor.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
    return () -> future.cancel(false);
  }

  int queuedTasks() {
    return executor.getQueue().size();
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
