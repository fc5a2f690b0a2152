package com.example.couchbaseconnect.core.connection;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorIdleSchedulerTest {

  @Test
  void shouldRunTaskOnNamedDaemonThread() throws InterruptedException {
    final var latch = new CountDownLatch(1);
    final var thread = new AtomicReference<Thread>();

    try (final var scheduler = new ExecutorIdleScheduler("idle-test")) {
      scheduler.schedule(
          () -> {
            thread.set(Thread.currentThread());
            latch.countDown();
          },
          Duration.ofMillis(10));

      assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    assertEquals("idle-test", thread.get().getName());
    assertTrue(thread.get().isDaemon());
  }

  @Test
  void shouldNotRunCancelledTask() throws InterruptedException {
    final var ran = new AtomicBoolean();

    try (final var scheduler = new ExecutorIdleScheduler("idle-test")) {
      scheduler.schedule(() -> ran.set(true), Duration.ofMillis(50)).cancel();
      Thread.sleep(150);
    }

    assertFalse(ran.get());
  }

  @Test
  void shouldDropCancelledTasksFromTheQueue() {
    try (final var scheduler = new ExecutorIdleScheduler("idle-test")) {
      for (var i = 0; i < 100; i++) scheduler.schedule(() -> {}, Duration.ofHours(1)).cancel();
      final var live = scheduler.schedule(() -> {}, Duration.ofHours(1));

      assertEquals(1, scheduler.queuedTasks());
      live.cancel();
      assertEquals(0, scheduler.queuedTasks());
    }
  }
}
