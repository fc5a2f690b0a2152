package com.example.couchbaseconnect.core.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RetryExecutorTest {

  private List<Duration> sleeps;
  private RetryExecutor executor;

  @BeforeEach
  void setUp() {
    sleeps = new ArrayList<>();
    executor = new RetryExecutor(sleeps::add);
  }

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  private static StorageException timeout() {
    return new StorageException(StorageErrorKind.TIMEOUT, "timed out");
  }

  private static RetryPolicy policy(final int attempts, final long delayMillis, final double mult) {
    return RetryPolicy.builder()
        .maxAttempts(attempts)
        .initialDelayMillis(delayMillis)
        .backoffMultiplier(mult)
        .build();
  }

  @Nested
  @DisplayName("Basic Retry Behavior")
  class BasicRetryBehavior {

    @Test
    @DisplayName("Should return immediately on first success")
    void shouldReturnOnFirstSuccess() {
      final var result = executor.execute(() -> "ok", policy(3, 10L, 2.0));

      assertEquals("ok", result);
      assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should retry transient failures with exponential backoff")
    void shouldRetryWithExponentialBackoff() {
      final var calls = new AtomicInteger();

      final var result =
          executor.execute(
              () -> {
                if (calls.incrementAndGet() < 3) throw timeout();
                return "success";
              },
              policy(3, 10L, 2.0));

      assertEquals("success", result);
      assertEquals(3, calls.get());
      assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
      assertEquals(
          Duration.ofMillis(30), sleeps.stream().reduce(Duration.ZERO, Duration::plus));
    }

    @Test
    @DisplayName("Should use a fixed delay when multiplier is 1")
    void shouldUseFixedDelay() {
      final var calls = new AtomicInteger();

      assertThrows(
          StorageException.class,
          () ->
              executor.execute(
                  () -> {
                    calls.incrementAndGet();
                    throw timeout();
                  },
                  policy(4, 50L, 1.0)));

      assertEquals(4, calls.get());
      assertEquals(Collections.nCopies(3, Duration.ofMillis(50)), sleeps);
    }

    @Test
    @DisplayName("Should not sleep when initial delay is zero")
    void shouldNotSleepWithZeroDelay() {
      final var calls = new AtomicInteger();

      executor.execute(
          () -> {
            if (calls.incrementAndGet() < 2) throw timeout();
            return calls.get();
          },
          policy(2, 0L, 2.0));

      assertEquals(2, calls.get());
      assertTrue(sleeps.isEmpty());
    }
  }

  @Nested
  @DisplayName("Failure Propagation")
  class FailurePropagation {

    @Test
    @DisplayName("Should call a non-retryable operation once and not sleep")
    void shouldNotRetryNonRetryable() {
      final var calls = new AtomicInteger();
      final var failure = new StorageException(StorageErrorKind.AUTHENTICATION, "denied");

      final var thrown =
          assertThrows(
              StorageException.class,
              () ->
                  executor.execute(
                      () -> {
                        calls.incrementAndGet();
                        throw failure;
                      },
                      policy(5, 10L, 2.0)));

      assertSame(failure, thrown);
      assertEquals(1, calls.get());
      assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should propagate the last error after exhausting attempts")
    void shouldPropagateLastError() {
      final var calls = new AtomicInteger();
      final var errors = new ArrayList<StorageException>();

      final var thrown =
          assertThrows(
              StorageException.class,
              () ->
                  executor.execute(
                      () -> {
                        final var e =
                            new StorageException(
                                StorageErrorKind.TEMPORARY_FAILURE,
                                "busy " + calls.incrementAndGet());
                        errors.add(e);
                        throw e;
                      },
                      policy(3, 1L, 2.0)));

      assertEquals(3, calls.get());
      assertSame(errors.get(2), thrown);
      assertEquals(0, thrown.getSuppressed().length);
    }

    @Test
    @DisplayName("Should propagate checked exceptions declared by the operation")
    void shouldPropagateCheckedExceptions() {
      final var policy =
          RetryPolicy.builder()
              .maxAttempts(2)
              .initialDelayMillis(1L)
              .isRetryable(e -> true)
              .build();
      final var calls = new AtomicInteger();

      final var thrown =
          assertThrows(
              IOException.class,
              () ->
                  executor.<String, IOException>execute(
                      () -> {
                        calls.incrementAndGet();
                        throw new IOException("disk");
                      },
                      policy));

      assertEquals("disk", thrown.getMessage());
      assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should honour a custom retry predicate")
    void shouldHonourCustomPredicate() {
      final var calls = new AtomicInteger();
      final var policy =
          RetryPolicy.builder()
              .maxAttempts(3)
              .initialDelayMillis(5L)
              .isRetryable(e -> e instanceof IllegalStateException)
              .build();

      final var result =
          executor.execute(
              () -> {
                if (calls.incrementAndGet() == 1) throw new IllegalStateException("flaky");
                return "done";
              },
              policy);

      assertEquals("done", result);
      assertEquals(List.of(Duration.ofMillis(5)), sleeps);
    }

    @Test
    @DisplayName("Should stop and restore the interrupt flag when interrupted while sleeping")
    void shouldStopWhenInterrupted() {
      final var interrupting =
          new RetryExecutor(
              d -> {
                throw new InterruptedException("stop");
              });
      final var calls = new AtomicInteger();

      final var thrown =
          assertThrows(
              IllegalStateException.class,
              () ->
                  interrupting.execute(
                      () -> {
                        calls.incrementAndGet();
                        throw timeout();
                      },
                      policy(5, 10L, 2.0)));

      assertEquals(1, calls.get());
      assertTrue(Thread.currentThread().isInterrupted());
      assertInstanceOf(StorageException.class, thrown.getSuppressed()[0]);
    }
  }

  @Nested
  @DisplayName("Pre-configured Retrier")
  class PreconfiguredRetrier {

    @Test
    @DisplayName("Should use the defaults when no overrides are given")
    void shouldUseDefaults() {
      final var retrier = executor.makeRetrier(policy(2, 7L, 3.0));
      final var calls = new AtomicInteger();

      assertThrows(
          StorageException.class,
          () ->
              retrier.execute(
                  () -> {
                    calls.incrementAndGet();
                    throw timeout();
                  }));

      assertEquals(2, calls.get());
      assertEquals(List.of(Duration.ofMillis(7)), sleeps);
    }

    @Test
    @DisplayName("Should let per-call overrides win over the defaults")
    void shouldMergeOverrides() {
      final var retrier = executor.makeRetrier(policy(2, 7L, 3.0));
      final var calls = new AtomicInteger();

      assertThrows(
          StorageException.class,
          () ->
              retrier.execute(
                  () -> {
                    calls.incrementAndGet();
                    throw timeout();
                  },
                  b -> b.maxAttempts(3)));

      assertEquals(3, calls.get());
      assertEquals(List.of(Duration.ofMillis(7), Duration.ofMillis(21)), sleeps);
    }

    @Test
    @DisplayName("Should keep unspecified fields from the defaults")
    void shouldKeepUnspecifiedDefaults() {
      final var defaults = policy(4, 100L, 2.0);
      final var merged = executor.makeRetrier(defaults).merge(b -> b.initialDelayMillis(5L));

      assertEquals(4, merged.maxAttempts());
      assertEquals(Duration.ofMillis(5), merged.initialDelay());
      assertEquals(2.0, merged.backoffMultiplier());
      assertSame(defaults.isRetryable(), merged.isRetryable());
    }
  }
}
