package com.example.couchbaseconnect.core.reactive;

import static org.junit.jupiter.api.Assertions.*;

import com.example.couchbaseconnect.core.retry.RetryPolicy;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ReactiveRetryExecutorTest {

  private static final RetryPolicy POLICY =
      RetryPolicy.builder().maxAttempts(3).initialDelayMillis(10L).backoffMultiplier(2.0).build();

  @Test
  @DisplayName("Retries transient failures after 10 ms then 20 ms and emits the success value")
  void shouldRetryWithBackoff() {
    final var calls = new AtomicInteger();

    StepVerifier.withVirtualTime(
            () ->
                new ReactiveRetryExecutor()
                    .execute(
                        () ->
                            Mono.fromCallable(
                                () -> {
                                  if (calls.incrementAndGet() < 3)
                                    throw new StorageException(StorageErrorKind.TIMEOUT, "slow");
                                  return "success";
                                }),
                        POLICY))
        .expectSubscription()
        .expectNoEvent(Duration.ofMillis(10))
        .expectNoEvent(Duration.ofMillis(20))
        .expectNext("success")
        .verifyComplete();

    assertEquals(3, calls.get());
  }

  @Test
  @DisplayName("Propagates a non-retryable failure without resubscribing")
  void shouldNotRetryNonRetryable() {
    final var calls = new AtomicInteger();
    final var failure = new StorageException(StorageErrorKind.AUTHENTICATION, "denied");

    StepVerifier.create(
            new ReactiveRetryExecutor()
                .execute(
                    () -> {
                      calls.incrementAndGet();
                      return Mono.<String>error(failure);
                    },
                    POLICY))
        .expectErrorSatisfies(e -> assertSame(failure, e))
        .verify(Duration.ofSeconds(1));

    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("Propagates the last failure unchanged after exhausting attempts")
  void shouldPropagateLastFailure() {
    final var calls = new AtomicInteger();

    StepVerifier.withVirtualTime(
            () ->
                new ReactiveRetryExecutor()
                    .execute(
                        () ->
                            Mono.<String>error(
                                new StorageException(
                                    StorageErrorKind.TEMPORARY_FAILURE,
                                    "busy " + calls.incrementAndGet())),
                        POLICY))
        .expectSubscription()
        .thenAwait(Duration.ofMillis(30))
        .expectErrorSatisfies(
            e -> {
              assertInstanceOf(StorageException.class, e);
              assertEquals("busy 3", e.getMessage());
            })
        .verify();

    assertEquals(3, calls.get());
  }
}
