package com.example.couchbaseconnect.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.couchbaseconnect.core.retry.RetryPolicy;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

/**
 * Reactive counterpart of {@link com.example.couchbaseconnect.core.retry.RetryExecutor}, for
 * operations exposed as {@link Mono}, such as those of the SDK's reactive collection API.
 *
 * <pre>{@code
 * var retrying = new ReactiveRetryExecutor()
 *     .execute(() -> reactiveCollection.get("order::42"), RetryPolicy.defaults());
 * }</pre>
 *
 * <p>The policy is interpreted exactly as the blocking executor does: the same delays, no jitter,
 * and the last failure is propagated unchanged.
 */
public final class ReactiveRetryExecutor {

  private static final System.Logger LOGGER =
      System.getLogger(ReactiveRetryExecutor.class.getName());

  private final Scheduler scheduler;

  /** Delays run on Reactor's default parallel scheduler. */
  public ReactiveRetryExecutor() {
    this.scheduler = null;
  }

  public ReactiveRetryExecutor(final Scheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Subscribes to a fresh {@link Mono} from {@code operation} for every attempt.
   *
   * @param operation supplies the operation to run
   * @param policy retry policy
   * @param <T> result type
   * @return a mono emitting the first successful result, or the last failure
   */
  public <T> Mono<T> execute(final Supplier<Mono<T>> operation, final RetryPolicy policy) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");

    return Mono.defer(operation)
        .retryWhen(
            Retry.from(
                signals ->
                    signals.concatMap(
                        signal -> {
                          final var failure = signal.failure();
                          final var attempt = (int) signal.totalRetries() + 1;
                          if (!policy.isRetryable().test(failure))
                            return Mono.<Long>error(failure);
                          if (attempt >= policy.maxAttempts()) {
                            LOGGER.log(
                                WARNING,
                                "All {0} attempts failed: {1}",
                                attempt,
                                failure.getMessage());
                            return Mono.<Long>error(failure);
                          }
                          final var delay = policy.delayAfter(attempt);
                          LOGGER.log(
                              DEBUG,
                              "Attempt {0} failed ({1}), retrying in {2} ms",
                              attempt,
                              failure.getMessage(),
                              delay.toMillis());
                          return Optional.ofNullable(scheduler)
                              .map(s -> Mono.delay(delay, s))
                              .orElseGet(() -> Mono.delay(delay));
                        })));
  }
}
