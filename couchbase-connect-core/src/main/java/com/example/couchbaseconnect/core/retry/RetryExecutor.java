package com.example.couchbaseconnect.core.retry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.util.Objects;

/**
 * Executes operations, retrying failures the policy classifies as retryable.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var executor = new RetryExecutor();
 * JsonNode doc = executor.execute(() -> collection.get("order::42"), RetryPolicy.defaults());
 * }</pre>
 *
 * <h2>Pre-configured Retrier</h2>
 *
 * <pre>{@code
 * var retrier = executor.makeRetrier(RetryPolicy.builder().maxAttempts(5).build());
 * retrier.execute(() -> collection.get("order::42"), b -> b.initialDelayMillis(200L));
 * }</pre>
 *
 * <p>There is no cancellation: a sequence of retries runs until success or until attempts are
 * exhausted. Bound the total time with {@code maxAttempts} and {@code initialDelay}.
 */
public final class RetryExecutor {

  private static final System.Logger LOGGER = System.getLogger(RetryExecutor.class.getName());

  private final Sleeper sleeper;

  public RetryExecutor() {
    this(Sleeper.THREAD);
  }

  public RetryExecutor(final Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Runs {@code operation}, retrying according to {@code policy}.
   *
   * @param operation operation to execute
   * @param policy retry policy
   * @param <T> result type
   * @param <E> checked exception type
   * @return the first successful result
   * @throws E the last failure, when it is not retryable or attempts are exhausted
   */
  public <T, E extends Exception> T execute(
      final RetryableOperation<T, E> operation, final RetryPolicy policy) throws E {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");

    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return operation.run();
      } catch (final Exception e) {
        if (!policy.isRetryable().test(e)) throw RetryExecutor.<E>rethrow(e);

        if (attempt >= policy.maxAttempts()) {
          if (policy.maxAttempts() > 1)
            LOGGER.log(WARNING, "All {0} attempts failed: {1}", attempt, e.getMessage());
          throw RetryExecutor.<E>rethrow(e);
        }

        final var delay = policy.delayAfter(attempt);
        LOGGER.log(
            DEBUG,
            "Attempt {0} failed ({1}), retrying in {2} ms",
            attempt,
            e.getMessage(),
            delay.toMillis());

        if (!delay.isZero()) {
          try {
            sleeper.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            final var interrupted = new IllegalStateException("Interrupted during retry delay", ie);
            interrupted.addSuppressed(e);
            throw interrupted;
          }
        }
      }
    }
  }

  /**
   * Returns a retrier that applies per-call overrides on top of {@code defaults}.
   *
   * @param defaults policy used when a call supplies no overrides
   * @return retrier bound to this executor
   */
  public Retrier makeRetrier(final RetryPolicy defaults) {
    return new Retrier(this, defaults);
  }

  // The operation declares E, so any checked exception reaching here is an E.
  @SuppressWarnings("unchecked")
  private static <E extends Exception> E rethrow(final Exception e) {
    return (E) e;
  }
}
