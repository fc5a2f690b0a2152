package com.example.couchbaseconnect.core.retry;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * {@link RetryExecutor} bound to a default {@link RetryPolicy}. Per-call overrides are applied to
 * a copy of the defaults, so values set by the caller win.
 */
public final class Retrier {

  private final RetryExecutor executor;
  private final RetryPolicy defaults;

  Retrier(final RetryExecutor executor, final RetryPolicy defaults) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.defaults = Objects.requireNonNull(defaults, "defaults");
  }

  public RetryPolicy defaults() {
    return defaults;
  }

  public <T, E extends Exception> T execute(final RetryableOperation<T, E> operation) throws E {
    return executor.execute(operation, defaults);
  }

  /**
   * Executes with overrides merged over the defaults.
   *
   * @param operation operation to execute
   * @param overrides adjusts a builder pre-populated with the defaults
   * @param <T> result type
   * @param <E> checked exception type
   * @return operation result
   * @throws E the last failure
   */
  public <T, E extends Exception> T execute(
      final RetryableOperation<T, E> operation, final UnaryOperator<RetryPolicy.Builder> overrides)
      throws E {
    return executor.execute(operation, merge(overrides));
  }

  RetryPolicy merge(final UnaryOperator<RetryPolicy.Builder> overrides) {
    return overrides.apply(defaults.toBuilder()).build();
  }
}
