package com.example.couchbaseconnect.core.retry;

/**
 * Operation executed by {@link RetryExecutor}.
 *
 * @param <T> result type
 * @param <E> checked exception type the operation may throw
 */
@FunctionalInterface
public interface RetryableOperation<T, E extends Exception> {
  T run() throws E;
}
