package com.example.couchbaseconnect.core.connection;

import java.util.Objects;

/**
 * A connection could not be opened, or an opened connection could not reach the requested
 * keyspace. {@link #hint()} carries a user-facing suggestion for fixing the problem.
 */
public class ConnectionException extends RuntimeException {

  private final ConnectionFailure failure;
  private final String hint;

  public ConnectionException(
      final ConnectionFailure failure, final String message, final Throwable cause) {
    this(failure, message, failure.hint(), cause);
  }

  public ConnectionException(
      final ConnectionFailure failure,
      final String message,
      final String hint,
      final Throwable cause) {
    super(message, cause);
    this.failure = Objects.requireNonNull(failure, "failure");
    this.hint = Objects.requireNonNullElse(hint, "");
  }

  public ConnectionFailure failure() {
    return failure;
  }

  public String hint() {
    return hint;
  }
}
