package com.example.couchbaseconnect.core.connection;

import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;

/** Classification of a failed connection attempt, with the hint shown to the user. */
public enum ConnectionFailure {
  AUTHENTICATION("Please check your username and password."),
  TIMEOUT(
      "Please ensure the database exists, is turned on, and the connection string is correct."),
  OTHER("");

  private final String hint;

  ConnectionFailure(final String hint) {
    this.hint = hint;
  }

  public String hint() {
    return hint;
  }

  /**
   * Classifies a connect failure by the {@link StorageErrorKind} found in its cause chain.
   *
   * @param error connect failure
   * @return the classification
   */
  public static ConnectionFailure classify(final Throwable error) {
    return switch (StorageException.kindOf(error)) {
      case AUTHENTICATION -> AUTHENTICATION;
      case TIMEOUT -> TIMEOUT;
      default -> OTHER;
    };
  }
}
