package com.example.couchbaseconnect.core;

/** Raised when a caller supplies a missing or blank required value. Always raised before I/O. */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(final String message) {
    super(message);
  }

  /**
   * Validates that {@code value} is present and not blank.
   *
   * @param value value to check
   * @param message message of the exception raised on failure
   * @return the value
   * @throws ValidationException if {@code value} is null or blank
   */
  public static String requireNonBlank(final String value, final String message) {
    if (value == null || value.isBlank()) throw new ValidationException(message);
    return value;
  }
}
