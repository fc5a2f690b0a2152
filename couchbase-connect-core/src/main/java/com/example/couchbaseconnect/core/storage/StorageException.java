package com.example.couchbaseconnect.core.storage;

import java.util.Objects;
import java.util.Optional;

/**
 * Failure reported by the storage collaborator, tagged with a {@link StorageErrorKind}.
 *
 * <p>Callers classify failures with {@link #kind()} or {@link #kindOf(Throwable)} rather than by
 * matching driver exception types.
 */
public class StorageException extends RuntimeException {

  private final StorageErrorKind kind;

  public StorageException(final StorageErrorKind kind, final String message) {
    this(kind, message, null);
  }

  public StorageException(
      final StorageErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public StorageErrorKind kind() {
    return kind;
  }

  public boolean is(final StorageErrorKind expected) {
    return kind == expected;
  }

  /**
   * Finds the first {@link StorageException} in a throwable cause chain.
   *
   * @param t the throwable to search
   * @return the first storage exception, if any
   */
  public static Optional<StorageException> find(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof StorageException se) return Optional.of(se);
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    return Optional.empty();
  }

  /**
   * Returns the kind of the first {@link StorageException} in the cause chain.
   *
   * @param t the throwable to classify
   * @return the storage kind, or {@link StorageErrorKind#OTHER} when no storage exception is found
   */
  public static StorageErrorKind kindOf(final Throwable t) {
    return find(t).map(StorageException::kind).orElse(StorageErrorKind.OTHER);
  }
}
