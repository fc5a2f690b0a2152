package com.example.couchbaseconnect.core.couchbase;

import com.couchbase.client.core.error.AuthenticationFailureException;
import com.couchbase.client.core.error.BucketNotFoundException;
import com.couchbase.client.core.error.CollectionNotFoundException;
import com.couchbase.client.core.error.DocumentExistsException;
import com.couchbase.client.core.error.DocumentNotFoundException;
import com.couchbase.client.core.error.ScopeNotFoundException;
import com.couchbase.client.core.error.TemporaryFailureException;
import com.couchbase.client.core.error.TimeoutException;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import java.util.Locale;

/** Maps Couchbase SDK exceptions onto {@link StorageErrorKind}. */
final class CouchbaseErrors {

  private static final String[] AUTH_KEYWORDS = {
    "authentication failure", "authentication_failure", "authentication failed", "access denied"
  };

  private CouchbaseErrors() {}

  /**
   * Classifies a throwable by walking its cause chain. Authentication wins over timeout, since the
   * SDK reports rejected credentials during bootstrap as a timeout whose context names the
   * authentication failure.
   *
   * @param error failure raised by the SDK
   * @return the matching kind, or {@link StorageErrorKind#OTHER}
   */
  static StorageErrorKind classify(final Throwable error) {
    var kind = StorageErrorKind.OTHER;
    Throwable cur = error;
    while (cur != null) {
      if (cur instanceof AuthenticationFailureException || mentionsAuthFailure(cur))
        return StorageErrorKind.AUTHENTICATION;
      if (kind == StorageErrorKind.OTHER) kind = direct(cur);
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    return kind;
  }

  /**
   * Wraps an SDK failure in a tagged {@link StorageException}.
   *
   * @param action what was being attempted, used as the message prefix
   * @param error failure raised by the SDK
   * @return tagged exception with {@code error} as cause
   */
  static StorageException wrap(final String action, final Throwable error) {
    if (error instanceof StorageException se) return se;
    return new StorageException(classify(error), action + ": " + error.getMessage(), error);
  }

  private static StorageErrorKind direct(final Throwable t) {
    if (t instanceof DocumentNotFoundException) return StorageErrorKind.DOCUMENT_NOT_FOUND;
    if (t instanceof DocumentExistsException) return StorageErrorKind.DOCUMENT_EXISTS;
    if (t instanceof TimeoutException) return StorageErrorKind.TIMEOUT;
    if (t instanceof TemporaryFailureException) return StorageErrorKind.TEMPORARY_FAILURE;
    if (t instanceof BucketNotFoundException
        || t instanceof ScopeNotFoundException
        || t instanceof CollectionNotFoundException) return StorageErrorKind.KEYSPACE_NOT_FOUND;
    return StorageErrorKind.OTHER;
  }

  private static boolean mentionsAuthFailure(final Throwable t) {
    final var msg = t.getMessage();
    if (msg == null) return false;
    final var lower = msg.toLowerCase(Locale.ROOT);
    for (final var keyword : AUTH_KEYWORDS) if (lower.contains(keyword)) return true;
    return false;
  }
}
