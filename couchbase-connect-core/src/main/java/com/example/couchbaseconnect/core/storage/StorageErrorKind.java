package com.example.couchbaseconnect.core.storage;

/** Discriminant for {@link StorageException}, independent of any driver exception hierarchy. */
public enum StorageErrorKind {
  /** Credentials were rejected by the cluster. */
  AUTHENTICATION,
  /** The operation did not complete within its timeout. */
  TIMEOUT,
  /** The server reported a temporary condition (e.g. busy, rebalancing). */
  TEMPORARY_FAILURE,
  DOCUMENT_NOT_FOUND,
  DOCUMENT_EXISTS,
  /** Bucket, scope or collection does not exist. */
  KEYSPACE_NOT_FOUND,
  OTHER;

  /**
   * Whether failures of this kind are expected to recover when the same operation is retried.
   *
   * @return true for {@link #TIMEOUT} and {@link #TEMPORARY_FAILURE}
   */
  public boolean isTransient() {
    return this == TIMEOUT || this == TEMPORARY_FAILURE;
  }
}
