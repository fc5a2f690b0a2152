package com.example.couchbaseconnect.core.storage;

import com.example.couchbaseconnect.core.ValidationException;

/**
 * Fully qualified location of a collection.
 *
 * @param bucket bucket name
 * @param scope scope name
 * @param collection collection name
 */
public record Keyspace(String bucket, String scope, String collection) {

  public static final String DEFAULT = "_default";

  public Keyspace {
    ValidationException.requireNonBlank(bucket, "Bucket name is required");
    ValidationException.requireNonBlank(scope, "Scope name is required");
    ValidationException.requireNonBlank(collection, "Collection name is required");
  }

  /**
   * Keyspace for the default scope and collection of a bucket.
   *
   * @param bucket bucket name
   * @return keyspace {@code bucket._default._default}
   */
  public static Keyspace defaults(final String bucket) {
    return new Keyspace(bucket, DEFAULT, DEFAULT);
  }

  @Override
  public String toString() {
    return bucket + "." + scope + "." + collection;
  }
}
