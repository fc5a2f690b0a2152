package com.example.couchbaseconnect.core.couchbase;

import com.couchbase.client.java.Cluster;
import com.example.couchbaseconnect.core.storage.DocumentCollection;
import com.example.couchbaseconnect.core.storage.Keyspace;
import com.example.couchbaseconnect.core.storage.StorageHandle;
import com.fasterxml.jackson.databind.ObjectMapper;

/** {@link StorageHandle} owning a connected Couchbase {@link Cluster}. */
public final class CouchbaseStorageHandle implements StorageHandle {

  private final Cluster cluster;
  private final ObjectMapper mapper;

  CouchbaseStorageHandle(final Cluster cluster, final ObjectMapper mapper) {
    this.cluster = cluster;
    this.mapper = mapper;
  }

  /** The underlying cluster, for operations outside the storage seam (queries, search). */
  public Cluster cluster() {
    return cluster;
  }

  @Override
  public DocumentCollection collection(final Keyspace keyspace) {
    try {
      final var collection =
          cluster
              .bucket(keyspace.bucket())
              .scope(keyspace.scope())
              .collection(keyspace.collection());
      return new CouchbaseDocumentCollection(collection, mapper);
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("open collection " + keyspace, e);
    }
  }

  @Override
  public void close() {
    try {
      cluster.disconnect();
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("disconnect", e);
    }
  }
}
