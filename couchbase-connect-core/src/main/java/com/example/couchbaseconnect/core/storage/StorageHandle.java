package com.example.couchbaseconnect.core.storage;

/** A live connection to the backing cluster. */
public interface StorageHandle extends AutoCloseable {

  /**
   * Opens a collection on this connection.
   *
   * @param keyspace bucket, scope and collection
   * @return the collection
   * @throws StorageException if the keyspace cannot be opened
   */
  DocumentCollection collection(Keyspace keyspace);

  /**
   * Releases the connection.
   *
   * @throws StorageException if the cluster reports a failure while disconnecting
   */
  @Override
  void close();
}
