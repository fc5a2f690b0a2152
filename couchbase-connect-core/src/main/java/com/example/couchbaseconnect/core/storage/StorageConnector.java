package com.example.couchbaseconnect.core.storage;

import com.example.couchbaseconnect.core.secrets.Credentials;
import java.time.Duration;

/** Opens connections to the backing cluster. */
@FunctionalInterface
public interface StorageConnector {

  /**
   * Connects with the given credentials.
   *
   * @param credentials endpoint, username and password
   * @param connectTimeout upper bound for establishing the connection
   * @return a ready handle
   * @throws StorageException if the connection cannot be established
   */
  StorageHandle connect(final Credentials credentials, final Duration connectTimeout);
}
