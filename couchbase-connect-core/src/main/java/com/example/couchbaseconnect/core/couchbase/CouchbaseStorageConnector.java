package com.example.couchbaseconnect.core.couchbase;

import static java.lang.System.Logger.Level.WARNING;

import com.couchbase.client.java.Cluster;
import com.couchbase.client.java.ClusterOptions;
import com.example.couchbaseconnect.core.secrets.Credentials;
import com.example.couchbaseconnect.core.storage.StorageConnector;
import com.example.couchbaseconnect.core.storage.StorageHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Opens Couchbase clusters with the Java SDK.
 *
 * <p>{@link Cluster#connect(String, ClusterOptions)} bootstraps lazily, so the connector waits
 * until the cluster is ready within the connect timeout. Rejected credentials and unreachable
 * clusters are reported here rather than on the first document operation.
 */
public final class CouchbaseStorageConnector implements StorageConnector {

  private static final System.Logger LOGGER =
      System.getLogger(CouchbaseStorageConnector.class.getName());

  private final BiFunction<Credentials, Duration, Cluster> opener;
  private final ObjectMapper mapper;

  public CouchbaseStorageConnector() {
    this(new ObjectMapper());
  }

  public CouchbaseStorageConnector(final ObjectMapper mapper) {
    this(CouchbaseStorageConnector::open, mapper);
  }

  CouchbaseStorageConnector(
      final BiFunction<Credentials, Duration, Cluster> opener, final ObjectMapper mapper) {
    this.opener = Objects.requireNonNull(opener, "opener");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public StorageHandle connect(final Credentials credentials, final Duration connectTimeout) {
    final Cluster cluster;
    try {
      cluster = opener.apply(credentials, connectTimeout);
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("connect to " + credentials.connectionString(), e);
    }

    try {
      cluster.waitUntilReady(connectTimeout);
    } catch (final RuntimeException e) {
      disconnectQuietly(cluster);
      throw CouchbaseErrors.wrap("connect to " + credentials.connectionString(), e);
    }
    return new CouchbaseStorageHandle(cluster, mapper);
  }

  private static Cluster open(final Credentials credentials, final Duration connectTimeout) {
    return Cluster.connect(
        credentials.connectionString(),
        ClusterOptions.clusterOptions(credentials.username(), credentials.password())
            .environment(env -> env.timeoutConfig(t -> t.connectTimeout(connectTimeout))));
  }

  private static void disconnectQuietly(final Cluster cluster) {
    try {
      cluster.disconnect();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to disconnect cluster after failed bootstrap", e);
    }
  }
}
