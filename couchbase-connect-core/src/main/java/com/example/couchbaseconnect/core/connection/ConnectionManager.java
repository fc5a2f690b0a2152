package com.example.couchbaseconnect.core.connection;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.couchbaseconnect.core.ValidationException;
import com.example.couchbaseconnect.core.retry.RetryExecutor;
import com.example.couchbaseconnect.core.retry.RetryPolicy;
import com.example.couchbaseconnect.core.secrets.CredentialSupplier;
import com.example.couchbaseconnect.core.secrets.Credentials;
import com.example.couchbaseconnect.core.storage.DocumentCollection;
import com.example.couchbaseconnect.core.storage.Keyspace;
import com.example.couchbaseconnect.core.storage.StorageConnector;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import com.example.couchbaseconnect.core.storage.StorageHandle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Owns a single cached cluster connection.
 *
 * <p>The connection is opened lazily by {@link #acquire(Credentials)}, reused while the
 * credentials stay the same, replaced when any credential field changes, and closed after {@code
 * idleTimeout} without an acquire. Construct one manager per process and pass it to every caller.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var manager = ConnectionManager.builder()
 *     .connector(new CouchbaseStorageConnector())
 *     .build();
 *
 * var handle = manager.acquire(new Credentials("couchbase://localhost", "app", "secret"));
 * var orders = handle.collection(Keyspace.defaults("orders"));
 * }</pre>
 *
 * <h2>Credentials from AWS Secrets Manager</h2>
 *
 * <pre>{@code
 * var supplier = SecretsManagerCredentialSupplier.withPrefix("couchbase/");
 * var handle = manager.acquire(supplier, "orders");
 * }</pre>
 *
 * <p>Acquire, close and idle eviction are serialized on the manager, so a handle is never replaced
 * or closed while another thread of this process is acquiring it. Handles themselves are safe for
 * concurrent use once returned.
 */
public final class ConnectionManager {

  private static final System.Logger LOGGER = System.getLogger(ConnectionManager.class.getName());

  private final StorageConnector connector;
  private final Clock clock;
  private final IdleScheduler idleScheduler;
  private final ExecutorIdleScheduler ownedScheduler;
  private final Duration connectTimeout;
  private final Duration idleTimeout;
  private final RetryPolicy connectRetryPolicy;
  private final RetryExecutor retryExecutor;

  private volatile ConnectionState state = ConnectionState.EMPTY;
  private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
  private long timerGeneration;
  private boolean shutdown;

  private ConnectionManager(final Builder builder) {
    this.connector = builder.connector;
    this.clock = builder.clock;
    this.connectTimeout = builder.connectTimeout;
    this.idleTimeout = builder.idleTimeout;
    this.retryExecutor = builder.retryExecutor;
    this.connectRetryPolicy =
        builder
            .connectRetryPolicy
            .toBuilder()
            .isRetryable(
                builder
                    .connectRetryPolicy
                    .isRetryable()
                    .and(e -> StorageException.kindOf(e) != StorageErrorKind.AUTHENTICATION))
            .build();
    if (builder.idleScheduler != null) {
      this.idleScheduler = builder.idleScheduler;
      this.ownedScheduler = null;
    } else {
      this.ownedScheduler = new ExecutorIdleScheduler("ConnectionManager-idle");
      this.idleScheduler = ownedScheduler;
    }
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link ConnectionManager}. Timeouts and the connect retry policy default to {@link
   * ConnectionSettings#fromEnvironment()}, except that connects are attempted once unless {@link
   * #connectRetryPolicy(RetryPolicy)} is set.
   */
  public static final class Builder {
    private final ConnectionSettings settings = ConnectionSettings.fromEnvironment();

    private StorageConnector connector;
    private Clock clock = Clock.systemUTC();
    private IdleScheduler idleScheduler;
    private Duration connectTimeout = settings.connectTimeout();
    private Duration idleTimeout = settings.idleTimeout();
    private RetryPolicy connectRetryPolicy = RetryPolicy.noRetry();
    private RetryExecutor retryExecutor = new RetryExecutor();

    private Builder() {}

    /**
     * Sets the connector used to open connections (required).
     *
     * @param connector opens handles against the cluster
     * @return this builder
     */
    public Builder connector(final StorageConnector connector) {
      this.connector = connector;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the scheduler that runs idle eviction. When not set the manager creates and owns a
     * single daemon thread, stopped by {@link ConnectionManager#shutdown()}.
     *
     * @param idleScheduler scheduler for the idle timer
     * @return this builder
     */
    public Builder idleScheduler(final IdleScheduler idleScheduler) {
      this.idleScheduler = idleScheduler;
      return this;
    }

    public Builder connectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder idleTimeout(final Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Sets the policy wrapped around each connect attempt. Authentication failures are never
     * retried regardless of the policy's predicate.
     *
     * <p>Default: {@link RetryPolicy#noRetry()}
     *
     * @param connectRetryPolicy retry policy for connects
     * @return this builder
     */
    public Builder connectRetryPolicy(final RetryPolicy connectRetryPolicy) {
      this.connectRetryPolicy = connectRetryPolicy;
      return this;
    }

    public Builder retryExecutor(final RetryExecutor retryExecutor) {
      this.retryExecutor = retryExecutor;
      return this;
    }

    /**
     * Builds the manager.
     *
     * @return configured manager
     * @throws IllegalStateException if a required collaborator is missing
     * @throws IllegalArgumentException if a timeout is not positive
     */
    public ConnectionManager build() {
      if (connector == null) throw new IllegalStateException("connector is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (connectRetryPolicy == null)
        throw new IllegalStateException("connectRetryPolicy cannot be null");
      if (retryExecutor == null) throw new IllegalStateException("retryExecutor cannot be null");
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
        throw new IllegalArgumentException("connectTimeout must be > 0");
      if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero())
        throw new IllegalArgumentException("idleTimeout must be > 0");
      return new ConnectionManager(this);
    }
  }

  /**
   * Returns a connection for {@code credentials}, reusing the cached one when the credentials are
   * unchanged.
   *
   * @param credentials connection string, username and password
   * @return live handle
   * @throws ValidationException if {@code credentials} is null
   * @throws AuthenticationException if the cluster rejects the credentials
   * @throws ConnectionException if the connection cannot be opened, the idle timer cannot be
   *     scheduled, or the manager has been shut down
   */
  public synchronized StorageHandle acquire(final Credentials credentials) {
    if (credentials == null) throw new ValidationException("Credentials are required");
    if (shutdown)
      throw new ConnectionException(
          ConnectionFailure.OTHER,
          "Connection manager has been shut down.",
          "Create a new connection manager.",
          null);

    final var current = state;
    if (current.isConnectedWith(credentials)) {
      LOGGER.log(DEBUG, "Reusing Couchbase connection to {0}", credentials.connectionString());
      final IdleScheduler.ScheduledTask timer;
      try {
        timer = scheduleIdleTimer(current.idleTimer());
      } catch (final RuntimeException e) {
        discard(current);
        throw idleTimerFailure(e);
      }
      state = current.touched(clock.instant(), timer);
      return current.handle();
    }

    if (current.handle() != null) {
      LOGGER.log(INFO, "Credentials changed, replacing Couchbase connection");
      discard(current);
    }

    status = ConnectionStatus.CONNECTING;
    final StorageHandle handle;
    try {
      LOGGER.log(INFO, "Opening a Couchbase connection to {0}", credentials.connectionString());
      handle =
          retryExecutor.execute(
              () -> connector.connect(credentials, connectTimeout), connectRetryPolicy);
    } catch (final RuntimeException e) {
      state = ConnectionState.EMPTY;
      status = ConnectionStatus.DISCONNECTED;
      throw connectFailure(e);
    }

    final IdleScheduler.ScheduledTask timer;
    try {
      timer = scheduleIdleTimer(null);
    } catch (final RuntimeException e) {
      discard(new ConnectionState(handle, credentials, clock.instant(), null));
      throw idleTimerFailure(e);
    }
    state = new ConnectionState(handle, credentials, clock.instant(), timer);
    status = ConnectionStatus.CONNECTED;
    LOGGER.log(INFO, "Couchbase connection established");
    return handle;
  }

  /**
   * Resolves {@code credentialSetName} through {@code supplier} and acquires a connection for the
   * result.
   *
   * @param supplier credential supplier
   * @param credentialSetName name of the credential set
   * @return live handle
   */
  public StorageHandle acquire(final CredentialSupplier supplier, final String credentialSetName) {
    if (supplier == null) throw new ValidationException("Credential supplier is required");
    ValidationException.requireNonBlank(credentialSetName, "Credential set name is required");
    return acquire(supplier.get(credentialSetName));
  }

  /**
   * Acquires a connection and opens a collection on it.
   *
   * @param credentials connection credentials
   * @param keyspace bucket, scope and collection
   * @return the collection
   * @throws ConnectionException if connecting fails or the keyspace cannot be opened
   */
  public DocumentCollection collection(final Credentials credentials, final Keyspace keyspace) {
    if (keyspace == null) throw new ValidationException("Keyspace is required");
    final var handle = acquire(credentials);
    try {
      return handle.collection(keyspace);
    } catch (final RuntimeException e) {
      throw new ConnectionException(
          ConnectionFailure.OTHER,
          "Could not access collection " + keyspace + ": " + e.getMessage() + ".",
          "Please ensure the selected bucket, scope, and collection exist and the credentials"
              + " have permissions.",
          e);
    }
  }

  /** Closes the cached connection, if any. Close failures are logged and ignored. */
  public synchronized void close() {
    final var current = state;
    if (current.handle() == null) return;
    discard(current);
    LOGGER.log(INFO, "Couchbase connection closed");
  }

  /**
   * Closes the cached connection if it has been idle for at least the idle timeout. Useful where
   * callers prefer cooperative eviction over relying on the timer.
   *
   * @return true if a connection was closed
   */
  public synchronized boolean evictIfIdle() {
    if (state.handle() == null || idleTime().compareTo(idleTimeout) < 0) return false;
    LOGGER.log(INFO, "Closing idle Couchbase connection");
    close();
    return true;
  }

  /**
   * Closes the cached connection and stops the idle scheduler if this manager created it. Later
   * acquires fail with a {@link ConnectionException}.
   */
  public void shutdown() {
    synchronized (this) {
      shutdown = true;
      close();
    }
    if (ownedScheduler != null) ownedScheduler.close();
  }

  public boolean hasActiveConnection() {
    return state.handle() != null;
  }

  /**
   * Time since the cached connection was last acquired.
   *
   * @return elapsed time, or {@link Duration#ZERO} when no connection is cached
   */
  public Duration idleTime() {
    final var current = state;
    if (current.handle() == null) return Duration.ZERO;
    final var elapsed = Duration.between(current.lastActivity(), clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }

  public ConnectionStatus status() {
    return status;
  }

  public Duration idleTimeout() {
    return idleTimeout;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  private IdleScheduler.ScheduledTask scheduleIdleTimer(
      final IdleScheduler.ScheduledTask previous) {
    if (previous != null) previous.cancel();
    final var generation = ++timerGeneration;
    return idleScheduler.schedule(() -> onIdleTimeout(generation), idleTimeout);
  }

  private synchronized void onIdleTimeout(final long generation) {
    // Superseded by a later acquire or by close().
    if (generation != timerGeneration || state.handle() == null) return;
    LOGGER.log(INFO, "Couchbase connection idle for {0} ms, closing", idleTimeout.toMillis());
    close();
  }

  private void discard(final ConnectionState current) {
    timerGeneration++;
    if (current.idleTimer() != null) current.idleTimer().cancel();
    try {
      current.handle().close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close Couchbase connection", e);
    }
    state = ConnectionState.EMPTY;
    status = ConnectionStatus.DISCONNECTED;
  }

  private static ConnectionException idleTimerFailure(final RuntimeException cause) {
    LOGGER.log(WARNING, "Could not schedule idle timer, connection closed", cause);
    return new ConnectionException(
        ConnectionFailure.OTHER,
        "Could not schedule the idle timer: " + cause.getMessage() + ".",
        cause);
  }

  private static ConnectionException connectFailure(final RuntimeException cause) {
    final var message = "Could not connect to database: " + cause.getMessage() + ".";
    final var failure = ConnectionFailure.classify(cause);
    LOGGER.log(WARNING, "Couchbase connection failed ({0}): {1}", failure, cause.getMessage());
    return failure == ConnectionFailure.AUTHENTICATION
        ? new AuthenticationException(message, cause)
        : new ConnectionException(failure, message, cause);
  }

  /**
   * Snapshot of the cached connection. Either all of handle, fingerprint and idle timer are
   * present, or none are.
   */
  record ConnectionState(
      StorageHandle handle,
      Credentials fingerprint,
      Instant lastActivity,
      IdleScheduler.ScheduledTask idleTimer) {

    static final ConnectionState EMPTY = new ConnectionState(null, null, null, null);

    boolean isConnectedWith(final Credentials credentials) {
      return handle != null && credentials.equals(fingerprint);
    }

    ConnectionState touched(final Instant now, final IdleScheduler.ScheduledTask timer) {
      return new ConnectionState(handle, fingerprint, now, timer);
    }
  }
}
