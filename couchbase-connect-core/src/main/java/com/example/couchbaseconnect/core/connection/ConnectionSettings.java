package com.example.couchbaseconnect.core.connection;

import com.example.couchbaseconnect.core.retry.RetryPolicy;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Tunables for connections and retries, resolved from system properties, then environment
 * variables, then defaults:
 *
 * <ul>
 *   <li>couchbase.connection.timeout.ms / COUCHBASE_CONNECTION_TIMEOUT_MS (default 10000)
 *   <li>couchbase.idle.timeout.ms / COUCHBASE_IDLE_TIMEOUT_MS (default 30000)
 *   <li>couchbase.retry.attempts / COUCHBASE_RETRY_ATTEMPTS (default 3)
 *   <li>couchbase.retry.delay.ms / COUCHBASE_RETRY_DELAY_MS (default 1000)
 *   <li>couchbase.retry.multiplier / COUCHBASE_RETRY_MULTIPLIER (default 2)
 * </ul>
 *
 * <p>Values that are blank, unparseable or out of range fall back to the default.
 *
 * @param connectTimeout upper bound for opening a connection
 * @param idleTimeout inactivity period after which a cached connection is closed
 * @param retryAttempts default {@link RetryPolicy#maxAttempts()}
 * @param retryDelay default {@link RetryPolicy#initialDelay()}
 * @param retryMultiplier default {@link RetryPolicy#backoffMultiplier()}
 */
public record ConnectionSettings(
    Duration connectTimeout,
    Duration idleTimeout,
    int retryAttempts,
    Duration retryDelay,
    double retryMultiplier) {

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(10_000L);
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMillis(30_000L);

  public ConnectionSettings {
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
      throw new IllegalArgumentException("connectTimeout must be > 0");
    if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero())
      throw new IllegalArgumentException("idleTimeout must be > 0");
  }

  /** Library defaults, ignoring the environment. */
  public static ConnectionSettings defaults() {
    return new ConnectionSettings(
        DEFAULT_CONNECT_TIMEOUT,
        DEFAULT_IDLE_TIMEOUT,
        RetryPolicy.DEFAULT_MAX_ATTEMPTS,
        RetryPolicy.DEFAULT_INITIAL_DELAY,
        RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER);
  }

  /** Resolves settings from system properties and the process environment. */
  public static ConnectionSettings fromEnvironment() {
    return from(key -> Optional.ofNullable(System.getProperty(key)), System::getenv);
  }

  static ConnectionSettings from(
      final Function<String, Optional<String>> properties, final Function<String, String> env) {
    final BiFunction<String, String, Optional<String>> lookup =
        (property, variable) ->
            properties
                .apply(property)
                .or(() -> Optional.ofNullable(env.apply(variable)))
                .filter(v -> !v.isBlank());

    return new ConnectionSettings(
        lookup
            .apply("couchbase.connection.timeout.ms", "COUCHBASE_CONNECTION_TIMEOUT_MS")
            .flatMap(ConnectionSettings::parseLong)
            .filter(v -> v > 0)
            .map(Duration::ofMillis)
            .orElse(DEFAULT_CONNECT_TIMEOUT),
        lookup
            .apply("couchbase.idle.timeout.ms", "COUCHBASE_IDLE_TIMEOUT_MS")
            .flatMap(ConnectionSettings::parseLong)
            .filter(v -> v > 0)
            .map(Duration::ofMillis)
            .orElse(DEFAULT_IDLE_TIMEOUT),
        lookup
            .apply("couchbase.retry.attempts", "COUCHBASE_RETRY_ATTEMPTS")
            .flatMap(ConnectionSettings::parseLong)
            .filter(v -> v >= 1 && v <= Integer.MAX_VALUE)
            .map(Long::intValue)
            .orElse(RetryPolicy.DEFAULT_MAX_ATTEMPTS),
        lookup
            .apply("couchbase.retry.delay.ms", "COUCHBASE_RETRY_DELAY_MS")
            .flatMap(ConnectionSettings::parseLong)
            .filter(v -> v >= 0)
            .map(Duration::ofMillis)
            .orElse(RetryPolicy.DEFAULT_INITIAL_DELAY),
        lookup
            .apply("couchbase.retry.multiplier", "COUCHBASE_RETRY_MULTIPLIER")
            .flatMap(ConnectionSettings::parseDouble)
            .filter(v -> v >= 1.0)
            .orElse(RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER));
  }

  /**
   * Builds a retry policy from these settings with the default retryable predicate.
   *
   * @return retry policy
   */
  public RetryPolicy retryPolicy() {
    return RetryPolicy.builder()
        .maxAttempts(retryAttempts)
        .initialDelay(retryDelay)
        .backoffMultiplier(retryMultiplier)
        .build();
  }

  private static Optional<Long> parseLong(final String raw) {
    try {
      return Optional.of(Long.parseLong(raw.trim()));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Optional<Double> parseDouble(final String raw) {
    try {
      return Optional.of(Double.parseDouble(raw.trim()));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }
}
