package com.example.couchbaseconnect.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.couchbaseconnect.core.ValidationException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * {@link CredentialSupplier} backed by AWS Secrets Manager. Each credential set name maps to one
 * secret, optionally through a fixed prefix, whose JSON payload is parsed into {@link Credentials}.
 *
 * <pre>{@code
 * var supplier = SecretsManagerCredentialSupplier.withPrefix("couchbase/");
 * var creds = supplier.get("orders"); // reads secret "couchbase/orders"
 * }</pre>
 *
 * <p>When no client is supplied one is built on first use from system properties or environment
 * variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID and aws.secretAccessKey / AWS_SECRET_ACCESS_KEY,
 *       otherwise the default AWS credential chain
 *   <li>aws.sm.cache.ttl.millis / AWS_SM_CACHE_TTL_MILLIS (default 0, caching disabled)
 * </ul>
 *
 * <p>With a positive cache TTL, parsed credentials are reused per credential set until they expire
 * or {@link #invalidate(String)} is called. A rotated secret is therefore seen at most one TTL late.
 */
public final class SecretsManagerCredentialSupplier implements CredentialSupplier, AutoCloseable {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerCredentialSupplier.class.getName());

  private final String secretIdPrefix;
  private final Duration cacheTtl;
  private final Clock clock;
  private final boolean ownsClient;
  private final Map<String, CachedCredentials> cache = new ConcurrentHashMap<>();
  private SecretsManagerClient client;

  private SecretsManagerCredentialSupplier(final Builder builder) {
    this.secretIdPrefix = builder.secretIdPrefix;
    this.cacheTtl = builder.cacheTtl;
    this.clock = builder.clock;
    this.client = builder.client;
    this.ownsClient = builder.client == null;
  }

  /** Supplier that uses the credential set name as the secret id. */
  public static SecretsManagerCredentialSupplier create() {
    return builder().build();
  }

  /**
   * Supplier that prepends {@code prefix} to the credential set name.
   *
   * @param prefix secret id prefix
   * @return supplier
   */
  public static SecretsManagerCredentialSupplier withPrefix(final String prefix) {
    return builder().secretIdPrefix(prefix).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String secretIdPrefix = "";
    private SecretsManagerClient client;
    private Duration cacheTtl = Duration.ofMillis(cacheTtlFromEnvironment());
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder secretIdPrefix(final String secretIdPrefix) {
      this.secretIdPrefix = Optional.ofNullable(secretIdPrefix).orElse("");
      return this;
    }

    /**
     * Sets the client used to read secrets. A client supplied here is not closed by {@link
     * SecretsManagerCredentialSupplier#close()}.
     *
     * @param client Secrets Manager client
     * @return this builder
     */
    public Builder client(final SecretsManagerClient client) {
      this.client = client;
      return this;
    }

    /**
     * Sets how long parsed credentials are reused. {@link Duration#ZERO} reads the secret on every
     * call.
     *
     * @param cacheTtl cache lifetime
     * @return this builder
     */
    public Builder cacheTtl(final Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public SecretsManagerCredentialSupplier build() {
      if (cacheTtl == null || cacheTtl.isNegative())
        throw new IllegalArgumentException("cacheTtl must be >= 0");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new SecretsManagerCredentialSupplier(this);
    }
  }

  /**
   * Maps a credential set name to the secret id read from Secrets Manager.
   *
   * @param name credential set name
   * @return secret id
   */
  public String secretIdFor(final String name) {
    return secretIdPrefix + name;
  }

  /**
   * Returns the credentials stored in the secret for {@code name}.
   *
   * @param name credential set name
   * @return parsed credentials
   * @throws ValidationException if {@code name} is blank
   * @throws IllegalStateException if the secret cannot be read or parsed
   */
  @Override
  public Credentials get(final String name) {
    ValidationException.requireNonBlank(name, "Credential set name is required");
    if (cacheTtl.isZero()) return load(name);

    final var now = clock.instant();
    final var cached = cache.get(name);
    if (cached != null && !now.isAfter(cached.expiresAt())) return cached.credentials();

    final var credentials = load(name);
    cache.put(name, new CachedCredentials(credentials, now.plus(cacheTtl)));
    return credentials;
  }

  /**
   * Drops the cached credentials for {@code name}, so the next {@link #get(String)} reads the
   * secret again.
   *
   * @param name credential set name
   */
  public void invalidate(final String name) {
    if (name != null) cache.remove(name);
  }

  public void invalidateAll() {
    cache.clear();
  }

  /** Clears the cache and closes the client if this supplier built it. */
  @Override
  public synchronized void close() {
    cache.clear();
    if (!ownsClient || client == null) return;
    try {
      client.close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close Secrets Manager client", e);
    }
    client = null;
  }

  private Credentials load(final String name) {
    final var secretId = secretIdFor(name);
    LOGGER.log(DEBUG, "Reading Couchbase credentials from secret {0}", secretId);
    final String secret;
    try {
      secret =
          client()
              .getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build())
              .secretString();
    } catch (final RuntimeException e) {
      throw new IllegalStateException("Failed to load secret " + secretId, e);
    }
    return SecretHelper.parseCredentials(secret);
  }

  private synchronized SecretsManagerClient client() {
    if (client == null) client = clientFromEnvironment(SecretsManagerCredentialSupplier::setting);
    return client;
  }

  static SecretsManagerClient clientFromEnvironment(
      final Function<String, Optional<String>> setting) {
    final var builder =
        SecretsManagerClient.builder()
            .region(setting.apply("aws.region").map(Region::of).orElse(Region.US_EAST_1));
    setting.apply("aws.sm.endpoint").map(URI::create).ifPresent(builder::endpointOverride);

    final var accessKey = setting.apply("aws.accessKeyId");
    final var secretKey = setting.apply("aws.secretAccessKey");
    if (accessKey.isPresent() && secretKey.isPresent())
      builder.credentialsProvider(
          StaticCredentialsProvider.create(
              AwsBasicCredentials.create(accessKey.get(), secretKey.get())));
    else builder.credentialsProvider(DefaultCredentialsProvider.create());
    return builder.build();
  }

  private static long cacheTtlFromEnvironment() {
    return setting("aws.sm.cache.ttl.millis")
        .flatMap(
            raw -> {
              try {
                return Optional.of(Long.parseLong(raw.trim()));
              } catch (final NumberFormatException e) {
                LOGGER.log(WARNING, "Ignoring invalid secret cache TTL {0}", raw);
                return Optional.empty();
              }
            })
        .map(ttl -> Math.max(0L, ttl))
        .orElse(0L);
  }

  // aws.sm.cache.ttl.millis -> AWS_SM_CACHE_TTL_MILLIS, aws.accessKeyId -> AWS_ACCESS_KEY_ID
  private static Optional<String> setting(final String property) {
    final var variable =
        property.replaceAll("([a-z])([A-Z])", "$1_$2").replace('.', '_').toUpperCase();
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(variable)))
        .filter(v -> !v.isBlank());
  }

  private record CachedCredentials(Credentials credentials, Instant expiresAt) {}
}
