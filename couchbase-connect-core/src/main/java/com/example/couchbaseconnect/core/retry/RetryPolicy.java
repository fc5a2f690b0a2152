package com.example.couchbaseconnect.core.retry;

import com.example.couchbaseconnect.core.storage.StorageException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry policy with deterministic exponential backoff.
 *
 * <p>The delay before retry {@code n} (after attempt {@code n}, 1-based) is {@code initialDelay *
 * backoffMultiplier^(n-1)}; the first retry therefore waits exactly {@code initialDelay}. No jitter
 * and no cap are applied.
 *
 * @param maxAttempts maximum number of attempts (including first), must be >= 1
 * @param initialDelay delay before the first retry, must be >= 0
 * @param backoffMultiplier growth factor between consecutive delays, must be >= 1.0
 * @param isRetryable decides whether a failure is worth another attempt
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    double backoffMultiplier,
    Predicate<Throwable> isRetryable) {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1_000L);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

  public RetryPolicy {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (initialDelay == null || initialDelay.isNegative())
      throw new IllegalArgumentException("initialDelay must be >= 0");
    if (!(backoffMultiplier >= 1.0))
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    Objects.requireNonNull(isRetryable, "isRetryable");
  }

  /**
   * Matches timeouts and temporary server failures anywhere in the cause chain.
   *
   * @return the default retryable predicate
   */
  public static Predicate<Throwable> defaultRetryable() {
    return t -> StorageException.find(t).map(e -> e.kind().isTransient()).orElse(false);
  }

  /** 3 attempts, 1 s initial delay, doubling, default predicate. */
  public static RetryPolicy defaults() {
    return builder().build();
  }

  /** A single attempt: failures propagate immediately. */
  public static RetryPolicy noRetry() {
    return builder().maxAttempts(1).initialDelay(Duration.ZERO).build();
  }

  /**
   * Creates a builder pre-populated with the library defaults.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a builder pre-populated with this policy's values, used to apply overrides.
   *
   * @return builder copying this policy
   */
  public Builder toBuilder() {
    return new Builder()
        .maxAttempts(maxAttempts)
        .initialDelay(initialDelay)
        .backoffMultiplier(backoffMultiplier)
        .isRetryable(isRetryable);
  }

  /**
   * Calculates the delay after a failed attempt.
   *
   * @param attempt the attempt that just failed (1-based)
   * @return delay before the next attempt
   */
  public Duration delayAfter(final int attempt) {
    if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
    final var factor = Math.pow(backoffMultiplier, attempt - 1);
    final var nanos = initialDelay.toNanos() * factor;
    if (nanos >= Long.MAX_VALUE) return Duration.ofNanos(Long.MAX_VALUE);
    return Duration.ofNanos(Math.round(nanos));
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration initialDelay = DEFAULT_INITIAL_DELAY;
    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
    private Predicate<Throwable> isRetryable = defaultRetryable();

    private Builder() {}

    public Builder maxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder initialDelay(final Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder initialDelayMillis(final long initialDelayMillis) {
      return initialDelay(Duration.ofMillis(initialDelayMillis));
    }

    public Builder backoffMultiplier(final double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    public Builder isRetryable(final Predicate<Throwable> isRetryable) {
      this.isRetryable = isRetryable;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(maxAttempts, initialDelay, backoffMultiplier, isRetryable);
    }
  }
}
