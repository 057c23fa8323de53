package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Immutable configuration of a {@link RetryExecutor}.
 *
 * <p>Every field has a default, so {@code RetryConfig.builder().build()} is a valid configuration:
 * 3 retries, 100ms initial delay capped at 10s, 20% jitter, Retry-After respected, circuit opening
 * after 5 exhausted calls and resetting after 60s.
 */
public final class RetryConfig {

  static final int DEFAULT_MAX_RETRIES = 3;
  static final long DEFAULT_INITIAL_DELAY_MS = 100;
  static final long DEFAULT_MAX_DELAY_MS = 10_000;
  static final double DEFAULT_JITTER_FACTOR = 0.2;
  static final boolean DEFAULT_RESPECT_RETRY_AFTER = true;
  static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
  static final long DEFAULT_CIRCUIT_OPEN_RESET_MS = 60_000;

  private final int maxRetries;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double jitterFactor;
  private final boolean respectRetryAfter;
  private final int circuitBreakerThreshold;
  private final long circuitOpenResetMs;

  private RetryConfig(Builder builder) {
    checkArgument(builder.maxRetries >= 0, "maxRetries must be >= 0, was %s", builder.maxRetries);
    checkArgument(
        builder.initialDelayMs > 0, "initialDelayMs must be > 0, was %s", builder.initialDelayMs);
    checkArgument(
        builder.maxDelayMs >= builder.initialDelayMs,
        "maxDelayMs (%s) must be >= initialDelayMs (%s)",
        builder.maxDelayMs,
        builder.initialDelayMs);
    checkArgument(
        builder.jitterFactor >= 0 && builder.jitterFactor <= 1,
        "jitterFactor must be within [0, 1], was %s",
        builder.jitterFactor);
    checkArgument(
        builder.circuitBreakerThreshold > 0,
        "circuitBreakerThreshold must be > 0, was %s",
        builder.circuitBreakerThreshold);
    checkArgument(
        builder.circuitOpenResetMs > 0,
        "circuitOpenResetMs must be > 0, was %s",
        builder.circuitOpenResetMs);
    this.maxRetries = builder.maxRetries;
    this.initialDelayMs = builder.initialDelayMs;
    this.maxDelayMs = builder.maxDelayMs;
    this.jitterFactor = builder.jitterFactor;
    this.respectRetryAfter = builder.respectRetryAfter;
    this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
    this.circuitOpenResetMs = builder.circuitOpenResetMs;
  }

  public static RetryConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a configuration from properties, falling back to the defaults for absent keys.
   *
   * <p>Recognized keys are the field names prefixed with {@code prefix}, e.g. {@code
   * ratelimit.maxRetries} for the prefix {@code "ratelimit."}.
   *
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static RetryConfig fromProperties(Properties properties, String prefix) {
    final Builder builder = builder();
    readProperty(properties, prefix, "maxRetries", Integer::parseInt)
        .ifPresent(builder::maxRetries);
    readProperty(properties, prefix, "initialDelayMs", Long::parseLong)
        .ifPresent(builder::initialDelayMs);
    readProperty(properties, prefix, "maxDelayMs", Long::parseLong).ifPresent(builder::maxDelayMs);
    readProperty(properties, prefix, "jitterFactor", Double::parseDouble)
        .ifPresent(builder::jitterFactor);
    readProperty(properties, prefix, "respectRetryAfter", RetryConfig::parseBoolean)
        .ifPresent(builder::respectRetryAfter);
    readProperty(properties, prefix, "circuitBreakerThreshold", Integer::parseInt)
        .ifPresent(builder::circuitBreakerThreshold);
    readProperty(properties, prefix, "circuitOpenResetMs", Long::parseLong)
        .ifPresent(builder::circuitOpenResetMs);
    return builder.build();
  }

  private static <T> Optional<T> readProperty(
      Properties properties, String prefix, String name, Function<String, T> parser) {
    final String key = prefix + name;
    final String raw = properties.getProperty(key);
    if (raw == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(parser.apply(raw.trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value '%s' for property '%s'", raw, key), e);
    }
  }

  private static Boolean parseBoolean(String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException("not a boolean: " + value);
  }

  public int maxRetries() {
    return maxRetries;
  }

  public long initialDelayMs() {
    return initialDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitterFactor() {
    return jitterFactor;
  }

  public boolean respectRetryAfter() {
    return respectRetryAfter;
  }

  public int circuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  public long circuitOpenResetMs() {
    return circuitOpenResetMs;
  }

  public Builder toBuilder() {
    return builder()
        .maxRetries(maxRetries)
        .initialDelayMs(initialDelayMs)
        .maxDelayMs(maxDelayMs)
        .jitterFactor(jitterFactor)
        .respectRetryAfter(respectRetryAfter)
        .circuitBreakerThreshold(circuitBreakerThreshold)
        .circuitOpenResetMs(circuitOpenResetMs);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final RetryConfig that = (RetryConfig) o;
    return maxRetries == that.maxRetries
        && initialDelayMs == that.initialDelayMs
        && maxDelayMs == that.maxDelayMs
        && Double.compare(that.jitterFactor, jitterFactor) == 0
        && respectRetryAfter == that.respectRetryAfter
        && circuitBreakerThreshold == that.circuitBreakerThreshold
        && circuitOpenResetMs == that.circuitOpenResetMs;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        maxRetries,
        initialDelayMs,
        maxDelayMs,
        jitterFactor,
        respectRetryAfter,
        circuitBreakerThreshold,
        circuitOpenResetMs);
  }

  @Override
  public String toString() {
    return "RetryConfig{"
        + "maxRetries="
        + maxRetries
        + ", initialDelayMs="
        + initialDelayMs
        + ", maxDelayMs="
        + maxDelayMs
        + ", jitterFactor="
        + jitterFactor
        + ", respectRetryAfter="
        + respectRetryAfter
        + ", circuitBreakerThreshold="
        + circuitBreakerThreshold
        + ", circuitOpenResetMs="
        + circuitOpenResetMs
        + '}';
  }

  public static class Builder {
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long initialDelayMs = DEFAULT_INITIAL_DELAY_MS;
    private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
    private double jitterFactor = DEFAULT_JITTER_FACTOR;
    private boolean respectRetryAfter = DEFAULT_RESPECT_RETRY_AFTER;
    private int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
    private long circuitOpenResetMs = DEFAULT_CIRCUIT_OPEN_RESET_MS;

    private Builder() {}

    /** Retries after the first attempt; the operation runs at most {@code maxRetries + 1} times. */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder initialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
      return this;
    }

    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /** Fraction of the exponential delay that may be added as random jitter. */
    public Builder jitterFactor(double jitterFactor) {
      this.jitterFactor = jitterFactor;
      return this;
    }

    public Builder respectRetryAfter(boolean respectRetryAfter) {
      this.respectRetryAfter = respectRetryAfter;
      return this;
    }

    /** Number of consecutive calls exhausting their retries on rate limits before opening. */
    public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
      this.circuitBreakerThreshold = circuitBreakerThreshold;
      return this;
    }

    public Builder circuitOpenResetMs(long circuitOpenResetMs) {
      this.circuitOpenResetMs = circuitOpenResetMs;
      return this;
    }

    public RetryConfig build() {
      return new RetryConfig(this);
    }
  }
}
