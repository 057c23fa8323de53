package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Exponential backoff with proportional jitter, capped at {@link RetryConfig#maxDelayMs()}. */
class BackoffCalculator {

  private final RetryConfig config;
  private final DoubleSupplier random;

  BackoffCalculator(RetryConfig config) {
    this(config, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of values in {@code [0, 1)}
   */
  BackoffCalculator(RetryConfig config, DoubleSupplier random) {
    this.config = config;
    this.random = random;
  }

  long computeBackoffMs(int attemptIndex) {
    checkArgument(attemptIndex >= 0, "attemptIndex must be >= 0, was %s", attemptIndex);
    final double exponential =
        Math.min(config.initialDelayMs() * Math.pow(2, attemptIndex), config.maxDelayMs());
    final double jitter = exponential * config.jitterFactor() * random.getAsDouble();
    return (long) Math.floor(exponential + jitter);
  }
}
