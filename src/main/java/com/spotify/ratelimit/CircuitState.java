package com.spotify.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** Point-in-time view of an executor's circuit breaker, for monitoring and dashboards. */
public final class CircuitState {

  private final boolean open;
  private final int consecutiveFailures;
  @Nullable private final Instant lastFailureTime;
  @Nullable private final Duration timeSinceLastFailure;

  CircuitState(
      boolean open,
      int consecutiveFailures,
      @Nullable Instant lastFailureTime,
      @Nullable Duration timeSinceLastFailure) {
    this.open = open;
    this.consecutiveFailures = consecutiveFailures;
    this.lastFailureTime = lastFailureTime;
    this.timeSinceLastFailure = timeSinceLastFailure;
  }

  public boolean isOpen() {
    return open;
  }

  /** Consecutive calls that exhausted their retries on rate limits. */
  public int consecutiveFailures() {
    return consecutiveFailures;
  }

  public Optional<Instant> lastFailureTime() {
    return Optional.ofNullable(lastFailureTime);
  }

  public Optional<Duration> timeSinceLastFailure() {
    return Optional.ofNullable(timeSinceLastFailure);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final CircuitState that = (CircuitState) o;
    return open == that.open
        && consecutiveFailures == that.consecutiveFailures
        && Objects.equals(lastFailureTime, that.lastFailureTime)
        && Objects.equals(timeSinceLastFailure, that.timeSinceLastFailure);
  }

  @Override
  public int hashCode() {
    return Objects.hash(open, consecutiveFailures, lastFailureTime, timeSinceLastFailure);
  }

  @Override
  public String toString() {
    return "CircuitState{"
        + "open="
        + open
        + ", consecutiveFailures="
        + consecutiveFailures
        + ", lastFailureTime="
        + lastFailureTime
        + ", timeSinceLastFailure="
        + timeSinceLastFailure
        + '}';
  }
}
