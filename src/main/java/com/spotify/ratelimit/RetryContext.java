package com.spotify.ratelimit;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/** Describes one scheduled retry. Created per retry and handed to the {@link RetryListener}. */
public final class RetryContext {

  private final int attempt;
  private final int totalAttempts;
  private final Duration backoffDelay;
  @Nullable private final Duration retryAfterDelay;
  private final Duration delay;
  private final OperationContext operationContext;
  private final Throwable error;

  RetryContext(
      int attempt,
      int totalAttempts,
      Duration backoffDelay,
      @Nullable Duration retryAfterDelay,
      Duration delay,
      OperationContext operationContext,
      Throwable error) {
    this.attempt = attempt;
    this.totalAttempts = totalAttempts;
    this.backoffDelay = backoffDelay;
    this.retryAfterDelay = retryAfterDelay;
    this.delay = delay;
    this.operationContext = operationContext;
    this.error = error;
  }

  /** 1-based number of the attempt that just failed. */
  public int attempt() {
    return attempt;
  }

  public int totalAttempts() {
    return totalAttempts;
  }

  /** The exponential backoff computed for this retry, before any Retry-After override. */
  public Duration backoffDelay() {
    return backoffDelay;
  }

  public Optional<Duration> retryAfterDelay() {
    return Optional.ofNullable(retryAfterDelay);
  }

  /** The wait that is actually applied before the next attempt. */
  public Duration delay() {
    return delay;
  }

  public OperationContext operationContext() {
    return operationContext;
  }

  /** The rate-limit error that triggered this retry. */
  public Throwable error() {
    return error;
  }

  @Override
  public String toString() {
    return "RetryContext{"
        + "attempt="
        + attempt
        + ", totalAttempts="
        + totalAttempts
        + ", backoffDelay="
        + backoffDelay
        + ", retryAfterDelay="
        + retryAfterDelay
        + ", delay="
        + delay
        + ", operationContext="
        + operationContext
        + '}';
  }
}
