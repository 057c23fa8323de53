package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.failsafe.spi.Scheduler;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs asynchronous operations and retries them while the remote side reports rate limiting,
 * backing off exponentially or as told by {@code Retry-After}. A circuit breaker shared by all
 * calls on the same instance stops calling out once enough calls in a row ran out of retries.
 *
 * <p>Errors that are not rate limits are never retried and reach the caller unchanged. The
 * executor's own failures are the subclasses of {@link Exceptions.RateLimitError}.
 *
 * <p>Instances are thread-safe and meant to be shared by the component that owns the remote
 * calls.
 */
public interface RetryExecutor {

  static RetryExecutor create() {
    return builder().build();
  }

  static RetryExecutor create(RetryConfig config) {
    return builder().config(config).build();
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Same as {@link #executeWithRetry(Supplier, OperationContext)} without labels or timeout.
   */
  <T> CompletableFuture<T> executeWithRetry(Supplier<? extends CompletionStage<T>> operation);

  /**
   * Invokes {@code operation}, retrying it on rate-limit errors.
   *
   * <p>The returned future completes with the operation's value, with the operation's own error
   * if it is not a rate limit, or with one of {@link Exceptions.RateLimitMaxRetriesExceeded},
   * {@link Exceptions.RateLimitCircuitOpen} or {@link Exceptions.RetryCancelled}. Cancelling the
   * returned future stops any further attempt and cancels the one in flight.
   *
   * @param operation started once per attempt; a supplier that throws or returns {@code null}
   *     counts as a failed attempt
   * @param context labels for logging and an optional timeout
   */
  <T> CompletableFuture<T> executeWithRetry(
      Supplier<? extends CompletionStage<T>> operation, OperationContext context);

  CircuitState getCircuitState();

  /** Closes the circuit and forgets all recorded failures, regardless of the cooldown. */
  void resetCircuit();

  RetryConfig config();

  class Builder {
    private RetryConfig config = RetryConfig.defaults();
    private Clock clock = SystemClock.INSTANCE;
    private Scheduler scheduler = Scheduler.DEFAULT;
    private RateLimitClassifier classifier = new DefaultRateLimitClassifier();
    private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();
    private RetryListener retryListener = RetryListener.NOOP;

    Builder() {}

    public Builder config(RetryConfig config) {
      this.config = checkNotNull(config, "config");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = checkNotNull(clock, "clock");
      return this;
    }

    /** Scheduler for the waits between attempts and for timeouts. */
    public Builder scheduler(Scheduler scheduler) {
      this.scheduler = checkNotNull(scheduler, "scheduler");
      return this;
    }

    public Builder classifier(RateLimitClassifier classifier) {
      this.classifier = checkNotNull(classifier, "classifier");
      return this;
    }

    /** Source of values in {@code [0, 1)} used to scale the jitter. */
    public Builder jitterSource(DoubleSupplier jitterSource) {
      this.jitterSource = checkNotNull(jitterSource, "jitterSource");
      return this;
    }

    public Builder retryListener(RetryListener retryListener) {
      this.retryListener = checkNotNull(retryListener, "retryListener");
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutorImpl(
          config,
          clock,
          scheduler,
          classifier,
          new BackoffCalculator(config, jitterSource),
          retryListener);
    }
  }
}
