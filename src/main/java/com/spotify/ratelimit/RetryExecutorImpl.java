package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.ratelimit.Exceptions.RateLimitCircuitOpen;
import com.spotify.ratelimit.Exceptions.RateLimitMaxRetriesExceeded;
import com.spotify.ratelimit.Exceptions.RetryCancelled;
import dev.failsafe.Failsafe;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import dev.failsafe.spi.Scheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;

class RetryExecutorImpl implements RetryExecutor {

  private static final Logger log = org.slf4j.LoggerFactory.getLogger(RetryExecutorImpl.class);

  private final RetryConfig config;
  private final Clock clock;
  private final Scheduler scheduler;
  private final RateLimitClassifier classifier;
  private final BackoffCalculator backoffCalculator;
  private final CircuitBreaker circuitBreaker;
  private final RetryListener retryListener;

  @VisibleForTesting
  RetryExecutorImpl(
      RetryConfig config,
      Clock clock,
      Scheduler scheduler,
      RateLimitClassifier classifier,
      BackoffCalculator backoffCalculator,
      RetryListener retryListener) {
    this.config = config;
    this.clock = clock;
    this.scheduler = scheduler;
    this.classifier = classifier;
    this.backoffCalculator = backoffCalculator;
    this.circuitBreaker = new CircuitBreaker(config, clock);
    this.retryListener = retryListener;
  }

  @Override
  public <T> CompletableFuture<T> executeWithRetry(
      Supplier<? extends CompletionStage<T>> operation) {
    return executeWithRetry(operation, OperationContext.empty());
  }

  @Override
  public <T> CompletableFuture<T> executeWithRetry(
      Supplier<? extends CompletionStage<T>> operation, OperationContext context) {
    checkNotNull(operation, "operation");
    checkNotNull(context, "context");
    if (!circuitBreaker.tryAcquire()) {
      log.warn("Rate limit circuit breaker is open, rejecting {}", context.label());
      return CompletableFuture.failedFuture(
          new RateLimitCircuitOpen(
              String.format(
                  "Rate limit circuit breaker is open. Too many throttled requests, wait %dms"
                      + " before trying again.",
                  config.circuitOpenResetMs()),
              null));
    }
    return new Execution<>(operation, context).start();
  }

  @Override
  public CircuitState getCircuitState() {
    return circuitBreaker.snapshot();
  }

  @Override
  public void resetCircuit() {
    circuitBreaker.reset();
  }

  @Override
  public RetryConfig config() {
    return config;
  }

  /**
   * The attempts of one {@code executeWithRetry} call. Failsafe drives the retries and the timeout;
   * each attempt records whether it was rate limited so the retry policy and the circuit breaker
   * agree on what happened.
   */
  private final class Execution<T> {
    private final Supplier<? extends CompletionStage<T>> operation;
    private final OperationContext context;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final int totalAttempts = config.maxRetries() + 1;
    private final AtomicInteger attempts = new AtomicInteger();

    @Nullable private volatile CompletableFuture<T> inFlight;
    @Nullable private volatile Throwable lastRateLimitError;
    @Nullable private volatile RetryContext nextRetry;
    private volatile boolean lastAttemptRateLimited = false;
    private volatile boolean rejectedByOpenCircuit = false;

    Execution(Supplier<? extends CompletionStage<T>> operation, OperationContext context) {
      this.operation = operation;
      this.context = context;
    }

    CompletableFuture<T> start() {
      final CompletableFuture<T> execution =
          Failsafe.with(policies()).with(scheduler).getStageAsync(this::attempt);
      execution.whenComplete(this::onDone);
      result.whenComplete(
          (value, error) -> {
            execution.cancel(true);
            cancelInFlight();
          });
      return result;
    }

    private List<Policy<T>> policies() {
      final List<Policy<T>> policies = new ArrayList<>();
      context.timeout().ifPresent(timeout -> policies.add(Timeout.<T>of(timeout)));
      policies.add(
          RetryPolicy.<T>builder()
              .handleIf(failure -> lastAttemptRateLimited)
              .withMaxRetries(config.maxRetries())
              .withDelayFn(
                  ctx -> {
                    final RetryContext retry = nextRetry;
                    return retry == null ? Duration.ZERO : retry.delay();
                  })
              .onRetryScheduled(event -> onRetryScheduled())
              .build());
      return policies;
    }

    private CompletableFuture<T> attempt() {
      final int attempt = attempts.getAndIncrement();
      lastAttemptRateLimited = false;
      if (result.isDone()) {
        return CompletableFuture.failedFuture(
            new CancellationException(context.label() + " already completed"));
      }
      if (attempt > 0 && !circuitBreaker.tryAcquire()) {
        log.warn(
            "Rate limit circuit breaker opened while {} was waiting for attempt {}/{}",
            context.label(),
            attempt + 1,
            totalAttempts);
        rejectedByOpenCircuit = true;
        return CompletableFuture.failedFuture(
            new RateLimitCircuitOpen(
                "Rate limit circuit breaker is open, giving up on retries", lastRateLimitError));
      }
      final CompletableFuture<T> future = invoke();
      inFlight = future;
      final CompletableFuture<T> outcome = new CompletableFuture<>();
      future.whenComplete(
          (value, error) -> {
            if (error == null) {
              outcome.complete(value);
            } else {
              outcome.completeExceptionally(onAttemptFailed(Failures.unwrap(error), attempt));
            }
          });
      return outcome;
    }

    private CompletableFuture<T> invoke() {
      try {
        final CompletionStage<T> stage = operation.get();
        if (stage == null) {
          return CompletableFuture.failedFuture(
              new NullPointerException("operation returned null instead of a future"));
        }
        return stage.toCompletableFuture();
      } catch (Throwable t) {
        // includes sneaky checked exceptions and errors
        return CompletableFuture.failedFuture(t);
      }
    }

    /** Classifies a failed attempt and returns the error the attempt fails with. */
    private Throwable onAttemptFailed(Throwable error, int attempt) {
      try {
        if (!classifier.isRateLimitError(error)) {
          return error;
        }
        lastRateLimitError = error;
        if (attempt < config.maxRetries()) {
          circuitBreaker.recordRateLimitFailure();
          nextRetry = retryContext(error, attempt);
        }
        lastAttemptRateLimited = true;
        return error;
      } catch (Throwable t) {
        log.error("Failed to classify error from {}", context.label(), t);
        lastAttemptRateLimited = false;
        if (t != error) {
          t.addSuppressed(error);
        }
        return t;
      }
    }

    private RetryContext retryContext(Throwable error, int attempt) {
      final long backoffMs = backoffCalculator.computeBackoffMs(attempt);
      final Duration retryAfter =
          config.respectRetryAfter()
              ? RetryAfterParser.parse(error, clock.get()).orElse(null)
              : null;
      final Duration delay = retryAfter != null ? retryAfter : Duration.ofMillis(backoffMs);
      return new RetryContext(
          attempt + 1,
          totalAttempts,
          Duration.ofMillis(backoffMs),
          retryAfter,
          delay,
          context,
          error);
    }

    private void onRetryScheduled() {
      final RetryContext retry = nextRetry;
      if (retry == null) {
        return;
      }
      log.warn(
          "Rate limited on {} (attempt {}/{}), retrying in {}ms{}",
          context.label(),
          retry.attempt(),
          totalAttempts,
          retry.delay().toMillis(),
          retry.retryAfterDelay().isPresent() ? " as requested by Retry-After" : "");
      try {
        retryListener.onRetry(retry);
      } catch (RuntimeException e) {
        log.warn("Retry listener failed for {}", context.label(), e);
      }
    }

    private void onDone(@Nullable T value, @Nullable Throwable error) {
      if (result.isDone()) {
        return;
      }
      try {
        if (error == null) {
          circuitBreaker.recordNonRateLimitOutcome();
          result.complete(value);
        } else {
          onFailure(Failures.unwrap(error));
        }
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    }

    private void onFailure(Throwable error) {
      if (error instanceof TimeoutExceededException) {
        final long timeoutMs = context.timeout().map(Duration::toMillis).orElse(0L);
        log.warn("Gave up on {} after timeout of {}ms", context.label(), timeoutMs);
        result.completeExceptionally(
            new RetryCancelled(
                String.format("%s did not complete within %dms", context.label(), timeoutMs),
                lastRateLimitError));
        return;
      }
      if (rejectedByOpenCircuit) {
        result.completeExceptionally(error);
        return;
      }
      if (!lastAttemptRateLimited) {
        circuitBreaker.recordNonRateLimitOutcome();
        result.completeExceptionally(error);
        return;
      }
      if (circuitBreaker.recordExhaustion()) {
        result.completeExceptionally(
            new RateLimitCircuitOpen(
                String.format(
                    "Rate limit circuit breaker is open after %d consecutive throttled calls."
                        + " Wait %dms before trying again.",
                    config.circuitBreakerThreshold(),
                    config.circuitOpenResetMs()),
                error));
      } else {
        log.warn(
            "Rate limit persisted for {} after {} retries: {}",
            context.label(),
            config.maxRetries(),
            error.getMessage());
        result.completeExceptionally(new RateLimitMaxRetriesExceeded(config.maxRetries(), error));
      }
    }

    private void cancelInFlight() {
      final CompletableFuture<T> current = inFlight;
      if (current != null && !current.isDone()) {
        current.cancel(true);
      }
    }
  }
}
