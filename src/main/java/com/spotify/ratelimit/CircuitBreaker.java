package com.spotify.ratelimit;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import org.slf4j.Logger;

/**
 * Counts consecutive calls that ran out of retries on rate limits and opens once the configured
 * threshold is reached. There is no half-open state: once the cooldown has passed the next call
 * closes the circuit and runs normally.
 *
 * <p>Shared by every call on one executor, so all state is read and written under a single lock.
 */
class CircuitBreaker {

  private static final Logger log = org.slf4j.LoggerFactory.getLogger(CircuitBreaker.class);

  private final int threshold;
  private final long resetMs;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private int consecutiveFailures = 0;
  private boolean open = false;
  @Nullable private Long lastFailureMonotonicMs = null;
  @Nullable private Instant lastFailureTime = null;

  CircuitBreaker(RetryConfig config, Clock clock) {
    this.threshold = config.circuitBreakerThreshold();
    this.resetMs = config.circuitOpenResetMs();
    this.clock = clock;
  }

  /**
   * Closes the circuit if its cooldown has elapsed, then reports whether a new call may proceed.
   */
  boolean tryAcquire() {
    lock.lock();
    try {
      if (open
          && lastFailureMonotonicMs != null
          && clock.monotonicMillis() - lastFailureMonotonicMs > resetMs) {
        open = false;
        consecutiveFailures = 0;
        log.info("Rate limit circuit breaker closed after {}ms cooldown", resetMs);
      }
      return !open;
    } finally {
      lock.unlock();
    }
  }

  boolean isOpen() {
    lock.lock();
    try {
      return open;
    } finally {
      lock.unlock();
    }
  }

  /** A call completed, successfully or with an error that is not a rate limit. */
  void recordNonRateLimitOutcome() {
    lock.lock();
    try {
      consecutiveFailures = 0;
    } finally {
      lock.unlock();
    }
  }

  void recordRateLimitFailure() {
    lock.lock();
    try {
      markFailureTime();
    } finally {
      lock.unlock();
    }
  }

  /**
   * A call used its last attempt and still hit a rate limit.
   *
   * @return true if the circuit is open afterwards
   */
  boolean recordExhaustion() {
    lock.lock();
    try {
      markFailureTime();
      consecutiveFailures++;
      if (!open && consecutiveFailures >= threshold) {
        open = true;
        log.error(
            "Rate limit circuit breaker opened after {} consecutive failures, rejecting calls for"
                + " {}ms",
            consecutiveFailures,
            resetMs);
      }
      return open;
    } finally {
      lock.unlock();
    }
  }

  void reset() {
    lock.lock();
    try {
      final boolean wasOpen = open;
      open = false;
      consecutiveFailures = 0;
      lastFailureMonotonicMs = null;
      lastFailureTime = null;
      if (wasOpen) {
        log.info("Rate limit circuit breaker manually reset");
      }
    } finally {
      lock.unlock();
    }
  }

  CircuitState snapshot() {
    lock.lock();
    try {
      final Duration sinceLastFailure =
          lastFailureMonotonicMs == null
              ? null
              : Duration.ofMillis(clock.monotonicMillis() - lastFailureMonotonicMs);
      return new CircuitState(open, consecutiveFailures, lastFailureTime, sinceLastFailure);
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int threshold() {
    return threshold;
  }

  private void markFailureTime() {
    lastFailureMonotonicMs = clock.monotonicMillis();
    lastFailureTime = clock.get();
  }
}
