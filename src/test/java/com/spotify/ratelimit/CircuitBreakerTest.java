package com.spotify.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class CircuitBreakerTest {

  private final FakeClock clock = new FakeClock();

  @Test
  public void testOpensWhenThresholdReached() {
    final CircuitBreaker breaker = breaker(2);

    assertThat(breaker.recordExhaustion()).isFalse();
    assertThat(breaker.recordExhaustion()).isTrue();
    assertThat(breaker.isOpen()).isTrue();
    assertThat(breaker.tryAcquire()).isFalse();
  }

  @Test
  public void testSingleRateLimitFailuresDoNotCount() {
    final CircuitBreaker breaker = breaker(1);

    breaker.recordRateLimitFailure();
    breaker.recordRateLimitFailure();

    final CircuitState state = breaker.snapshot();
    assertThat(state.isOpen()).isFalse();
    assertThat(state.consecutiveFailures()).isEqualTo(0);
    assertThat(state.lastFailureTime()).contains(clock.get());
  }

  @Test
  public void testOtherOutcomesResetCounter() {
    final CircuitBreaker breaker = breaker(3);
    breaker.recordExhaustion();
    breaker.recordExhaustion();

    breaker.recordNonRateLimitOutcome();

    assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(0);
    assertThat(breaker.recordExhaustion()).isFalse();
  }

  @Test
  public void testClosesLazilyAfterCooldown() {
    final CircuitBreaker breaker = breaker(1);
    breaker.recordExhaustion();

    clock.advance(Duration.ofMillis(1000));
    assertThat(breaker.tryAcquire()).isFalse();
    assertThat(breaker.isOpen()).isTrue();

    clock.advance(Duration.ofMillis(1));
    assertThat(breaker.isOpen()).isTrue();
    assertThat(breaker.tryAcquire()).isTrue();

    final CircuitState state = breaker.snapshot();
    assertThat(state.isOpen()).isFalse();
    assertThat(state.consecutiveFailures()).isEqualTo(0);
    assertThat(state.timeSinceLastFailure()).contains(Duration.ofMillis(1001));
  }

  @Test
  public void testResetClearsEverything() {
    final CircuitBreaker breaker = breaker(1);
    breaker.recordExhaustion();

    breaker.reset();

    final CircuitState state = breaker.snapshot();
    assertThat(state.isOpen()).isFalse();
    assertThat(state.consecutiveFailures()).isEqualTo(0);
    assertThat(state.lastFailureTime()).isEmpty();
    assertThat(state.timeSinceLastFailure()).isEmpty();
    assertThat(breaker.tryAcquire()).isTrue();
  }

  @Test
  public void testConcurrentUpdatesAreNotLost() throws Exception {
    final CircuitBreaker breaker = breaker(Integer.MAX_VALUE);
    final int threads = 8;
    final int perThread = 1_000;
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perThread; i++) {
                    breaker.recordExhaustion();
                    breaker.snapshot();
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(threads * perThread);
  }

  private CircuitBreaker breaker(int threshold) {
    return new CircuitBreaker(
        RetryConfig.builder().circuitBreakerThreshold(threshold).circuitOpenResetMs(1000).build(),
        clock);
  }
}
