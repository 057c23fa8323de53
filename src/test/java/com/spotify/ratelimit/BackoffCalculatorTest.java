package com.spotify.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class BackoffCalculatorTest {

  private static final RetryConfig NO_JITTER =
      RetryConfig.builder().initialDelayMs(100).maxDelayMs(400).jitterFactor(0).build();

  @Test
  public void testDoublesUntilCapped() {
    final BackoffCalculator calculator = new BackoffCalculator(NO_JITTER);

    assertThat(calculator.computeBackoffMs(0)).isEqualTo(100);
    assertThat(calculator.computeBackoffMs(1)).isEqualTo(200);
    assertThat(calculator.computeBackoffMs(2)).isEqualTo(400);
    assertThat(calculator.computeBackoffMs(3)).isEqualTo(400);
  }

  @Test
  public void testLargeAttemptIndexStaysAtCap() {
    final BackoffCalculator calculator = new BackoffCalculator(NO_JITTER);

    assertThat(calculator.computeBackoffMs(64)).isEqualTo(400);
    assertThat(calculator.computeBackoffMs(2000)).isEqualTo(400);
  }

  @Test
  public void testJitterIsProportionalToExponentialDelay() {
    final RetryConfig config = NO_JITTER.toBuilder().jitterFactor(0.2).build();
    final BackoffCalculator calculator = new BackoffCalculator(config, () -> 0.5);

    assertThat(calculator.computeBackoffMs(0)).isEqualTo(110);
    assertThat(calculator.computeBackoffMs(1)).isEqualTo(220);
    // jitter applies on top of the cap
    assertThat(calculator.computeBackoffMs(5)).isEqualTo(440);
  }

  @Test
  public void testResultIsFloored() {
    final RetryConfig config = NO_JITTER.toBuilder().jitterFactor(0.2).build();
    final BackoffCalculator calculator = new BackoffCalculator(config, () -> 0.9999);

    assertThat(calculator.computeBackoffMs(0)).isEqualTo(119);
  }

  @Test
  public void testRandomJitterStaysWithinBounds() {
    final RetryConfig config = NO_JITTER.toBuilder().jitterFactor(0.5).build();
    final BackoffCalculator calculator = new BackoffCalculator(config);
    final Set<Long> seen = new HashSet<>();

    for (int i = 0; i < 200; i++) {
      final long delay = calculator.computeBackoffMs(0);
      assertThat(delay).isBetween(100L, 149L);
      seen.add(delay);
    }
    assertThat(seen.size()).isGreaterThan(1);
  }

  @Test
  public void testRejectsNegativeAttempt() {
    final BackoffCalculator calculator = new BackoffCalculator(NO_JITTER);

    assertThatThrownBy(() -> calculator.computeBackoffMs(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
