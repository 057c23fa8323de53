package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Periodically inspects an executor's circuit and reports while it is open, so an open circuit is
 * visible even when no calls are being made.
 */
public class CircuitStateMonitor implements Closeable {

  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  private static final Logger log = org.slf4j.LoggerFactory.getLogger(CircuitStateMonitor.class);

  private final RetryExecutor executor;
  private final Consumer<CircuitState> onOpen;
  private final ScheduledExecutorService monitorExecutor;

  @VisibleForTesting
  CircuitStateMonitor(RetryExecutor executor, Consumer<CircuitState> onOpen) {
    this.executor = executor;
    this.onOpen = onOpen;
    this.monitorExecutor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("ratelimit-circuit-monitor-%d")
                .build());
  }

  public static CircuitStateMonitor start(RetryExecutor executor) {
    return start(executor, DEFAULT_INTERVAL, state -> {});
  }

  /**
   * Starts checking {@code executor} every {@code interval}. {@code onOpen} is called from the
   * monitor thread each time the circuit is found open.
   */
  public static CircuitStateMonitor start(
      RetryExecutor executor, Duration interval, Consumer<CircuitState> onOpen) {
    checkArgument(
        !interval.isNegative() && !interval.isZero(),
        "interval must be positive, was %s",
        interval);
    final CircuitStateMonitor monitor = new CircuitStateMonitor(executor, onOpen);
    monitor.monitorExecutor.scheduleAtFixedRate(
        monitor::check, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    return monitor;
  }

  @VisibleForTesting
  void check() {
    try {
      final CircuitState state = executor.getCircuitState();
      if (state.isOpen()) {
        log.warn("Rate limit circuit breaker is open: {}", state);
        onOpen.accept(state);
      }
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task
      log.error("Failed to check rate limit circuit state", e);
    }
  }

  @Override
  public void close() {
    monitorExecutor.shutdownNow();
  }
}
