package com.spotify.ratelimit;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Optional per-call information: labels that show up in log lines and an optional timeout
 * covering all attempts and the delays between them.
 */
public final class OperationContext {

  private static final OperationContext EMPTY = new OperationContext(null, null, null);

  @Nullable private final String resourceName;
  @Nullable private final String operationName;
  @Nullable private final Duration timeout;

  private OperationContext(
      @Nullable String resourceName, @Nullable String operationName, @Nullable Duration timeout) {
    this.resourceName = resourceName;
    this.operationName = operationName;
    this.timeout = timeout;
  }

  public static OperationContext empty() {
    return EMPTY;
  }

  public static OperationContext of(String resourceName, String operationName) {
    return new OperationContext(resourceName, operationName, null);
  }

  /** Returns a copy that gives up once {@code timeout} has passed since the call started. */
  public OperationContext withTimeout(Duration timeout) {
    checkArgument(
        !timeout.isNegative() && !timeout.isZero(), "timeout must be positive, was %s", timeout);
    return new OperationContext(resourceName, operationName, timeout);
  }

  public Optional<String> resourceName() {
    return Optional.ofNullable(resourceName);
  }

  public Optional<String> operationName() {
    return Optional.ofNullable(operationName);
  }

  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Label used in log lines, e.g. {@code contacts/create}. */
  String label() {
    if (resourceName == null && operationName == null) {
      return "operation";
    }
    if (resourceName == null) {
      return operationName;
    }
    return operationName == null ? resourceName : resourceName + "/" + operationName;
  }

  @Override
  public String toString() {
    return "OperationContext{"
        + "resourceName="
        + resourceName
        + ", operationName="
        + operationName
        + ", timeout="
        + timeout
        + '}';
  }
}
