package com.spotify.ratelimit;

import java.util.Optional;
import javax.annotation.Nullable;

public class Exceptions {

  /**
   * Base of the errors produced by the executor itself. Errors that are not rate limits are never
   * wrapped in one of these; they reach the caller unchanged.
   */
  public abstract static class RateLimitError extends RuntimeException {
    private final ErrorCode code;

    RateLimitError(ErrorCode code, String message, @Nullable Throwable originalError) {
      super(message, originalError);
      this.code = code;
    }

    public ErrorCode getCode() {
      return code;
    }

    /** The operation's own error that led to this one, if an attempt was made. */
    public Optional<Throwable> getOriginalError() {
      return Optional.ofNullable(getCause());
    }
  }

  public static class RateLimitMaxRetriesExceeded extends RateLimitError {
    private final int retries;

    public RateLimitMaxRetriesExceeded(int retries, Throwable originalError) {
      super(
          ErrorCode.RATE_LIMIT_MAX_RETRIES_EXCEEDED,
          String.format(
              "Rate limit error persisted after %d retries. The service is temporarily"
                  + " overloaded, try again shortly.",
              retries),
          originalError);
      this.retries = retries;
    }

    public int getRetries() {
      return retries;
    }
  }

  public static class RateLimitCircuitOpen extends RateLimitError {
    public RateLimitCircuitOpen(String message, @Nullable Throwable originalError) {
      super(ErrorCode.RATE_LIMIT_CIRCUIT_OPEN, message, originalError);
    }
  }

  /** The call's timeout elapsed before it could complete. */
  public static class RetryCancelled extends RateLimitError {
    public RetryCancelled(String message, @Nullable Throwable originalError) {
      super(ErrorCode.RATE_LIMIT_CANCELLED, message, originalError);
    }
  }
}
