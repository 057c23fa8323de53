package com.spotify.ratelimit;

import com.spotify.ratelimit.Exceptions.RateLimitCircuitOpen;
import com.spotify.ratelimit.Exceptions.RateLimitMaxRetriesExceeded;
import javax.annotation.Nullable;

/** Text to show end users for failures coming out of a {@link RetryExecutor}. */
public final class ErrorMessages {

  static final String CIRCUIT_OPEN =
      "Too many requests. Please wait 1-2 minutes before trying again.";
  static final String OVERLOADED =
      "The system is temporarily overloaded. Please try again in a few moments.";
  static final String GENERIC = "An error occurred";

  private ErrorMessages() {}

  public static String userMessage(@Nullable Throwable error) {
    if (error == null) {
      return GENERIC;
    }
    final Throwable unwrapped = Failures.unwrap(error);
    if (unwrapped instanceof RateLimitCircuitOpen) {
      return CIRCUIT_OPEN;
    }
    if (unwrapped instanceof RateLimitMaxRetriesExceeded) {
      return OVERLOADED;
    }
    final String message = unwrapped.getMessage();
    return message == null || message.isBlank() ? GENERIC : message;
  }
}
