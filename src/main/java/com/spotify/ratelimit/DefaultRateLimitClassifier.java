package com.spotify.ratelimit;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

/**
 * Treats an error as a rate limit if anything in its causal chain is an {@link HttpFailure} with
 * status 429, or if its message mentions one. The message match is case-sensitive. Failures
 * raised by a {@link RetryExecutor} itself are never rate limits.
 */
public class DefaultRateLimitClassifier implements RateLimitClassifier {

  static final int TOO_MANY_REQUESTS = 429;

  private static final ImmutableList<String> MESSAGE_MARKERS =
      ImmutableList.of("429", "rate limit", "Too Many Requests");

  @Override
  public boolean isRateLimitError(Throwable error) {
    if (error == null) {
      return false;
    }
    final Throwable unwrapped = Failures.unwrap(error);
    if (unwrapped instanceof Exceptions.RateLimitError) {
      return false;
    }
    final boolean hasStatus =
        Throwables.getCausalChain(unwrapped).stream()
            .anyMatch(
                t ->
                    t instanceof HttpFailure
                        && ((HttpFailure) t).statusCode() == TOO_MANY_REQUESTS);
    if (hasStatus) {
      return true;
    }
    final String message = unwrapped.getMessage();
    return message != null && MESSAGE_MARKERS.stream().anyMatch(message::contains);
  }
}
