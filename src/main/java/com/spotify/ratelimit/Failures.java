package com.spotify.ratelimit;

import com.google.common.base.Throwables;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Failures {

  private Failures() {}

  /** Strips the wrappers that futures add around an operation's own error. */
  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  static Optional<HttpFailure> findHttpFailure(Throwable error) {
    return Throwables.getCausalChain(unwrap(error)).stream()
        .filter(HttpFailure.class::isInstance)
        .map(HttpFailure.class::cast)
        .findFirst();
  }
}
