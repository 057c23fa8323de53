package com.spotify.ratelimit;

/** Decides whether a failed attempt was caused by the remote side rate-limiting the caller. */
@FunctionalInterface
public interface RateLimitClassifier {

  boolean isRateLimitError(Throwable error);
}
