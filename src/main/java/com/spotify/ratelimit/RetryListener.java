package com.spotify.ratelimit;

/** Notified before every retry an executor schedules. Must not block. */
@FunctionalInterface
public interface RetryListener {

  RetryListener NOOP = context -> {};

  void onRetry(RetryContext context);
}
