package com.spotify.ratelimit;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

class SystemClock implements Clock {

  static final SystemClock INSTANCE = new SystemClock();

  @Override
  public Instant get() {
    return Instant.now();
  }

  @Override
  public long monotonicMillis() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }
}
