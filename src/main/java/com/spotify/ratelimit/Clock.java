package com.spotify.ratelimit;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Time source for the executor. {@link #get()} is wall-clock time, used for HTTP dates and for
 * reporting. {@link #monotonicMillis()} only moves forward and is used for all elapsed-time
 * decisions.
 */
public interface Clock extends Supplier<Instant> {

  long monotonicMillis();
}
