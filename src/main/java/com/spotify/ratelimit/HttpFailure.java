package com.spotify.ratelimit;

import java.util.Map;

/**
 * Implemented by errors that carry an HTTP response status, so the executor can classify them
 * without looking at their message. Header names are matched case-insensitively.
 */
public interface HttpFailure {

  int statusCode();

  Map<String, String> headers();
}
