package com.spotify.ratelimit;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nullable;

/** A failed remote call, described by its HTTP status and response headers. */
public class HttpStatusException extends RuntimeException implements HttpFailure {

  private final int statusCode;
  private final ImmutableMap<String, String> headers;

  public HttpStatusException(int statusCode, String message) {
    this(statusCode, message, ImmutableMap.of(), null);
  }

  public HttpStatusException(int statusCode, String message, Map<String, String> headers) {
    this(statusCode, message, headers, null);
  }

  public HttpStatusException(
      int statusCode, String message, Map<String, String> headers, @Nullable Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.headers = ImmutableMap.copyOf(headers);
  }

  @Override
  public int statusCode() {
    return statusCode;
  }

  @Override
  public Map<String, String> headers() {
    return headers;
  }
}
