package com.spotify.ratelimit;

public enum ErrorCode {
  RATE_LIMIT_MAX_RETRIES_EXCEEDED,
  RATE_LIMIT_CIRCUIT_OPEN,
  RATE_LIMIT_CANCELLED
}
