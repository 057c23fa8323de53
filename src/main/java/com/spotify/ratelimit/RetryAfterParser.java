package com.spotify.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the server-suggested wait from a {@code Retry-After} header. Accepts delta-seconds and RFC
 * 1123 HTTP dates; anything else, or a wait that cannot be scheduled, is ignored.
 */
final class RetryAfterParser {

  static final String RETRY_AFTER = "retry-after";

  private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+");

  private RetryAfterParser() {}

  static Optional<Duration> parse(Throwable error, Instant now) {
    return Failures.findHttpFailure(error)
        .flatMap(failure -> header(failure.headers()))
        .flatMap(value -> parseValue(value, now));
  }

  static Optional<Duration> parseValue(String rawValue, Instant now) {
    final String value = rawValue.trim();
    if (value.isEmpty()) {
      return Optional.empty();
    }
    if (DELTA_SECONDS.matcher(value).matches()) {
      try {
        return schedulable(Duration.ofSeconds(Long.parseLong(value)));
      } catch (NumberFormatException | ArithmeticException e) {
        return Optional.empty();
      }
    }
    try {
      final Instant date =
          ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      final Duration untilDate = Duration.between(now, date);
      return schedulable(untilDate.isNegative() ? Duration.ZERO : untilDate);
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /** Waits too long to be scheduled in nanoseconds are ignored. */
  private static Optional<Duration> schedulable(Duration delay) {
    try {
      delay.toNanos();
      return Optional.of(delay);
    } catch (ArithmeticException e) {
      return Optional.empty();
    }
  }

  private static Optional<String> header(Map<String, String> headers) {
    if (headers == null) {
      return Optional.empty();
    }
    return headers.entrySet().stream()
        .filter(e -> e.getKey() != null && RETRY_AFTER.equalsIgnoreCase(e.getKey()))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }
}
