package com.codeheadsystems.iracing.client.manager;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the {@code Retry-After} header of a 429 response: either delta-seconds or an HTTP date.
 * Delays are capped at {@link #MAX_DELAY}.
 */
final class RetryAfterParser {

  static final Duration MAX_DELAY = Duration.ofHours(1);

  private RetryAfterParser() {
  }

  /**
   * Parses the header.
   *
   * @param header raw header value, may be null
   * @param now    the current wall-clock time, for HTTP-date values
   * @return the delay, or empty when the header is absent or unparseable
   */
  static Optional<Duration> parse(final String header, final Instant now) {
    if (header == null) {
      return Optional.empty();
    }
    String trimmed = header.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    if (isDigits(trimmed)) {
      try {
        return Optional.of(cap(Duration.ofSeconds(Long.parseLong(trimmed))));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    try {
      Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      Duration delay = Duration.between(now, at);
      return Optional.of(delay.isNegative() ? Duration.ZERO : cap(delay));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Duration cap(final Duration delay) {
    return delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
  }

  private static boolean isDigits(final String value) {
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
