package com.laddertrader.integration.nonkyc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/** Reads {@code Retry-After} as delta seconds (fractions allowed) or as an HTTP date. */
public class RetryAfterParser {
  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return Optional.empty();
    }
    String candidate = headerValue.trim();
    Optional<Duration> seconds = parseSeconds(candidate);
    if (seconds.isPresent()) {
      return seconds;
    }
    try {
      ZonedDateTime retryAt = ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration until = Duration.between(clock.instant(), retryAt.toInstant());
      return Optional.of(until.isNegative() ? Duration.ZERO : until);
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  private static Optional<Duration> parseSeconds(String candidate) {
    if (!candidate.matches("\\d+(\\.\\d+)?")) {
      return Optional.empty();
    }
    long millis = new BigDecimal(candidate).movePointRight(3).longValue();
    return Optional.of(Duration.ofMillis(Math.max(0L, millis)));
  }
}
