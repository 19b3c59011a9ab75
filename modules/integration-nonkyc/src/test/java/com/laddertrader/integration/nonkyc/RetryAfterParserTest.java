package com.laddertrader.integration.nonkyc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RetryAfterParserTest {
  private final RetryAfterParser parser =
      new RetryAfterParser(Clock.fixed(Instant.parse("2026-02-25T12:00:00Z"), ZoneOffset.UTC));

  @Test
  void shouldParseDeltaSeconds() {
    assertEquals(Optional.of(Duration.ofSeconds(3)), parser.parse("3"));
    assertEquals(Optional.of(Duration.ofMillis(1500)), parser.parse(" 1.5 "));
  }

  @Test
  void shouldParseHttpDate() {
    assertEquals(
        Optional.of(Duration.ofSeconds(10)), parser.parse("Wed, 25 Feb 2026 12:00:10 GMT"));
  }

  @Test
  void shouldClampPastHttpDateToZero() {
    assertEquals(Optional.of(Duration.ZERO), parser.parse("Wed, 25 Feb 2026 11:59:00 GMT"));
  }

  @Test
  void shouldIgnoreMissingOrMalformedValues() {
    assertTrue(parser.parse(null).isEmpty());
    assertTrue(parser.parse("").isEmpty());
    assertTrue(parser.parse("soon").isEmpty());
    assertTrue(parser.parse("-5").isEmpty());
  }
}
