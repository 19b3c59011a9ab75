package com.laddertrader.integration.nonkyc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {
  @Test
  void shouldAllowBurstUpToCapacity() {
    MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3, 1.0d, clock);

    assertTrue(limiter.tryAcquire());
    assertTrue(limiter.tryAcquire());
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
  }

  @Test
  void shouldRefillLazilyFromElapsedTimeWithoutExceedingCapacity() {
    MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2, 2.0d, clock);
    limiter.tryAcquire();
    limiter.tryAcquire();

    clock.advance(Duration.ofMillis(500));
    assertEquals(1.0d, limiter.availableTokens(), 1e-9);

    clock.advance(Duration.ofSeconds(10));
    assertEquals(2.0d, limiter.availableTokens(), 1e-9);
  }

  @Test
  void shouldSleepForMissingTokenThenTakeIt() {
    MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    List<Duration> sleeps = new ArrayList<>();
    TokenBucketRateLimiter limiter =
        new TokenBucketRateLimiter(
            1,
            4.0d,
            clock,
            duration -> {
              sleeps.add(duration);
              clock.advance(duration);
            });

    limiter.acquire();
    limiter.acquire();

    assertEquals(List.of(Duration.ofMillis(250)), sleeps);
    assertEquals(0.0d, limiter.availableTokens(), 1e-9);
  }

  @Test
  void shouldNeverBlockWithNoopLimiter() {
    RequestRateLimiter limiter = RequestRateLimiter.noop();
    for (int i = 0; i < 1_000; i++) {
      limiter.acquire();
    }
    assertTrue(limiter.tryAcquire());
  }
}
