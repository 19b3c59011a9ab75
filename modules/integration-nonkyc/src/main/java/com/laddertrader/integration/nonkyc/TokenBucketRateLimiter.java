package com.laddertrader.integration.nonkyc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Token bucket shared by every outbound call of one credential. Refill is computed from elapsed
 * time inside the same lock that takes the token; waiting happens outside the lock.
 */
public final class TokenBucketRateLimiter implements RequestRateLimiter {
  private final double capacity;
  private final double refillPerSecond;
  private final Clock clock;
  private final Sleeper sleeper;

  private double tokens;
  private Instant lastRefill;

  public TokenBucketRateLimiter(int capacity, double refillPerSecond, Clock clock) {
    this(capacity, refillPerSecond, clock, Sleeper.threadSleeper());
  }

  public TokenBucketRateLimiter(int capacity, double refillPerSecond, Clock clock, Sleeper sleeper) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (refillPerSecond <= 0) {
      throw new IllegalArgumentException("refillPerSecond must be > 0");
    }
    this.capacity = capacity;
    this.refillPerSecond = refillPerSecond;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.tokens = capacity;
    this.lastRefill = clock.instant();
  }

  @Override
  public void acquire() {
    while (true) {
      long waitMillis;
      synchronized (this) {
        refill();
        if (tokens >= 1.0d) {
          tokens -= 1.0d;
          return;
        }
        waitMillis = Math.max(1L, (long) Math.ceil((1.0d - tokens) / refillPerSecond * 1000.0d));
      }
      try {
        sleeper.sleep(Duration.ofMillis(waitMillis));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for a rate limit token", ex);
      }
    }
  }

  @Override
  public synchronized boolean tryAcquire() {
    refill();
    if (tokens >= 1.0d) {
      tokens -= 1.0d;
      return true;
    }
    return false;
  }

  public synchronized double availableTokens() {
    refill();
    return tokens;
  }

  private void refill() {
    Instant now = clock.instant();
    Duration elapsed = Duration.between(lastRefill, now);
    if (elapsed.isNegative() || elapsed.isZero()) {
      return;
    }
    tokens = Math.min(capacity, tokens + elapsed.toNanos() / 1_000_000_000.0d * refillPerSecond);
    lastRefill = now;
  }
}
