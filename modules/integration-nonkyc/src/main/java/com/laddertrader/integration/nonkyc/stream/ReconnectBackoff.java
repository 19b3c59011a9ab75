package com.laddertrader.integration.nonkyc.stream;

import java.time.Duration;

/**
 * Reconnect delay with a circuit breaker. After {@code k} consecutive failures the current delay
 * is {@code min(base * 2^k, max)}; a successful connect resets it.
 */
public final class ReconnectBackoff {
  private final Duration base;
  private final Duration max;
  private final int circuitBreakerThreshold;
  private int consecutiveFailures;
  private Duration currentBackoff;

  public ReconnectBackoff(Duration base, Duration max, int circuitBreakerThreshold) {
    if (base == null || base.isNegative() || base.isZero()) {
      throw new IllegalArgumentException("base must be > 0");
    }
    if (max == null || max.compareTo(base) < 0) {
      throw new IllegalArgumentException("max must be >= base");
    }
    if (circuitBreakerThreshold <= 0) {
      throw new IllegalArgumentException("circuitBreakerThreshold must be > 0");
    }
    this.base = base;
    this.max = max;
    this.circuitBreakerThreshold = circuitBreakerThreshold;
    this.currentBackoff = base;
  }

  /** Returns the delay to wait before the next attempt, then doubles it up to {@code max}. */
  public synchronized Duration recordFailure() {
    Duration wait = currentBackoff;
    consecutiveFailures++;
    currentBackoff = doubled(currentBackoff);
    return wait;
  }

  public synchronized void recordSuccess() {
    consecutiveFailures = 0;
    currentBackoff = base;
  }

  public synchronized Duration currentBackoff() {
    return currentBackoff;
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  public synchronized boolean isCircuitOpen() {
    return consecutiveFailures >= circuitBreakerThreshold;
  }

  public int circuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  private Duration doubled(Duration value) {
    if (value.compareTo(max.dividedBy(2)) >= 0) {
      return max;
    }
    return value.multipliedBy(2);
  }
}
