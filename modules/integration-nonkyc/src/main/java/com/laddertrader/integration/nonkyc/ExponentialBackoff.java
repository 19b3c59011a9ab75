package com.laddertrader.integration.nonkyc;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay {@code base * 2^(attempt-1)} capped at {@code max}. With a positive jitter ratio a
 * random extra of up to {@code ratio * delay} is added, still capped at {@code max}.
 */
public class ExponentialBackoff {
  private final long baseMs;
  private final long maxMs;
  private final double jitterRatio;
  private final DoubleSupplier jitterSource;

  public ExponentialBackoff(long baseMs, long maxMs, double jitterRatio) {
    this(baseMs, maxMs, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
  }

  public ExponentialBackoff(long baseMs, long maxMs, double jitterRatio, DoubleSupplier jitterSource) {
    this.baseMs = Math.max(0L, baseMs);
    this.maxMs = Math.max(this.baseMs, maxMs);
    this.jitterRatio = Math.max(0.0d, jitterRatio);
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public static ExponentialBackoff withoutJitter(long baseMs, long maxMs) {
    return new ExponentialBackoff(baseMs, maxMs, 0.0d);
  }

  public Duration delayForAttempt(int attempt) {
    long deterministic = deterministicDelay(attempt);
    if (jitterRatio == 0.0d || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    double factor = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    long extra = (long) Math.floor(deterministic * jitterRatio * factor);
    return Duration.ofMillis(Math.min(maxMs, deterministic + extra));
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxMs);
  }

  private long deterministicDelay(int attempt) {
    if (baseMs == 0L) {
      return 0L;
    }
    int exponent = Math.min(62, Math.max(0, attempt - 1));
    double scaled = baseMs * Math.pow(2.0d, exponent);
    return (long) Math.floor(Math.min((double) maxMs, scaled));
  }
}
