package com.laddertrader.integration.nonkyc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing nonces of the form {@code floor(nowMillis * multiplier)}. One instance is
 * shared by every signed call path of a credential.
 */
public class NonceGenerator {
  private final Clock clock;
  private final BigDecimal multiplier;
  private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

  public NonceGenerator(Clock clock, BigDecimal multiplier) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    Objects.requireNonNull(multiplier, "multiplier must not be null");
    if (multiplier.signum() <= 0) {
      throw new IllegalArgumentException("multiplier must be > 0");
    }
    this.multiplier = multiplier;
  }

  public long next() {
    long candidate =
        BigDecimal.valueOf(clock.millis())
            .multiply(multiplier)
            .setScale(0, RoundingMode.FLOOR)
            .longValueExact();
    return last.updateAndGet(previous -> previous >= candidate ? previous + 1 : candidate);
  }

  public BigDecimal multiplier() {
    return multiplier;
  }
}
