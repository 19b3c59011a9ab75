package com.laddertrader.domain.orders;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class PrecisionRounding {
  private PrecisionRounding() {}

  public static BigDecimal roundDownToTick(BigDecimal price, BigDecimal tickSize) {
    return roundDown(price, tickSize, "price");
  }

  public static BigDecimal roundDownToStep(BigDecimal quantity, BigDecimal stepSize) {
    return roundDown(quantity, stepSize, "quantity");
  }

  /** Smallest multiple of {@code stepSize} that is not below {@code quantity}. */
  public static BigDecimal roundUpToStep(BigDecimal quantity, BigDecimal stepSize) {
    if (quantity == null) {
      throw new OrderDomainException("quantity must not be null");
    }
    if (stepSize == null || stepSize.signum() <= 0) {
      return quantity;
    }
    BigDecimal units = quantity.divide(stepSize, 0, RoundingMode.CEILING);
    return units.multiply(stepSize).setScale(Math.max(stepSize.scale(), 0), RoundingMode.CEILING);
  }

  private static BigDecimal roundDown(BigDecimal value, BigDecimal increment, String fieldName) {
    if (value == null) {
      throw new OrderDomainException(fieldName + " must not be null");
    }
    if (increment == null || increment.signum() <= 0) {
      return value;
    }
    BigDecimal units = value.divide(increment, 0, RoundingMode.FLOOR);
    return units.multiply(increment).setScale(Math.max(increment.scale(), 0), RoundingMode.FLOOR);
  }
}
