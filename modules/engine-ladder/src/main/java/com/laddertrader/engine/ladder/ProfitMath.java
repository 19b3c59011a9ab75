package com.laddertrader.engine.ladder;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Fee-aware round-trip arithmetic. A buy at {@code b} and a sell at {@code s} of the same
 * quantity net a non-negative result when {@code s >= b * (1 + minProfitableStep)}.
 */
public final class ProfitMath {
  private static final MathContext MC = MathContext.DECIMAL64;

  private ProfitMath() {}

  public static BigDecimal minProfitableStep(BigDecimal feeRate, BigDecimal feeBuffer) {
    BigDecimal denominator = BigDecimal.ONE.subtract(feeRate).subtract(feeBuffer);
    if (denominator.signum() <= 0) {
      throw new LadderConfigurationException("feeRate + feeBuffer must be < 1");
    }
    return BigDecimal.ONE.add(feeRate).divide(denominator, MC).subtract(BigDecimal.ONE);
  }

  public static BigDecimal minProfitableSellPrice(
      BigDecimal buyPrice, BigDecimal feeRate, BigDecimal feeBuffer) {
    Objects.requireNonNull(buyPrice, "buyPrice must not be null");
    return buyPrice.multiply(BigDecimal.ONE.add(minProfitableStep(feeRate, feeBuffer)), MC);
  }

  public static BigDecimal maxProfitableBuyPrice(
      BigDecimal sellPrice, BigDecimal feeRate, BigDecimal feeBuffer) {
    Objects.requireNonNull(sellPrice, "sellPrice must not be null");
    return sellPrice.divide(BigDecimal.ONE.add(minProfitableStep(feeRate, feeBuffer)), MC);
  }

  /** {@code sell*q*(1-fee) - buy*q*(1+fee)}. */
  public static BigDecimal roundTripNet(
      BigDecimal buyPrice, BigDecimal sellPrice, BigDecimal quantity, BigDecimal feeRate) {
    BigDecimal proceeds = sellPrice.multiply(quantity).multiply(BigDecimal.ONE.subtract(feeRate));
    BigDecimal cost = buyPrice.multiply(quantity).multiply(BigDecimal.ONE.add(feeRate));
    return proceeds.subtract(cost);
  }
}
