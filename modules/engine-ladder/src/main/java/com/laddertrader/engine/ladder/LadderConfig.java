package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.MarketSymbol;
import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.orders.PrecisionRounding;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Validated ladder settings, built once at startup and shared by reference. */
public record LadderConfig(
    MarketSymbol symbol,
    LadderVariant variant,
    StepMode stepMode,
    BigDecimal stepPct,
    BigDecimal stepAbs,
    int buyLevels,
    int sellLevels,
    BigDecimal baseOrderSize,
    BigDecimal feeRate,
    BigDecimal feeBuffer,
    BigDecimal minNotional,
    BigDecimal tickSize,
    BigDecimal quantityStep,
    RunMode runMode,
    boolean startupCancelAll,
    int maxDeferredAttempts,
    OrderSizing sizing,
    boolean extendBuyLevelsOnRestart) {
  public LadderConfig {
    Objects.requireNonNull(symbol, "symbol must not be null");
    Objects.requireNonNull(variant, "variant must not be null");
    Objects.requireNonNull(stepMode, "stepMode must not be null");
    Objects.requireNonNull(runMode, "runMode must not be null");
    if (stepMode == StepMode.PCT && !isPositive(stepPct)) {
      throw new LadderConfigurationException("stepPct must be > 0 in PCT step mode");
    }
    if (stepMode == StepMode.ABS && !isPositive(stepAbs)) {
      throw new LadderConfigurationException("stepAbs must be > 0 in ABS step mode");
    }
    if (stepMode == StepMode.PCT && stepPct.compareTo(BigDecimal.ONE) >= 0) {
      throw new LadderConfigurationException("stepPct must be < 1");
    }
    if (buyLevels < 0 || sellLevels < 0) {
      throw new LadderConfigurationException("level counts must be >= 0");
    }
    if (buyLevels + sellLevels == 0) {
      throw new LadderConfigurationException("at least one ladder level is required");
    }
    if (!isPositive(baseOrderSize)) {
      throw new LadderConfigurationException("baseOrderSize must be > 0");
    }
    feeRate = requireNonNegative(feeRate, "feeRate");
    feeBuffer = requireNonNegative(feeBuffer, "feeBuffer");
    if (feeRate.add(feeBuffer).compareTo(BigDecimal.ONE) >= 0) {
      throw new LadderConfigurationException("feeRate + feeBuffer must be < 1");
    }
    minNotional = requireNonNegative(minNotional, "minNotional");
    tickSize = requireNonNegative(tickSize, "tickSize");
    quantityStep = requireNonNegative(quantityStep, "quantityStep");
    if (maxDeferredAttempts < 0) {
      throw new LadderConfigurationException("maxDeferredAttempts must be >= 0");
    }
    sizing = sizing == null ? OrderSizing.fixed() : sizing;
  }

  /** Fixed sizing, no buy-side extension on restart. */
  public LadderConfig(
      MarketSymbol symbol,
      LadderVariant variant,
      StepMode stepMode,
      BigDecimal stepPct,
      BigDecimal stepAbs,
      int buyLevels,
      int sellLevels,
      BigDecimal baseOrderSize,
      BigDecimal feeRate,
      BigDecimal feeBuffer,
      BigDecimal minNotional,
      BigDecimal tickSize,
      BigDecimal quantityStep,
      RunMode runMode,
      boolean startupCancelAll,
      int maxDeferredAttempts) {
    this(
        symbol,
        variant,
        stepMode,
        stepPct,
        stepAbs,
        buyLevels,
        sellLevels,
        baseOrderSize,
        feeRate,
        feeBuffer,
        minNotional,
        tickSize,
        quantityStep,
        runMode,
        startupCancelAll,
        maxDeferredAttempts,
        OrderSizing.fixed(),
        false);
  }

  public BigDecimal minProfitableStep() {
    return ProfitMath.minProfitableStep(feeRate, feeBuffer);
  }

  /** Spacing as a fraction of {@code referencePrice}; ABS steps are converted. */
  public BigDecimal effectiveStep(BigDecimal referencePrice) {
    if (stepMode == StepMode.PCT) {
      return stepPct;
    }
    if (!isPositive(referencePrice)) {
      throw new LadderConfigurationException("reference price must be > 0");
    }
    return stepAbs.divide(referencePrice, MathContext.DECIMAL64);
  }

  /** Refuses spacing that would lose money on a round trip after fees. */
  public void validateSpacing(BigDecimal referencePrice) {
    BigDecimal effective = effectiveStep(referencePrice);
    BigDecimal minimum = minProfitableStep();
    if (effective.compareTo(minimum) < 0) {
      throw new LadderConfigurationException(
          "Ladder spacing "
              + effective.toPlainString()
              + " is below the minimum profitable step "
              + minimum.round(new MathContext(6)).toPlainString()
              + " for feeRate="
              + feeRate.toPlainString()
              + " feeBuffer="
              + feeBuffer.toPlainString());
    }
  }

  public BigDecimal priceAbove(BigDecimal price, int levels) {
    return roundPrice(price.add(stepDelta(price, levels)));
  }

  public BigDecimal priceBelow(BigDecimal price, int levels) {
    return roundPrice(price.subtract(stepDelta(price, levels)));
  }

  public BigDecimal roundPrice(BigDecimal price) {
    return PrecisionRounding.roundDownToTick(price, tickSize);
  }

  public BigDecimal roundQuantity(BigDecimal quantity) {
    return PrecisionRounding.roundDownToStep(quantity, quantityStep);
  }

  /**
   * Quantity for a fresh rung at {@code price}, rounded down to the quantity step. Quote-target
   * sizing without an explicit target spends {@code baseOrderSize} worth of {@code entryPrice}.
   */
  public BigDecimal orderQuantity(OrderSide side, BigDecimal price, BigDecimal entryPrice) {
    SizingMode mode = sizing.mode(side);
    if (mode == SizingMode.FIXED || !isPositive(price)) {
      return baseOrderSize;
    }
    BigDecimal target = sizing.targetQuotePerOrder();
    if (target == null) {
      target = baseOrderSize.multiply(isPositive(entryPrice) ? entryPrice : price);
    }
    BigDecimal quantity = roundQuantity(target.divide(price, MathContext.DECIMAL64));
    if (mode == SizingMode.HYBRID) {
      quantity = quantity.max(PrecisionRounding.roundUpToStep(sizing.minBaseOrderQty(), quantityStep));
    }
    return quantity;
  }

  /** Plain view for the state snapshot. */
  public Map<String, Object> describe() {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("symbol", symbol.venueSymbol());
    view.put("variant", variant.name());
    view.put("step_mode", stepMode.name());
    view.put("step_pct", stepPct == null ? null : stepPct.toPlainString());
    view.put("step_abs", stepAbs == null ? null : stepAbs.toPlainString());
    view.put("buy_levels", buyLevels);
    view.put("sell_levels", sellLevels);
    view.put("base_order_size", baseOrderSize.toPlainString());
    view.put("fee_rate", feeRate.toPlainString());
    view.put("fee_buffer", feeBuffer.toPlainString());
    view.put("min_notional", minNotional.toPlainString());
    view.put("tick_size", tickSize.toPlainString());
    view.put("quantity_step", quantityStep.toPlainString());
    view.put("run_mode", runMode.value());
    view.put("buy_sizing", sizing.buyMode().value());
    view.put("sell_sizing", sizing.sellMode().value());
    view.put(
        "target_quote_per_order",
        sizing.targetQuotePerOrder() == null ? null : sizing.targetQuotePerOrder().toPlainString());
    view.put(
        "min_base_order_qty",
        sizing.minBaseOrderQty() == null ? null : sizing.minBaseOrderQty().toPlainString());
    view.put("extend_buy_levels_on_restart", extendBuyLevelsOnRestart);
    return view;
  }

  private BigDecimal stepDelta(BigDecimal price, int levels) {
    BigDecimal multiplier = BigDecimal.valueOf(levels);
    if (stepMode == StepMode.PCT) {
      return price.multiply(stepPct).multiply(multiplier);
    }
    return stepAbs.multiply(multiplier);
  }

  private static boolean isPositive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }

  private static BigDecimal requireNonNegative(BigDecimal value, String field) {
    BigDecimal resolved = value == null ? BigDecimal.ZERO : value;
    if (resolved.signum() < 0) {
      throw new LadderConfigurationException(field + " must be >= 0");
    }
    return resolved;
  }
}
