package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Per-side sizing for rungs that are not counter-orders. Counter-orders always reuse the filled
 * quantity.
 *
 * @param targetQuotePerOrder quote value per rung; when {@code null} it is {@code baseOrderSize}
 *     times the entry price
 * @param minBaseOrderQty floor for {@link SizingMode#HYBRID}, required by that mode
 */
public record OrderSizing(
    SizingMode buyMode, SizingMode sellMode, BigDecimal targetQuotePerOrder, BigDecimal minBaseOrderQty) {
  public OrderSizing {
    Objects.requireNonNull(buyMode, "buyMode must not be null");
    Objects.requireNonNull(sellMode, "sellMode must not be null");
    if (targetQuotePerOrder != null && targetQuotePerOrder.signum() <= 0) {
      throw new LadderConfigurationException("targetQuotePerOrder must be > 0");
    }
    if (minBaseOrderQty != null && minBaseOrderQty.signum() <= 0) {
      throw new LadderConfigurationException("minBaseOrderQty must be > 0");
    }
    if ((buyMode == SizingMode.HYBRID || sellMode == SizingMode.HYBRID) && minBaseOrderQty == null) {
      throw new LadderConfigurationException("minBaseOrderQty is required for hybrid sizing");
    }
  }

  public static OrderSizing fixed() {
    return new OrderSizing(SizingMode.FIXED, SizingMode.FIXED, null, null);
  }

  public SizingMode mode(OrderSide side) {
    return side == OrderSide.BUY ? buyMode : sellMode;
  }
}
