package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.Order;
import java.math.BigDecimal;
import java.util.Objects;

/** A tracked ladder order. {@code costBasis} is the buy price a sell was placed against, if known. */
record LadderOrder(Order order, BigDecimal costBasis) {
  LadderOrder {
    Objects.requireNonNull(order, "order must not be null");
  }

  LadderOrder withOrder(Order next) {
    return new LadderOrder(next, costBasis);
  }

  boolean isDryRun() {
    return order.orderId() != null && order.orderId().startsWith(LadderEngine.DRY_RUN_PREFIX);
  }
}
