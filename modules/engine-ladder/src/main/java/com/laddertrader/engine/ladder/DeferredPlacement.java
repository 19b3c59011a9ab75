package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.Objects;

/** A rung the venue refused or that could not be funded; retried on the next reconcile. */
record DeferredPlacement(
    OrderSide side,
    BigDecimal price,
    BigDecimal quantity,
    BigDecimal pairedPrice,
    BigDecimal costBasis,
    int attempts,
    String reason) {
  DeferredPlacement {
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(price, "price must not be null");
    Objects.requireNonNull(quantity, "quantity must not be null");
  }
}
