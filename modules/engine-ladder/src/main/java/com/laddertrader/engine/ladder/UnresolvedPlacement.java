package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.Order;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * A placement whose request failed without a definite answer. The order may exist on the venue
 * under {@code order.clientReferenceId()}; {@code misses} counts open-order scans that did not find it.
 */
record UnresolvedPlacement(Order order, BigDecimal costBasis, BigDecimal pairedPrice, int misses) {
  UnresolvedPlacement {
    Objects.requireNonNull(order, "order must not be null");
  }

  UnresolvedPlacement missed() {
    return new UnresolvedPlacement(order, costBasis, pairedPrice, misses + 1);
  }
}
