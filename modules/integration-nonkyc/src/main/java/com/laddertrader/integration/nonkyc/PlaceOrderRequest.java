package com.laddertrader.integration.nonkyc;

import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.Objects;

public record PlaceOrderRequest(
    String symbol, OrderSide side, BigDecimal price, BigDecimal quantity, String clientReferenceId) {
  public PlaceOrderRequest {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    Objects.requireNonNull(side, "side must not be null");
    if (price == null || price.signum() <= 0) {
      throw new IllegalArgumentException("price must be > 0");
    }
    if (quantity == null || quantity.signum() <= 0) {
      throw new IllegalArgumentException("quantity must be > 0");
    }
    if (clientReferenceId == null || clientReferenceId.isBlank()) {
      throw new IllegalArgumentException("clientReferenceId is required");
    }
  }
}
