package com.laddertrader.engine.ladder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.laddertrader.domain.orders.Order;
import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.orders.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;

public record OrderSnapshot(
    @JsonProperty("order_id") String orderId,
    @JsonProperty("client_reference_id") String clientReferenceId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("side") OrderSide side,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("quantity") BigDecimal quantity,
    @JsonProperty("filled_quantity") BigDecimal filledQuantity,
    @JsonProperty("status") OrderStatus status,
    @JsonProperty("cost_basis") BigDecimal costBasis,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  static OrderSnapshot of(Order order, BigDecimal costBasis) {
    return new OrderSnapshot(
        order.orderId(),
        order.clientReferenceId(),
        order.symbol(),
        order.side(),
        order.price(),
        order.quantity(),
        order.filledQuantity(),
        order.status(),
        costBasis,
        order.createdAt(),
        order.updatedAt());
  }

  Order toOrder() {
    return new Order(
        orderId,
        clientReferenceId,
        symbol,
        side,
        price,
        quantity,
        filledQuantity == null ? BigDecimal.ZERO : filledQuantity,
        status,
        createdAt,
        updatedAt);
  }
}
