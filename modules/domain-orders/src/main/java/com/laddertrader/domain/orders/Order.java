package com.laddertrader.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A limit order on the venue. {@code orderId} stays null until the venue acknowledges the
 * placement; {@code clientReferenceId} is assigned locally and survives retries.
 */
public record Order(
    String orderId,
    String clientReferenceId,
    String symbol,
    OrderSide side,
    BigDecimal price,
    BigDecimal quantity,
    BigDecimal filledQuantity,
    OrderStatus status,
    Instant createdAt,
    Instant updatedAt) {
  public Order {
    requireNonBlank(clientReferenceId, "clientReferenceId");
    requireNonBlank(symbol, "symbol");
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(price, "price");
    requirePositive(quantity, "quantity");
    Objects.requireNonNull(filledQuantity, "filledQuantity must not be null");
    if (filledQuantity.compareTo(BigDecimal.ZERO) < 0 || filledQuantity.compareTo(quantity) > 0) {
      throw new OrderDomainException("filledQuantity must be between 0 and quantity");
    }
    Objects.requireNonNull(status, "status must not be null");
    if (status != OrderStatus.PENDING && (orderId == null || orderId.isBlank())) {
      throw new OrderDomainException("orderId is required once the order leaves PENDING");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static Order pending(
      String clientReferenceId,
      String symbol,
      OrderSide side,
      BigDecimal price,
      BigDecimal quantity,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new Order(
        null,
        clientReferenceId,
        symbol,
        side,
        price,
        quantity,
        BigDecimal.ZERO,
        OrderStatus.PENDING,
        now,
        now);
  }

  public Order acknowledge(String venueOrderId, Instant now) {
    return transitionTo(OrderStatus.OPEN, venueOrderId, filledQuantity, now);
  }

  public Order transitionTo(OrderStatus toStatus, BigDecimal nextFilledQuantity, Instant now) {
    return transitionTo(toStatus, orderId, nextFilledQuantity, now);
  }

  public Order transitionTo(
      OrderStatus toStatus, String venueOrderId, BigDecimal nextFilledQuantity, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    OrderStateMachine.validateTransition(status, toStatus);
    BigDecimal safeFilled = nextFilledQuantity == null ? filledQuantity : nextFilledQuantity;
    if (toStatus == OrderStatus.FILLED) {
      safeFilled = quantity;
    }
    String safeOrderId = venueOrderId == null ? orderId : venueOrderId;
    return new Order(
        safeOrderId,
        clientReferenceId,
        symbol,
        side,
        price,
        quantity,
        safeFilled.min(quantity),
        toStatus,
        createdAt,
        now);
  }

  public BigDecimal notional() {
    return price.multiply(quantity);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
