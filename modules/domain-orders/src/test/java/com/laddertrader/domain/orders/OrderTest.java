package com.laddertrader.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class OrderTest {
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void shouldCreatePendingOrderAndAcknowledge() {
    Order order =
        Order.pending(
            "ladder-buy-1", "BTC_USDT", OrderSide.BUY, new BigDecimal("88200"), new BigDecimal("0.01"), NOW);

    assertNull(order.orderId());
    assertEquals(OrderStatus.PENDING, order.status());

    Order acknowledged = order.acknowledge("venue-1", NOW.plusSeconds(1));

    assertEquals("venue-1", acknowledged.orderId());
    assertEquals(OrderStatus.OPEN, acknowledged.status());
    assertEquals("ladder-buy-1", acknowledged.clientReferenceId());
    assertEquals(NOW.plusSeconds(1), acknowledged.updatedAt());
  }

  @Test
  void shouldSetFilledQuantityToFullQuantityOnFill() {
    Order order =
        Order.pending(
                "ladder-sell-1", "BTC_USDT", OrderSide.SELL, new BigDecimal("91800"), new BigDecimal("0.02"), NOW)
            .acknowledge("venue-2", NOW);

    Order partial = order.transitionTo(OrderStatus.PARTIALLY_FILLED, new BigDecimal("0.005"), NOW);
    Order filled = partial.transitionTo(OrderStatus.FILLED, null, NOW);

    assertEquals(new BigDecimal("0.005"), partial.filledQuantity());
    assertEquals(new BigDecimal("0.02"), filled.filledQuantity());
  }

  @Test
  void shouldRequireOrderIdOutsidePending() {
    assertThrows(
        OrderDomainException.class,
        () ->
            new Order(
                null,
                "ladder-buy-2",
                "BTC_USDT",
                OrderSide.BUY,
                BigDecimal.ONE,
                BigDecimal.ONE,
                BigDecimal.ZERO,
                OrderStatus.OPEN,
                NOW,
                NOW));
  }

  @Test
  void shouldRejectNonPositivePrice() {
    assertThrows(
        OrderDomainException.class,
        () -> Order.pending("ladder-buy-3", "BTC_USDT", OrderSide.BUY, BigDecimal.ZERO, BigDecimal.ONE, NOW));
  }
}
