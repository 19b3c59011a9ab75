package com.laddertrader.domain.orders;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OrderStateMachineTest {
  @Test
  void shouldAllowVenueConfirmedTransitions() {
    assertTrue(OrderStateMachine.canTransition(OrderStatus.PENDING, OrderStatus.OPEN));
    assertTrue(OrderStateMachine.canTransition(OrderStatus.PENDING, OrderStatus.REJECTED));
    assertTrue(OrderStateMachine.canTransition(OrderStatus.OPEN, OrderStatus.FILLED));
    assertTrue(OrderStateMachine.canTransition(OrderStatus.OPEN, OrderStatus.CANCELLED));
    assertTrue(
        OrderStateMachine.canTransition(OrderStatus.PARTIALLY_FILLED, OrderStatus.PARTIALLY_FILLED));
    assertTrue(OrderStateMachine.canTransition(OrderStatus.PARTIALLY_FILLED, OrderStatus.FILLED));
  }

  @Test
  void shouldRejectTransitionsOutOfTerminalStatuses() {
    assertFalse(OrderStateMachine.canTransition(OrderStatus.OPEN, OrderStatus.PENDING));
    assertFalse(OrderStateMachine.canTransition(OrderStatus.FILLED, OrderStatus.OPEN));
    assertFalse(OrderStateMachine.canTransition(OrderStatus.CANCELLED, OrderStatus.FILLED));
    assertFalse(OrderStateMachine.canTransition(OrderStatus.PARTIALLY_FILLED, OrderStatus.REJECTED));
    assertFalse(OrderStateMachine.canTransition(null, OrderStatus.OPEN));
  }

  @Test
  void shouldThrowForInvalidTransition() {
    assertThrows(
        OrderDomainException.class,
        () -> OrderStateMachine.validateTransition(OrderStatus.FILLED, OrderStatus.CANCELLED));
    assertDoesNotThrow(
        () -> OrderStateMachine.validateTransition(OrderStatus.PENDING, OrderStatus.OPEN));
  }

  @Test
  void shouldClassifyVenueReports() {
    assertEquals(
        OrderTransition.FILL, OrderStateMachine.classify(OrderStatus.PENDING, OrderStatus.FILLED));
    assertEquals(
        OrderTransition.WITHDRAWAL,
        OrderStateMachine.classify(OrderStatus.OPEN, OrderStatus.EXPIRED));
    assertEquals(
        OrderTransition.WITHDRAWAL,
        OrderStateMachine.classify(OrderStatus.PARTIALLY_FILLED, OrderStatus.CANCELLED));
    assertEquals(
        OrderTransition.UNCHANGED, OrderStateMachine.classify(OrderStatus.OPEN, OrderStatus.OPEN));
    assertEquals(
        OrderTransition.PROGRESS,
        OrderStateMachine.classify(OrderStatus.PARTIALLY_FILLED, OrderStatus.PARTIALLY_FILLED));
    assertEquals(
        OrderTransition.INVALID,
        OrderStateMachine.classify(OrderStatus.PARTIALLY_FILLED, OrderStatus.OPEN));
    assertEquals(
        OrderTransition.INVALID,
        OrderStateMachine.classify(OrderStatus.EXPIRED, OrderStatus.EXPIRED));
  }

  @Test
  void shouldSeparateWithdrawnStatusesFromFills() {
    assertTrue(OrderStatus.CANCELLED.isWithdrawn());
    assertTrue(OrderStatus.REJECTED.isWithdrawn());
    assertTrue(OrderStatus.EXPIRED.isWithdrawn());
    assertFalse(OrderStatus.FILLED.isWithdrawn());
    assertTrue(OrderStatus.FILLED.isTerminal());
    assertFalse(OrderStatus.PARTIALLY_FILLED.isTerminal());
  }
}
