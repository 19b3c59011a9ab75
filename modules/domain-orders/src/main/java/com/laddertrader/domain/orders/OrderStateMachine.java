package com.laddertrader.domain.orders;

/**
 * Status rules for venue-reported orders. The venue may skip intermediate statuses (a resting
 * order can be reported straight as FILLED), so transitions are judged by direction rather than
 * by adjacency.
 */
public final class OrderStateMachine {
  private OrderStateMachine() {}

  public static OrderTransition classify(OrderStatus from, OrderStatus to) {
    if (from == null || to == null || from.isTerminal()) {
      return OrderTransition.INVALID;
    }
    if (from == to) {
      return from == OrderStatus.PARTIALLY_FILLED ? OrderTransition.PROGRESS : OrderTransition.UNCHANGED;
    }
    switch (to) {
      case PENDING:
        return OrderTransition.INVALID;
      case OPEN:
        return from == OrderStatus.PENDING ? OrderTransition.PROGRESS : OrderTransition.INVALID;
      case PARTIALLY_FILLED:
        return OrderTransition.PROGRESS;
      case FILLED:
        return OrderTransition.FILL;
      case REJECTED:
        // a partially executed order was accepted by the venue
        return from == OrderStatus.PARTIALLY_FILLED
            ? OrderTransition.INVALID
            : OrderTransition.WITHDRAWAL;
      default:
        return OrderTransition.WITHDRAWAL;
    }
  }

  public static boolean canTransition(OrderStatus from, OrderStatus to) {
    return classify(from, to).isApplicable();
  }

  public static void validateTransition(OrderStatus from, OrderStatus to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException(
          "Invalid order status transition from " + from + " to " + to);
    }
  }
}
