package com.laddertrader.domain.orders;

public enum OrderStatus {
  PENDING,
  OPEN,
  PARTIALLY_FILLED,
  FILLED,
  CANCELLED,
  REJECTED,
  EXPIRED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
  }

  /** Terminal without a venue-side trade. */
  public boolean isWithdrawn() {
    return this == CANCELLED || this == REJECTED || this == EXPIRED;
  }
}
