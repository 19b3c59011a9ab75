package com.laddertrader.domain.orders;

import java.util.Locale;

public enum OrderSide {
  BUY("buy"),
  SELL("sell");

  private final String apiValue;

  OrderSide(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }

  public static OrderSide fromApiValue(String value) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException("side must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OrderSide side : values()) {
      if (side.apiValue.equals(normalized)) {
        return side;
      }
    }
    throw new OrderDomainException("Unknown order side: " + value);
  }
}
