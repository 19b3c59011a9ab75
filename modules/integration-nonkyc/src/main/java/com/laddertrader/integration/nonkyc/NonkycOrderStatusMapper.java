package com.laddertrader.integration.nonkyc;

import com.laddertrader.domain.orders.OrderStatus;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class NonkycOrderStatusMapper {
  private static final Map<String, OrderStatus> STATUSES =
      Map.ofEntries(
          Map.entry("new", OrderStatus.OPEN),
          Map.entry("active", OrderStatus.OPEN),
          Map.entry("open", OrderStatus.OPEN),
          Map.entry("pending", OrderStatus.OPEN),
          Map.entry("partly filled", OrderStatus.PARTIALLY_FILLED),
          Map.entry("partially filled", OrderStatus.PARTIALLY_FILLED),
          Map.entry("partiallyfilled", OrderStatus.PARTIALLY_FILLED),
          Map.entry("filled", OrderStatus.FILLED),
          Map.entry("closed", OrderStatus.FILLED),
          Map.entry("done", OrderStatus.FILLED),
          Map.entry("cancelled", OrderStatus.CANCELLED),
          Map.entry("canceled", OrderStatus.CANCELLED),
          Map.entry("rejected", OrderStatus.REJECTED),
          Map.entry("expired", OrderStatus.EXPIRED));

  private NonkycOrderStatusMapper() {}

  public static Optional<OrderStatus> map(String rawStatus) {
    if (rawStatus == null || rawStatus.isBlank()) {
      return Optional.empty();
    }
    String normalized = rawStatus.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
    return Optional.ofNullable(STATUSES.get(normalized));
  }
}
