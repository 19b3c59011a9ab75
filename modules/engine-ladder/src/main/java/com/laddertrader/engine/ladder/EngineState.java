package com.laddertrader.engine.ladder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Mutable engine state. Only touched while holding the engine lock. */
final class EngineState {
  final Map<String, LadderOrder> openOrders = new LinkedHashMap<>();
  final Map<String, UnresolvedPlacement> unresolved = new LinkedHashMap<>();
  final List<DeferredPlacement> deferred = new ArrayList<>();
  BigDecimal referencePrice;
  BigDecimal lowestBuyPrice;
  BigDecimal highestSellPrice;
  BigDecimal cumulativeSellRevenue = BigDecimal.ZERO;
  BigDecimal realizedNetProfit = BigDecimal.ZERO;
  long completedRoundTrips;
  boolean running;
  String lastError;
  Instant startedAt;

  LadderOrder findByOrderId(String orderId) {
    if (orderId == null) {
      return null;
    }
    for (LadderOrder tracked : openOrders.values()) {
      if (orderId.equals(tracked.order().orderId())) {
        return tracked;
      }
    }
    return null;
  }
}
