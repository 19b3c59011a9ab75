package com.laddertrader.engine.ladder;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted engine state. {@code cumulativeSellRevenueGross} is gross sell proceeds only: it
 * ignores buy cost and fees. {@code realizedNetProfit} covers sells whose buy price was tracked.
 */
public record EngineSnapshot(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("variant") LadderVariant variant,
    @JsonProperty("is_running") boolean running,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("reference_price") BigDecimal referencePrice,
    @JsonProperty("lowest_buy_price") BigDecimal lowestBuyPrice,
    @JsonProperty("highest_sell_price") BigDecimal highestSellPrice,
    @JsonProperty("cumulative_sell_revenue_gross") BigDecimal cumulativeSellRevenueGross,
    @JsonProperty("realized_net_profit") BigDecimal realizedNetProfit,
    @JsonProperty("completed_round_trips") long completedRoundTrips,
    @JsonProperty("open_orders") List<OrderSnapshot> openOrders,
    @JsonProperty("unresolved_orders") List<OrderSnapshot> unresolvedOrders,
    @JsonProperty("configuration") Map<String, Object> configuration,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("saved_at") Instant savedAt) {
  public EngineSnapshot {
    openOrders = openOrders == null ? List.of() : List.copyOf(openOrders);
    unresolvedOrders = unresolvedOrders == null ? List.of() : List.copyOf(unresolvedOrders);
  }

  public boolean hasOpenOrders() {
    return !openOrders.isEmpty() || !unresolvedOrders.isEmpty();
  }
}
