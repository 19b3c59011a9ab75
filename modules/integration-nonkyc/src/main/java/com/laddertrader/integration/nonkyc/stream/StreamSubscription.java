package com.laddertrader.integration.nonkyc.stream;

import java.util.LinkedHashMap;
import java.util.Map;

/** A subscription frame, replayed after every (re)connect. */
public record StreamSubscription(String method, Map<String, Object> params) {
  public StreamSubscription {
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("method is required");
    }
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  public static StreamSubscription orderbook(String symbol, Integer limit) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("symbol", requireSymbol(symbol));
    if (limit != null) {
      params.put("limit", limit);
    }
    return new StreamSubscription("subscribeOrderbook", params);
  }

  public static StreamSubscription trades(String symbol) {
    return new StreamSubscription("subscribeTrades", Map.of("symbol", requireSymbol(symbol)));
  }

  public static StreamSubscription reports() {
    return new StreamSubscription("subscribeReports", Map.of());
  }

  public static StreamSubscription balances() {
    return new StreamSubscription("subscribeBalances", Map.of());
  }

  public Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("method", method);
    payload.put("params", params);
    return payload;
  }

  private static String requireSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    return symbol;
  }
}
