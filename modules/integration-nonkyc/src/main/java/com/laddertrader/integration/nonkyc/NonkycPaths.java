package com.laddertrader.integration.nonkyc;

import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Endpoint paths and request bodies, relative to the configured {@code /api/v2} base. */
final class NonkycPaths {
  static final String BALANCES = "/balances";
  static final String CREATE_ORDER = "/createorder";
  static final String CANCEL_ORDER = "/cancelorder";
  static final String CANCEL_ALL = "/cancelallorders";
  static final String GET_ORDER = "/getorder/";
  static final String GET_ORDERS = "/getorders";
  static final String TICKER = "/ticker/";

  private NonkycPaths() {}

  static NonkycRequest balances() {
    return NonkycRequest.get("fetch_balances", BALANCES, null);
  }

  static NonkycRequest placeOrder(PlaceOrderRequest order, boolean strictValidate) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("symbol", order.symbol());
    body.put("side", order.side().apiValue());
    body.put("type", "limit");
    body.put("quantity", plain(order.quantity()));
    body.put("price", plain(order.price()));
    body.put("userProvidedId", order.clientReferenceId());
    body.put("strictValidate", strictValidate);
    return NonkycRequest.post("place_order", CREATE_ORDER, body);
  }

  static NonkycRequest cancelOrder(String orderId) {
    return NonkycRequest.post("cancel_order", CANCEL_ORDER, Map.of("id", orderId));
  }

  static NonkycRequest cancelByClientReference(String clientReferenceId) {
    return NonkycRequest.post("cancel_order", CANCEL_ORDER, Map.of("userProvidedId", clientReferenceId));
  }

  static NonkycRequest fetchOrder(String orderId) {
    return NonkycRequest.get("fetch_order", GET_ORDER + encode(orderId), null);
  }

  static NonkycRequest ticker(String symbol) {
    return NonkycRequest.get("fetch_ticker", TICKER + encode(symbol), null).unsigned();
  }

  static NonkycRequest openOrders(String symbol) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("symbol", symbol);
    query.put("status", "active");
    return NonkycRequest.get("fetch_open_orders", GET_ORDERS, query);
  }

  static NonkycRequest cancelAll(String symbol, OrderSide side) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("symbol", symbol);
    if (side != null) {
      body.put("side", side.apiValue());
    }
    return NonkycRequest.post("cancel_all_orders", CANCEL_ALL, body);
  }

  static String plain(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }

  private static String encode(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("path parameter is required");
    }
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
