package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.databind.JsonNode;
import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Maps venue JSON payloads (already unwrapped from {@code data}/{@code result}) to records. */
public final class NonkycResponseParser {
  private NonkycResponseParser() {}

  public static JsonNode unwrap(JsonNode root) {
    if (root != null && root.isObject()) {
      if (root.has("data") && !root.get("data").isNull()) {
        return root.get("data");
      }
      if (root.has("result") && !root.get("result").isNull()) {
        return root.get("result");
      }
    }
    return root;
  }

  public static List<VenueBalance> balances(JsonNode payload) {
    List<VenueBalance> balances = new ArrayList<>();
    if (payload == null) {
      return balances;
    }
    if (payload.isArray()) {
      for (JsonNode item : payload) {
        String asset = item.path("asset").asText("");
        if (asset.isBlank()) {
          continue;
        }
        balances.add(
            new VenueBalance(asset, decimal(item, "available"), decimal(item, "held")));
      }
      return balances;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      JsonNode item = entry.getValue();
      if (item.isObject()) {
        balances.add(
            new VenueBalance(entry.getKey(), decimal(item, "available"), decimal(item, "held")));
      }
    }
    return balances;
  }

  public static VenueOrder order(JsonNode payload, PlaceOrderRequest fallback) {
    String rawStatus = text(payload, "status");
    String sideText = text(payload, "side");
    OrderSide side =
        sideText == null ? (fallback == null ? null : fallback.side()) : OrderSide.fromApiValue(sideText);
    BigDecimal quantity = decimalOrNull(payload, "quantity");
    BigDecimal executed = decimalOrNull(payload, "executedQuantity");
    if (executed == null) {
      executed = decimalOrNull(payload, "filled");
    }
    if (executed == null && quantity != null) {
      BigDecimal remaining = decimalOrNull(payload, "remaining");
      executed = remaining == null ? null : quantity.subtract(remaining);
    }
    return new VenueOrder(
        firstText(payload, "id", "orderId"),
        firstText(payload, "userProvidedId", "clientOrderId"),
        firstNonNull(text(payload, "symbol"), fallback == null ? null : fallback.symbol()),
        side,
        NonkycOrderStatusMapper.map(rawStatus),
        rawStatus == null ? "" : rawStatus,
        firstNonNull(decimalOrNull(payload, "price"), fallback == null ? null : fallback.price()),
        firstNonNull(quantity, fallback == null ? null : fallback.quantity()),
        executed == null ? BigDecimal.ZERO : executed);
  }

  public static List<VenueOrder> orders(JsonNode payload) {
    List<VenueOrder> orders = new ArrayList<>();
    if (payload != null && payload.isArray()) {
      for (JsonNode item : payload) {
        orders.add(order(item, null));
      }
    }
    return orders;
  }

  public static Ticker ticker(JsonNode payload, String symbol) {
    BigDecimal last = null;
    for (String field : List.of("lastPrice", "last_price", "last", "price")) {
      last = decimalOrNull(payload, field);
      if (last != null) {
        break;
      }
    }
    return new Ticker(
        firstNonNull(text(payload, "symbol"), symbol),
        decimalOrNull(payload, "bid"),
        decimalOrNull(payload, "ask"),
        last);
  }

  public static CancelResult cancel(JsonNode payload, String target) {
    String status = text(payload, "status");
    boolean success =
        payload != null
            && (payload.path("success").asBoolean(false)
                || payload.path("ok").asBoolean(false)
                || "Cancelled".equalsIgnoreCase(status)
                || "Canceled".equalsIgnoreCase(status));
    String resolvedTarget = firstText(payload, "id", "orderId", "userProvidedId");
    return new CancelResult(resolvedTarget == null ? target : resolvedTarget, success, status);
  }

  static String errorMessage(JsonNode root) {
    if (root == null) {
      return null;
    }
    for (String field : List.of("error", "message", "msg", "detail")) {
      JsonNode value = root.get(field);
      if (value == null || value.isNull()) {
        continue;
      }
      if (value.isObject() && value.hasNonNull("message")) {
        return value.get("message").asText();
      }
      if (value.isValueNode()) {
        return value.asText();
      }
    }
    return null;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      String value = text(node, field);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    if (node == null || !node.hasNonNull(field)) {
      return null;
    }
    String value = node.get(field).asText();
    return value.isBlank() ? null : value;
  }

  private static BigDecimal decimal(JsonNode node, String field) {
    BigDecimal value = decimalOrNull(node, field);
    return value == null ? BigDecimal.ZERO : value;
  }

  private static BigDecimal decimalOrNull(JsonNode node, String field) {
    String value = text(node, field);
    if (value == null) {
      return null;
    }
    try {
      return new BigDecimal(value);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static <T> T firstNonNull(T first, T second) {
    return first != null ? first : second;
  }
}
