package com.laddertrader.integration.nonkyc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * One venue call. The correlation id travels with the request and is logged on every attempt.
 */
public record NonkycRequest(
    String operation,
    String method,
    String path,
    Map<String, String> query,
    Map<String, Object> body,
    boolean signed,
    String correlationId) {
  public NonkycRequest {
    if (operation == null || operation.isBlank()) {
      throw new IllegalArgumentException("operation is required");
    }
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("method is required");
    }
    method = method.trim().toUpperCase(Locale.ROOT);
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/'");
    }
    query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = newCorrelationId(operation);
    }
  }

  public static NonkycRequest get(String operation, String path, Map<String, String> query) {
    return new NonkycRequest(operation, "GET", path, query, null, true, null);
  }

  public static NonkycRequest post(String operation, String path, Map<String, Object> body) {
    return new NonkycRequest(operation, "POST", path, null, body, true, null);
  }

  public NonkycRequest unsigned() {
    return new NonkycRequest(operation, method, path, query, body, false, correlationId);
  }

  private static String newCorrelationId(String operation) {
    return operation + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
