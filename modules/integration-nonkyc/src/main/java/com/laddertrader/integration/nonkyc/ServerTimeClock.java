package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clock offset to the venue's server time. The offset is refreshed lazily once it is older than
 * {@code maxAge}; a failed refresh keeps the previous offset.
 */
public class ServerTimeClock extends Clock {
  private static final Logger log = LoggerFactory.getLogger(ServerTimeClock.class);
  private static final List<String> TIME_FIELDS = List.of("serverTime", "server_time", "time", "timestamp");
  private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI serverTimeUri;
  private final Duration maxAge;
  private final Duration timeout;
  private final Clock localClock;
  private volatile long offsetMillis;
  private volatile long lastSyncAttemptMillis = Long.MIN_VALUE;

  public ServerTimeClock(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      URI serverTimeUri,
      Duration maxAge,
      Duration timeout,
      Clock localClock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.serverTimeUri = Objects.requireNonNull(serverTimeUri, "serverTimeUri is required");
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge is required");
    this.timeout = Objects.requireNonNull(timeout, "timeout is required");
    this.localClock = Objects.requireNonNull(localClock, "localClock is required");
  }

  @Override
  public long millis() {
    long now = localClock.millis();
    if (lastSyncAttemptMillis == Long.MIN_VALUE || now - lastSyncAttemptMillis >= maxAge.toMillis()) {
      syncIfStale(now);
    }
    return localClock.millis() + offsetMillis;
  }

  @Override
  public Instant instant() {
    return Instant.ofEpochMilli(millis());
  }

  @Override
  public ZoneId getZone() {
    return localClock.getZone();
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return new ServerTimeClock(
        httpClient, objectMapper, serverTimeUri, maxAge, timeout, localClock.withZone(zone));
  }

  public long offsetMillis() {
    return offsetMillis;
  }

  /** Fetches server time now; returns false and keeps the previous offset on failure. */
  public synchronized boolean sync() {
    lastSyncAttemptMillis = localClock.millis();
    try {
      HttpRequest request =
          HttpRequest.newBuilder(serverTimeUri)
              .timeout(timeout)
              .header("Accept", NonkycHeaders.JSON)
              .GET()
              .build();
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        log.warn("Server time sync failed status={} uri={}", response.statusCode(), serverTimeUri);
        return false;
      }
      long serverMillis = extractServerMillis(objectMapper.readTree(response.body()));
      offsetMillis = serverMillis - localClock.millis();
      log.info("Server time synchronized offsetMs={}", offsetMillis);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Server time sync interrupted, keeping offsetMs={}", offsetMillis);
      return false;
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Server time sync failed, keeping offsetMs={} error={}", offsetMillis, ex.toString());
      return false;
    }
  }

  private synchronized void syncIfStale(long observedAt) {
    if (lastSyncAttemptMillis != Long.MIN_VALUE
        && observedAt - lastSyncAttemptMillis < maxAge.toMillis()) {
      return;
    }
    sync();
  }

  static long extractServerMillis(JsonNode payload) {
    if (payload == null || payload.isNull()) {
      throw new IllegalArgumentException("Unsupported server time payload");
    }
    if (payload.isObject()) {
      for (String field : TIME_FIELDS) {
        if (payload.has(field)) {
          return normalize(payload.get(field));
        }
      }
      for (String wrapper : List.of("data", "result")) {
        if (payload.has(wrapper)) {
          return extractServerMillis(payload.get(wrapper));
        }
      }
      throw new IllegalArgumentException("Unsupported server time payload");
    }
    return normalize(payload);
  }

  private static long normalize(JsonNode value) {
    try {
      BigDecimal numeric = new BigDecimal(value.asText().trim());
      if (numeric.compareTo(BigDecimal.valueOf(MILLIS_THRESHOLD)) < 0) {
        numeric = numeric.movePointRight(3);
      }
      return numeric.longValue();
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Unsupported server time value: " + value, ex);
    }
  }
}
