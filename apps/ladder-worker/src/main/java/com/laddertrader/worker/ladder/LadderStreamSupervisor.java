package com.laddertrader.worker.ladder;

import com.fasterxml.jackson.databind.JsonNode;
import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.engine.ladder.PlacementResult;
import com.laddertrader.integration.nonkyc.VenueOrder;
import com.laddertrader.integration.nonkyc.stream.NonkycStreamClient;
import com.laddertrader.integration.nonkyc.stream.NonkycStreamReports;
import com.laddertrader.integration.nonkyc.stream.StreamEventHandler;
import com.laddertrader.integration.nonkyc.stream.StreamSubscription;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Feeds pushed order reports into the engine; polling stays on as the fallback. */
@Component
@ConditionalOnProperty(prefix = "ladder", name = "stream-enabled", havingValue = "true")
public class LadderStreamSupervisor implements StreamEventHandler {
  private static final Logger log = LoggerFactory.getLogger(LadderStreamSupervisor.class);
  static final String REPORTS_METRIC = "worker.ladder.stream.reports.total";

  private final NonkycStreamClient streamClient;
  private final LadderEngine engine;
  private final MeterRegistry meterRegistry;

  public LadderStreamSupervisor(
      NonkycStreamClient streamClient, LadderEngine engine, MeterRegistry meterRegistry) {
    this.streamClient = streamClient;
    this.engine = engine;
    this.meterRegistry = meterRegistry;
  }

  @EventListener(ApplicationReadyEvent.class)
  @Order(10)
  public void start() {
    if (!engine.isRunning()) {
      log.warn("Ladder engine is not running, stream not started");
      return;
    }
    streamClient.registerHandler(NonkycStreamReports.REPORT, this::onReport);
    streamClient.subscribe(StreamSubscription.reports());
    streamClient.start(this);
  }

  @PreDestroy
  public void stop() {
    streamClient.stop();
  }

  void onReport(JsonNode message) {
    VenueOrder report;
    try {
      report = NonkycStreamReports.orderReport(message);
    } catch (IllegalArgumentException ex) {
      meterRegistry.counter(REPORTS_METRIC, "outcome", "malformed").increment();
      log.warn("Ignoring malformed report frame error={}", ex.getMessage());
      return;
    }
    List<PlacementResult> results = engine.applyOrderUpdate(report);
    meterRegistry.counter(REPORTS_METRIC, "outcome", "applied").increment();
    if (!results.isEmpty()) {
      log.info(
          "Stream report triggered placements orderId={} status={} placements={}",
          report.orderId(),
          report.status().map(Enum::name).orElse("UNKNOWN"),
          results.size());
    }
  }

  @Override
  public void onConnected() {
    log.info("Ladder stream connected");
  }

  @Override
  public void onDisconnected(int statusCode, String reason) {
    log.warn("Ladder stream disconnected statusCode={} reason={}", statusCode, reason);
  }

  @Override
  public void onReconnectScheduled(long reconnectAttempts, Duration delay) {
    log.info(
        "Ladder stream reconnect scheduled attempts={} delayMs={}",
        reconnectAttempts,
        delay.toMillis());
  }

  @Override
  public void onError(String errorCode, String errorMessage, Throwable error) {
    log.warn("Ladder stream error code={} message={}", errorCode, errorMessage, error);
  }

  @Override
  public void onFatal(String errorCode, String errorMessage) {
    engine.halt("Stream circuit breaker open: " + errorCode + " " + errorMessage);
  }
}
