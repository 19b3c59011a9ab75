package com.laddertrader.worker.ladder;

import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.engine.ladder.ReconcileReport;
import com.laddertrader.integration.nonkyc.AuthenticationException;
import com.laddertrader.integration.nonkyc.ExponentialBackoff;
import com.laddertrader.integration.nonkyc.NonkycApiException;
import com.laddertrader.worker.config.LadderWorkerProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation. Overlapping runs are skipped; after a failed pass the next one waits for
 * an exponential backoff instead of the fixed delay.
 */
@Component
public class LadderReconciliationPoller {
  private static final Logger log = LoggerFactory.getLogger(LadderReconciliationPoller.class);
  static final String POLL_TOTAL_METRIC = "worker.ladder.poll.total";
  private static final String POLL_ERROR_METRIC = "worker.ladder.errors.total";

  private final LadderEngine engine;
  private final MeterRegistry meterRegistry;
  private final ExponentialBackoff backoff;
  private final Clock clock;
  private final AtomicBoolean pollInProgress = new AtomicBoolean(false);
  private int consecutiveFailures;
  private Instant nextAttemptAt = Instant.MIN;

  @Autowired
  public LadderReconciliationPoller(
      LadderEngine engine, LadderWorkerProperties properties, MeterRegistry meterRegistry) {
    this(
        engine,
        ExponentialBackoff.withoutJitter(
            properties.getBackoff().getBase().toMillis(), properties.getBackoff().getMax().toMillis()),
        meterRegistry,
        Clock.systemUTC());
  }

  LadderReconciliationPoller(
      LadderEngine engine, ExponentialBackoff backoff, MeterRegistry meterRegistry, Clock clock) {
    this.engine = engine;
    this.backoff = backoff;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Scheduled(
      initialDelayString = "${ladder.poll-interval-ms:15000}",
      fixedDelayString = "${ladder.poll-interval-ms:15000}")
  public void runScheduled() {
    poll();
  }

  /** Returns the pass report, or null when the pass was skipped. */
  ReconcileReport poll() {
    if (!pollInProgress.compareAndSet(false, true)) {
      log.info("Skipping ladder reconcile because another pass is in progress");
      return null;
    }
    try {
      Instant now = clock.instant();
      if (now.isBefore(nextAttemptAt)) {
        incrementTotal("backoff");
        return null;
      }
      if (!engine.isRunning()) {
        incrementTotal("not_running");
        return null;
      }
      ReconcileReport report = engine.reconcileOnce();
      if (consecutiveFailures > 0) {
        log.info("Ladder reconcile recovered after failures={}", consecutiveFailures);
      }
      consecutiveFailures = 0;
      nextAttemptAt = Instant.MIN;
      incrementTotal(report.skipped() ? "not_running" : "success");
      return report;
    } catch (AuthenticationException ex) {
      incrementTotal("failure");
      incrementError(ex);
      log.error(
          "Ladder reconcile rejected by venue authentication, engine halted status={}",
          ex.httpStatus());
      return null;
    } catch (RuntimeException ex) {
      consecutiveFailures++;
      Duration delay = backoff.delayForAttempt(consecutiveFailures);
      nextAttemptAt = clock.instant().plus(delay);
      incrementTotal("failure");
      incrementError(ex);
      log.warn(
          "Ladder reconcile failed failures={} nextAttemptInMs={} error={}",
          consecutiveFailures,
          delay.toMillis(),
          errorCode(ex),
          ex);
      return null;
    } finally {
      pollInProgress.set(false);
    }
  }

  int consecutiveFailures() {
    return consecutiveFailures;
  }

  private void incrementTotal(String outcome) {
    meterRegistry.counter(POLL_TOTAL_METRIC, "outcome", outcome).increment();
  }

  private void incrementError(RuntimeException ex) {
    meterRegistry.counter(POLL_ERROR_METRIC, "error", errorCode(ex)).increment();
  }

  private static String errorCode(Throwable error) {
    if (error instanceof NonkycApiException ex && ex.httpStatus() > 0) {
      return "HTTP_" + ex.httpStatus();
    }
    String simpleName = error.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? "UnknownError" : simpleName;
  }
}
