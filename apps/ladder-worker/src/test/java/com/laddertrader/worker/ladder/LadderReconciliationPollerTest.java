package com.laddertrader.worker.ladder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.engine.ladder.ReconcileReport;
import com.laddertrader.integration.nonkyc.AuthenticationException;
import com.laddertrader.integration.nonkyc.ExponentialBackoff;
import com.laddertrader.integration.nonkyc.TransientApiException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LadderReconciliationPollerTest {
  private static final ReconcileReport REPORT = new ReconcileReport(4, 1, 0, 0, 0, 1, false);

  private final LadderEngine engine = mock(LadderEngine.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
  private final LadderReconciliationPoller poller =
      new LadderReconciliationPoller(
          engine, ExponentialBackoff.withoutJitter(1000L, 8000L), meterRegistry, clock);

  @Test
  void shouldReconcileWhenEngineIsRunning() {
    when(engine.isRunning()).thenReturn(true);
    when(engine.reconcileOnce()).thenReturn(REPORT);

    ReconcileReport report = poller.poll();

    assertNotNull(report);
    assertEquals(4, report.ordersChecked());
    assertEquals(1.0d, pollCount("success"));
  }

  @Test
  void shouldSkipWhenEngineIsStopped() {
    when(engine.isRunning()).thenReturn(false);

    assertNull(poller.poll());

    verify(engine, never()).reconcileOnce();
    assertEquals(1.0d, pollCount("not_running"));
  }

  @Test
  void shouldBackOffAfterTransientFailures() {
    when(engine.isRunning()).thenReturn(true);
    when(engine.reconcileOnce())
        .thenThrow(new TransientApiException("balances", 503, "unavailable"))
        .thenThrow(new TransientApiException("balances", 503, "unavailable"))
        .thenReturn(REPORT);

    assertNull(poller.poll());
    assertEquals(1, poller.consecutiveFailures());

    clock.advance(Duration.ofMillis(500));
    assertNull(poller.poll());
    assertEquals(1.0d, pollCount("backoff"));

    clock.advance(Duration.ofMillis(500));
    assertNull(poller.poll());
    assertEquals(2, poller.consecutiveFailures());

    clock.advance(Duration.ofMillis(1999));
    assertNull(poller.poll());
    assertEquals(2.0d, pollCount("backoff"));

    clock.advance(Duration.ofMillis(1));
    assertNotNull(poller.poll());
    assertEquals(0, poller.consecutiveFailures());
    verify(engine, times(3)).reconcileOnce();
    assertEquals(2.0d, pollCount("failure"));
  }

  @Test
  void shouldNotBackOffOnAuthenticationFailure() {
    when(engine.isRunning()).thenReturn(true, false);
    when(engine.reconcileOnce()).thenThrow(new AuthenticationException("balances", 401, "bad key"));

    assertNull(poller.poll());
    assertNull(poller.poll());

    assertEquals(0, poller.consecutiveFailures());
    assertEquals(1.0d, pollCount("failure"));
    assertEquals(1.0d, pollCount("not_running"));
    assertEquals(
        1.0d,
        meterRegistry.get("worker.ladder.errors.total").tag("error", "HTTP_401").counter().count());
  }

  private double pollCount(String outcome) {
    return meterRegistry
        .get(LadderReconciliationPoller.POLL_TOTAL_METRIC)
        .tag("outcome", outcome)
        .counter()
        .count();
  }

  private static final class MutableClock extends Clock {
    private Instant instant;

    private MutableClock(Instant instant) {
      this.instant = instant;
    }

    void advance(Duration duration) {
      instant = instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return instant;
    }
  }
}
