package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.Order;
import com.laddertrader.integration.nonkyc.ApiErrorKind;
import java.util.Objects;

/**
 * Outcome of one placement attempt. A rejected or skipped rung is an ordinary result, not an
 * exception; {@code order} is present only when {@code outcome} is {@link Outcome#PLACED}.
 */
public record PlacementResult(Outcome outcome, Order order, String reason, ApiErrorKind failureKind) {
  public enum Outcome {
    PLACED("placed"),
    SKIPPED("skipped"),
    FAILED("failed");

    private final String metricTag;

    Outcome(String metricTag) {
      this.metricTag = metricTag;
    }

    public String metricTag() {
      return metricTag;
    }
  }

  public PlacementResult {
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (outcome == Outcome.PLACED && order == null) {
      throw new IllegalArgumentException("order is required for a placed result");
    }
    if (outcome != Outcome.PLACED && (reason == null || reason.isBlank())) {
      throw new IllegalArgumentException("reason is required");
    }
    if (outcome == Outcome.FAILED && failureKind == null) {
      throw new IllegalArgumentException("failureKind is required for a failed result");
    }
  }

  public static PlacementResult placed(Order order) {
    return new PlacementResult(Outcome.PLACED, order, null, null);
  }

  public static PlacementResult skipped(String reason) {
    return new PlacementResult(Outcome.SKIPPED, null, reason, null);
  }

  public static PlacementResult failed(ApiErrorKind kind, String reason) {
    return new PlacementResult(Outcome.FAILED, null, reason, kind);
  }

  public boolean isPlaced() {
    return outcome == Outcome.PLACED;
  }
}
