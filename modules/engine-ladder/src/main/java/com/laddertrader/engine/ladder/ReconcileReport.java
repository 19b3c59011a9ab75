package com.laddertrader.engine.ladder;

/** Counts from one reconciliation pass. */
public record ReconcileReport(
    int ordersChecked,
    int statusChanges,
    int resolvedPlacements,
    int deferredRetried,
    int levelsRefilled,
    int placements,
    boolean skipped) {

  static ReconcileReport notRunning() {
    return new ReconcileReport(0, 0, 0, 0, 0, 0, true);
  }
}
