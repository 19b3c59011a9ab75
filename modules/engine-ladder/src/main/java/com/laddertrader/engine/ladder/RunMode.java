package com.laddertrader.engine.ladder;

import java.util.Locale;

public enum RunMode {
  LIVE("live"),
  DRY_RUN("dry-run"),
  MONITOR("monitor");

  private final String value;

  RunMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Accepts {@code live}, {@code dry-run}/{@code dry_run} and {@code monitor}. */
  public static RunMode fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new LadderConfigurationException("run mode must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (RunMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new LadderConfigurationException("Unsupported run mode: " + raw);
  }
}
