package com.laddertrader.engine.ladder;

import java.util.Locale;

/** How a fresh rung's quantity is derived. */
public enum SizingMode {
  /** Always {@code baseOrderSize}. */
  FIXED("fixed"),
  /** A constant quote value per rung, so quantity shrinks as price rises. */
  QUOTE_TARGET("quote-target"),
  /** Quote target with a floor of {@code minBaseOrderQty}. */
  HYBRID("hybrid");

  private final String value;

  SizingMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Accepts {@code fixed}, {@code quote-target} (also {@code dynamic}) and {@code hybrid}. */
  public static SizingMode fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new LadderConfigurationException("sizing mode must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    if ("dynamic".equals(normalized)) {
      return QUOTE_TARGET;
    }
    for (SizingMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new LadderConfigurationException("Unsupported sizing mode: " + raw);
  }
}
