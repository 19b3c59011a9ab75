package com.laddertrader.integration.nonkyc.stream;

import java.net.URI;
import java.time.Duration;

public record NonkycStreamConfig(
    URI wsUri,
    Duration connectTimeout,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    int circuitBreakerThreshold) {
  public NonkycStreamConfig {
    if (wsUri == null) {
      throw new IllegalArgumentException("wsUri is required");
    }
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
    if (reconnectBaseBackoff == null
        || reconnectBaseBackoff.isNegative()
        || reconnectBaseBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectBaseBackoff must be > 0");
    }
    if (reconnectMaxBackoff == null || reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
    if (circuitBreakerThreshold <= 0) {
      throw new IllegalArgumentException("circuitBreakerThreshold must be > 0");
    }
  }

  public ReconnectBackoff newBackoff() {
    return new ReconnectBackoff(reconnectBaseBackoff, reconnectMaxBackoff, circuitBreakerThreshold);
  }
}
