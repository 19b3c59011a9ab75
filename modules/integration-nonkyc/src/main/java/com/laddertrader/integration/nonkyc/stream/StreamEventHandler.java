package com.laddertrader.integration.nonkyc.stream;

import java.time.Duration;

public interface StreamEventHandler {
  default void onConnected() {}

  default void onDisconnected(int statusCode, String reason) {}

  default void onReconnectScheduled(long reconnectAttempts, Duration delay) {}

  default void onError(String errorCode, String errorMessage, Throwable error) {}

  /** Called once when the circuit breaker opens; no further reconnects follow. */
  default void onFatal(String errorCode, String errorMessage) {}

  static StreamEventHandler noop() {
    return new StreamEventHandler() {};
  }
}
