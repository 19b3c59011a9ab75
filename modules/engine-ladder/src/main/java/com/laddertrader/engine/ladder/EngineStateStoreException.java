package com.laddertrader.engine.ladder;

public class EngineStateStoreException extends RuntimeException {
  public EngineStateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
