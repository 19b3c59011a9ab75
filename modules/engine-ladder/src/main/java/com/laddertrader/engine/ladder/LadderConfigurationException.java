package com.laddertrader.engine.ladder;

public class LadderConfigurationException extends RuntimeException {
  public LadderConfigurationException(String message) {
    super(message);
  }
}
