package com.laddertrader.engine.ladder;

public enum StepMode {
  PCT,
  ABS
}
