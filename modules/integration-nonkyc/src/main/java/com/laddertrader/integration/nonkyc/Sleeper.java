package com.laddertrader.integration.nonkyc;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
