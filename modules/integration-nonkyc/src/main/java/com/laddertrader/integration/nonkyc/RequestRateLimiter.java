package com.laddertrader.integration.nonkyc;

public interface RequestRateLimiter {

  /** Blocks until a request may be sent. */
  void acquire();

  boolean tryAcquire();

  static RequestRateLimiter noop() {
    return new RequestRateLimiter() {
      @Override
      public void acquire() {}

      @Override
      public boolean tryAcquire() {
        return true;
      }
    };
  }
}
