package com.laddertrader.integration.nonkyc;

public enum ApiErrorKind {
  AUTHENTICATION,
  RATE_LIMIT,
  TRANSIENT,
  VALIDATION;

  public boolean isRetryable() {
    return this == RATE_LIMIT || this == TRANSIENT;
  }
}
