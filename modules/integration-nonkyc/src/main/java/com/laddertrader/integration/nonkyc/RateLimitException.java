package com.laddertrader.integration.nonkyc;

import java.time.Duration;
import java.util.Optional;

public class RateLimitException extends NonkycApiException {
  private final String retryAfterHeader;
  private final Duration retryAfter;

  public RateLimitException(
      String operation, String responseBody, String retryAfterHeader, Duration retryAfter) {
    super(
        operation,
        429,
        responseBody,
        "NonKYC rate limit hit operation=" + operation + " retryAfter=" + retryAfterHeader,
        null);
    this.retryAfterHeader = retryAfterHeader;
    this.retryAfter = retryAfter;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(retryAfterHeader);
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }

  @Override
  public ApiErrorKind kind() {
    return ApiErrorKind.RATE_LIMIT;
  }
}
