package com.laddertrader.integration.nonkyc;

import java.util.Locale;

/** A 4xx other than 401 and 429: the request itself was refused. */
public class ValidationException extends NonkycApiException {
  private final String venueMessage;

  public ValidationException(String operation, int httpStatus, String responseBody, String venueMessage) {
    super(
        operation,
        httpStatus,
        responseBody,
        "NonKYC rejected request operation="
            + operation
            + " status="
            + httpStatus
            + " message="
            + venueMessage,
        null);
    this.venueMessage = venueMessage == null ? "" : venueMessage;
  }

  public String venueMessage() {
    return venueMessage;
  }

  public boolean isMinNotionalViolation() {
    String text = (venueMessage + " " + responseBody()).toLowerCase(Locale.ROOT);
    return text.contains("notional")
        || text.contains("minimum order value")
        || text.contains("min_notional")
        || (text.contains("minimum") && text.contains("value"));
  }

  public boolean isInsufficientFunds() {
    String text = (venueMessage + " " + responseBody()).toLowerCase(Locale.ROOT);
    return text.contains("insufficient") || text.contains("not enough balance");
  }

  @Override
  public ApiErrorKind kind() {
    return ApiErrorKind.VALIDATION;
  }
}
