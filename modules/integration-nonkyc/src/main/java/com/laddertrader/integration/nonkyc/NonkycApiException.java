package com.laddertrader.integration.nonkyc;

import java.util.Objects;

/** Base of the venue error taxonomy. {@code httpStatus} is -1 when no response was received. */
public abstract class NonkycApiException extends RuntimeException {
  public static final int NO_RESPONSE = -1;

  private final String operation;
  private final int httpStatus;
  private final String responseBody;

  protected NonkycApiException(
      String operation, int httpStatus, String responseBody, String message, Throwable cause) {
    super(message, cause);
    this.operation = Objects.requireNonNullElse(operation, "unknown");
    this.httpStatus = httpStatus;
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  public abstract ApiErrorKind kind();

  public String operation() {
    return operation;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public String responseBody() {
    return responseBody;
  }

  public String errorCode() {
    return httpStatus > 0 ? "HTTP_" + httpStatus : kind().name();
  }
}
