package com.laddertrader.integration.nonkyc;

/** Timeouts, resets, refused connections and 5xx responses. */
public class TransientApiException extends NonkycApiException {
  public TransientApiException(String operation, int httpStatus, String responseBody) {
    super(
        operation,
        httpStatus,
        responseBody,
        "NonKYC transient error operation=" + operation + " status=" + httpStatus,
        null);
  }

  public TransientApiException(String operation, String message, Throwable cause) {
    super(
        operation,
        NO_RESPONSE,
        null,
        "NonKYC transient error operation=" + operation + " message=" + message,
        cause);
  }

  public boolean hasResponse() {
    return httpStatus() != NO_RESPONSE;
  }

  @Override
  public ApiErrorKind kind() {
    return ApiErrorKind.TRANSIENT;
  }
}
