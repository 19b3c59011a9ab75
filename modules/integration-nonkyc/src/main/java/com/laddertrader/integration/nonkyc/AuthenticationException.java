package com.laddertrader.integration.nonkyc;

/** 401 from the venue. Credentials or signing are broken; never retried. */
public class AuthenticationException extends NonkycApiException {
  public AuthenticationException(String operation, int httpStatus, String responseBody) {
    super(
        operation,
        httpStatus,
        responseBody,
        "NonKYC authentication failed operation="
            + operation
            + " status="
            + httpStatus
            + "; check API key, secret, nonce multiplier and that the absolute URL is signed",
        null);
  }

  @Override
  public ApiErrorKind kind() {
    return ApiErrorKind.AUTHENTICATION;
  }
}
