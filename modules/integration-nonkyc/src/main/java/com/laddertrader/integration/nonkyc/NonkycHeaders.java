package com.laddertrader.integration.nonkyc;

final class NonkycHeaders {
  static final String API_KEY = "X-API-KEY";
  static final String API_NONCE = "X-API-NONCE";
  static final String API_SIGN = "X-API-SIGN";
  static final String RETRY_AFTER = "Retry-After";
  static final String CONTENT_TYPE = "Content-Type";
  static final String JSON = "application/json";

  private NonkycHeaders() {}
}
