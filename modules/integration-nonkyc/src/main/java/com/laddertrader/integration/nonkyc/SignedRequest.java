package com.laddertrader.integration.nonkyc;

import java.util.Map;

public record SignedRequest(
    String method, String url, long nonce, String signature, String signedMessage, String body) {

  public Map<String, String> headers(ApiCredentials credentials) {
    return Map.of(
        NonkycHeaders.API_KEY, credentials.apiKey(),
        NonkycHeaders.API_NONCE, Long.toString(nonce),
        NonkycHeaders.API_SIGN, signature);
  }

  @Override
  public String toString() {
    return "SignedRequest[method=" + method + ", url=" + url + ", nonce=" + nonce + "]";
  }
}
