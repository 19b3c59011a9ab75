package com.laddertrader.integration.nonkyc;

/** Key and secret held in memory only. */
public record ApiCredentials(String apiKey, String apiSecret) {
  public ApiCredentials {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required");
    }
    if (apiSecret == null || apiSecret.isBlank()) {
      throw new IllegalArgumentException("apiSecret is required");
    }
  }

  public String maskedKey() {
    if (apiKey.length() <= 4) {
      return "****";
    }
    return "****" + apiKey.substring(apiKey.length() - 4);
  }

  @Override
  public String toString() {
    return "ApiCredentials[apiKey=" + maskedKey() + ", apiSecret=****]";
  }
}
