package com.laddertrader.integration.nonkyc;

import java.net.URI;
import java.time.Duration;

public record NonkycApiConfig(
    URI baseUri, ApiCredentials credentials, Duration timeout, boolean strictValidate) {
  public NonkycApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (!baseUri.isAbsolute()) {
      throw new IllegalArgumentException("baseUri must be absolute");
    }
    if (credentials == null) {
      throw new IllegalArgumentException("credentials are required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }

  public String resolve(String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + path;
  }
}
