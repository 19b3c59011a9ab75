package com.laddertrader.integration.nonkyc;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.nonkyc")
public class NonkycConnectorProperties {
  private String baseUrl = "https://api.nonkyc.io/api/v2";
  private String apiKey = "";
  private String apiSecret = "";
  private String apiKeyFile = "";
  private String apiSecretFile = "";
  private Duration timeout = Duration.ofSeconds(10);
  private BigDecimal nonceMultiplier = BigDecimal.ONE;
  private boolean strictValidate = true;
  private SignatureScope signatureScope = SignatureScope.ABSOLUTE_URL;
  private ServerTime serverTime = new ServerTime();
  private Retry retry = new Retry();
  private RateLimit rateLimit = new RateLimit();
  private Stream stream = new Stream();

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getApiSecret() {
    return apiSecret;
  }

  public void setApiSecret(String apiSecret) {
    this.apiSecret = apiSecret;
  }

  public String getApiKeyFile() {
    return apiKeyFile;
  }

  public void setApiKeyFile(String apiKeyFile) {
    this.apiKeyFile = apiKeyFile;
  }

  public String getApiSecretFile() {
    return apiSecretFile;
  }

  public void setApiSecretFile(String apiSecretFile) {
    this.apiSecretFile = apiSecretFile;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public BigDecimal getNonceMultiplier() {
    return nonceMultiplier;
  }

  public void setNonceMultiplier(BigDecimal nonceMultiplier) {
    this.nonceMultiplier = nonceMultiplier;
  }

  public boolean isStrictValidate() {
    return strictValidate;
  }

  public void setStrictValidate(boolean strictValidate) {
    this.strictValidate = strictValidate;
  }

  public SignatureScope getSignatureScope() {
    return signatureScope;
  }

  public void setSignatureScope(SignatureScope signatureScope) {
    this.signatureScope = signatureScope;
  }

  public ServerTime getServerTime() {
    return serverTime;
  }

  public void setServerTime(ServerTime serverTime) {
    this.serverTime = serverTime;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(RateLimit rateLimit) {
    this.rateLimit = rateLimit;
  }

  public Stream getStream() {
    return stream;
  }

  public void setStream(Stream stream) {
    this.stream = stream;
  }

  public static class ServerTime {
    private boolean enabled = false;
    private String url = "https://nonkyc.io/api/v2/getservertime";
    private Duration maxAge = Duration.ofSeconds(60);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public Duration getMaxAge() {
      return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private Duration baseBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(8);
    private boolean jitterEnabled = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseBackoff() {
      return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
      this.baseBackoff = baseBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }

  public static class RateLimit {
    private boolean enabled = true;
    private int capacity = 10;
    private double refillPerSecond = 5.0;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getCapacity() {
      return capacity;
    }

    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }

    public double getRefillPerSecond() {
      return refillPerSecond;
    }

    public void setRefillPerSecond(double refillPerSecond) {
      this.refillPerSecond = refillPerSecond;
    }
  }

  public static class Stream {
    private String wsUrl = "wss://api.nonkyc.io";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration reconnectBaseBackoff = Duration.ofSeconds(1);
    private Duration reconnectMaxBackoff = Duration.ofSeconds(30);
    private int circuitBreakerThreshold = 10;
    private Integer orderbookDepth;

    public String getWsUrl() {
      return wsUrl;
    }

    public void setWsUrl(String wsUrl) {
      this.wsUrl = wsUrl;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReconnectBaseBackoff() {
      return reconnectBaseBackoff;
    }

    public void setReconnectBaseBackoff(Duration reconnectBaseBackoff) {
      this.reconnectBaseBackoff = reconnectBaseBackoff;
    }

    public Duration getReconnectMaxBackoff() {
      return reconnectMaxBackoff;
    }

    public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
      this.reconnectMaxBackoff = reconnectMaxBackoff;
    }

    public int getCircuitBreakerThreshold() {
      return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(int circuitBreakerThreshold) {
      this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public Integer getOrderbookDepth() {
      return orderbookDepth;
    }

    public void setOrderbookDepth(Integer orderbookDepth) {
      this.orderbookDepth = orderbookDepth;
    }
  }
}
