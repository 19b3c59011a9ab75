package com.laddertrader.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.laddertrader.domain.wallet.BalanceTracker;
import com.laddertrader.engine.ladder.EngineStateStore;
import com.laddertrader.engine.ladder.LadderConfig;
import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.engine.ladder.LadderExchangePort;
import com.laddertrader.engine.ladder.NonkycLadderExchangeAdapter;
import com.laddertrader.integration.nonkyc.ApiCredentials;
import com.laddertrader.integration.nonkyc.AsyncNonkycRestClient;
import com.laddertrader.integration.nonkyc.ExponentialBackoff;
import com.laddertrader.integration.nonkyc.HttpNonkycRestClient;
import com.laddertrader.integration.nonkyc.NonceGenerator;
import com.laddertrader.integration.nonkyc.NonkycApiConfig;
import com.laddertrader.integration.nonkyc.NonkycConnectorProperties;
import com.laddertrader.integration.nonkyc.NonkycHttpExchange;
import com.laddertrader.integration.nonkyc.NonkycRequestSigner;
import com.laddertrader.integration.nonkyc.NonkycRestClient;
import com.laddertrader.integration.nonkyc.NonkycRetryExecutor;
import com.laddertrader.integration.nonkyc.RequestRateLimiter;
import com.laddertrader.integration.nonkyc.RetryAfterParser;
import com.laddertrader.integration.nonkyc.ServerTimeClock;
import com.laddertrader.integration.nonkyc.TokenBucketRateLimiter;
import com.laddertrader.integration.nonkyc.stream.NonkycStreamClient;
import com.laddertrader.integration.nonkyc.stream.NonkycStreamConfig;
import com.laddertrader.integration.nonkyc.stream.WebSocketNonkycStreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({NonkycConnectorProperties.class, LadderWorkerProperties.class})
public class LadderWorkerConfiguration {
  private static final double JITTER_RATIO = 0.2d;

  @Bean
  @ConditionalOnMissingBean(name = "nonkycHttpClient")
  public HttpClient nonkycHttpClient(NonkycConnectorProperties properties) {
    return HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock nonkycConnectorClock(
      NonkycConnectorProperties properties, HttpClient nonkycHttpClient, ObjectMapper objectMapper) {
    NonkycConnectorProperties.ServerTime serverTime = properties.getServerTime();
    if (!serverTime.isEnabled()) {
      return Clock.systemUTC();
    }
    return new ServerTimeClock(
        nonkycHttpClient,
        objectMapper,
        URI.create(serverTime.getUrl()),
        serverTime.getMaxAge(),
        properties.getTimeout(),
        Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public ApiCredentials nonkycApiCredentials(NonkycConnectorProperties properties) {
    return new ApiCredentials(
        resolveOptionalSecret(
            properties.getApiKey(), properties.getApiKeyFile(), "connector.nonkyc.api-key-file"),
        resolveOptionalSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "connector.nonkyc.api-secret-file"));
  }

  @Bean
  @ConditionalOnMissingBean
  public NonkycRequestSigner nonkycRequestSigner(
      ObjectMapper objectMapper, NonkycConnectorProperties properties) {
    return new NonkycRequestSigner(objectMapper, properties.getSignatureScope());
  }

  @Bean
  @ConditionalOnMissingBean
  public NonceGenerator nonceGenerator(
      NonkycConnectorProperties properties, Clock nonkycConnectorClock) {
    return new NonceGenerator(nonkycConnectorClock, properties.getNonceMultiplier());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryAfterParser retryAfterParser(Clock nonkycConnectorClock) {
    return new RetryAfterParser(nonkycConnectorClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public NonkycHttpExchange nonkycHttpExchange(
      ObjectMapper objectMapper,
      NonkycConnectorProperties properties,
      ApiCredentials nonkycApiCredentials,
      NonkycRequestSigner nonkycRequestSigner,
      NonceGenerator nonceGenerator,
      RetryAfterParser retryAfterParser) {
    NonkycApiConfig apiConfig =
        new NonkycApiConfig(
            URI.create(properties.getBaseUrl()),
            nonkycApiCredentials,
            properties.getTimeout(),
            properties.isStrictValidate());
    return new NonkycHttpExchange(
        objectMapper, apiConfig, nonkycRequestSigner, nonceGenerator, retryAfterParser);
  }

  @Bean
  @ConditionalOnMissingBean
  public RequestRateLimiter requestRateLimiter(
      NonkycConnectorProperties properties, Clock nonkycConnectorClock) {
    NonkycConnectorProperties.RateLimit rateLimit = properties.getRateLimit();
    if (!rateLimit.isEnabled()) {
      return RequestRateLimiter.noop();
    }
    return new TokenBucketRateLimiter(
        rateLimit.getCapacity(), rateLimit.getRefillPerSecond(), nonkycConnectorClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public NonkycRetryExecutor nonkycRetryExecutor(
      NonkycConnectorProperties properties, MeterRegistry meterRegistry) {
    NonkycConnectorProperties.Retry retry = properties.getRetry();
    ExponentialBackoff backoff =
        new ExponentialBackoff(
            retry.getBaseBackoff().toMillis(),
            retry.getMaxBackoff().toMillis(),
            retry.isJitterEnabled() ? JITTER_RATIO : 0d);
    return new NonkycRetryExecutor(retry.getMaxAttempts(), backoff, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public NonkycRestClient nonkycRestClient(
      HttpClient nonkycHttpClient,
      NonkycHttpExchange nonkycHttpExchange,
      RequestRateLimiter requestRateLimiter,
      NonkycRetryExecutor nonkycRetryExecutor,
      NonkycConnectorProperties properties) {
    return new HttpNonkycRestClient(
        nonkycHttpClient,
        nonkycHttpExchange,
        requestRateLimiter,
        nonkycRetryExecutor,
        properties.isStrictValidate());
  }

  @Bean
  @ConditionalOnMissingBean
  public AsyncNonkycRestClient asyncNonkycRestClient(
      HttpClient nonkycHttpClient,
      NonkycHttpExchange nonkycHttpExchange,
      RequestRateLimiter requestRateLimiter,
      NonkycRetryExecutor nonkycRetryExecutor,
      NonkycConnectorProperties properties) {
    return new AsyncNonkycRestClient(
        nonkycHttpClient,
        nonkycHttpExchange,
        requestRateLimiter,
        nonkycRetryExecutor,
        properties.isStrictValidate());
  }

  @Bean
  @ConditionalOnMissingBean
  public LadderExchangePort ladderExchangePort(
      NonkycRestClient nonkycRestClient, AsyncNonkycRestClient asyncNonkycRestClient) {
    return new NonkycLadderExchangeAdapter(nonkycRestClient, asyncNonkycRestClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public BalanceTracker balanceTracker() {
    return new BalanceTracker();
  }

  @Bean
  @ConditionalOnMissingBean
  public EngineStateStore engineStateStore(
      LadderWorkerProperties properties, ObjectMapper objectMapper) {
    return new EngineStateStore(Path.of(properties.getStatePath()), objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public LadderConfig ladderConfig(LadderWorkerProperties properties) {
    return properties.toLadderConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public LadderEngine ladderEngine(
      LadderConfig ladderConfig,
      LadderExchangePort ladderExchangePort,
      BalanceTracker balanceTracker,
      EngineStateStore engineStateStore,
      MeterRegistry meterRegistry) {
    return new LadderEngine(
        ladderConfig,
        ladderExchangePort,
        balanceTracker,
        engineStateStore,
        meterRegistry,
        Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "ladder", name = "stream-enabled", havingValue = "true")
  public NonkycStreamClient nonkycStreamClient(
      HttpClient nonkycHttpClient,
      ObjectMapper objectMapper,
      NonkycConnectorProperties properties,
      ApiCredentials nonkycApiCredentials,
      NonkycRequestSigner nonkycRequestSigner,
      MeterRegistry meterRegistry) {
    NonkycConnectorProperties.Stream stream = properties.getStream();
    NonkycStreamConfig streamConfig =
        new NonkycStreamConfig(
            URI.create(stream.getWsUrl()),
            stream.getConnectTimeout(),
            stream.getReconnectBaseBackoff(),
            stream.getReconnectMaxBackoff(),
            stream.getCircuitBreakerThreshold());
    return new WebSocketNonkycStreamClient(
        nonkycHttpClient,
        objectMapper,
        streamConfig,
        nonkycApiCredentials,
        nonkycRequestSigner,
        meterRegistry);
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}
