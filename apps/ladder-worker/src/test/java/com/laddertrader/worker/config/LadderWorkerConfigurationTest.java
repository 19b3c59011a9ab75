package com.laddertrader.worker.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.laddertrader.engine.ladder.LadderConfig;
import com.laddertrader.engine.ladder.LadderConfigurationException;
import com.laddertrader.engine.ladder.LadderEngine;
import com.laddertrader.engine.ladder.LadderExchangePort;
import com.laddertrader.engine.ladder.LadderVariant;
import com.laddertrader.engine.ladder.RunMode;
import com.laddertrader.integration.nonkyc.ApiCredentials;
import com.laddertrader.integration.nonkyc.RequestRateLimiter;
import com.laddertrader.integration.nonkyc.TokenBucketRateLimiter;
import com.laddertrader.integration.nonkyc.stream.NonkycStreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class LadderWorkerConfigurationTest {
  @TempDir Path tempDir;

  private ApplicationContextRunner contextRunner() {
    return new ApplicationContextRunner()
        .withUserConfiguration(LadderWorkerConfiguration.class)
        .withBean(ObjectMapper.class, () -> new ObjectMapper().findAndRegisterModules())
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
        .withPropertyValues(
            "connector.nonkyc.base-url=https://nonkyc.test/api/v2",
            "connector.nonkyc.api-key=api-key",
            "connector.nonkyc.api-secret=api-secret",
            "ladder.symbol=btc/usdt",
            "ladder.variant=unbounded",
            "ladder.step-pct=0.02",
            "ladder.mode=dry-run",
            "ladder.state-path=" + tempDir.resolve("state.json"));
  }

  @Test
  void shouldRegisterLadderBeans() {
    contextRunner()
        .run(
            context -> {
              assertThat(context).hasSingleBean(LadderEngine.class);
              assertThat(context).hasSingleBean(LadderExchangePort.class);
              assertThat(context).hasBean("nonkycRestClient");
              assertThat(context).hasBean("asyncNonkycRestClient");
              assertThat(context).hasBean("nonkycRetryExecutor");
              assertThat(context).doesNotHaveBean(NonkycStreamClient.class);
              assertThat(context.getBean(RequestRateLimiter.class))
                  .isInstanceOf(TokenBucketRateLimiter.class);

              LadderConfig config = context.getBean(LadderConfig.class);
              assertThat(config.symbol().venueSymbol()).isEqualTo("BTC_USDT");
              assertThat(config.variant()).isEqualTo(LadderVariant.UNBOUNDED);
              assertThat(config.runMode()).isEqualTo(RunMode.DRY_RUN);
              assertThat(config.stepPct()).isEqualByComparingTo(new BigDecimal("0.02"));
            });
  }

  @Test
  void shouldRegisterStreamClientWhenEnabled() {
    contextRunner()
        .withPropertyValues("ladder.stream-enabled=true")
        .run(context -> assertThat(context).hasSingleBean(NonkycStreamClient.class));
  }

  @Test
  void shouldUseNoopLimiterWhenRateLimitDisabled() {
    contextRunner()
        .withPropertyValues("connector.nonkyc.rate-limit.enabled=false")
        .run(
            context ->
                assertThat(context.getBean(RequestRateLimiter.class))
                    .isNotInstanceOf(TokenBucketRateLimiter.class));
  }

  @Test
  void shouldPreferCredentialFiles() throws IOException {
    Path keyFile = tempDir.resolve("key.txt");
    Path secretFile = tempDir.resolve("secret.txt");
    Files.writeString(keyFile, "file-key-1234\n", StandardCharsets.UTF_8);
    Files.writeString(secretFile, "file-secret\n", StandardCharsets.UTF_8);

    contextRunner()
        .withPropertyValues(
            "connector.nonkyc.api-key-file=" + keyFile,
            "connector.nonkyc.api-secret-file=" + secretFile)
        .run(
            context -> {
              ApiCredentials credentials = context.getBean(ApiCredentials.class);
              assertThat(credentials.apiKey()).isEqualTo("file-key-1234");
              assertThat(credentials.apiSecret()).isEqualTo("file-secret");
              assertThat(credentials.toString()).doesNotContain("file-secret");
            });
  }

  @Test
  void shouldFailWhenCredentialFileIsMissing() {
    contextRunner()
        .withPropertyValues("connector.nonkyc.api-secret-file=" + tempDir.resolve("missing.txt"))
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .hasRootCauseInstanceOf(NoSuchFileException.class)
                  .hasStackTraceContaining("connector.nonkyc.api-secret-file cannot be read");
            });
  }

  @Test
  void shouldFailOnInvalidLadderSettings() {
    contextRunner()
        .withPropertyValues("ladder.base-order-size=0")
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .rootCause()
                  .isInstanceOf(LadderConfigurationException.class)
                  .hasMessageContaining("baseOrderSize");
            });
  }

  @Test
  void shouldRejectUnknownRunMode() {
    contextRunner()
        .withPropertyValues("ladder.mode=paper")
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .rootCause()
                  .isInstanceOf(LadderConfigurationException.class)
                  .hasMessageContaining("paper");
            });
  }
}
