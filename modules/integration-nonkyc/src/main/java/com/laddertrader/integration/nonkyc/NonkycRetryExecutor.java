package com.laddertrader.integration.nonkyc;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries rate-limited and transient venue failures. Rate limits wait for {@code Retry-After}
 * (capped at the backoff maximum) when the venue sends one; everything else uses exponential
 * backoff. Authentication and validation errors propagate on the first attempt.
 */
public class NonkycRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(NonkycRetryExecutor.class);
  static final String RETRY_COUNTER = "connector.nonkyc.retry";
  static final String EXHAUSTED_COUNTER = "connector.nonkyc.retry.exhausted";

  private final int maxAttempts;
  private final ExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public NonkycRetryExecutor(int maxAttempts, ExponentialBackoff backoff, MeterRegistry meterRegistry) {
    this(maxAttempts, backoff, Sleeper.threadSleeper(), meterRegistry);
  }

  public NonkycRetryExecutor(
      int maxAttempts, ExponentialBackoff backoff, Sleeper sleeper, MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(NonkycRequest request, Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (NonkycApiException ex) {
        Optional<Duration> wait = retryDelay(request, ex, attempt);
        if (wait.isEmpty()) {
          throw ex;
        }
        sleep(wait.get());
        attempt++;
      }
    }
  }

  /**
   * Delay before the next attempt, or empty when {@code error} must propagate. Records the retry
   * metrics either way so sync and async callers report alike.
   */
  public Optional<Duration> retryDelay(NonkycRequest request, NonkycApiException error, int attempt) {
    if (!error.kind().isRetryable()) {
      return Optional.empty();
    }
    String reason = error.kind().name().toLowerCase(Locale.ROOT);
    if (attempt >= maxAttempts) {
      meterRegistry
          .counter(EXHAUSTED_COUNTER, "operation", request.operation(), "reason", reason)
          .increment();
      log.warn(
          "NonKYC retries exhausted operation={} correlationId={} attempts={} error={}",
          request.operation(),
          request.correlationId(),
          attempt,
          error.errorCode());
      return Optional.empty();
    }
    Duration wait = resolveDelay(error, attempt);
    meterRegistry.counter(RETRY_COUNTER, "operation", request.operation(), "reason", reason).increment();
    log.info(
        "Retrying NonKYC call operation={} correlationId={} attempt={} waitMs={} error={}",
        request.operation(),
        request.correlationId(),
        attempt,
        wait.toMillis(),
        error.errorCode());
    return Optional.of(wait);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private Duration resolveDelay(NonkycApiException error, int attempt) {
    Duration computed = backoff.delayForAttempt(attempt);
    if (error instanceof RateLimitException rateLimit) {
      return rateLimit
          .retryAfter()
          .map(retryAfter -> minDuration(retryAfter, backoff.maxDelay()))
          .orElse(computed);
    }
    return computed;
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during NonKYC retry backoff", interrupted);
    }
  }

  private static Duration minDuration(Duration left, Duration right) {
    return left.compareTo(right) <= 0 ? left : right;
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }
}
