package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.databind.JsonNode;
import com.laddertrader.domain.orders.OrderSide;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking variant of {@link HttpNonkycRestClient}. Shares the rate limiter, nonce source and
 * error classification with the sync client; retries are scheduled instead of slept.
 */
public class AsyncNonkycRestClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncNonkycRestClient.class);

  private final HttpClient httpClient;
  private final NonkycHttpExchange exchange;
  private final RequestRateLimiter rateLimiter;
  private final NonkycRetryExecutor retryExecutor;
  private final boolean strictValidate;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  public AsyncNonkycRestClient(
      HttpClient httpClient,
      NonkycHttpExchange exchange,
      RequestRateLimiter rateLimiter,
      NonkycRetryExecutor retryExecutor,
      boolean strictValidate) {
    this(httpClient, exchange, rateLimiter, retryExecutor, strictValidate, null);
  }

  public AsyncNonkycRestClient(
      HttpClient httpClient,
      NonkycHttpExchange exchange,
      RequestRateLimiter rateLimiter,
      NonkycRetryExecutor retryExecutor,
      boolean strictValidate,
      Executor executor) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.exchange = Objects.requireNonNull(exchange, "exchange is required");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
    this.strictValidate = strictValidate;
    if (executor == null) {
      AtomicInteger threadCounter = new AtomicInteger();
      this.ownedExecutor =
          Executors.newCachedThreadPool(
              runnable -> {
                Thread thread = new Thread(runnable, "nonkyc-async-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
              });
      this.executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
      this.executor = executor;
    }
  }

  public CompletableFuture<List<VenueBalance>> fetchBalances() {
    return send(NonkycPaths.balances()).thenApply(NonkycResponseParser::balances);
  }

  public CompletableFuture<VenueOrder> placeOrder(PlaceOrderRequest request) {
    return send(NonkycPaths.placeOrder(request, strictValidate))
        .thenApply(payload -> NonkycResponseParser.order(payload, request));
  }

  public CompletableFuture<CancelResult> cancelOrder(String orderId) {
    return send(NonkycPaths.cancelOrder(orderId))
        .thenApply(payload -> NonkycResponseParser.cancel(payload, orderId));
  }

  public CompletableFuture<VenueOrder> fetchOrder(String orderId) {
    return send(NonkycPaths.fetchOrder(orderId))
        .thenApply(payload -> NonkycResponseParser.order(payload, null));
  }

  public CompletableFuture<Ticker> fetchTicker(String symbol) {
    return send(NonkycPaths.ticker(symbol))
        .thenApply(payload -> NonkycResponseParser.ticker(payload, symbol));
  }

  public CompletableFuture<List<VenueOrder>> fetchOpenOrders(String symbol) {
    return send(NonkycPaths.openOrders(symbol)).thenApply(NonkycResponseParser::orders);
  }

  public CompletableFuture<CancelResult> cancelAllOrders(String symbol, OrderSide side) {
    return send(NonkycPaths.cancelAll(symbol, side))
        .thenApply(payload -> NonkycResponseParser.cancel(payload, symbol));
  }

  CompletableFuture<JsonNode> send(NonkycRequest request) {
    return attempt(request, 1);
  }

  private CompletableFuture<JsonNode> attempt(NonkycRequest request, int attempt) {
    return CompletableFuture.runAsync(rateLimiter::acquire, executor)
        .thenCompose(
            ignored -> {
              log.debug(
                  "Sending async NonKYC request operation={} correlationId={} attempt={}",
                  request.operation(),
                  request.correlationId(),
                  attempt);
              return httpClient.sendAsync(
                  exchange.build(request), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            })
        .thenApply(response -> exchange.handle(request, response))
        .handle((payload, error) -> next(request, attempt, payload, error))
        .thenCompose(Function.identity());
  }

  private CompletableFuture<JsonNode> next(
      NonkycRequest request, int attempt, JsonNode payload, Throwable error) {
    if (error == null) {
      return CompletableFuture.completedFuture(payload);
    }
    NonkycApiException apiError;
    try {
      apiError = exchange.translate(request, error);
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
    Optional<Duration> wait = retryExecutor.retryDelay(request, apiError, attempt);
    if (wait.isEmpty()) {
      return CompletableFuture.failedFuture(apiError);
    }
    Executor delayed =
        CompletableFuture.delayedExecutor(wait.get().toMillis(), TimeUnit.MILLISECONDS, executor);
    return CompletableFuture.runAsync(() -> {}, delayed)
        .thenCompose(ignored -> attempt(request, attempt + 1));
  }

  @Override
  public void close() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
  }
}
