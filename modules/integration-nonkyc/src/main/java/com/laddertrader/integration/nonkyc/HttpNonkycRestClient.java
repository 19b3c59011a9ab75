package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.databind.JsonNode;
import com.laddertrader.domain.orders.OrderSide;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpNonkycRestClient implements NonkycRestClient {
  private static final Logger log = LoggerFactory.getLogger(HttpNonkycRestClient.class);

  private final HttpClient httpClient;
  private final NonkycHttpExchange exchange;
  private final RequestRateLimiter rateLimiter;
  private final NonkycRetryExecutor retryExecutor;
  private final boolean strictValidate;

  public HttpNonkycRestClient(
      HttpClient httpClient,
      NonkycHttpExchange exchange,
      RequestRateLimiter rateLimiter,
      NonkycRetryExecutor retryExecutor,
      boolean strictValidate) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.exchange = Objects.requireNonNull(exchange, "exchange is required");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
    this.strictValidate = strictValidate;
  }

  @Override
  public List<VenueBalance> fetchBalances() {
    return NonkycResponseParser.balances(send(NonkycPaths.balances()));
  }

  @Override
  public VenueOrder placeOrder(PlaceOrderRequest request) {
    JsonNode payload = send(NonkycPaths.placeOrder(request, strictValidate));
    return NonkycResponseParser.order(payload, request);
  }

  @Override
  public CancelResult cancelOrder(String orderId) {
    return NonkycResponseParser.cancel(send(NonkycPaths.cancelOrder(orderId)), orderId);
  }

  @Override
  public CancelResult cancelOrderByClientReference(String clientReferenceId) {
    return NonkycResponseParser.cancel(
        send(NonkycPaths.cancelByClientReference(clientReferenceId)), clientReferenceId);
  }

  @Override
  public VenueOrder fetchOrder(String orderId) {
    return NonkycResponseParser.order(send(NonkycPaths.fetchOrder(orderId)), null);
  }

  @Override
  public Ticker fetchTicker(String symbol) {
    return NonkycResponseParser.ticker(send(NonkycPaths.ticker(symbol)), symbol);
  }

  @Override
  public List<VenueOrder> fetchOpenOrders(String symbol) {
    return NonkycResponseParser.orders(send(NonkycPaths.openOrders(symbol)));
  }

  @Override
  public CancelResult cancelAllOrders(String symbol, OrderSide side) {
    return NonkycResponseParser.cancel(send(NonkycPaths.cancelAll(symbol, side)), symbol);
  }

  JsonNode send(NonkycRequest request) {
    return retryExecutor.execute(request, () -> sendOnce(request));
  }

  private JsonNode sendOnce(NonkycRequest request) {
    rateLimiter.acquire();
    HttpRequest httpRequest = exchange.build(request);
    log.debug(
        "Sending NonKYC request operation={} correlationId={} method={} path={}",
        request.operation(),
        request.correlationId(),
        request.method(),
        request.path());
    HttpResponse<String> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException | InterruptedException ex) {
      throw exchange.translate(request, ex);
    }
    return exchange.handle(request, response);
  }
}
