package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.wallet.Balance;
import com.laddertrader.integration.nonkyc.AsyncNonkycRestClient;
import com.laddertrader.integration.nonkyc.CancelResult;
import com.laddertrader.integration.nonkyc.NonkycRestClient;
import com.laddertrader.integration.nonkyc.PlaceOrderRequest;
import com.laddertrader.integration.nonkyc.Ticker;
import com.laddertrader.integration.nonkyc.VenueBalance;
import com.laddertrader.integration.nonkyc.VenueOrder;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Routes engine calls to the REST clients; the startup snapshot fans out over the async one. */
public class NonkycLadderExchangeAdapter implements LadderExchangePort {
  private final NonkycRestClient restClient;
  private final AsyncNonkycRestClient asyncRestClient;

  public NonkycLadderExchangeAdapter(
      NonkycRestClient restClient, AsyncNonkycRestClient asyncRestClient) {
    this.restClient = Objects.requireNonNull(restClient, "restClient is required");
    this.asyncRestClient = Objects.requireNonNull(asyncRestClient, "asyncRestClient is required");
  }

  @Override
  public MarketSnapshot marketSnapshot(String symbol) {
    CompletableFuture<List<VenueBalance>> balances = asyncRestClient.fetchBalances();
    CompletableFuture<Ticker> ticker = asyncRestClient.fetchTicker(symbol);
    try {
      CompletableFuture.allOf(balances, ticker).join();
      return new MarketSnapshot(toBalances(balances.join()), ticker.join());
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw ex;
    }
  }

  @Override
  public Ticker ticker(String symbol) {
    return restClient.fetchTicker(symbol);
  }

  @Override
  public List<Balance> balances() {
    return toBalances(restClient.fetchBalances());
  }

  @Override
  public VenueOrder place(PlaceOrderRequest request) {
    return restClient.placeOrder(request);
  }

  @Override
  public VenueOrder order(String orderId) {
    return restClient.fetchOrder(orderId);
  }

  @Override
  public List<VenueOrder> openOrders(String symbol) {
    return restClient.fetchOpenOrders(symbol);
  }

  @Override
  public CancelResult cancelAll(String symbol, OrderSide side) {
    return restClient.cancelAllOrders(symbol, side);
  }

  static List<Balance> toBalances(List<VenueBalance> venueBalances) {
    return venueBalances.stream()
        .map(
            balance ->
                new Balance(
                    balance.asset(),
                    nonNegative(balance.available()),
                    nonNegative(balance.held())))
        .toList();
  }

  private static BigDecimal nonNegative(BigDecimal value) {
    return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
  }
}
