package com.laddertrader.integration.nonkyc;

import com.laddertrader.domain.orders.OrderSide;
import java.util.List;

/**
 * Signed REST surface of the venue. Every operation throws {@link AuthenticationException},
 * {@link RateLimitException}, {@link TransientApiException} or {@link ValidationException} once
 * retries are exhausted.
 */
public interface NonkycRestClient {
  List<VenueBalance> fetchBalances();

  /**
   * A {@link TransientApiException} from this call means the outcome is unknown: the order may
   * exist under {@code clientReferenceId}.
   */
  VenueOrder placeOrder(PlaceOrderRequest request);

  CancelResult cancelOrder(String orderId);

  CancelResult cancelOrderByClientReference(String clientReferenceId);

  VenueOrder fetchOrder(String orderId);

  Ticker fetchTicker(String symbol);

  List<VenueOrder> fetchOpenOrders(String symbol);

  /** Bulk cancel; {@code side} may be null for both sides. */
  CancelResult cancelAllOrders(String symbol, OrderSide side);
}
