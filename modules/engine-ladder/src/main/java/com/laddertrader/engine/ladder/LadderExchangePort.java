package com.laddertrader.engine.ladder;

import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.wallet.Balance;
import com.laddertrader.integration.nonkyc.CancelResult;
import com.laddertrader.integration.nonkyc.PlaceOrderRequest;
import com.laddertrader.integration.nonkyc.Ticker;
import com.laddertrader.integration.nonkyc.VenueOrder;
import java.util.List;

/**
 * What the ladder engine needs from the venue. Implementations throw the
 * {@link com.laddertrader.integration.nonkyc.NonkycApiException} taxonomy unchanged.
 */
public interface LadderExchangePort {
  MarketSnapshot marketSnapshot(String symbol);

  Ticker ticker(String symbol);

  List<Balance> balances();

  VenueOrder place(PlaceOrderRequest request);

  VenueOrder order(String orderId);

  List<VenueOrder> openOrders(String symbol);

  CancelResult cancelAll(String symbol, OrderSide side);
}
