package com.laddertrader.integration.nonkyc;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record Ticker(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal lastPrice) {

  /** Bid/ask midpoint when the book has both sides, the last trade price otherwise. */
  public BigDecimal referencePrice() {
    if (bid != null && ask != null && bid.signum() > 0 && ask.signum() > 0) {
      return bid.add(ask).divide(BigDecimal.valueOf(2), Math.max(bid.scale(), ask.scale()) + 1, RoundingMode.HALF_EVEN);
    }
    if (lastPrice != null && lastPrice.signum() > 0) {
      return lastPrice;
    }
    throw new IllegalStateException("Ticker for " + symbol + " has no usable price");
  }
}
