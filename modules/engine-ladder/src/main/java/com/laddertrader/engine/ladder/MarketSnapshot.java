package com.laddertrader.engine.ladder;

import com.laddertrader.domain.wallet.Balance;
import com.laddertrader.integration.nonkyc.Ticker;
import java.util.List;
import java.util.Objects;

public record MarketSnapshot(List<Balance> balances, Ticker ticker) {
  public MarketSnapshot {
    balances = List.copyOf(Objects.requireNonNull(balances, "balances must not be null"));
    Objects.requireNonNull(ticker, "ticker must not be null");
  }
}
