package com.laddertrader.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MarketSymbolTest {
  @Test
  void shouldNormalizeDelimitersToUnderscore() {
    assertEquals("BTC_USDT", MarketSymbol.normalize("BTC_USDT"));
    assertEquals("BTC_USDT", MarketSymbol.normalize("btc/usdt"));
    assertEquals("XMR_BTC", MarketSymbol.normalize("XMR-BTC"));
    assertEquals("ETH_USDT", MarketSymbol.normalize(" eth:usdt "));
  }

  @Test
  void shouldSplitIntoBaseAndQuote() {
    MarketSymbol symbol = MarketSymbol.splitSymbol("SAL/USDT");

    assertEquals("SAL", symbol.base());
    assertEquals("USDT", symbol.quote());
  }

  @Test
  void shouldRejectSymbolsWithoutExactlyTwoAssets() {
    assertThrows(OrderDomainException.class, () -> MarketSymbol.splitSymbol("BTCUSDT"));
    assertThrows(OrderDomainException.class, () -> MarketSymbol.splitSymbol("A_B_C"));
    assertThrows(OrderDomainException.class, () -> MarketSymbol.splitSymbol("BTC_"));
    assertThrows(OrderDomainException.class, () -> MarketSymbol.splitSymbol(" "));
  }
}
