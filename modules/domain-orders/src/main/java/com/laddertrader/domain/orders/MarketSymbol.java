package com.laddertrader.domain.orders;

import java.util.Locale;
import java.util.regex.Pattern;

/** A trading pair in the venue's {@code BASE_QUOTE} form. */
public record MarketSymbol(String base, String quote) {
  private static final Pattern DELIMITERS = Pattern.compile("[/\\-:_]");

  public MarketSymbol {
    if (base == null || base.isBlank()) {
      throw new OrderDomainException("base asset must not be blank");
    }
    if (quote == null || quote.isBlank()) {
      throw new OrderDomainException("quote asset must not be blank");
    }
    base = base.trim().toUpperCase(Locale.ROOT);
    quote = quote.trim().toUpperCase(Locale.ROOT);
  }

  /** Accepts {@code BTC_USDT}, {@code BTC/USDT}, {@code btc-usdt} and {@code BTC:USDT}. */
  public static MarketSymbol splitSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new OrderDomainException("symbol must not be blank");
    }
    String[] parts = DELIMITERS.split(symbol.trim());
    if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
      throw new OrderDomainException("symbol must have the form BASE_QUOTE: " + symbol);
    }
    return new MarketSymbol(parts[0], parts[1]);
  }

  public static String normalize(String symbol) {
    return splitSymbol(symbol).venueSymbol();
  }

  public String venueSymbol() {
    return base + "_" + quote;
  }

  @Override
  public String toString() {
    return venueSymbol();
  }
}
