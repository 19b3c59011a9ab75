package com.laddertrader.domain.wallet;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/** Venue-reported balance of one asset. */
public record Balance(String asset, BigDecimal available, BigDecimal held) {

  public Balance {
    if (asset == null || asset.isBlank()) {
      throw new WalletDomainException("asset must not be blank");
    }
    asset = asset.trim().toUpperCase(Locale.ROOT);
    Objects.requireNonNull(available, "available must not be null");
    Objects.requireNonNull(held, "held must not be null");
    if (available.compareTo(BigDecimal.ZERO) < 0) {
      throw new WalletDomainException("available must be >= 0");
    }
    if (held.compareTo(BigDecimal.ZERO) < 0) {
      throw new WalletDomainException("held must be >= 0");
    }
  }

  public static Balance zero(String asset) {
    return new Balance(asset, BigDecimal.ZERO, BigDecimal.ZERO);
  }
}
