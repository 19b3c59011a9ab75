package com.laddertrader.domain.wallet;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Locally predicted balance delta not yet visible in a venue fetch. {@code cyclesUnreflected}
 * counts reconciliation passes that did not observe it.
 */
public record PendingAdjustment(String key, String asset, BigDecimal delta, int cyclesUnreflected) {

  public PendingAdjustment {
    if (key == null || key.isBlank()) {
      throw new WalletDomainException("key must not be blank");
    }
    if (asset == null || asset.isBlank()) {
      throw new WalletDomainException("asset must not be blank");
    }
    Objects.requireNonNull(delta, "delta must not be null");
    if (cyclesUnreflected < 0) {
      throw new WalletDomainException("cyclesUnreflected must be >= 0");
    }
  }

  PendingAdjustment aged() {
    return new PendingAdjustment(key, asset, delta, cyclesUnreflected + 1);
  }
}
