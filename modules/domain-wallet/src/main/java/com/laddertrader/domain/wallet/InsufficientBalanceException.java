package com.laddertrader.domain.wallet;

import java.math.BigDecimal;

public class InsufficientBalanceException extends WalletDomainException {
  private final String asset;
  private final BigDecimal requested;
  private final BigDecimal available;

  public InsufficientBalanceException(String asset, BigDecimal requested, BigDecimal available) {
    super(
        String.format(
            "Insufficient %s balance: requested=%s, available=%s",
            asset, requested.toPlainString(), available.toPlainString()));
    this.asset = asset;
    this.requested = requested;
    this.available = available;
  }

  public String asset() {
    return asset;
  }

  public BigDecimal requested() {
    return requested;
  }

  public BigDecimal available() {
    return available;
  }
}
