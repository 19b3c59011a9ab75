package com.laddertrader.domain.wallet;

public class WalletDomainException extends RuntimeException {
  public WalletDomainException(String message) {
    super(message);
  }
}
