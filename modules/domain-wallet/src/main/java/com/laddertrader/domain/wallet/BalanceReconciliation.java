package com.laddertrader.domain.wallet;

public record BalanceReconciliation(int cleared, int carried, int expired) {}
