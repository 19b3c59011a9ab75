package com.laddertrader.integration.nonkyc;

public record CancelResult(String target, boolean success, String rawStatus) {}
