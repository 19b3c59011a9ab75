package com.laddertrader.integration.nonkyc;

import java.math.BigDecimal;

public record VenueBalance(String asset, BigDecimal available, BigDecimal held) {}
