package com.laddertrader.engine.ladder;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.laddertrader.domain.orders.MarketSymbol;
import com.laddertrader.domain.orders.OrderSide;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LadderConfigTest {

  @Test
  void shouldAcceptSpacingAboveMinimum() {
    LadderConfig config = LadderEngineTest.config(LadderVariant.BOUNDED, RunMode.LIVE);

    assertDoesNotThrow(() -> config.validateSpacing(new BigDecimal("90000")));
  }

  @Test
  void shouldConvertAbsoluteStepToFractionOfReference() {
    LadderConfig config = absolute("100");

    assertEquals(0, new BigDecimal("0.001").compareTo(config.effectiveStep(new BigDecimal("100000"))));
    assertThrows(LadderConfigurationException.class, () -> config.validateSpacing(new BigDecimal("100000")));
    assertDoesNotThrow(() -> config.validateSpacing(new BigDecimal("10000")));
  }

  @Test
  void shouldPriceRungsByStepMode() {
    LadderConfig pct = LadderEngineTest.config(LadderVariant.BOUNDED, RunMode.LIVE);
    LadderConfig abs = absolute("250");
    BigDecimal reference = new BigDecimal("90000");

    assertEquals(0, new BigDecimal("84600").compareTo(pct.priceBelow(reference, 3)));
    assertEquals(0, new BigDecimal("91800").compareTo(pct.priceAbove(reference, 1)));
    assertEquals(0, new BigDecimal("89500").compareTo(abs.priceBelow(reference, 2)));
    assertEquals(0, new BigDecimal("90250").compareTo(abs.priceAbove(reference, 1)));
  }

  @Test
  void shouldRoundPricesDownToTick() {
    LadderConfig config = LadderEngineTest.config(LadderVariant.BOUNDED, RunMode.LIVE);

    assertEquals(new BigDecimal("101.23"), config.roundPrice(new BigDecimal("101.2399")));
    assertEquals(new BigDecimal("0.0123"), config.roundQuantity(new BigDecimal("0.012399")));
  }

  @Test
  void shouldRejectInvalidSettings() {
    assertThrows(
        LadderConfigurationException.class,
        () -> build(StepMode.PCT, null, null, 3, 3, "0.01", "0.002"));
    assertThrows(
        LadderConfigurationException.class,
        () -> build(StepMode.PCT, "0.02", null, 0, 0, "0.01", "0.002"));
    assertThrows(
        LadderConfigurationException.class,
        () -> build(StepMode.PCT, "0.02", null, 3, 3, "0", "0.002"));
    assertThrows(
        LadderConfigurationException.class,
        () -> build(StepMode.PCT, "0.02", null, 3, 3, "0.01", "-0.001"));
    assertThrows(
        LadderConfigurationException.class,
        () -> build(StepMode.ABS, "0.02", null, 3, 3, "0.01", "0.002"));
  }

  @Test
  void shouldSizeQuoteTargetRungsFromTargetOrEntryPrice() {
    BigDecimal entry = new BigDecimal("90000");
    LadderConfig explicit =
        LadderEngineTest.config(
            LadderVariant.BOUNDED,
            RunMode.LIVE,
            new OrderSizing(SizingMode.QUOTE_TARGET, SizingMode.FIXED, new BigDecimal("500"), null),
            false);
    LadderConfig implicit =
        LadderEngineTest.config(
            LadderVariant.BOUNDED,
            RunMode.LIVE,
            new OrderSizing(SizingMode.FIXED, SizingMode.QUOTE_TARGET, null, null),
            false);

    assertEquals(
        0,
        new BigDecimal("0.005")
            .compareTo(explicit.orderQuantity(OrderSide.BUY, new BigDecimal("100000"), entry)));
    assertEquals(
        0,
        new BigDecimal("0.01")
            .compareTo(explicit.orderQuantity(OrderSide.SELL, new BigDecimal("100000"), entry)));
    assertEquals(
        0,
        new BigDecimal("0.009")
            .compareTo(implicit.orderQuantity(OrderSide.SELL, new BigDecimal("100000"), entry)));
  }

  @Test
  void shouldApplyHybridFloorRoundedUpToStep() {
    LadderConfig config =
        LadderEngineTest.config(
            LadderVariant.BOUNDED,
            RunMode.LIVE,
            new OrderSizing(
                SizingMode.HYBRID, SizingMode.HYBRID, new BigDecimal("500"), new BigDecimal("0.00615")),
            false);

    assertEquals(
        0,
        new BigDecimal("0.0062")
            .compareTo(config.orderQuantity(OrderSide.BUY, new BigDecimal("100000"), null)));
    assertEquals(
        0,
        new BigDecimal("0.01")
            .compareTo(config.orderQuantity(OrderSide.BUY, new BigDecimal("50000"), null)));
  }

  @Test
  void shouldRejectIncompleteSizing() {
    assertThrows(
        LadderConfigurationException.class,
        () -> new OrderSizing(SizingMode.HYBRID, SizingMode.FIXED, null, null));
    assertThrows(
        LadderConfigurationException.class,
        () -> new OrderSizing(SizingMode.QUOTE_TARGET, SizingMode.FIXED, BigDecimal.ZERO, null));
    assertEquals(SizingMode.QUOTE_TARGET, SizingMode.fromValue("dynamic"));
    assertThrows(LadderConfigurationException.class, () -> SizingMode.fromValue("martingale"));
  }

  @Test
  void shouldDescribeWithoutCredentials() {
    LadderConfig config = LadderEngineTest.config(LadderVariant.UNBOUNDED, RunMode.DRY_RUN);

    assertEquals("BTC_USDT", config.describe().get("symbol"));
    assertEquals("UNBOUNDED", config.describe().get("variant"));
    assertFalse(config.describe().keySet().stream().anyMatch(EngineStateStore::isSensitive));
  }

  private static LadderConfig absolute(String step) {
    return build(StepMode.ABS, null, step, 3, 3, "0.01", "0.002");
  }

  private static LadderConfig build(
      StepMode mode, String pct, String abs, int buys, int sells, String size, String fee) {
    return new LadderConfig(
        MarketSymbol.splitSymbol("BTC/USDT"),
        LadderVariant.BOUNDED,
        mode,
        pct == null ? null : new BigDecimal(pct),
        abs == null ? null : new BigDecimal(abs),
        buys,
        sells,
        new BigDecimal(size),
        new BigDecimal(fee),
        new BigDecimal("0.0001"),
        BigDecimal.ONE,
        new BigDecimal("0.01"),
        new BigDecimal("0.0001"),
        RunMode.LIVE,
        false,
        3);
  }
}
