package com.laddertrader.worker.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.laddertrader.engine.ladder.LadderConfig;
import com.laddertrader.engine.ladder.LadderConfigurationException;
import com.laddertrader.engine.ladder.RunMode;
import com.laddertrader.engine.ladder.SizingMode;
import com.laddertrader.engine.ladder.StepMode;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LadderWorkerPropertiesTest {
  @Test
  void shouldDefaultToMonitorMode() {
    LadderConfig config = new LadderWorkerProperties().toLadderConfig();

    assertEquals(RunMode.MONITOR, config.runMode());
    assertEquals("BTC_USDT", config.symbol().venueSymbol());
  }

  @Test
  void shouldBuildAbsoluteStepConfig() {
    LadderWorkerProperties properties = new LadderWorkerProperties();
    properties.setStepMode(StepMode.ABS);
    properties.setStepAbs(new BigDecimal("500"));
    properties.setMode("LIVE");

    LadderConfig config = properties.toLadderConfig();

    assertEquals(StepMode.ABS, config.stepMode());
    assertEquals(RunMode.LIVE, config.runMode());
    assertEquals(0, new BigDecimal("0.005").compareTo(config.effectiveStep(new BigDecimal("100000"))));
  }

  @Test
  void shouldBuildQuoteTargetSizing() {
    LadderWorkerProperties properties = new LadderWorkerProperties();
    properties.setBuySizing("dynamic");
    properties.setSellSizing("hybrid");
    properties.setTargetQuotePerOrder(new BigDecimal("50"));
    properties.setMinBaseOrderQty(new BigDecimal("0.0005"));
    properties.setExtendBuyLevelsOnRestart(true);

    LadderConfig config = properties.toLadderConfig();

    assertEquals(SizingMode.QUOTE_TARGET, config.sizing().buyMode());
    assertEquals(SizingMode.HYBRID, config.sizing().sellMode());
    assertTrue(config.extendBuyLevelsOnRestart());
    assertEquals("hybrid", config.describe().get("sell_sizing"));
  }

  @Test
  void shouldRequireMinimumQuantityForHybridSizing() {
    LadderWorkerProperties properties = new LadderWorkerProperties();
    properties.setBuySizing("hybrid");

    LadderConfigurationException error =
        assertThrows(LadderConfigurationException.class, properties::toLadderConfig);
    assertTrue(error.getMessage().contains("minBaseOrderQty"));
  }

  @Test
  void shouldRejectMalformedSymbol() {
    LadderWorkerProperties properties = new LadderWorkerProperties();
    properties.setSymbol("BTCUSDT");

    LadderConfigurationException error =
        assertThrows(LadderConfigurationException.class, properties::toLadderConfig);
    assertTrue(error.getMessage().contains("ladder.symbol"));
  }
}
