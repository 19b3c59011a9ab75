package com.laddertrader.worker.config;

import com.laddertrader.domain.orders.MarketSymbol;
import com.laddertrader.domain.orders.OrderDomainException;
import com.laddertrader.engine.ladder.LadderConfig;
import com.laddertrader.engine.ladder.LadderConfigurationException;
import com.laddertrader.engine.ladder.LadderVariant;
import com.laddertrader.engine.ladder.OrderSizing;
import com.laddertrader.engine.ladder.RunMode;
import com.laddertrader.engine.ladder.SizingMode;
import com.laddertrader.engine.ladder.StepMode;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ladder")
public class LadderWorkerProperties {
  private String symbol = "BTC_USDT";
  private LadderVariant variant = LadderVariant.BOUNDED;
  private StepMode stepMode = StepMode.PCT;
  private BigDecimal stepPct = new BigDecimal("0.01");
  private BigDecimal stepAbs;
  private int buyLevels = 5;
  private int sellLevels = 5;
  private BigDecimal baseOrderSize = new BigDecimal("0.001");
  private BigDecimal feeRate = new BigDecimal("0.002");
  private BigDecimal feeBuffer = new BigDecimal("0.0001");
  private BigDecimal minNotional = BigDecimal.ONE;
  private BigDecimal tickSize = BigDecimal.ZERO;
  private BigDecimal quantityStep = BigDecimal.ZERO;
  private String mode = RunMode.MONITOR.value();
  private boolean startupCancelAll;
  private int maxDeferredAttempts = 5;
  private String buySizing = SizingMode.FIXED.value();
  private String sellSizing = SizingMode.FIXED.value();
  private BigDecimal targetQuotePerOrder;
  private BigDecimal minBaseOrderQty;
  private boolean extendBuyLevelsOnRestart;
  private String statePath = "state/ladder-state.json";
  private long pollIntervalMs = 15000L;
  private boolean streamEnabled;
  private Backoff backoff = new Backoff();

  /**
   * @throws LadderConfigurationException when a setting is missing or out of range
   */
  public LadderConfig toLadderConfig() {
    MarketSymbol marketSymbol;
    try {
      marketSymbol = MarketSymbol.splitSymbol(symbol);
    } catch (OrderDomainException ex) {
      throw new LadderConfigurationException("ladder.symbol is invalid: " + ex.getMessage());
    }
    return new LadderConfig(
        marketSymbol,
        variant,
        stepMode,
        stepPct,
        stepAbs,
        buyLevels,
        sellLevels,
        baseOrderSize,
        feeRate,
        feeBuffer,
        minNotional,
        tickSize,
        quantityStep,
        RunMode.fromValue(mode),
        startupCancelAll,
        maxDeferredAttempts,
        new OrderSizing(
            SizingMode.fromValue(buySizing),
            SizingMode.fromValue(sellSizing),
            targetQuotePerOrder,
            minBaseOrderQty),
        extendBuyLevelsOnRestart);
  }

  public String getSymbol() {
    return symbol;
  }

  public void setSymbol(String symbol) {
    this.symbol = symbol;
  }

  public LadderVariant getVariant() {
    return variant;
  }

  public void setVariant(LadderVariant variant) {
    this.variant = variant;
  }

  public StepMode getStepMode() {
    return stepMode;
  }

  public void setStepMode(StepMode stepMode) {
    this.stepMode = stepMode;
  }

  public BigDecimal getStepPct() {
    return stepPct;
  }

  public void setStepPct(BigDecimal stepPct) {
    this.stepPct = stepPct;
  }

  public BigDecimal getStepAbs() {
    return stepAbs;
  }

  public void setStepAbs(BigDecimal stepAbs) {
    this.stepAbs = stepAbs;
  }

  public int getBuyLevels() {
    return buyLevels;
  }

  public void setBuyLevels(int buyLevels) {
    this.buyLevels = buyLevels;
  }

  public int getSellLevels() {
    return sellLevels;
  }

  public void setSellLevels(int sellLevels) {
    this.sellLevels = sellLevels;
  }

  public BigDecimal getBaseOrderSize() {
    return baseOrderSize;
  }

  public void setBaseOrderSize(BigDecimal baseOrderSize) {
    this.baseOrderSize = baseOrderSize;
  }

  public BigDecimal getFeeRate() {
    return feeRate;
  }

  public void setFeeRate(BigDecimal feeRate) {
    this.feeRate = feeRate;
  }

  public BigDecimal getFeeBuffer() {
    return feeBuffer;
  }

  public void setFeeBuffer(BigDecimal feeBuffer) {
    this.feeBuffer = feeBuffer;
  }

  public BigDecimal getMinNotional() {
    return minNotional;
  }

  public void setMinNotional(BigDecimal minNotional) {
    this.minNotional = minNotional;
  }

  public BigDecimal getTickSize() {
    return tickSize;
  }

  public void setTickSize(BigDecimal tickSize) {
    this.tickSize = tickSize;
  }

  public BigDecimal getQuantityStep() {
    return quantityStep;
  }

  public void setQuantityStep(BigDecimal quantityStep) {
    this.quantityStep = quantityStep;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public boolean isStartupCancelAll() {
    return startupCancelAll;
  }

  public void setStartupCancelAll(boolean startupCancelAll) {
    this.startupCancelAll = startupCancelAll;
  }

  public int getMaxDeferredAttempts() {
    return maxDeferredAttempts;
  }

  public void setMaxDeferredAttempts(int maxDeferredAttempts) {
    this.maxDeferredAttempts = maxDeferredAttempts;
  }

  public String getBuySizing() {
    return buySizing;
  }

  public void setBuySizing(String buySizing) {
    this.buySizing = buySizing;
  }

  public String getSellSizing() {
    return sellSizing;
  }

  public void setSellSizing(String sellSizing) {
    this.sellSizing = sellSizing;
  }

  public BigDecimal getTargetQuotePerOrder() {
    return targetQuotePerOrder;
  }

  public void setTargetQuotePerOrder(BigDecimal targetQuotePerOrder) {
    this.targetQuotePerOrder = targetQuotePerOrder;
  }

  public BigDecimal getMinBaseOrderQty() {
    return minBaseOrderQty;
  }

  public void setMinBaseOrderQty(BigDecimal minBaseOrderQty) {
    this.minBaseOrderQty = minBaseOrderQty;
  }

  public boolean isExtendBuyLevelsOnRestart() {
    return extendBuyLevelsOnRestart;
  }

  public void setExtendBuyLevelsOnRestart(boolean extendBuyLevelsOnRestart) {
    this.extendBuyLevelsOnRestart = extendBuyLevelsOnRestart;
  }

  public String getStatePath() {
    return statePath;
  }

  public void setStatePath(String statePath) {
    this.statePath = statePath;
  }

  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  public void setPollIntervalMs(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
  }

  public boolean isStreamEnabled() {
    return streamEnabled;
  }

  public void setStreamEnabled(boolean streamEnabled) {
    this.streamEnabled = streamEnabled;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public void setBackoff(Backoff backoff) {
    this.backoff = backoff;
  }

  /** Delay between reconciliation passes after consecutive failures. */
  public static class Backoff {
    private Duration base = Duration.ofSeconds(5);
    private Duration max = Duration.ofMinutes(5);

    public Duration getBase() {
      return base;
    }

    public void setBase(Duration base) {
      this.base = base;
    }

    public Duration getMax() {
      return max;
    }

    public void setMax(Duration max) {
      this.max = max;
    }
  }
}
