package com.hedgeplatform.worker.config;

import com.hedgeplatform.domain.hedge.HedgeDirection;
import com.hedgeplatform.integration.venue.MarginMode;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hedge.strategy")
public class HedgeStrategyProperties {
  private String instrument = "BTC/USDT";
  private HedgeDirection direction = HedgeDirection.OPEN;
  private BigDecimal minSpread = new BigDecimal("0.001");
  private BigDecimal maxAbsSpread = new BigDecimal("0.10");
  private BigDecimal depthMultiplier = new BigDecimal("2.0");
  private BigDecimal tradeSize = new BigDecimal("0.001");
  private BigDecimal rebalanceThreshold = new BigDecimal("6");
  private int leverage = 20;
  private MarginMode marginMode = MarginMode.CROSSED;
  private int maxConsecutiveFailures = 3;
  private int targetTrades = 1;
  private BigDecimal fillTolerance = new BigDecimal("0.01");
  private int quantityScale = 6;
  private boolean dryRun = false;

  public String getInstrument() {
    return instrument;
  }

  public void setInstrument(String instrument) {
    this.instrument = instrument;
  }

  public HedgeDirection getDirection() {
    return direction;
  }

  public void setDirection(HedgeDirection direction) {
    this.direction = direction;
  }

  public BigDecimal getMinSpread() {
    return minSpread;
  }

  public void setMinSpread(BigDecimal minSpread) {
    this.minSpread = minSpread;
  }

  public BigDecimal getMaxAbsSpread() {
    return maxAbsSpread;
  }

  public void setMaxAbsSpread(BigDecimal maxAbsSpread) {
    this.maxAbsSpread = maxAbsSpread;
  }

  public BigDecimal getDepthMultiplier() {
    return depthMultiplier;
  }

  public void setDepthMultiplier(BigDecimal depthMultiplier) {
    this.depthMultiplier = depthMultiplier;
  }

  public BigDecimal getTradeSize() {
    return tradeSize;
  }

  public void setTradeSize(BigDecimal tradeSize) {
    this.tradeSize = tradeSize;
  }

  public BigDecimal getRebalanceThreshold() {
    return rebalanceThreshold;
  }

  public void setRebalanceThreshold(BigDecimal rebalanceThreshold) {
    this.rebalanceThreshold = rebalanceThreshold;
  }

  public int getLeverage() {
    return leverage;
  }

  public void setLeverage(int leverage) {
    this.leverage = leverage;
  }

  public MarginMode getMarginMode() {
    return marginMode;
  }

  public void setMarginMode(MarginMode marginMode) {
    this.marginMode = marginMode;
  }

  public int getMaxConsecutiveFailures() {
    return maxConsecutiveFailures;
  }

  public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  public int getTargetTrades() {
    return targetTrades;
  }

  public void setTargetTrades(int targetTrades) {
    this.targetTrades = targetTrades;
  }

  public BigDecimal getFillTolerance() {
    return fillTolerance;
  }

  public void setFillTolerance(BigDecimal fillTolerance) {
    this.fillTolerance = fillTolerance;
  }

  public int getQuantityScale() {
    return quantityScale;
  }

  public void setQuantityScale(int quantityScale) {
    this.quantityScale = quantityScale;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }
}
