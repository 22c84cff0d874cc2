package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Venue A always carries the spot leg and venue B the perpetual short.
 *
 * <p>OPEN buys spot on A and sells the perpetual on B. CLOSE sells spot on A and buys the
 * perpetual back on B.
 */
public enum HedgeDirection {
  OPEN(OrderSide.BUY, OrderSide.SELL),
  CLOSE(OrderSide.SELL, OrderSide.BUY);

  private final OrderSide legASide;
  private final OrderSide legBSide;

  HedgeDirection(OrderSide legASide, OrderSide legBSide) {
    this.legASide = legASide;
    this.legBSide = legBSide;
  }

  public OrderSide legASide() {
    return legASide;
  }

  public OrderSide legBSide() {
    return legBSide;
  }

  public BigDecimal legAPrice(SnapshotPair pair) {
    return legASide == OrderSide.BUY ? pair.legA().askPrice() : pair.legA().bidPrice();
  }

  public BigDecimal legBPrice(SnapshotPair pair) {
    return legBSide == OrderSide.BUY ? pair.legB().askPrice() : pair.legB().bidPrice();
  }

  public BigDecimal legADepth(SnapshotPair pair) {
    return legASide == OrderSide.BUY ? pair.legA().askSize() : pair.legA().bidSize();
  }

  public BigDecimal legBDepth(SnapshotPair pair) {
    return legBSide == OrderSide.BUY ? pair.legB().askSize() : pair.legB().bidSize();
  }

  /** Relative edge of the side we sell over the side we buy, measured against the buy price. */
  public BigDecimal spread(SnapshotPair pair) {
    BigDecimal sellPrice = legASide == OrderSide.SELL ? legAPrice(pair) : legBPrice(pair);
    BigDecimal buyPrice = legASide == OrderSide.BUY ? legAPrice(pair) : legBPrice(pair);
    return spread(sellPrice, buyPrice);
  }

  public BigDecimal realizedSpread(BigDecimal legAAveragePrice, BigDecimal legBAveragePrice) {
    BigDecimal sellPrice = legASide == OrderSide.SELL ? legAAveragePrice : legBAveragePrice;
    BigDecimal buyPrice = legASide == OrderSide.BUY ? legAAveragePrice : legBAveragePrice;
    return spread(sellPrice, buyPrice);
  }

  /**
   * Net base exposure added per unit of {@code cumulative_diff}: OPEN turns a positive diff into a
   * net short, CLOSE into a net long.
   */
  public int exposurePerDiff() {
    return this == OPEN ? -1 : 1;
  }

  private static BigDecimal spread(BigDecimal sellPrice, BigDecimal buyPrice) {
    return sellPrice.subtract(buyPrice).divide(buyPrice, MathContext.DECIMAL64);
  }
}
