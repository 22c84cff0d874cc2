package com.hedgeplatform.domain.hedge;

public enum RebalanceCorrection {
  /** Buy on the spot venue (A) to cover a net short. */
  BUY_SPOT(OrderSide.BUY, true),
  /** Sell on the perpetual venue (B) to cover a net long. */
  OPEN_SHORT(OrderSide.SELL, false);

  private final OrderSide side;
  private final boolean spotLeg;

  RebalanceCorrection(OrderSide side, boolean spotLeg) {
    this.side = side;
    this.spotLeg = spotLeg;
  }

  public OrderSide side() {
    return side;
  }

  public boolean isSpotLeg() {
    return spotLeg;
  }
}
