package com.hedgeplatform.domain.hedge;

public enum OrderSide {
  BUY,
  SELL;

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }

  /** +1 when the side adds base-asset exposure, -1 when it removes it. */
  public int exposureSign() {
    return this == BUY ? 1 : -1;
  }
}
