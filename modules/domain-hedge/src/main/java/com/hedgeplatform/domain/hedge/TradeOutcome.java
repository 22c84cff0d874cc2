package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.math.MathContext;

public enum TradeOutcome {
  VERIFIED,
  FILL_MISMATCH,
  ONE_LEG_FAILED,
  BOTH_LEGS_FAILED;

  public boolean isFailure() {
    return this != VERIFIED;
  }

  public static TradeOutcome classify(
      LegResult legA, LegResult legB, BigDecimal tolerance, boolean bothSettled) {
    if (!legA.isFilled() && !legB.isFilled()) {
      return BOTH_LEGS_FAILED;
    }
    if (!legA.isFilled() || !legB.isFilled()) {
      return ONE_LEG_FAILED;
    }
    if (!bothSettled) {
      return FILL_MISMATCH;
    }
    BigDecimal difference =
        relativeDifference(legA.filledQuantity(), legB.filledQuantity());
    return difference.compareTo(tolerance) <= 0 ? VERIFIED : FILL_MISMATCH;
  }

  /** {@code |a - b| / max(a, b)}, zero when both are zero. */
  public static BigDecimal relativeDifference(BigDecimal a, BigDecimal b) {
    BigDecimal larger = a.max(b);
    if (larger.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return a.subtract(b).abs().divide(larger, MathContext.DECIMAL64);
  }
}
