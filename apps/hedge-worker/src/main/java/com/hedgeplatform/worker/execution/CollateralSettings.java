package com.hedgeplatform.worker.execution;

import java.math.BigDecimal;

public record CollateralSettings(
    BigDecimal spotBuffer, BigDecimal marginBuffer, BigDecimal redeemBuffer, int leverage) {
  public CollateralSettings {
    requireAtLeastOne(spotBuffer, "spotBuffer");
    requireAtLeastOne(marginBuffer, "marginBuffer");
    requireAtLeastOne(redeemBuffer, "redeemBuffer");
    if (leverage < 1) {
      throw new IllegalArgumentException("leverage must be >= 1");
    }
  }

  private static void requireAtLeastOne(BigDecimal value, String name) {
    if (value == null || value.compareTo(BigDecimal.ONE) < 0) {
      throw new IllegalArgumentException(name + " must be >= 1");
    }
  }
}
