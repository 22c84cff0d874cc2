package com.hedgeplatform.integration.venue;

import java.math.BigDecimal;

public record AssetBalance(String asset, BigDecimal free, BigDecimal locked) {
  public AssetBalance {
    if (asset == null || asset.isBlank()) {
      throw new IllegalArgumentException("asset is required");
    }
    free = free == null ? BigDecimal.ZERO : free;
    locked = locked == null ? BigDecimal.ZERO : locked;
  }

  public BigDecimal total() {
    return free.add(locked);
  }
}
