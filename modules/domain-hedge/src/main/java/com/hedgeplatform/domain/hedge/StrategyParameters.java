package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

public record StrategyParameters(
    HedgeDirection direction,
    BigDecimal minSpread,
    BigDecimal maxAbsSpread,
    BigDecimal depthMultiplier,
    BigDecimal tradeSize,
    Duration maxSnapshotAge) {
  public StrategyParameters {
    Objects.requireNonNull(direction, "direction must not be null");
    Objects.requireNonNull(minSpread, "minSpread must not be null");
    requirePositive(maxAbsSpread, "maxAbsSpread");
    requirePositive(depthMultiplier, "depthMultiplier");
    requirePositive(tradeSize, "tradeSize");
    Objects.requireNonNull(maxSnapshotAge, "maxSnapshotAge must not be null");
    if (maxSnapshotAge.isZero() || maxSnapshotAge.isNegative()) {
      throw new HedgeDomainException("maxSnapshotAge must be > 0");
    }
  }

  public BigDecimal requiredDepth() {
    return tradeSize.multiply(depthMultiplier);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new HedgeDomainException(fieldName + " must be > 0");
    }
  }
}
