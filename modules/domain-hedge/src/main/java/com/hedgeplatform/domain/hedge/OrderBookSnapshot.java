package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record OrderBookSnapshot(
    String venueId,
    Instrument instrument,
    BigDecimal bidPrice,
    BigDecimal bidSize,
    BigDecimal askPrice,
    BigDecimal askSize,
    Instant capturedAt) {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  public OrderBookSnapshot {
    if (venueId == null || venueId.isBlank()) {
      throw new HedgeDomainException("venueId must not be blank");
    }
    Objects.requireNonNull(instrument, "instrument must not be null");
    requirePositive(bidPrice, "bidPrice");
    requireNonNegative(bidSize, "bidSize");
    requirePositive(askPrice, "askPrice");
    requireNonNegative(askSize, "askSize");
    Objects.requireNonNull(capturedAt, "capturedAt must not be null");
  }

  public Duration ageAt(Instant now) {
    Duration age = Duration.between(capturedAt, now);
    return age.isNegative() ? Duration.ZERO : age;
  }

  public BigDecimal midPrice() {
    return bidPrice.add(askPrice).divide(TWO, MathContext.DECIMAL64);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new HedgeDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new HedgeDomainException(fieldName + " must be >= 0");
    }
  }
}
