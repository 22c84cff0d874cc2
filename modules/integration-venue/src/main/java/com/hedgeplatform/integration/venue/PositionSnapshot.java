package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.Instrument;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Signed base-asset position: positive is long, negative is short. */
public record PositionSnapshot(
    String venueId, Instrument instrument, BigDecimal quantity, BigDecimal entryPrice, Instant capturedAt) {
  public PositionSnapshot {
    Objects.requireNonNull(venueId, "venueId must not be null");
    Objects.requireNonNull(instrument, "instrument must not be null");
    quantity = quantity == null ? BigDecimal.ZERO : quantity;
    Objects.requireNonNull(capturedAt, "capturedAt must not be null");
  }

  public BigDecimal shortQuantity() {
    return quantity.signum() < 0 ? quantity.negate() : BigDecimal.ZERO;
  }
}
