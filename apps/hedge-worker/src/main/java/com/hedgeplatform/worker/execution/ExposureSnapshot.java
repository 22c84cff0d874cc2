package com.hedgeplatform.worker.execution;

import com.hedgeplatform.integration.venue.PositionSnapshot;
import com.hedgeplatform.integration.venue.VenueBalances;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Balances and signed base positions on both venues at one point in time. */
public record ExposureSnapshot(
    VenueBalances balancesA,
    PositionSnapshot positionA,
    VenueBalances balancesB,
    PositionSnapshot positionB,
    Instant capturedAt) {
  public ExposureSnapshot {
    Objects.requireNonNull(balancesA, "balancesA must not be null");
    Objects.requireNonNull(positionA, "positionA must not be null");
    Objects.requireNonNull(balancesB, "balancesB must not be null");
    Objects.requireNonNull(positionB, "positionB must not be null");
    Objects.requireNonNull(capturedAt, "capturedAt must not be null");
  }

  public BigDecimal position(boolean legA) {
    return legA ? positionA.quantity() : positionB.quantity();
  }
}
