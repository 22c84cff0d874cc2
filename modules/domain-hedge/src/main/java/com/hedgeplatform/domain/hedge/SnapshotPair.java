package com.hedgeplatform.domain.hedge;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record SnapshotPair(OrderBookSnapshot legA, OrderBookSnapshot legB, Instant pairedAt) {
  public SnapshotPair {
    Objects.requireNonNull(legA, "legA must not be null");
    Objects.requireNonNull(legB, "legB must not be null");
    Objects.requireNonNull(pairedAt, "pairedAt must not be null");
    if (!legA.instrument().equals(legB.instrument())) {
      throw new HedgeDomainException(
          "legs quote different instruments: " + legA.instrument() + " vs " + legB.instrument());
    }
  }

  public Instrument instrument() {
    return legA.instrument();
  }

  public Duration oldestAgeAt(Instant now) {
    Duration ageA = legA.ageAt(now);
    Duration ageB = legB.ageAt(now);
    return ageA.compareTo(ageB) >= 0 ? ageA : ageB;
  }

  /** Usable only while both snapshots are strictly younger than {@code maxAge}. */
  public boolean isFreshAt(Instant now, Duration maxAge) {
    return oldestAgeAt(now).compareTo(maxAge) < 0;
  }
}
