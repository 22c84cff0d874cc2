package com.hedgeplatform.worker.feed;

import java.time.Duration;
import java.util.Objects;

public record FeedSettings(
    Duration maxSnapshotAge,
    Duration stallTimeout,
    Duration resubscribeBaseBackoff,
    Duration resubscribeMaxBackoff) {
  public FeedSettings {
    requirePositive(maxSnapshotAge, "maxSnapshotAge");
    requirePositive(stallTimeout, "stallTimeout");
    requirePositive(resubscribeBaseBackoff, "resubscribeBaseBackoff");
    requirePositive(resubscribeMaxBackoff, "resubscribeMaxBackoff");
    if (resubscribeMaxBackoff.compareTo(resubscribeBaseBackoff) < 0) {
      throw new IllegalArgumentException("resubscribeMaxBackoff must be >= resubscribeBaseBackoff");
    }
  }

  /** Doubling delay for the given consecutive failure count, capped at the maximum. */
  public Duration resubscribeDelay(int failures) {
    if (failures <= 1) {
      return resubscribeBaseBackoff;
    }
    int exponent = Math.min(failures - 1, 20);
    long millis = resubscribeBaseBackoff.toMillis() * (1L << exponent);
    return millis >= resubscribeMaxBackoff.toMillis() ? resubscribeMaxBackoff : Duration.ofMillis(millis);
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name + " is required");
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }
}
