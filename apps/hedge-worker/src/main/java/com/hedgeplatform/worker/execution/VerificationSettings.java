package com.hedgeplatform.worker.execution;

import java.time.Duration;
import java.util.Objects;

public record VerificationSettings(Duration pollInterval, Duration maxWait) {
  public VerificationSettings {
    Objects.requireNonNull(pollInterval, "pollInterval is required");
    Objects.requireNonNull(maxWait, "maxWait is required");
    if (pollInterval.isNegative() || maxWait.isNegative()) {
      throw new IllegalArgumentException("verification durations must not be negative");
    }
  }

  /** Number of status reads before giving up; at least one. */
  public int maxPolls() {
    if (pollInterval.isZero()) {
      return 1;
    }
    return (int) Math.max(1L, maxWait.toMillis() / Math.max(1L, pollInterval.toMillis()) + 1L);
  }
}
