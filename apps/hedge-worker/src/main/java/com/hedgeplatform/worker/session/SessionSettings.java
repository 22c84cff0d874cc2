package com.hedgeplatform.worker.session;

import com.hedgeplatform.integration.venue.LeverageSettings;
import java.time.Duration;
import java.util.Objects;

/** {@code targetTrades == 0} runs until stopped. */
public record SessionSettings(
    LeverageSettings leverage,
    Duration idleWait,
    Duration tradeCooldown,
    int maxConsecutiveFailures,
    int targetTrades,
    boolean dryRun) {
  public SessionSettings {
    Objects.requireNonNull(leverage, "leverage is required");
    Objects.requireNonNull(idleWait, "idleWait is required");
    Objects.requireNonNull(tradeCooldown, "tradeCooldown is required");
    if (idleWait.isNegative() || tradeCooldown.isNegative()) {
      throw new IllegalArgumentException("session durations must not be negative");
    }
    if (maxConsecutiveFailures < 1) {
      throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1");
    }
    if (targetTrades < 0) {
      throw new IllegalArgumentException("targetTrades must be >= 0");
    }
  }

  public boolean isBounded() {
    return targetTrades > 0;
  }
}
