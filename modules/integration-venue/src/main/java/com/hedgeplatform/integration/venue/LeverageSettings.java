package com.hedgeplatform.integration.venue;

import java.util.Objects;

public record LeverageSettings(int leverage, MarginMode marginMode) {
  public LeverageSettings {
    if (leverage < 1 || leverage > 125) {
      throw new IllegalArgumentException("leverage must be between 1 and 125");
    }
    Objects.requireNonNull(marginMode, "marginMode must not be null");
  }
}
