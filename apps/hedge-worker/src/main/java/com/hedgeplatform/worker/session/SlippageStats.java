package com.hedgeplatform.worker.session;

import java.math.BigDecimal;

/** Min and max are null until the first sample. */
public record SlippageStats(long count, BigDecimal mean, BigDecimal min, BigDecimal max) {
  public static SlippageStats empty() {
    return new SlippageStats(0L, BigDecimal.ZERO, null, null);
  }
}
