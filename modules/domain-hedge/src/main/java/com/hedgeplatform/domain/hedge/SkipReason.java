package com.hedgeplatform.domain.hedge;

public enum SkipReason {
  STALE_DATA("stale data"),
  ANOMALOUS_SPREAD("anomalous spread"),
  SPREAD_BELOW_MINIMUM("spread below minimum"),
  INSUFFICIENT_DEPTH_A("insufficient depth on venue A"),
  INSUFFICIENT_DEPTH_B("insufficient depth on venue B");

  private final String description;

  SkipReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
