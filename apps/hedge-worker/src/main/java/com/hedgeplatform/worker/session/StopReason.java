package com.hedgeplatform.worker.session;

public enum StopReason {
  TARGET_REACHED,
  COLLATERAL_EXHAUSTED,
  CONSECUTIVE_FAILURES,
  STOP_REQUESTED,
  DRY_RUN_COMPLETE,
  FATAL_VENUE_ERROR,
  /** A failure outside the venue error model, such as a bug or a malformed local state. */
  INTERNAL_ERROR;

  public boolean isFailure() {
    return this == FATAL_VENUE_ERROR || this == INTERNAL_ERROR;
  }
}
