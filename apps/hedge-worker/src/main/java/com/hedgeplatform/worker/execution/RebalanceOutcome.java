package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.RebalanceOrder;

public record RebalanceOutcome(Status status, RebalanceOrder order, String detail) {
  public enum Status {
    NOT_NEEDED,
    FILLED,
    FAILED
  }

  static RebalanceOutcome notNeeded(String detail) {
    return new RebalanceOutcome(Status.NOT_NEEDED, null, detail);
  }

  public boolean isCorrection() {
    return status != Status.NOT_NEEDED;
  }
}
