package com.hedgeplatform.domain.hedge;

public enum LedgerState {
  IDLE,
  ACCUMULATING,
  REBALANCE_PENDING
}
