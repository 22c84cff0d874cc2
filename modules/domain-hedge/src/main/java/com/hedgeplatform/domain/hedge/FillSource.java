package com.hedgeplatform.domain.hedge;

public enum FillSource {
  STATUS_REPORT,
  BALANCE_DELTA,
  NONE
}
