package com.hedgeplatform.domain.hedge;

public enum OrderState {
  NEW,
  PARTIALLY_FILLED,
  FILLED,
  PARTIALLY_FILLED_CLOSED,
  CANCELED,
  REJECTED,
  UNKNOWN;

  public boolean isTerminal() {
    return this == FILLED
        || this == PARTIALLY_FILLED_CLOSED
        || this == CANCELED
        || this == REJECTED;
  }
}
