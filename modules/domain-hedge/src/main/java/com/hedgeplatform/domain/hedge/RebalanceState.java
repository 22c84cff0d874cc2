package com.hedgeplatform.domain.hedge;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum RebalanceState {
  CREATED,
  SUBMITTED,
  FILLED,
  FAILED;

  private static final Map<RebalanceState, Set<RebalanceState>> ALLOWED =
      new EnumMap<>(RebalanceState.class);

  static {
    ALLOWED.put(CREATED, EnumSet.of(SUBMITTED, FAILED));
    ALLOWED.put(SUBMITTED, EnumSet.of(FILLED, FAILED));
    ALLOWED.put(FILLED, EnumSet.noneOf(RebalanceState.class));
    ALLOWED.put(FAILED, EnumSet.noneOf(RebalanceState.class));
  }

  public boolean isTerminal() {
    return this == FILLED || this == FAILED;
  }

  public boolean canTransitionTo(RebalanceState next) {
    return next != null && ALLOWED.get(this).contains(next);
  }

  public void validateTransition(RebalanceState next) {
    if (!canTransitionTo(next)) {
      throw new HedgeDomainException("Invalid rebalance transition: " + this + " -> " + next);
    }
  }
}
