package com.hedgeplatform.domain.hedge;

import java.util.Objects;

public record PairedTradeResult(
    TradeIntent intent, LegResult legA, LegResult legB, TradeOutcome outcome, String detail) {
  public PairedTradeResult {
    Objects.requireNonNull(intent, "intent must not be null");
    Objects.requireNonNull(legA, "legA must not be null");
    Objects.requireNonNull(legB, "legB must not be null");
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (legA.side() != intent.legASide() || legB.side() != intent.legBSide()) {
      throw new HedgeDomainException("leg sides do not match the trade direction");
    }
  }

  public String tradeId() {
    return intent.tradeId();
  }

  public boolean hasAnyFill() {
    return legA.isFilled() || legB.isFilled();
  }
}
