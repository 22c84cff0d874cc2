package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record GateDecision(
    Outcome outcome,
    SnapshotPair pair,
    HedgeDirection direction,
    BigDecimal quantity,
    BigDecimal spread,
    SkipReason skipReason,
    String reason) {
  public enum Outcome {
    TRADE,
    SKIP
  }

  public GateDecision {
    Objects.requireNonNull(outcome, "outcome must not be null");
    Objects.requireNonNull(pair, "pair must not be null");
    Objects.requireNonNull(direction, "direction must not be null");
    if (outcome == Outcome.TRADE && (quantity == null || quantity.signum() <= 0)) {
      throw new HedgeDomainException("trade decision requires quantity > 0");
    }
    if (outcome == Outcome.SKIP && skipReason == null) {
      throw new HedgeDomainException("skip decision requires a skip reason");
    }
  }

  static GateDecision trade(
      SnapshotPair pair, HedgeDirection direction, BigDecimal quantity, BigDecimal spread) {
    return new GateDecision(
        Outcome.TRADE,
        pair,
        direction,
        quantity,
        spread,
        null,
        "spread " + spread.toPlainString() + " with depth for " + quantity.toPlainString());
  }

  static GateDecision skip(
      SnapshotPair pair,
      HedgeDirection direction,
      BigDecimal spread,
      SkipReason skipReason,
      String detail) {
    return new GateDecision(
        Outcome.SKIP,
        pair,
        direction,
        BigDecimal.ZERO,
        spread,
        skipReason,
        skipReason.description() + " (" + detail + ")");
  }

  public boolean isTrade() {
    return outcome == Outcome.TRADE;
  }

  public TradeIntent toIntent(String tradeId, Instant createdAt) {
    if (!isTrade()) {
      throw new HedgeDomainException("cannot build a trade intent from a skip decision");
    }
    return new TradeIntent(
        tradeId,
        pair.instrument(),
        direction,
        quantity,
        direction.legAPrice(pair),
        direction.legBPrice(pair),
        spread,
        createdAt);
  }
}
