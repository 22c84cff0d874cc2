package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Stateless trade/skip decision over a snapshot pair. */
public final class OpportunityGate {
  private final StrategyParameters parameters;

  public OpportunityGate(StrategyParameters parameters) {
    this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
  }

  public StrategyParameters parameters() {
    return parameters;
  }

  public GateDecision evaluate(SnapshotPair pair, Instant now) {
    Objects.requireNonNull(pair, "pair must not be null");
    Objects.requireNonNull(now, "now must not be null");
    HedgeDirection direction = parameters.direction();
    BigDecimal spread = direction.spread(pair);

    if (!pair.isFreshAt(now, parameters.maxSnapshotAge())) {
      return GateDecision.skip(
          pair,
          direction,
          spread,
          SkipReason.STALE_DATA,
          "oldest snapshot age " + pair.oldestAgeAt(now).toMillis() + "ms");
    }
    if (spread.abs().compareTo(parameters.maxAbsSpread()) > 0) {
      return GateDecision.skip(
          pair,
          direction,
          spread,
          SkipReason.ANOMALOUS_SPREAD,
          "spread " + spread.toPlainString() + " beyond " + parameters.maxAbsSpread().toPlainString());
    }
    if (spread.compareTo(parameters.minSpread()) < 0) {
      return GateDecision.skip(
          pair,
          direction,
          spread,
          SkipReason.SPREAD_BELOW_MINIMUM,
          "spread " + spread.toPlainString() + " < " + parameters.minSpread().toPlainString());
    }
    BigDecimal required = parameters.requiredDepth();
    BigDecimal depthA = direction.legADepth(pair);
    if (depthA.compareTo(required) < 0) {
      return GateDecision.skip(
          pair, direction, spread, SkipReason.INSUFFICIENT_DEPTH_A, depthDetail(pair.legA(), depthA, required));
    }
    BigDecimal depthB = direction.legBDepth(pair);
    if (depthB.compareTo(required) < 0) {
      return GateDecision.skip(
          pair, direction, spread, SkipReason.INSUFFICIENT_DEPTH_B, depthDetail(pair.legB(), depthB, required));
    }
    return GateDecision.trade(pair, direction, parameters.tradeSize(), spread);
  }

  private static String depthDetail(OrderBookSnapshot snapshot, BigDecimal depth, BigDecimal required) {
    return snapshot.venueId() + " top size " + depth.toPlainString() + " < " + required.toPlainString();
  }
}
