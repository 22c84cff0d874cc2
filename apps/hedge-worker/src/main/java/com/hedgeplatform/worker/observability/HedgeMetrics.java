package com.hedgeplatform.worker.observability;

import com.hedgeplatform.domain.hedge.GateDecision;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.RebalanceCorrection;
import com.hedgeplatform.domain.hedge.SkipReason;
import com.hedgeplatform.domain.hedge.TradeOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Objects;

public class HedgeMetrics {
  private final MeterRegistry meterRegistry;

  public HedgeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
  }

  public void bindLedger(PositionLedger ledger) {
    Gauge.builder("hedge.ledger.imbalance.base", ledger, l -> l.cumulativeDiff().doubleValue())
        .description("Cumulative base-asset difference between the two legs")
        .register(meterRegistry);
    Gauge.builder("hedge.ledger.imbalance.value", ledger, l -> l.cumulativeDiffValue().doubleValue())
        .description("Leg imbalance valued at the reference price")
        .register(meterRegistry);
  }

  public void decision(GateDecision decision) {
    String reason = decision.isTrade() ? "none" : tagValue(decision.skipReason());
    meterRegistry
        .counter(
            "hedge.gate.decision.total",
            "outcome",
            decision.outcome().name().toLowerCase(Locale.ROOT),
            "reason",
            reason)
        .increment();
  }

  public void trade(TradeOutcome outcome) {
    meterRegistry.counter("hedge.trade.total", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
  }

  public void rebalance(RebalanceCorrection correction, String outcome) {
    meterRegistry
        .counter(
            "hedge.rebalance.total",
            "correction",
            correction.name().toLowerCase(Locale.ROOT),
            "outcome",
            outcome)
        .increment();
  }

  private static String tagValue(SkipReason reason) {
    return reason.name().toLowerCase(Locale.ROOT);
  }
}
