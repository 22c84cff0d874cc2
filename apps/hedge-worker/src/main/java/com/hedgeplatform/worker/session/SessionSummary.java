package com.hedgeplatform.worker.session;

import com.hedgeplatform.domain.hedge.HedgeDirection;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.LedgerSnapshot;
import java.time.Duration;
import java.time.Instant;

public record SessionSummary(
    StopReason stopReason,
    String stopDetail,
    Instrument instrument,
    HedgeDirection direction,
    boolean dryRun,
    Instant startedAt,
    Instant endedAt,
    long decisions,
    long skips,
    long tradesAttempted,
    long verifiedTrades,
    long failedTrades,
    long collateralFailures,
    long rebalances,
    long plannedTrades,
    LedgerSnapshot ledger,
    SlippageStats legASlippage,
    SlippageStats legBSlippage,
    SlippageStats spreadSlippage) {
  public Duration duration() {
    return Duration.between(startedAt, endedAt);
  }
}
