package com.hedgeplatform.worker.observability;

import com.hedgeplatform.worker.session.SessionSummary;
import com.hedgeplatform.worker.session.SlippageStats;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingSessionSummaryReporter implements SessionSummaryReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingSessionSummaryReporter.class);

  @Override
  public void report(SessionSummary summary) {
    String message =
        "Hedge session finished stopReason={} detail={} instrument={} direction={} dryRun={} durationMs={} "
            + "decisions={} skips={} attempted={} verified={} failed={} collateralFailures={} "
            + "rebalances={} planned={} ledgerState={} imbalance={} imbalanceValue={} "
            + "legASlippage={} legBSlippage={} spreadSlippage={}";
    Object[] args = {
      summary.stopReason(),
      summary.stopDetail(),
      summary.instrument(),
      summary.direction(),
      summary.dryRun(),
      summary.duration().toMillis(),
      summary.decisions(),
      summary.skips(),
      summary.tradesAttempted(),
      summary.verifiedTrades(),
      summary.failedTrades(),
      summary.collateralFailures(),
      summary.rebalances(),
      summary.plannedTrades(),
      summary.ledger().state(),
      summary.ledger().cumulativeDiff().toPlainString(),
      summary.ledger().cumulativeDiffValue().toPlainString(),
      format(summary.legASlippage()),
      format(summary.legBSlippage()),
      format(summary.spreadSlippage())
    };
    if (summary.stopReason().isFailure()) {
      log.error(message, args);
    } else {
      log.info(message, args);
    }
  }

  static String format(SlippageStats stats) {
    if (stats.count() == 0) {
      return "n=0";
    }
    return "n="
        + stats.count()
        + "/mean="
        + plain(stats.mean())
        + "/min="
        + plain(stats.min())
        + "/max="
        + plain(stats.max());
  }

  private static String plain(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }
}
