package com.hedgeplatform.worker.session;

import com.hedgeplatform.domain.hedge.GateDecision;
import com.hedgeplatform.domain.hedge.InsufficientCollateralException;
import com.hedgeplatform.domain.hedge.OpportunityGate;
import com.hedgeplatform.domain.hedge.PairedTradeResult;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.SnapshotPair;
import com.hedgeplatform.domain.hedge.TradeIntent;
import com.hedgeplatform.domain.hedge.TradeOutcome;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import com.hedgeplatform.worker.execution.PairedExecutor;
import com.hedgeplatform.worker.execution.RebalanceOutcome;
import com.hedgeplatform.worker.execution.Rebalancer;
import com.hedgeplatform.worker.feed.OrderBookAggregator;
import com.hedgeplatform.worker.observability.HedgeMetrics;
import com.hedgeplatform.worker.observability.SessionSummaryReporter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one hedging session: read the paired book, ask the gate, execute, rebalance when the
 * ledger drifts, and stop on the first stop condition.
 *
 * <p>{@link #run()} blocks the calling thread and may be called once. {@link #requestStop()} is
 * safe from any thread and lets an in-flight trade finish before the loop exits.
 */
public class HedgeSession {
  private static final Logger log = LoggerFactory.getLogger(HedgeSession.class);

  private final VenueAdapter venueA;
  private final VenueAdapter venueB;
  private final OrderBookAggregator aggregator;
  private final OpportunityGate gate;
  private final PairedExecutor executor;
  private final Rebalancer rebalancer;
  private final PositionLedger ledger;
  private final SessionSettings settings;
  private final HedgeMetrics metrics;
  private final SessionSummaryReporter reporter;
  private final Clock clock;
  private final Supplier<String> tradeIds;
  private final SlippageTracker slippage = new SlippageTracker();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final CountDownLatch finished = new CountDownLatch(1);

  private StopReason stopReason;
  private String stopDetail;
  private long decisions;
  private long skips;
  private long tradesAttempted;
  private long verifiedTrades;
  private long failedTrades;
  private long collateralFailures;
  private long rebalances;
  private long plannedTrades;
  private int consecutiveFailures;
  private int consecutiveCollateralFailures;

  public HedgeSession(
      VenueAdapter venueA,
      VenueAdapter venueB,
      OrderBookAggregator aggregator,
      OpportunityGate gate,
      PairedExecutor executor,
      Rebalancer rebalancer,
      PositionLedger ledger,
      SessionSettings settings,
      HedgeMetrics metrics,
      SessionSummaryReporter reporter,
      Clock clock) {
    this(
        venueA,
        venueB,
        aggregator,
        gate,
        executor,
        rebalancer,
        ledger,
        settings,
        metrics,
        reporter,
        clock,
        () -> "hx-" + UUID.randomUUID());
  }

  HedgeSession(
      VenueAdapter venueA,
      VenueAdapter venueB,
      OrderBookAggregator aggregator,
      OpportunityGate gate,
      PairedExecutor executor,
      Rebalancer rebalancer,
      PositionLedger ledger,
      SessionSettings settings,
      HedgeMetrics metrics,
      SessionSummaryReporter reporter,
      Clock clock,
      Supplier<String> tradeIds) {
    this.venueA = Objects.requireNonNull(venueA, "venueA is required");
    this.venueB = Objects.requireNonNull(venueB, "venueB is required");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
    this.gate = Objects.requireNonNull(gate, "gate is required");
    this.executor = Objects.requireNonNull(executor, "executor is required");
    this.rebalancer = Objects.requireNonNull(rebalancer, "rebalancer is required");
    this.ledger = Objects.requireNonNull(ledger, "ledger is required");
    this.settings = Objects.requireNonNull(settings, "settings is required");
    this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    this.reporter = Objects.requireNonNull(reporter, "reporter is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.tradeIds = Objects.requireNonNull(tradeIds, "tradeIds is required");
  }

  /**
   * Runs until a stop condition and returns the reported summary. The summary is reported on
   * every exit path, including unexpected failures.
   *
   * @throws HedgeSessionAbortedException when a venue reports a fatal error or the loop fails
   */
  public SessionSummary run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("hedge session can only run once");
    }
    try {
      return runSession();
    } finally {
      finished.countDown();
    }
  }

  private SessionSummary runSession() {
    Instant startedAt = clock.instant();
    RuntimeException failure = null;
    log.info(
        "Hedge session starting instrument={} direction={} venueA={} venueB={} targetTrades={} dryRun={}",
        ledger.instrument(),
        ledger.direction(),
        venueA.venueId(),
        venueB.venueId(),
        settings.targetTrades(),
        settings.dryRun());
    try {
      configureVenues();
      aggregator.start();
      loop();
    } catch (VenueConnectorException ex) {
      failure = ex;
      stop(StopReason.FATAL_VENUE_ERROR, ex.getMessage());
      log.error(
          "Hedge session aborting venue={} status={} code={}",
          ex.venueId(),
          ex.httpStatus(),
          ex.venueCode(),
          ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stop(StopReason.STOP_REQUESTED, "interrupted");
    } catch (RuntimeException ex) {
      failure = ex;
      stop(StopReason.INTERNAL_ERROR, ex.toString());
      log.error("Hedge session aborting on unexpected error", ex);
    } finally {
      aggregator.close();
    }

    SessionSummary summary = summarize(startedAt, clock.instant());
    reporter.report(summary);
    if (failure != null) {
      throw new HedgeSessionAbortedException(summary, failure);
    }
    return summary;
  }

  /**
   * Waits for {@link #run()} to report its summary. Returns at once when the session never
   * started.
   *
   * @return false when the timeout elapsed first
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    if (!started.get()) {
      return true;
    }
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Asks the loop to exit after the current step. Idempotent. */
  public void requestStop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    log.info("Hedge session stop requested");
    stopSignal.countDown();
    aggregator.close();
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  private void configureVenues() {
    if (settings.dryRun()) {
      log.info("Dry run: skipping leverage setup leverage={}", settings.leverage().leverage());
      return;
    }
    venueA.configureInstrument(ledger.instrument(), settings.leverage());
    venueB.configureInstrument(ledger.instrument(), settings.leverage());
  }

  private void loop() throws InterruptedException {
    Optional<SnapshotPair> current = aggregator.latest();
    while (stopReason == null) {
      if (stopRequested.get()) {
        stop(StopReason.STOP_REQUESTED, "stop requested");
        break;
      }
      if (current.isEmpty()) {
        current = aggregator.awaitUpdate(settings.idleWait());
        continue;
      }

      SnapshotPair pair = current.get();
      ledger.markPrice(pair.legA().midPrice());
      GateDecision decision = gate.evaluate(pair, clock.instant());
      decisions++;
      metrics.decision(decision);
      if (!decision.isTrade()) {
        skips++;
        log.debug("Skipping opportunity reason={} detail={}", decision.skipReason(), decision.reason());
        current = aggregator.awaitUpdate(settings.idleWait());
        continue;
      }

      TradeIntent intent = decision.toIntent(tradeIds.get(), clock.instant());
      if (settings.dryRun()) {
        plan(intent);
      } else {
        trade(intent);
      }
      if (stopReason != null) {
        break;
      }
      if (stopSignal.await(settings.tradeCooldown().toMillis(), TimeUnit.MILLISECONDS)) {
        continue;
      }
      current = aggregator.latest();
    }
  }

  private void plan(TradeIntent intent) {
    plannedTrades++;
    log.info(
        "Dry run: would trade tradeId={} direction={} qty={} legAPrice={} legBPrice={} spread={}",
        intent.tradeId(),
        intent.direction(),
        intent.quantity().toPlainString(),
        intent.expectedLegAPrice().toPlainString(),
        intent.expectedLegBPrice().toPlainString(),
        intent.expectedSpread().toPlainString());
    if (settings.isBounded() && plannedTrades >= settings.targetTrades()) {
      stop(StopReason.DRY_RUN_COMPLETE, plannedTrades + " trades planned");
    }
  }

  private void trade(TradeIntent intent) {
    tradesAttempted++;
    try {
      PairedTradeResult result = executor.execute(intent);
      slippage.record(result);
      if (result.outcome() == TradeOutcome.VERIFIED) {
        verifiedTrades++;
        consecutiveFailures = 0;
      } else {
        failedTrades++;
        consecutiveFailures++;
        log.warn(
            "Trade not verified tradeId={} outcome={} detail={}",
            result.tradeId(),
            result.outcome(),
            result.detail());
      }
      consecutiveCollateralFailures = 0;
    } catch (InsufficientCollateralException ex) {
      collateralFailures++;
      consecutiveFailures++;
      consecutiveCollateralFailures++;
      log.warn(
          "Trade skipped for collateral tradeId={} venue={} asset={} required={} available={}",
          intent.tradeId(),
          ex.venueId(),
          ex.asset(),
          ex.required().toPlainString(),
          ex.available().toPlainString());
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      failedTrades++;
      consecutiveFailures++;
      consecutiveCollateralFailures = 0;
      log.warn("Trade failed before dispatch tradeId={} venue={}", intent.tradeId(), ex.venueId(), ex);
    }

    rebalanceIfNeeded();
    checkStopConditions();
  }

  private void rebalanceIfNeeded() {
    if (!ledger.needsRebalance()) {
      return;
    }
    try {
      RebalanceOutcome outcome = rebalancer.run();
      if (outcome.isCorrection()) {
        rebalances++;
      }
      if (outcome.status() == RebalanceOutcome.Status.FAILED) {
        log.warn("Rebalance failed detail={}", outcome.detail());
      }
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      log.warn("Rebalance could not start venue={}", ex.venueId(), ex);
    }
  }

  private void checkStopConditions() {
    int limit = settings.maxConsecutiveFailures();
    if (consecutiveCollateralFailures >= limit) {
      stop(StopReason.COLLATERAL_EXHAUSTED, consecutiveCollateralFailures + " consecutive collateral failures");
    } else if (consecutiveFailures >= limit) {
      stop(StopReason.CONSECUTIVE_FAILURES, consecutiveFailures + " consecutive failed trades");
    } else if (settings.isBounded() && verifiedTrades >= settings.targetTrades()) {
      stop(StopReason.TARGET_REACHED, verifiedTrades + " verified trades");
    }
  }

  private void stop(StopReason reason, String detail) {
    if (stopReason != null) {
      return;
    }
    stopReason = reason;
    stopDetail = detail;
    log.info("Hedge session stopping reason={} detail={}", reason, detail);
  }

  private SessionSummary summarize(Instant startedAt, Instant endedAt) {
    return new SessionSummary(
        stopReason,
        stopDetail,
        ledger.instrument(),
        ledger.direction(),
        settings.dryRun(),
        startedAt,
        endedAt,
        decisions,
        skips,
        tradesAttempted,
        verifiedTrades,
        failedTrades,
        collateralFailures,
        rebalances,
        plannedTrades,
        ledger.snapshot(),
        slippage.legA(),
        slippage.legB(),
        slippage.spread());
  }
}
