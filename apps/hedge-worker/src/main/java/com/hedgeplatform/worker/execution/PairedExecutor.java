package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.LegResult;
import com.hedgeplatform.domain.hedge.PairedTradeResult;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.TradeIntent;
import com.hedgeplatform.domain.hedge.TradeOutcome;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.worker.observability.HedgeMetrics;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes both legs of a trade intent concurrently and records the verified result.
 *
 * <p>Holds the execution lock for the whole trade, so no rebalance can interleave. A fatal venue
 * error on either leg is rethrown only after the trade has been recorded.
 */
public class PairedExecutor {
  private static final Logger log = LoggerFactory.getLogger(PairedExecutor.class);

  private final VenueAdapter venueA;
  private final VenueAdapter venueB;
  private final ExposureReader exposureReader;
  private final CollateralGuard collateralGuard;
  private final LegDispatcher dispatcher;
  private final PositionLedger ledger;
  private final ReentrantLock executionLock;
  private final Executor legPool;
  private final BigDecimal fillTolerance;
  private final HedgeMetrics metrics;

  public PairedExecutor(
      VenueAdapter venueA,
      VenueAdapter venueB,
      ExposureReader exposureReader,
      CollateralGuard collateralGuard,
      FillVerifier verifier,
      PositionLedger ledger,
      ReentrantLock executionLock,
      Executor legPool,
      BigDecimal fillTolerance,
      HedgeMetrics metrics) {
    this.venueA = Objects.requireNonNull(venueA, "venueA is required");
    this.venueB = Objects.requireNonNull(venueB, "venueB is required");
    this.exposureReader = Objects.requireNonNull(exposureReader, "exposureReader is required");
    this.collateralGuard = Objects.requireNonNull(collateralGuard, "collateralGuard is required");
    this.dispatcher = new LegDispatcher(Objects.requireNonNull(verifier, "verifier is required"));
    this.ledger = Objects.requireNonNull(ledger, "ledger is required");
    this.executionLock = Objects.requireNonNull(executionLock, "executionLock is required");
    this.legPool = Objects.requireNonNull(legPool, "legPool is required");
    this.fillTolerance = Objects.requireNonNull(fillTolerance, "fillTolerance is required");
    this.metrics = Objects.requireNonNull(metrics, "metrics is required");
  }

  /**
   * Once either order is out the trade is always recorded; a failed exposure read only leaves the
   * affected leg's fill unknown.
   *
   * @throws com.hedgeplatform.domain.hedge.InsufficientCollateralException before any order is sent
   * @throws FatalVenueException after the trade has been recorded
   */
  public PairedTradeResult execute(TradeIntent intent) {
    Objects.requireNonNull(intent, "intent is required");
    executionLock.lock();
    try {
      ExposureSnapshot before =
          collateralGuard.ensure(intent, exposureReader.capture(), exposureReader::capture);
      log.info(
          "Dispatching paired trade tradeId={} direction={} qty={} expectedSpread={}",
          intent.tradeId(),
          intent.direction(),
          intent.quantity().toPlainString(),
          intent.expectedSpread().toPlainString());

      CompletableFuture<LegAttempt> futureA =
          CompletableFuture.supplyAsync(
              () -> dispatcher.dispatch(venueA, intent.instrument(), intent.legASide(), intent.quantity()),
              legPool);
      CompletableFuture<LegAttempt> futureB =
          CompletableFuture.supplyAsync(
              () -> dispatcher.dispatch(venueB, intent.instrument(), intent.legBSide(), intent.quantity()),
              legPool);
      LegAttempt attemptA = futureA.join();
      LegAttempt attemptB = futureB.join();

      FatalVenueException fatal = firstFatal(attemptA, attemptB);
      ExposureSnapshot after = null;
      if (LegSettlement.needsExposureFallback(attemptA) || LegSettlement.needsExposureFallback(attemptB)) {
        try {
          after = exposureReader.capture();
        } catch (FatalVenueException ex) {
          fatal = fatal == null ? ex : fatal;
        } catch (RuntimeException ex) {
          log.warn(
              "Post-trade exposure read failed, fill unknown tradeId={}", intent.tradeId(), ex);
        }
      }

      LegResult legA = LegSettlement.resolve(attemptA, delta(before, after, true));
      LegResult legB = LegSettlement.resolve(attemptB, delta(before, after, false));
      boolean bothSettled =
          LegSettlement.isSettled(attemptA, legA) && LegSettlement.isSettled(attemptB, legB);
      TradeOutcome outcome = TradeOutcome.classify(legA, legB, fillTolerance, bothSettled);
      PairedTradeResult result =
          new PairedTradeResult(intent, legA, legB, outcome, detail(legA, legB));

      ledger.recordTrade(result);
      metrics.trade(outcome);
      log.info(
          "Paired trade settled tradeId={} outcome={} legAFilled={} legBFilled={} legASource={} legBSource={} imbalance={}",
          intent.tradeId(),
          outcome,
          legA.filledQuantity().toPlainString(),
          legB.filledQuantity().toPlainString(),
          legA.fillSource(),
          legB.fillSource(),
          ledger.cumulativeDiff().toPlainString());
      if (fatal != null) {
        throw fatal;
      }
      return result;
    } finally {
      executionLock.unlock();
    }
  }

  private static FatalVenueException firstFatal(LegAttempt a, LegAttempt b) {
    if (a.isFatal()) {
      return (FatalVenueException) a.error();
    }
    if (b.isFatal()) {
      return (FatalVenueException) b.error();
    }
    return null;
  }

  private static BigDecimal delta(ExposureSnapshot before, ExposureSnapshot after, boolean legA) {
    if (after == null) {
      return null;
    }
    return after.position(legA).subtract(before.position(legA));
  }

  private static String detail(LegResult legA, LegResult legB) {
    StringBuilder detail =
        new StringBuilder("legA=").append(legA.fillSource()).append(" legB=").append(legB.fillSource());
    if (legA.failure() != null) {
      detail.append(" legAFailure=").append(legA.failure());
    }
    if (legB.failure() != null) {
      detail.append(" legBFailure=").append(legB.failure());
    }
    return detail.toString();
  }
}
