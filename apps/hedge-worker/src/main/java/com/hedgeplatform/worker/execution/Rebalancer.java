package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.LegResult;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.RebalanceCorrection;
import com.hedgeplatform.domain.hedge.RebalanceOrder;
import com.hedgeplatform.domain.hedge.RebalanceState;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.worker.observability.HedgeMetrics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends one market order on the correcting venue when the ledger imbalance crosses its threshold. */
public class Rebalancer {
  private static final Logger log = LoggerFactory.getLogger(Rebalancer.class);

  private final VenueAdapter venueA;
  private final VenueAdapter venueB;
  private final PositionLedger ledger;
  private final ExposureReader exposureReader;
  private final LegDispatcher dispatcher;
  private final ReentrantLock executionLock;
  private final int quantityScale;
  private final HedgeMetrics metrics;
  private final Clock clock;
  private final Supplier<String> ids;

  public Rebalancer(
      VenueAdapter venueA,
      VenueAdapter venueB,
      PositionLedger ledger,
      ExposureReader exposureReader,
      FillVerifier verifier,
      ReentrantLock executionLock,
      int quantityScale,
      HedgeMetrics metrics,
      Clock clock) {
    this(
        venueA,
        venueB,
        ledger,
        exposureReader,
        verifier,
        executionLock,
        quantityScale,
        metrics,
        clock,
        () -> "rb-" + UUID.randomUUID());
  }

  Rebalancer(
      VenueAdapter venueA,
      VenueAdapter venueB,
      PositionLedger ledger,
      ExposureReader exposureReader,
      FillVerifier verifier,
      ReentrantLock executionLock,
      int quantityScale,
      HedgeMetrics metrics,
      Clock clock,
      Supplier<String> ids) {
    this.venueA = Objects.requireNonNull(venueA, "venueA is required");
    this.venueB = Objects.requireNonNull(venueB, "venueB is required");
    this.ledger = Objects.requireNonNull(ledger, "ledger is required");
    this.exposureReader = Objects.requireNonNull(exposureReader, "exposureReader is required");
    this.dispatcher = new LegDispatcher(Objects.requireNonNull(verifier, "verifier is required"));
    this.executionLock = Objects.requireNonNull(executionLock, "executionLock is required");
    if (quantityScale < 0) {
      throw new IllegalArgumentException("quantityScale must be >= 0");
    }
    this.quantityScale = quantityScale;
    this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.ids = Objects.requireNonNull(ids, "ids is required");
  }

  /**
   * Re-checks the ledger under the execution lock, so calling this when nothing is pending is a
   * no-op.
   *
   * @throws FatalVenueException after the failed correction has been recorded
   */
  public RebalanceOutcome run() {
    executionLock.lock();
    try {
      if (!ledger.needsRebalance()) {
        return RebalanceOutcome.notNeeded("imbalance below threshold");
      }
      RebalanceCorrection correction = ledger.directionToCorrect();
      BigDecimal quantity = ledger.cumulativeDiff().abs().setScale(quantityScale, RoundingMode.DOWN);
      if (quantity.signum() == 0) {
        log.debug(
            "Imbalance below order precision diff={} scale={}",
            ledger.cumulativeDiff().toPlainString(),
            quantityScale);
        return RebalanceOutcome.notNeeded("imbalance below order precision");
      }
      VenueAdapter venue = correction.isSpotLeg() ? venueA : venueB;
      RebalanceOrder order =
          RebalanceOrder.create(
              ids.get(), correction, venue.venueId(), ledger.instrument(), quantity, clock.instant());
      log.info(
          "Rebalancing id={} correction={} venue={} qty={} imbalanceValue={}",
          order.id(),
          correction,
          venue.venueId(),
          quantity.toPlainString(),
          ledger.cumulativeDiffValue().toPlainString());

      ExposureSnapshot before = exposureReader.capture();
      LegAttempt attempt = dispatcher.dispatch(venue, ledger.instrument(), correction.side(), quantity);
      FatalVenueException fatal = attempt.isFatal() ? (FatalVenueException) attempt.error() : null;
      BigDecimal delta = null;
      if (LegSettlement.needsExposureFallback(attempt)) {
        try {
          ExposureSnapshot after = exposureReader.capture();
          delta = after.position(correction.isSpotLeg()).subtract(before.position(correction.isSpotLeg()));
        } catch (FatalVenueException ex) {
          fatal = fatal == null ? ex : fatal;
        } catch (RuntimeException ex) {
          log.warn("Post-rebalance exposure read failed, fill unknown id={}", order.id(), ex);
        }
      }
      LegResult leg = LegSettlement.resolve(attempt, delta);
      RebalanceOrder settled =
          attempt.dispatch() == LegAttempt.Dispatch.REJECTED
              ? order.failed(leg)
              : order.submitted().settled(leg);
      ledger.recordRebalance(settled);

      RebalanceOutcome.Status status =
          settled.state() == RebalanceState.FILLED
              ? RebalanceOutcome.Status.FILLED
              : RebalanceOutcome.Status.FAILED;
      metrics.rebalance(correction, status.name().toLowerCase(Locale.ROOT));
      log.info(
          "Rebalance settled id={} state={} filled={} source={} imbalance={}",
          settled.id(),
          settled.state(),
          leg.filledQuantity().toPlainString(),
          leg.fillSource(),
          ledger.cumulativeDiff().toPlainString());
      if (fatal != null) {
        throw fatal;
      }
      return new RebalanceOutcome(status, settled, leg.failure());
    } finally {
      executionLock.unlock();
    }
  }
}
