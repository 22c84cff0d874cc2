package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Running imbalance between the two legs for one session.
 *
 * <p>{@code cumulativeDiff} is the sum of {@code legB.net - legA.net} over every recorded trade,
 * adjusted by each filled rebalance. Every trade id and rebalance id is accepted at most once.
 */
public final class PositionLedger {
  private final Instrument instrument;
  private final HedgeDirection direction;
  private final BigDecimal rebalanceThreshold;
  private final Set<String> recordedIds = new HashSet<>();

  private BigDecimal cumulativeDiff = BigDecimal.ZERO;
  private BigDecimal referencePrice = BigDecimal.ZERO;
  private BigDecimal legAFilledTotal = BigDecimal.ZERO;
  private BigDecimal legBFilledTotal = BigDecimal.ZERO;
  private long tradesExecuted;
  private long partialTrades;
  private long rebalancesExecuted;

  public PositionLedger(Instrument instrument, HedgeDirection direction, BigDecimal rebalanceThreshold) {
    this.instrument = Objects.requireNonNull(instrument, "instrument must not be null");
    this.direction = Objects.requireNonNull(direction, "direction must not be null");
    if (rebalanceThreshold == null || rebalanceThreshold.signum() <= 0) {
      throw new LedgerDomainException("rebalanceThreshold must be > 0");
    }
    this.rebalanceThreshold = rebalanceThreshold;
  }

  public Instrument instrument() {
    return instrument;
  }

  public HedgeDirection direction() {
    return direction;
  }

  /**
   * Folds one settled paired trade in. Returns false when neither leg moved any quantity, in which
   * case only the trade id is remembered.
   */
  public synchronized boolean recordTrade(PairedTradeResult result) {
    Objects.requireNonNull(result, "result must not be null");
    if (result.intent().direction() != direction) {
      throw new LedgerDomainException(
          "trade " + result.tradeId() + " runs " + result.intent().direction() + ", ledger tracks " + direction);
    }
    remember(result.tradeId());
    if (!result.hasAnyFill()) {
      return false;
    }
    BigDecimal legA = result.legA().netBaseQuantity(instrument);
    BigDecimal legB = result.legB().netBaseQuantity(instrument);
    cumulativeDiff = cumulativeDiff.add(legB).subtract(legA);
    legAFilledTotal = legAFilledTotal.add(legA);
    legBFilledTotal = legBFilledTotal.add(legB);
    if (result.outcome() == TradeOutcome.VERIFIED) {
      tradesExecuted++;
    } else {
      partialTrades++;
    }
    BigDecimal executedPrice = result.legA().averagePrice();
    if (executedPrice != null && executedPrice.signum() > 0) {
      referencePrice = executedPrice;
    }
    return true;
  }

  /** Applies a settled correction; a failed one leaves the imbalance untouched. */
  public synchronized boolean recordRebalance(RebalanceOrder order) {
    Objects.requireNonNull(order, "order must not be null");
    if (!order.state().isTerminal()) {
      throw new LedgerDomainException("rebalance " + order.id() + " has not settled: " + order.state());
    }
    if (!order.instrument().equals(instrument)) {
      throw new LedgerDomainException("rebalance " + order.id() + " targets " + order.instrument());
    }
    remember(order.id());
    BigDecimal filled = order.netFilled();
    if (filled.signum() == 0) {
      return false;
    }
    BigDecimal exposureDelta = filled.multiply(BigDecimal.valueOf(order.side().exposureSign()));
    cumulativeDiff =
        cumulativeDiff.add(exposureDelta.multiply(BigDecimal.valueOf(direction.exposurePerDiff())));
    rebalancesExecuted++;
    return true;
  }

  public synchronized void markPrice(BigDecimal price) {
    if (price == null || price.signum() <= 0) {
      throw new LedgerDomainException("reference price must be > 0");
    }
    referencePrice = price;
  }

  public synchronized BigDecimal cumulativeDiff() {
    return cumulativeDiff;
  }

  public synchronized BigDecimal cumulativeDiffValue() {
    return cumulativeDiff.multiply(referencePrice);
  }

  /** Net base-asset exposure: positive is net long, negative is net short. */
  public synchronized BigDecimal netExposure() {
    return cumulativeDiff.multiply(BigDecimal.valueOf(direction.exposurePerDiff()));
  }

  public synchronized boolean needsRebalance() {
    return cumulativeDiffValue().abs().compareTo(rebalanceThreshold) >= 0;
  }

  public synchronized RebalanceCorrection directionToCorrect() {
    int exposure = netExposure().signum();
    if (exposure == 0) {
      throw new LedgerDomainException("ledger is balanced, nothing to correct");
    }
    return exposure > 0 ? RebalanceCorrection.OPEN_SHORT : RebalanceCorrection.BUY_SPOT;
  }

  public synchronized LedgerState state() {
    if (cumulativeDiff.signum() == 0) {
      return LedgerState.IDLE;
    }
    return needsRebalance() ? LedgerState.REBALANCE_PENDING : LedgerState.ACCUMULATING;
  }

  public synchronized long tradesExecuted() {
    return tradesExecuted;
  }

  public synchronized LedgerSnapshot snapshot() {
    return new LedgerSnapshot(
        state(),
        cumulativeDiff,
        cumulativeDiffValue(),
        referencePrice,
        legAFilledTotal,
        legBFilledTotal,
        tradesExecuted,
        partialTrades,
        rebalancesExecuted);
  }

  private void remember(String id) {
    if (!recordedIds.add(id)) {
      throw new LedgerDomainException("already recorded: " + id);
    }
  }
}
