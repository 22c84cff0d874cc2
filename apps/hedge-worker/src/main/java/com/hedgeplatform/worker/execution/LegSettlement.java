package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.FillSource;
import com.hedgeplatform.domain.hedge.LegResult;
import com.hedgeplatform.domain.hedge.OrderState;
import com.hedgeplatform.integration.venue.OrderStatusReport;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a leg attempt into the fill the ledger will see.
 *
 * <p>A status report with a fill is taken as is. When the report is missing, or claims FILLED with
 * nothing executed, or the placement outcome is unknown, the fill is inferred from the position
 * change on the leg's venue, capped at the requested quantity.
 */
final class LegSettlement {
  private static final Logger log = LoggerFactory.getLogger(LegSettlement.class);

  private LegSettlement() {}

  static boolean needsExposureFallback(LegAttempt attempt) {
    if (attempt.dispatch() == LegAttempt.Dispatch.REJECTED) {
      return false;
    }
    if (attempt.dispatch() == LegAttempt.Dispatch.UNKNOWN) {
      return true;
    }
    OrderStatusReport report = attempt.verification().report();
    if (report == null) {
      return true;
    }
    return report.state() == OrderState.FILLED && report.filledQuantity().signum() == 0;
  }

  /**
   * @param positionDelta signed position change on the leg's venue, or null when it could not be
   *     read
   */
  static LegResult resolve(LegAttempt attempt, BigDecimal positionDelta) {
    String failure = attempt.error() == null ? null : attempt.error().getMessage();
    if (attempt.dispatch() == LegAttempt.Dispatch.REJECTED) {
      return LegResult.notFilled(
          attempt.venueId(), attempt.side(), attempt.quantity(), OrderState.REJECTED, failure);
    }
    OrderStatusReport report =
        attempt.verification() == null ? null : attempt.verification().report();
    if (!needsExposureFallback(attempt)) {
      if (report.filledQuantity().signum() == 0) {
        return LegResult.notFilled(
            attempt.venueId(),
            attempt.side(),
            attempt.quantity(),
            report.state(),
            failure == null ? "no fill, state " + report.state() : failure);
      }
      return new LegResult(
          attempt.venueId(),
          attempt.side(),
          attempt.quantity(),
          report.filledQuantity(),
          report.averagePrice(),
          report.fee(),
          report.feeAsset(),
          report.state(),
          report.orderId(),
          FillSource.STATUS_REPORT,
          failure);
    }
    OrderState state = report == null ? OrderState.UNKNOWN : report.state();
    String orderId = attempt.handle() == null ? null : attempt.handle().orderId();
    if (positionDelta == null) {
      log.warn(
          "Fill unknown and exposure unavailable venue={} side={} orderId={}; counting zero",
          attempt.venueId(),
          attempt.side(),
          orderId);
      return LegResult.notFilled(
          attempt.venueId(),
          attempt.side(),
          attempt.quantity(),
          state,
          failure == null ? "fill unknown" : failure);
    }
    BigDecimal moved = positionDelta.multiply(BigDecimal.valueOf(attempt.side().exposureSign()));
    BigDecimal inferred = moved.max(BigDecimal.ZERO).min(attempt.quantity());
    log.warn(
        "Heuristic fill from exposure delta venue={} side={} orderId={} delta={} inferred={}",
        attempt.venueId(),
        attempt.side(),
        orderId,
        positionDelta.toPlainString(),
        inferred.toPlainString());
    if (inferred.signum() == 0) {
      return LegResult.notFilled(
          attempt.venueId(),
          attempt.side(),
          attempt.quantity(),
          state,
          failure == null ? "no exposure change" : failure);
    }
    return new LegResult(
        attempt.venueId(),
        attempt.side(),
        attempt.quantity(),
        inferred,
        report == null ? null : report.averagePrice(),
        BigDecimal.ZERO,
        null,
        state,
        orderId,
        FillSource.BALANCE_DELTA,
        failure);
  }

  static boolean isSettled(LegAttempt attempt, LegResult result) {
    if (result.fillSource() == FillSource.BALANCE_DELTA) {
      return true;
    }
    return attempt.verification() != null && attempt.verification().settled();
  }
}
