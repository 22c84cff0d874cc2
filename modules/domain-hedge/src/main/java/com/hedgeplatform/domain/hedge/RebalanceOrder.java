package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record RebalanceOrder(
    String id,
    RebalanceCorrection correction,
    String venueId,
    Instrument instrument,
    BigDecimal quantity,
    RebalanceState state,
    LegResult result,
    Instant createdAt) {
  public RebalanceOrder {
    if (id == null || id.isBlank()) {
      throw new HedgeDomainException("id must not be blank");
    }
    Objects.requireNonNull(correction, "correction must not be null");
    if (venueId == null || venueId.isBlank()) {
      throw new HedgeDomainException("venueId must not be blank");
    }
    Objects.requireNonNull(instrument, "instrument must not be null");
    if (quantity == null || quantity.signum() <= 0) {
      throw new HedgeDomainException("quantity must be > 0");
    }
    Objects.requireNonNull(state, "state must not be null");
    if (state == RebalanceState.FILLED && (result == null || !result.isFilled())) {
      throw new HedgeDomainException("filled rebalance requires a filled leg result");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public static RebalanceOrder create(
      String id,
      RebalanceCorrection correction,
      String venueId,
      Instrument instrument,
      BigDecimal quantity,
      Instant now) {
    return new RebalanceOrder(
        id, correction, venueId, instrument, quantity, RebalanceState.CREATED, null, now);
  }

  public OrderSide side() {
    return correction.side();
  }

  public RebalanceOrder submitted() {
    return transitionTo(RebalanceState.SUBMITTED, null);
  }

  /** Moves to FILLED when the leg moved any quantity, FAILED otherwise. */
  public RebalanceOrder settled(LegResult legResult) {
    Objects.requireNonNull(legResult, "legResult must not be null");
    return transitionTo(
        legResult.isFilled() ? RebalanceState.FILLED : RebalanceState.FAILED, legResult);
  }

  public RebalanceOrder failed(LegResult legResult) {
    return transitionTo(RebalanceState.FAILED, legResult);
  }

  public BigDecimal netFilled() {
    if (state != RebalanceState.FILLED) {
      return BigDecimal.ZERO;
    }
    return result.netBaseQuantity(instrument);
  }

  private RebalanceOrder transitionTo(RebalanceState next, LegResult legResult) {
    state.validateTransition(next);
    return new RebalanceOrder(
        id, correction, venueId, instrument, quantity, next, legResult, createdAt);
  }
}
