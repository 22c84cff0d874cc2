package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.util.Objects;

public record LegResult(
    String venueId,
    OrderSide side,
    BigDecimal requestedQuantity,
    BigDecimal filledQuantity,
    BigDecimal averagePrice,
    BigDecimal fee,
    String feeAsset,
    OrderState state,
    String orderId,
    FillSource fillSource,
    String failure) {
  public LegResult {
    if (venueId == null || venueId.isBlank()) {
      throw new HedgeDomainException("venueId must not be blank");
    }
    Objects.requireNonNull(side, "side must not be null");
    if (requestedQuantity == null || requestedQuantity.signum() <= 0) {
      throw new HedgeDomainException("requestedQuantity must be > 0");
    }
    if (filledQuantity == null || filledQuantity.signum() < 0) {
      throw new HedgeDomainException("filledQuantity must be >= 0");
    }
    if (averagePrice != null && averagePrice.signum() < 0) {
      throw new HedgeDomainException("averagePrice must be >= 0");
    }
    fee = fee == null ? BigDecimal.ZERO : fee;
    Objects.requireNonNull(state, "state must not be null");
    Objects.requireNonNull(fillSource, "fillSource must not be null");
  }

  public static LegResult notFilled(
      String venueId, OrderSide side, BigDecimal requestedQuantity, OrderState state, String failure) {
    return new LegResult(
        venueId,
        side,
        requestedQuantity,
        BigDecimal.ZERO,
        null,
        BigDecimal.ZERO,
        null,
        state,
        null,
        FillSource.NONE,
        failure);
  }

  public boolean isFilled() {
    return filledQuantity.signum() > 0;
  }

  /**
   * Base-asset units that actually moved. A fee charged in the base asset shrinks a buy and
   * enlarges a sell.
   */
  public BigDecimal netBaseQuantity(Instrument instrument) {
    if (feeAsset == null || !feeAsset.equalsIgnoreCase(instrument.base()) || fee.signum() == 0) {
      return filledQuantity;
    }
    if (side == OrderSide.BUY) {
      BigDecimal net = filledQuantity.subtract(fee);
      return net.signum() < 0 ? BigDecimal.ZERO : net;
    }
    return filledQuantity.add(fee);
  }
}
