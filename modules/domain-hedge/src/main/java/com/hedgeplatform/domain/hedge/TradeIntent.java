package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record TradeIntent(
    String tradeId,
    Instrument instrument,
    HedgeDirection direction,
    BigDecimal quantity,
    BigDecimal expectedLegAPrice,
    BigDecimal expectedLegBPrice,
    BigDecimal expectedSpread,
    Instant createdAt) {
  public TradeIntent {
    if (tradeId == null || tradeId.isBlank()) {
      throw new HedgeDomainException("tradeId must not be blank");
    }
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(direction, "direction must not be null");
    if (quantity == null || quantity.signum() <= 0) {
      throw new HedgeDomainException("quantity must be > 0");
    }
    Objects.requireNonNull(expectedLegAPrice, "expectedLegAPrice must not be null");
    Objects.requireNonNull(expectedLegBPrice, "expectedLegBPrice must not be null");
    Objects.requireNonNull(expectedSpread, "expectedSpread must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public OrderSide legASide() {
    return direction.legASide();
  }

  public OrderSide legBSide() {
    return direction.legBSide();
  }
}
