package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record OrderHandle(
    String venueId,
    Instrument instrument,
    String orderId,
    String clientOrderId,
    OrderSide side,
    BigDecimal requestedQuantity,
    Instant placedAt) {
  public OrderHandle {
    if (venueId == null || venueId.isBlank()) {
      throw new IllegalArgumentException("venueId is required");
    }
    Objects.requireNonNull(instrument, "instrument must not be null");
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("orderId is required");
    }
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(requestedQuantity, "requestedQuantity must not be null");
    Objects.requireNonNull(placedAt, "placedAt must not be null");
  }
}
