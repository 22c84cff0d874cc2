package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.OrderState;
import java.math.BigDecimal;
import java.util.Objects;

public record OrderStatusReport(
    String orderId,
    OrderState state,
    BigDecimal filledQuantity,
    BigDecimal averagePrice,
    BigDecimal fee,
    String feeAsset) {
  public OrderStatusReport {
    Objects.requireNonNull(state, "state must not be null");
    filledQuantity = filledQuantity == null ? BigDecimal.ZERO : filledQuantity;
    fee = fee == null ? BigDecimal.ZERO : fee;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
