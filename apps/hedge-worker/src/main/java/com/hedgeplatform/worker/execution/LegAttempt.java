package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.OrderHandle;
import java.math.BigDecimal;

/** What happened to one order: placement, then verification when the venue accepted it. */
record LegAttempt(
    String venueId,
    OrderSide side,
    BigDecimal quantity,
    Dispatch dispatch,
    LegVerification verification,
    RuntimeException error) {
  enum Dispatch {
    ACCEPTED,
    REJECTED,
    /** No answer from the venue; the order may or may not exist. */
    UNKNOWN
  }

  OrderHandle handle() {
    return verification == null ? null : verification.handle();
  }

  boolean isFatal() {
    return error instanceof FatalVenueException;
  }
}
