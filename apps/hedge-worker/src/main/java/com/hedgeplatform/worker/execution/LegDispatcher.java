package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.RejectedOrderException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import java.math.BigDecimal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Places one market order and follows it to settlement. Never throws; failures are captured. */
class LegDispatcher {
  private static final Logger log = LoggerFactory.getLogger(LegDispatcher.class);

  private final FillVerifier verifier;

  LegDispatcher(FillVerifier verifier) {
    this.verifier = Objects.requireNonNull(verifier, "verifier is required");
  }

  LegAttempt dispatch(VenueAdapter venue, Instrument instrument, OrderSide side, BigDecimal quantity) {
    OrderHandle handle;
    try {
      handle = venue.placeMarketOrder(instrument, side, quantity);
    } catch (RejectedOrderException ex) {
      log.warn(
          "Order rejected venue={} side={} qty={} code={}",
          venue.venueId(),
          side,
          quantity.toPlainString(),
          ex.venueCode());
      return new LegAttempt(venue.venueId(), side, quantity, LegAttempt.Dispatch.REJECTED, null, ex);
    } catch (FatalVenueException ex) {
      log.error("Order placement failed fatally venue={} side={}", venue.venueId(), side, ex);
      return new LegAttempt(venue.venueId(), side, quantity, LegAttempt.Dispatch.REJECTED, null, ex);
    } catch (RuntimeException ex) {
      log.warn(
          "Order placement outcome unknown venue={} side={} qty={}",
          venue.venueId(),
          side,
          quantity.toPlainString(),
          ex);
      return new LegAttempt(venue.venueId(), side, quantity, LegAttempt.Dispatch.UNKNOWN, null, ex);
    }
    try {
      LegVerification verification = verifier.await(venue, handle);
      return new LegAttempt(venue.venueId(), side, quantity, LegAttempt.Dispatch.ACCEPTED, verification, null);
    } catch (RuntimeException ex) {
      log.warn("Order verification failed venue={} orderId={}", venue.venueId(), handle.orderId(), ex);
      return new LegAttempt(
          venue.venueId(),
          side,
          quantity,
          LegAttempt.Dispatch.ACCEPTED,
          new LegVerification(handle, null, false),
          ex);
    }
  }
}
