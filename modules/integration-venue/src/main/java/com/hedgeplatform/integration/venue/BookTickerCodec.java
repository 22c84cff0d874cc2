package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import java.time.Instant;
import java.util.Optional;

/** Venue-specific wire format of a best bid/offer feed. */
public interface BookTickerCodec {
  /** Message sent right after the socket opens, if the venue subscribes in-band. */
  Optional<String> subscribeMessage(Instrument instrument, Instant now);

  /** Empty for acknowledgements, heartbeats and other non-book frames. */
  Optional<OrderBookSnapshot> parse(String payload, Instrument instrument, Instant receivedAt);
}
