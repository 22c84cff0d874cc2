package com.hedgeplatform.integration.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import com.hedgeplatform.integration.venue.BookTickerCodec;
import com.hedgeplatform.integration.venue.VenueJson;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** {@code <symbol>@bookTicker} frames; the stream is selected by URL so nothing is sent. */
class BinanceBookTickerCodec implements BookTickerCodec {
  private final String venueId;
  private final ObjectMapper objectMapper;

  BinanceBookTickerCodec(String venueId, ObjectMapper objectMapper) {
    this.venueId = venueId;
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  @Override
  public Optional<String> subscribeMessage(Instrument instrument, Instant now) {
    return Optional.empty();
  }

  @Override
  public Optional<OrderBookSnapshot> parse(String payload, Instrument instrument, Instant receivedAt) {
    JsonNode root = VenueJson.parse(objectMapper, venueId, payload);
    if (!"bookTicker".equals(root.path("e").asText(""))) {
      return Optional.empty();
    }
    if (!BinanceFuturesVenueAdapter.symbol(instrument).equals(root.path("s").asText(""))) {
      return Optional.empty();
    }
    return Optional.of(
        new OrderBookSnapshot(
            venueId,
            instrument,
            VenueJson.decimal(root, "b"),
            VenueJson.decimal(root, "B"),
            VenueJson.decimal(root, "a"),
            VenueJson.decimal(root, "A"),
            receivedAt));
  }
}
