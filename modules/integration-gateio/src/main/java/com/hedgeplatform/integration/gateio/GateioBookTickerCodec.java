package com.hedgeplatform.integration.gateio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import com.hedgeplatform.integration.venue.BookTickerCodec;
import com.hedgeplatform.integration.venue.VenueJson;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** {@code spot.book_ticker} channel of the v4 WebSocket API. */
class GateioBookTickerCodec implements BookTickerCodec {
  static final String CHANNEL = "spot.book_ticker";

  private final String venueId;
  private final ObjectMapper objectMapper;

  GateioBookTickerCodec(String venueId, ObjectMapper objectMapper) {
    this.venueId = venueId;
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  @Override
  public Optional<String> subscribeMessage(Instrument instrument, Instant now) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("time", now.getEpochSecond());
    message.put("channel", CHANNEL);
    message.put("event", "subscribe");
    message.putArray("payload").add(GateioSpotVenueAdapter.currencyPair(instrument));
    return Optional.of(message.toString());
  }

  @Override
  public Optional<OrderBookSnapshot> parse(String payload, Instrument instrument, Instant receivedAt) {
    JsonNode root = VenueJson.parse(objectMapper, venueId, payload);
    if (!CHANNEL.equals(root.path("channel").asText("")) || !"update".equals(root.path("event").asText(""))) {
      return Optional.empty();
    }
    JsonNode result = root.path("result");
    if (!GateioSpotVenueAdapter.currencyPair(instrument).equals(result.path("s").asText(""))) {
      return Optional.empty();
    }
    return Optional.of(
        new OrderBookSnapshot(
            venueId,
            instrument,
            VenueJson.decimal(result, "b"),
            VenueJson.decimal(result, "B"),
            VenueJson.decimal(result, "a"),
            VenueJson.decimal(result, "A"),
            receivedAt));
  }
}
