package com.hedgeplatform.integration.gateio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hedgeplatform.integration.venue.CapitalReservoir;
import com.hedgeplatform.integration.venue.VenueHttpTransport;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Redeems Simple Earn (uni lending) balances back into the spot account. */
public class GateioEarnReservoir implements CapitalReservoir {
  private static final Logger log = LoggerFactory.getLogger(GateioEarnReservoir.class);
  private static final String LENDS_PATH = "/api/v4/earn/uni/lends";

  private final GateioApiConfig config;
  private final ObjectMapper objectMapper;
  private final GateioRequestSigner signer;
  private final VenueHttpTransport transport;

  public GateioEarnReservoir(GateioApiConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
    this.config = Objects.requireNonNull(config, "config is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.signer = new GateioRequestSigner(config.apiKey(), config.apiSecret(), config.clock());
    String venueId = GateioSpotVenueAdapter.VENUE_ID;
    this.transport =
        new VenueHttpTransport(venueId, httpClient, new GateioErrorDecoder(venueId, objectMapper));
  }

  @Override
  public void redeem(String asset, BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
    BigDecimal rounded = amount.setScale(8, RoundingMode.UP).stripTrailingZeros();
    ObjectNode body = objectMapper.createObjectNode();
    body.put("currency", asset.toUpperCase(Locale.ROOT));
    body.put("amount", rounded.toPlainString());
    body.put("type", "redeem");
    String payload = body.toString();
    HttpRequest request =
        signer
            .sign(
                HttpRequest.newBuilder(config.baseUri().resolve(LENDS_PATH))
                    .timeout(config.timeout())
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json"),
                "POST",
                LENDS_PATH,
                "",
                payload)
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();
    transport.exchange(request, "redeem_earn");
    log.info(
        "Earn redemption accepted venue={} asset={} amount={}",
        GateioSpotVenueAdapter.VENUE_ID,
        asset,
        rounded.toPlainString());
  }
}
