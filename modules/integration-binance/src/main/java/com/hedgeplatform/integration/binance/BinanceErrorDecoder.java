package com.hedgeplatform.integration.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.RejectedOrderException;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import com.hedgeplatform.integration.venue.VenueErrorDecoder;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Set;

class BinanceErrorDecoder implements VenueErrorDecoder {
  static final String ORDER_DOES_NOT_EXIST = "-2013";
  static final String NO_NEED_TO_CHANGE_MARGIN_TYPE = "-4046";

  // -1002 unauthorized, -1022 bad signature, -2014 bad key format, -2015 key/IP/permission
  private static final Set<String> AUTH_CODES = Set.of("-1002", "-1022", "-2014", "-2015");

  private final String venueId;
  private final ObjectMapper objectMapper;

  BinanceErrorDecoder(String venueId, ObjectMapper objectMapper) {
    this.venueId = venueId;
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  @Override
  public VenueConnectorException decode(String action, HttpResponse<String> response) {
    int status = response.statusCode();
    JsonNode node = readBody(response.body());
    String code = node.hasNonNull("code") ? node.get("code").asText() : null;
    String message = node.hasNonNull("msg") ? node.get("msg").asText() : response.body();
    String description =
        "Binance futures "
            + action
            + " failed status="
            + status
            + " code="
            + (code == null ? "null" : code)
            + " message="
            + message;
    if (status == 401 || status == 403 || AUTH_CODES.contains(code)) {
      return new FatalVenueException(venueId, description, status, code);
    }
    boolean clientError = status >= 400 && status < 500 && status != 429 && status != 418;
    if (clientError && action.startsWith("place_")) {
      return new RejectedOrderException(venueId, description, status, code);
    }
    return new VenueConnectorException(
        venueId,
        description,
        status,
        code,
        response.headers().firstValue("Retry-After").orElse(null),
        null);
  }

  private JsonNode readBody(String body) {
    try {
      JsonNode node = objectMapper.readTree(body == null ? "" : body);
      return node == null ? objectMapper.missingNode() : node;
    } catch (IOException ex) {
      return objectMapper.missingNode();
    }
  }
}
