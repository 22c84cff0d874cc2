package com.hedgeplatform.integration.gateio;

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

class GateioErrorDecoder implements VenueErrorDecoder {
  static final String ORDER_NOT_FOUND = "ORDER_NOT_FOUND";

  private static final Set<String> FATAL_LABELS =
      Set.of(
          "INVALID_KEY",
          "INVALID_SIGNATURE",
          "INVALID_CREDENTIALS",
          "MISSING_REQUIRED_HEADER",
          "REQUEST_EXPIRED",
          "IP_FORBIDDEN",
          "READ_ONLY",
          "FORBIDDEN",
          "ACCOUNT_LOCKED");

  private final String venueId;
  private final ObjectMapper objectMapper;

  GateioErrorDecoder(String venueId, ObjectMapper objectMapper) {
    this.venueId = venueId;
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  @Override
  public VenueConnectorException decode(String action, HttpResponse<String> response) {
    int status = response.statusCode();
    JsonNode node = readBody(response.body());
    String label = node.hasNonNull("label") ? node.get("label").asText() : null;
    String message = node.hasNonNull("message") ? node.get("message").asText() : response.body();
    String description =
        "Gate.io "
            + action
            + " failed status="
            + status
            + " label="
            + (label == null ? "null" : label)
            + " message="
            + message;
    if (status == 401 || status == 403 || FATAL_LABELS.contains(label)) {
      return new FatalVenueException(venueId, description, status, label);
    }
    boolean clientError = status >= 400 && status < 500 && status != 429;
    if (clientError && action.startsWith("place_")) {
      return new RejectedOrderException(venueId, description, status, label);
    }
    return new VenueConnectorException(
        venueId,
        description,
        status,
        label,
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
