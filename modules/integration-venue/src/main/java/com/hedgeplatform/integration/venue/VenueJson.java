package com.hedgeplatform.integration.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * Field readers shared by the venue response parsers. Field-level failures carry no venue id;
 * the calling adapter's log line names the venue.
 */
public final class VenueJson {
  private VenueJson() {}

  public static JsonNode parse(ObjectMapper objectMapper, String venueId, String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new MalformedResponseException(
          venueId, "Failed to parse " + venueId + " response JSON: " + body, ex);
    }
  }

  public static String text(JsonNode node, String field) {
    if (!node.hasNonNull(field)) {
      throw new MalformedResponseException(null, "response missing field: " + field);
    }
    String value = node.get(field).asText();
    if (value == null || value.isBlank()) {
      throw new MalformedResponseException(null, "response has blank field: " + field);
    }
    return value;
  }

  public static String optionalText(JsonNode node, String field) {
    if (!node.hasNonNull(field)) {
      return null;
    }
    String value = node.get(field).asText().trim();
    return value.isEmpty() ? null : value;
  }

  public static BigDecimal decimal(JsonNode node, String field) {
    BigDecimal value = optionalDecimal(node, field);
    if (value == null) {
      throw new MalformedResponseException(null, "response missing field: " + field);
    }
    return value;
  }

  /** Null when absent or blank; venues send decimals as JSON strings. */
  public static BigDecimal optionalDecimal(JsonNode node, String field) {
    String raw = optionalText(node, field);
    if (raw == null) {
      return null;
    }
    try {
      return new BigDecimal(raw);
    } catch (NumberFormatException ex) {
      throw new MalformedResponseException(null, "response has invalid decimal field: " + field, ex);
    }
  }
}
