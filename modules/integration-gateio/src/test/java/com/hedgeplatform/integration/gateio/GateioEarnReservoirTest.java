package com.hedgeplatform.integration.gateio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GateioEarnReservoirTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-25T00:00:00Z"), ZoneOffset.UTC);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockWebServer server;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldPostSignedRedemption() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    reservoir().redeem("usdt", new BigDecimal("101.0000000123"));

    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/api/v4/earn/uni/lends", request.getPath());
    assertTrue(request.getHeader("SIGN") != null && !request.getHeader("SIGN").isBlank());
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("USDT", body.get("currency").asText());
    assertEquals("101.00000002", body.get("amount").asText());
    assertEquals("redeem", body.get("type").asText());
  }

  @Test
  void shouldSurfaceRefusedRedemption() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setBody("{\"label\":\"INVALID_PARAM_VALUE\",\"message\":\"insufficient lent amount\"}"));

    VenueConnectorException thrown =
        assertThrows(VenueConnectorException.class, () -> reservoir().redeem("USDT", BigDecimal.TEN));

    assertEquals("INVALID_PARAM_VALUE", thrown.venueCode());
  }

  private GateioEarnReservoir reservoir() {
    return new GateioEarnReservoir(
        new GateioApiConfig(
            server.url("/").uri(),
            server.url("/ws/v4/").uri(),
            "test-key",
            "test-secret",
            Duration.ofSeconds(3),
            FIXED_CLOCK),
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
        objectMapper);
  }
}
