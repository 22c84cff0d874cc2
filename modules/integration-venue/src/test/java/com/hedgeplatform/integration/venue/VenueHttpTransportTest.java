package com.hedgeplatform.integration.venue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VenueHttpTransportTest {
  private MockWebServer server;
  private VenueHttpTransport transport;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    transport =
        new VenueHttpTransport(
            "stub",
            HttpClient.newHttpClient(),
            (action, response) ->
                new VenueConnectorException(
                    "stub",
                    action + " failed",
                    response.statusCode(),
                    null,
                    response.headers().firstValue("Retry-After").orElse(null),
                    null));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void shouldReturnBodyOnSuccess() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

    String body = transport.exchange(get(), "ping");

    assertEquals("{\"ok\":true}", body);
  }

  @Test
  void shouldDelegateFailuresToDecoder() {
    server.enqueue(new MockResponse().setResponseCode(429).addHeader("Retry-After", "2"));

    VenueConnectorException thrown =
        assertThrows(VenueConnectorException.class, () -> transport.exchange(get(), "ping"));

    assertEquals(429, thrown.httpStatus());
    assertTrue(thrown.isRateLimited());
    assertEquals("2", thrown.retryAfterHeader().orElseThrow());
  }

  @Test
  void shouldMapTransportFailureToRetryableStatus() {
    HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:1/ping")).GET().build();

    VenueConnectorException thrown =
        assertThrows(VenueConnectorException.class, () -> transport.exchange(request, "ping"));

    assertEquals(VenueConnectorException.IO_FAILURE_STATUS, thrown.httpStatus());
    assertTrue(thrown.isRetryable());
  }

  private HttpRequest get() {
    return HttpRequest.newBuilder(server.url("/ping").uri()).GET().build();
  }
}
