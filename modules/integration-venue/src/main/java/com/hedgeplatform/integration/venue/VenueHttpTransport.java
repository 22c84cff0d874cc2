package com.hedgeplatform.integration.venue;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Single-shot HTTP exchange; retries belong to {@link ReadRetryExecutor}. */
public class VenueHttpTransport {
  private final String venueId;
  private final HttpClient httpClient;
  private final VenueErrorDecoder errorDecoder;

  public VenueHttpTransport(String venueId, HttpClient httpClient, VenueErrorDecoder errorDecoder) {
    this.venueId = Objects.requireNonNull(venueId, "venueId is required");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.errorDecoder = Objects.requireNonNull(errorDecoder, "errorDecoder is required");
  }

  public String exchange(HttpRequest request, String action) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new VenueConnectorException(
          venueId,
          venueId + " " + action + " request was interrupted",
          VenueConnectorException.IO_FAILURE_STATUS,
          null,
          ex);
    } catch (IOException ex) {
      throw new VenueConnectorException(
          venueId,
          "Failed to call " + venueId + " " + action + " endpoint",
          VenueConnectorException.IO_FAILURE_STATUS,
          null,
          ex);
    }
    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response.body();
    }
    throw errorDecoder.decode(action, response);
  }
}
