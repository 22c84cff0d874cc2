package com.hedgeplatform.integration.venue;

import java.net.http.HttpResponse;

/** Maps a non-2xx venue response to the connector exception hierarchy. */
@FunctionalInterface
public interface VenueErrorDecoder {
  VenueConnectorException decode(String action, HttpResponse<String> response);
}
