package com.hedgeplatform.integration.venue;

/** Authentication failure or a venue that cannot be traded on. Stops the session. */
public class FatalVenueException extends VenueConnectorException {
  public FatalVenueException(String venueId, String message, int httpStatus, String venueCode) {
    super(venueId, message, httpStatus, venueCode);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
