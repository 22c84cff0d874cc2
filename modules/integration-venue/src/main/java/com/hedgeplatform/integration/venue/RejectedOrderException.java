package com.hedgeplatform.integration.venue;

/** The venue refused the order before it could trade; no position was taken. */
public class RejectedOrderException extends VenueConnectorException {
  public RejectedOrderException(String venueId, String message, int httpStatus, String venueCode) {
    super(venueId, message, httpStatus, venueCode);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
