package com.hedgeplatform.integration.venue;

/**
 * The venue answered, but the body could not be read. Never retried: the same request is
 * expected to produce the same body.
 */
public class MalformedResponseException extends VenueConnectorException {
  public static final int MALFORMED_RESPONSE_STATUS = -2;

  public MalformedResponseException(String venueId, String message) {
    this(venueId, message, null);
  }

  public MalformedResponseException(String venueId, String message, Throwable cause) {
    super(venueId, message, MALFORMED_RESPONSE_STATUS, null, cause);
  }
}
