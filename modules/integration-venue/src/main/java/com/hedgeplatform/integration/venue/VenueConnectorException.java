package com.hedgeplatform.integration.venue;

import java.util.Optional;

public class VenueConnectorException extends RuntimeException {
  public static final int IO_FAILURE_STATUS = -1;

  private final String venueId;
  private final int httpStatus;
  private final String venueCode;
  private final String retryAfterHeader;

  public VenueConnectorException(String venueId, String message, int httpStatus, String venueCode) {
    this(venueId, message, httpStatus, venueCode, null, null);
  }

  public VenueConnectorException(
      String venueId, String message, int httpStatus, String venueCode, Throwable cause) {
    this(venueId, message, httpStatus, venueCode, null, cause);
  }

  public VenueConnectorException(
      String venueId,
      String message,
      int httpStatus,
      String venueCode,
      String retryAfterHeader,
      Throwable cause) {
    super(message, cause);
    this.venueId = venueId;
    this.httpStatus = httpStatus;
    this.venueCode = venueCode;
    this.retryAfterHeader = retryAfterHeader;
  }

  public String venueId() {
    return venueId;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public String venueCode() {
    return venueCode;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(retryAfterHeader);
  }

  public boolean isRateLimited() {
    return httpStatus == 429 || httpStatus == 418;
  }

  /** Transport failures, throttling and venue-side 5xx may succeed on a later attempt. */
  public boolean isRetryable() {
    return httpStatus == IO_FAILURE_STATUS || isRateLimited() || httpStatus >= 500;
  }
}
