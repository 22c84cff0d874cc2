package com.hedgeplatform.integration.venue;

public class StreamDisconnectException extends RuntimeException {
  private final String venueId;
  private final int statusCode;

  public StreamDisconnectException(String venueId, int statusCode, String reason, Throwable cause) {
    super("stream disconnected venue=" + venueId + " statusCode=" + statusCode + " reason=" + reason, cause);
    this.venueId = venueId;
    this.statusCode = statusCode;
  }

  public String venueId() {
    return venueId;
  }

  public int statusCode() {
    return statusCode;
  }
}
