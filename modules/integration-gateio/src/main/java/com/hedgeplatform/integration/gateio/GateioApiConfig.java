package com.hedgeplatform.integration.gateio;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

public record GateioApiConfig(
    URI baseUri, URI streamUri, String apiKey, String apiSecret, Duration timeout, Clock clock) {
  public GateioApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (streamUri == null) {
      throw new IllegalArgumentException("streamUri is required");
    }
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required");
    }
    if (apiSecret == null || apiSecret.isBlank()) {
      throw new IllegalArgumentException("apiSecret is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
  }
}
