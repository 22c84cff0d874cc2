package com.hedgeplatform.integration.gateio;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * APIv4 request signing. The signed string is {@code METHOD\nPATH\nQUERY\nhex(sha512(body))\nTS}
 * with the timestamp in epoch seconds.
 */
public class GateioRequestSigner {
  private static final String ALGORITHM = "HmacSHA512";

  private final String apiKey;
  private final SecretKeySpec key;
  private final Clock clock;

  public GateioRequestSigner(String apiKey, String apiSecret, Clock clock) {
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
    this.key =
        new SecretKeySpec(
            Objects.requireNonNullElse(apiSecret, "").getBytes(StandardCharsets.UTF_8), ALGORITHM);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Adds the {@code KEY}, {@code Timestamp} and {@code SIGN} headers. */
  public HttpRequest.Builder sign(
      HttpRequest.Builder builder, String method, String path, String query, String body) {
    String timestamp = Long.toString(clock.instant().getEpochSecond());
    return builder
        .header("KEY", apiKey)
        .header("Timestamp", timestamp)
        .header("SIGN", signature(method, path, query, body, timestamp));
  }

  String signature(String method, String path, String query, String body, String timestamp) {
    String payload =
        method
            + "\n"
            + path
            + "\n"
            + Objects.requireNonNullElse(query, "")
            + "\n"
            + hashedPayload(Objects.requireNonNullElse(body, ""))
            + "\n"
            + timestamp;
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign Gate.io request", ex);
    }
  }

  static String hashedPayload(String body) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-512");
      return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("SHA-512 unavailable", ex);
    }
  }
}
