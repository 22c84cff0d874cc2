package com.hedgeplatform.integration.binance;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/** HMAC-SHA256 query signing used by every private USDⓈ-M endpoint. */
public class BinanceRequestSigner {
  private static final String ALGORITHM = "HmacSHA256";

  private final SecretKeySpec key;
  private final long recvWindowMs;
  private final Clock clock;

  public BinanceRequestSigner(String apiSecret, long recvWindowMs, Clock clock) {
    this.key =
        new SecretKeySpec(
            Objects.requireNonNullElse(apiSecret, "").getBytes(StandardCharsets.UTF_8), ALGORITHM);
    this.recvWindowMs = Math.max(1L, recvWindowMs);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Appends timestamp and recvWindow, drops blank values, and returns {@code query&signature=}. */
  public String signedQuery(Map<String, String> params) {
    Map<String, String> ordered = new LinkedHashMap<>();
    params.forEach(
        (name, value) -> {
          if (value != null && !value.isBlank()) {
            ordered.put(name, value);
          }
        });
    ordered.put("timestamp", Long.toString(clock.millis()));
    ordered.put("recvWindow", Long.toString(recvWindowMs));
    String query =
        ordered.entrySet().stream()
            .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
            .collect(Collectors.joining("&"));
    return query + "&signature=" + signature(query);
  }

  String signature(String payload) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign Binance request", ex);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
