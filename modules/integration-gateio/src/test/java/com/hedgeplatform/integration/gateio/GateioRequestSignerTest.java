package com.hedgeplatform.integration.gateio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class GateioRequestSignerTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.ofEpochSecond(1541993715L), ZoneOffset.UTC);
  private static final String EMPTY_SHA512 =
      "cf83e1357eefb8bdf1542850d66d8007d620e4050b5715dc83f4a921d36ce9ce"
          + "47d0d13c5d85f2b0ff8318d2877eec2f63b931bd47417a81a538327af927da3e";

  private final GateioRequestSigner signer = new GateioRequestSigner("key", "secret", FIXED_CLOCK);

  @Test
  void shouldHashEmptyBody() {
    assertEquals(EMPTY_SHA512, GateioRequestSigner.hashedPayload(""));
  }

  @Test
  void shouldSignCanonicalRequestString() throws Exception {
    String expectedPayload =
        "GET\n/api/v4/spot/orders\ncurrency_pair=BTC_USDT&status=open\n" + EMPTY_SHA512 + "\n1541993715";
    Mac mac = Mac.getInstance("HmacSHA512");
    mac.init(new SecretKeySpec("secret".getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
    String expected = HexFormat.of().formatHex(mac.doFinal(expectedPayload.getBytes(StandardCharsets.UTF_8)));

    assertEquals(
        expected,
        signer.signature("GET", "/api/v4/spot/orders", "currency_pair=BTC_USDT&status=open", "", "1541993715"));
  }

  @Test
  void shouldBindSignatureToBody() {
    assertNotEquals(
        signer.signature("POST", "/api/v4/spot/orders", "", "{\"amount\":\"1\"}", "1541993715"),
        signer.signature("POST", "/api/v4/spot/orders", "", "{\"amount\":\"2\"}", "1541993715"));
  }

  @Test
  void shouldAttachAuthenticationHeaders() {
    HttpRequest request =
        signer
            .sign(HttpRequest.newBuilder(URI.create("https://api.gateio.ws/api/v4/spot/accounts")), "GET", "/api/v4/spot/accounts", "", "")
            .GET()
            .build();

    assertEquals("key", request.headers().firstValue("KEY").orElseThrow());
    assertEquals("1541993715", request.headers().firstValue("Timestamp").orElseThrow());
    assertEquals(
        signer.signature("GET", "/api/v4/spot/accounts", "", "", "1541993715"),
        request.headers().firstValue("SIGN").orElseThrow());
  }
}
