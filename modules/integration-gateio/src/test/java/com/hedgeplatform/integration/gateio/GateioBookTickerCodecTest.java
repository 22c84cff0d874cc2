package com.hedgeplatform.integration.gateio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class GateioBookTickerCodecTest {
  private static final Instrument BTC_USDT = Instrument.parse("BTC/USDT");
  private static final Instant NOW = Instant.parse("2026-02-25T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GateioBookTickerCodec codec = new GateioBookTickerCodec("gateio-spot", objectMapper);

  @Test
  void shouldSubscribeToBookTickerChannel() throws Exception {
    JsonNode message = objectMapper.readTree(codec.subscribeMessage(BTC_USDT, NOW).orElseThrow());

    assertEquals(NOW.getEpochSecond(), message.get("time").asLong());
    assertEquals("spot.book_ticker", message.get("channel").asText());
    assertEquals("subscribe", message.get("event").asText());
    assertEquals("BTC_USDT", message.get("payload").get(0).asText());
  }

  @Test
  void shouldParseUpdateFrame() {
    OrderBookSnapshot snapshot =
        codec
            .parse(
                """
                {"time":1606293275,"time_ms":1606293275723,"channel":"spot.book_ticker","event":"update",
                 "result":{"t":1606293275123,"u":48733182,"s":"BTC_USDT","b":"19177.79","B":"0.0003341504",
                 "a":"19179.38","A":"0.09"}}
                """,
                BTC_USDT,
                NOW)
            .orElseThrow();

    assertEquals(new BigDecimal("19177.79"), snapshot.bidPrice());
    assertEquals(new BigDecimal("0.0003341504"), snapshot.bidSize());
    assertEquals(new BigDecimal("19179.38"), snapshot.askPrice());
    assertEquals(new BigDecimal("0.09"), snapshot.askSize());
    assertEquals(NOW, snapshot.capturedAt());
  }

  @Test
  void shouldIgnoreSubscriptionAcknowledgement() {
    assertTrue(
        codec
            .parse(
                "{\"time\":1606292218,\"channel\":\"spot.book_ticker\",\"event\":\"subscribe\",\"result\":{\"status\":\"success\"}}",
                BTC_USDT,
                NOW)
            .isEmpty());
  }
}
