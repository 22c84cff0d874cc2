package com.hedgeplatform.integration.gateio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.domain.hedge.OrderState;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.MalformedResponseException;
import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.OrderPollResult;
import com.hedgeplatform.integration.venue.PositionSnapshot;
import com.hedgeplatform.integration.venue.ReadBackoff;
import com.hedgeplatform.integration.venue.ReadRetryExecutor;
import com.hedgeplatform.integration.venue.RejectedOrderException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GateioSpotVenueAdapterTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-25T00:00:00Z"), ZoneOffset.UTC);
  private static final Instrument BTC_USDT = Instrument.parse("BTC/USDT");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockWebServer server;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    meterRegistry = new SimpleMeterRegistry();
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldPriceMarketBuyInQuoteCurrencyFromTicker() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                [{"currency_pair":"BTC_USDT","last":"60000.1","lowest_ask":"60000.5","highest_bid":"60000.1"}]
                """));
    server.enqueue(
        new MockResponse()
            .setResponseCode(201)
            .setBody(
                """
                {"id":"1852454420","text":"t-hx-test","currency_pair":"BTC_USDT","status":"open"}
                """));

    OrderHandle handle = adapter().placeMarketOrder(BTC_USDT, OrderSide.BUY, new BigDecimal("0.01"));

    assertEquals("1852454420", handle.orderId());
    assertEquals("t-hx-test", handle.clientOrderId());
    assertEquals(0, new BigDecimal("0.01").compareTo(handle.requestedQuantity()));

    RecordedRequest ticker = server.takeRequest();
    assertEquals("/api/v4/spot/tickers?currency_pair=BTC_USDT", ticker.getPath());
    assertNull(ticker.getHeader("SIGN"));

    RecordedRequest order = server.takeRequest();
    assertEquals("POST", order.getMethod());
    assertEquals("/api/v4/spot/orders", order.getPath());
    assertEquals("test-key", order.getHeader("KEY"));
    assertEquals(Long.toString(FIXED_CLOCK.instant().getEpochSecond()), order.getHeader("Timestamp"));
    JsonNode body = objectMapper.readTree(order.getBody().readUtf8());
    assertEquals("t-hx-test", body.get("text").asText());
    assertEquals("BTC_USDT", body.get("currency_pair").asText());
    assertEquals("market", body.get("type").asText());
    assertEquals("spot", body.get("account").asText());
    assertEquals("buy", body.get("side").asText());
    assertEquals("ioc", body.get("time_in_force").asText());
    assertEquals("600.005", body.get("amount").asText());
    assertEquals(
        new GateioRequestSigner("test-key", "test-secret", FIXED_CLOCK)
            .signature(
                "POST",
                "/api/v4/spot/orders",
                "",
                body.toString(),
                order.getHeader("Timestamp")),
        order.getHeader("SIGN"));
  }

  @Test
  void shouldSendMarketSellInBaseCurrency() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\":\"2\",\"status\":\"closed\"}"));

    adapter().placeMarketOrder(BTC_USDT, OrderSide.SELL, new BigDecimal("0.0100"));

    JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
    assertEquals("sell", body.get("side").asText());
    assertEquals("0.01", body.get("amount").asText());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldRejectInsufficientBalanceWithoutRetry() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setBody("{\"label\":\"BALANCE_NOT_ENOUGH\",\"message\":\"Not enough balance\"}"));

    RejectedOrderException thrown =
        assertThrows(
            RejectedOrderException.class,
            () -> adapter().placeMarketOrder(BTC_USDT, OrderSide.SELL, BigDecimal.ONE));

    assertEquals("BALANCE_NOT_ENOUGH", thrown.venueCode());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldTreatInvalidKeyAsFatal() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(401)
            .setBody("{\"label\":\"INVALID_KEY\",\"message\":\"Invalid key provided\"}"));

    assertThrows(FatalVenueException.class, () -> adapter().fetchBalances());
  }

  @Test
  void shouldFailFastOnAccountBodyThatIsNotAnArray() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"currency\":\"USDT\"}"));

    MalformedResponseException ex =
        assertThrows(MalformedResponseException.class, () -> adapter().fetchBalances());

    assertEquals("gateio-spot", ex.venueId());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldReportFilledSpotOrderWithBaseFee() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                {"id":"1852454420","status":"closed","finish_as":"filled","side":"buy",
                 "amount":"600.005","left":"0","filled_amount":"0.01","filled_total":"600.005",
                 "avg_deal_price":"60000.5","fee":"0.00002","fee_currency":"BTC"}
                """));

    OrderPollResult result = adapter().pollOrder(handle("1852454420", OrderSide.BUY));

    assertEquals(OrderPollResult.Kind.REPORTED, result.kind());
    assertEquals(OrderState.FILLED, result.report().state());
    assertEquals(0, new BigDecimal("0.01").compareTo(result.report().filledQuantity()));
    assertEquals(0, new BigDecimal("60000.5").compareTo(result.report().averagePrice()));
    assertEquals(0, new BigDecimal("0.00002").compareTo(result.report().fee()));
    assertEquals("BTC", result.report().feeAsset());
    RecordedRequest request = server.takeRequest();
    assertEquals("/api/v4/spot/orders/1852454420?currency_pair=BTC_USDT", request.getPath());
    assertEquals("test-key", request.getHeader("KEY"));
  }

  @Test
  void shouldDeriveBoughtBaseFromQuoteTotalWhenFilledAmountAbsent() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                {"id":"7","status":"closed","finish_as":"filled","amount":"600.005","left":"0",
                 "filled_total":"600.005","avg_deal_price":"60000.5","fee":"0","fee_currency":"BTC"}
                """));

    OrderPollResult result = adapter().pollOrder(handle("7", OrderSide.BUY));

    assertEquals(0, new BigDecimal("0.01").compareTo(result.report().filledQuantity()));
  }

  @Test
  void shouldReportNotFoundYetForUnindexedOrder() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(404)
            .setBody("{\"label\":\"ORDER_NOT_FOUND\",\"message\":\"Order not found\"}"));

    OrderPollResult result = adapter().pollOrder(handle("8", OrderSide.SELL));

    assertEquals(OrderPollResult.Kind.NOT_FOUND_YET, result.kind());
  }

  @Test
  void shouldReportUnavailableWhenReadsKeepFailing() {
    server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
    server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));

    OrderPollResult result = adapter().pollOrder(handle("9", OrderSide.SELL));

    assertEquals(OrderPollResult.Kind.UNAVAILABLE, result.kind());
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void shouldReportBaseHoldingAsPosition() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                [{"currency":"BTC","available":"0.015","locked":"0.005"},
                 {"currency":"USDT","available":"1250.5","locked":"0"}]
                """));

    PositionSnapshot position = adapter().fetchPosition(BTC_USDT);

    assertEquals(0, new BigDecimal("0.02").compareTo(position.quantity()));
    assertEquals(GateioSpotVenueAdapter.VENUE_ID, position.venueId());
  }

  @Test
  void shouldMapCloseReasons() {
    assertEquals(OrderState.FILLED, GateioSpotVenueAdapter.mapState("closed", "filled", BigDecimal.ONE));
    assertEquals(
        OrderState.PARTIALLY_FILLED_CLOSED,
        GateioSpotVenueAdapter.mapState("closed", "ioc", new BigDecimal("0.5")));
    assertEquals(OrderState.CANCELED, GateioSpotVenueAdapter.mapState("cancelled", "cancelled", BigDecimal.ZERO));
    assertEquals(
        OrderState.PARTIALLY_FILLED, GateioSpotVenueAdapter.mapState("open", "open", new BigDecimal("0.1")));
    assertEquals(OrderState.NEW, GateioSpotVenueAdapter.mapState("open", "open", BigDecimal.ZERO));
  }

  private OrderHandle handle(String orderId, OrderSide side) {
    return new OrderHandle(
        GateioSpotVenueAdapter.VENUE_ID,
        BTC_USDT,
        orderId,
        null,
        side,
        new BigDecimal("0.01"),
        FIXED_CLOCK.instant());
  }

  private GateioSpotVenueAdapter adapter() {
    GateioApiConfig config =
        new GateioApiConfig(
            server.url("/").uri(),
            server.url("/ws/v4/").uri(),
            "test-key",
            "test-secret",
            Duration.ofSeconds(3),
            FIXED_CLOCK);
    ReadRetryExecutor retryExecutor =
        new ReadRetryExecutor(
            2,
            new ReadBackoff(Duration.ofMillis(10), Duration.ofMillis(50), false, FIXED_CLOCK),
            duration -> {},
            meterRegistry);
    return new GateioSpotVenueAdapter(
        config,
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
        objectMapper,
        retryExecutor,
        meterRegistry,
        () -> "t-hx-test");
  }
}
