package com.hedgeplatform.integration.gateio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.domain.hedge.OrderState;
import com.hedgeplatform.integration.venue.AssetBalance;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.LeverageSettings;
import com.hedgeplatform.integration.venue.MalformedResponseException;
import com.hedgeplatform.integration.venue.OrderBookListener;
import com.hedgeplatform.integration.venue.OrderBookSubscription;
import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.OrderPollResult;
import com.hedgeplatform.integration.venue.OrderStatusReport;
import com.hedgeplatform.integration.venue.PositionSnapshot;
import com.hedgeplatform.integration.venue.ReadRetryExecutor;
import com.hedgeplatform.integration.venue.StreamDisconnectException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.integration.venue.VenueBalances;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import com.hedgeplatform.integration.venue.VenueHttpTransport;
import com.hedgeplatform.integration.venue.VenueJson;
import com.hedgeplatform.integration.venue.WebSocketBookStream;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Gate.io v4 spot account: the long leg of the hedge. */
public class GateioSpotVenueAdapter implements VenueAdapter {
  private static final Logger log = LoggerFactory.getLogger(GateioSpotVenueAdapter.class);

  public static final String VENUE_ID = "gateio-spot";

  private static final String API_PREFIX = "/api/v4";
  private static final String ORDERS_PATH = API_PREFIX + "/spot/orders";
  private static final String ACCOUNTS_PATH = API_PREFIX + "/spot/accounts";
  private static final String TICKERS_PATH = API_PREFIX + "/spot/tickers";
  private static final int QUOTE_AMOUNT_SCALE = 8;
  private static final Duration STREAM_PRICE_MAX_AGE = Duration.ofSeconds(3);

  private final GateioApiConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final GateioRequestSigner signer;
  private final VenueHttpTransport transport;
  private final ReadRetryExecutor retryExecutor;
  private final MeterRegistry meterRegistry;
  private final Supplier<String> clientOrderIds;
  private final Map<Instrument, OrderBookSnapshot> lastStreamBook = new ConcurrentHashMap<>();

  public GateioSpotVenueAdapter(
      GateioApiConfig config,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      ReadRetryExecutor retryExecutor,
      MeterRegistry meterRegistry) {
    this(
        config,
        httpClient,
        objectMapper,
        retryExecutor,
        meterRegistry,
        () -> "t-hx" + UUID.randomUUID().toString().replace("-", "").substring(0, 24));
  }

  GateioSpotVenueAdapter(
      GateioApiConfig config,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      ReadRetryExecutor retryExecutor,
      MeterRegistry meterRegistry,
      Supplier<String> clientOrderIds) {
    this.config = Objects.requireNonNull(config, "config is required");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.clientOrderIds = Objects.requireNonNull(clientOrderIds, "clientOrderIds is required");
    this.signer = new GateioRequestSigner(config.apiKey(), config.apiSecret(), config.clock());
    this.transport =
        new VenueHttpTransport(VENUE_ID, httpClient, new GateioErrorDecoder(VENUE_ID, objectMapper));
  }

  static String currencyPair(Instrument instrument) {
    return instrument.joined("_");
  }

  @Override
  public String venueId() {
    return VENUE_ID;
  }

  @Override
  public OrderBookSubscription streamOrderBook(Instrument instrument, OrderBookListener listener) {
    OrderBookListener caching =
        new OrderBookListener() {
          @Override
          public void onSnapshot(OrderBookSnapshot snapshot) {
            lastStreamBook.put(instrument, snapshot);
            listener.onSnapshot(snapshot);
          }

          @Override
          public void onDisconnected(StreamDisconnectException error) {
            lastStreamBook.remove(instrument);
            listener.onDisconnected(error);
          }

          @Override
          public void onConnected(String venueId) {
            listener.onConnected(venueId);
          }
        };
    return new WebSocketBookStream(
            VENUE_ID,
            config.streamUri(),
            instrument,
            new GateioBookTickerCodec(VENUE_ID, objectMapper),
            caching,
            httpClient,
            config.clock(),
            config.timeout(),
            meterRegistry)
        .start();
  }

  /** Market buys are denominated in quote currency, so the base quantity is priced at best ask. */
  @Override
  public OrderHandle placeMarketOrder(Instrument instrument, OrderSide side, BigDecimal quantity) {
    requirePositive(quantity);
    ObjectNode body = orderBody(instrument, side);
    body.put("type", "market");
    body.put("time_in_force", "ioc");
    if (side == OrderSide.BUY) {
      BigDecimal ask = bestAsk(instrument);
      BigDecimal quoteAmount = quantity.multiply(ask).setScale(QUOTE_AMOUNT_SCALE, RoundingMode.UP);
      body.put("amount", quoteAmount.stripTrailingZeros().toPlainString());
      log.debug(
          "Market buy priced venue={} pair={} qty={} ask={} quoteAmount={}",
          VENUE_ID,
          currencyPair(instrument),
          quantity.toPlainString(),
          ask.toPlainString(),
          quoteAmount.toPlainString());
    } else {
      body.put("amount", quantity.stripTrailingZeros().toPlainString());
    }
    return submit(instrument, side, quantity, body);
  }

  @Override
  public OrderHandle placeLimitOrder(
      Instrument instrument, OrderSide side, BigDecimal quantity, BigDecimal price) {
    requirePositive(quantity);
    ObjectNode body = orderBody(instrument, side);
    body.put("type", "limit");
    body.put("time_in_force", "ioc");
    body.put("amount", quantity.stripTrailingZeros().toPlainString());
    body.put("price", price.toPlainString());
    return submit(instrument, side, quantity, body);
  }

  @Override
  public OrderPollResult pollOrder(OrderHandle handle) {
    String query = "currency_pair=" + encode(currencyPair(handle.instrument()));
    String path = ORDERS_PATH + "/" + encode(handle.orderId());
    try {
      JsonNode node =
          retryExecutor.execute(VENUE_ID, "poll_order", () -> signedGet(path, query, "poll_order"));
      return OrderPollResult.reported(toReport(node, handle.side()));
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      if (GateioErrorDecoder.ORDER_NOT_FOUND.equals(ex.venueCode())) {
        return OrderPollResult.notFoundYet(ex.getMessage());
      }
      if (ex.isRetryable()) {
        return OrderPollResult.unavailable(ex.getMessage());
      }
      throw ex;
    }
  }

  @Override
  public VenueBalances fetchBalances() {
    JsonNode root =
        retryExecutor.execute(
            VENUE_ID, "fetch_balances", () -> signedGet(ACCOUNTS_PATH, "", "fetch_balances"));
    if (!root.isArray()) {
      throw new MalformedResponseException(VENUE_ID, "Expected account array response from Gate.io");
    }
    List<AssetBalance> balances = new ArrayList<>();
    for (JsonNode node : root) {
      balances.add(
          new AssetBalance(
              VenueJson.text(node, "currency"),
              VenueJson.decimal(node, "available"),
              VenueJson.decimal(node, "locked")));
    }
    return VenueBalances.of(VENUE_ID, balances, config.clock().instant());
  }

  /** Spot has no position; the whole base holding stands in for it. */
  @Override
  public PositionSnapshot fetchPosition(Instrument instrument) {
    VenueBalances balances = fetchBalances();
    return new PositionSnapshot(
        VENUE_ID, instrument, balances.total(instrument.base()), null, balances.capturedAt());
  }

  @Override
  public void configureInstrument(Instrument instrument, LeverageSettings settings) {
    log.debug("Spot venue has no leverage settings venue={} pair={}", VENUE_ID, currencyPair(instrument));
  }

  BigDecimal bestAsk(Instrument instrument) {
    OrderBookSnapshot streamed = lastStreamBook.get(instrument);
    if (streamed != null
        && streamed.ageAt(config.clock().instant()).compareTo(STREAM_PRICE_MAX_AGE) < 0
        && streamed.askPrice().signum() > 0) {
      return streamed.askPrice();
    }
    String query = "currency_pair=" + encode(currencyPair(instrument));
    JsonNode root =
        retryExecutor.execute(
            VENUE_ID,
            "fetch_ticker",
            () -> {
              HttpRequest request =
                  HttpRequest.newBuilder(config.baseUri().resolve(TICKERS_PATH + "?" + query))
                      .timeout(config.timeout())
                      .header("Accept", "application/json")
                      .GET()
                      .build();
              return VenueJson.parse(objectMapper, VENUE_ID, transport.exchange(request, "fetch_ticker"));
            });
    if (!root.isArray() || root.isEmpty()) {
      throw new MalformedResponseException(
          VENUE_ID, "Gate.io returned no ticker for " + currencyPair(instrument));
    }
    BigDecimal ask = VenueJson.decimal(root.get(0), "lowest_ask");
    if (ask.signum() <= 0) {
      throw new MalformedResponseException(
          VENUE_ID, "Gate.io ticker has no ask for " + currencyPair(instrument));
    }
    return ask;
  }

  private ObjectNode orderBody(Instrument instrument, OrderSide side) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("text", clientOrderIds.get());
    body.put("currency_pair", currencyPair(instrument));
    body.put("account", "spot");
    body.put("side", side == OrderSide.BUY ? "buy" : "sell");
    return body;
  }

  private OrderHandle submit(
      Instrument instrument, OrderSide side, BigDecimal quantity, ObjectNode body) {
    String payload = body.toString();
    HttpRequest request =
        signer
            .sign(
                HttpRequest.newBuilder(config.baseUri().resolve(ORDERS_PATH))
                    .timeout(config.timeout())
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json"),
                "POST",
                ORDERS_PATH,
                "",
                payload)
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();
    JsonNode node = VenueJson.parse(objectMapper, VENUE_ID, transport.exchange(request, "place_order"));
    meterRegistry.counter("venue.order.placed.total", "venue", VENUE_ID, "side", side.name()).increment();
    OrderHandle handle =
        new OrderHandle(
            VENUE_ID,
            instrument,
            VenueJson.text(node, "id"),
            VenueJson.optionalText(node, "text"),
            side,
            quantity,
            config.clock().instant());
    log.info(
        "Order accepted venue={} pair={} side={} qty={} orderId={} status={}",
        VENUE_ID,
        currencyPair(instrument),
        side,
        quantity.toPlainString(),
        handle.orderId(),
        node.path("status").asText(""));
    return handle;
  }

  static OrderStatusReport toReport(JsonNode node, OrderSide side) {
    BigDecimal averagePrice = VenueJson.optionalDecimal(node, "avg_deal_price");
    if (averagePrice != null && averagePrice.signum() == 0) {
      averagePrice = null;
    }
    BigDecimal filled = filledBase(node, side, averagePrice);
    return new OrderStatusReport(
        VenueJson.text(node, "id"),
        mapState(node.path("status").asText(""), node.path("finish_as").asText(""), filled),
        filled,
        averagePrice,
        VenueJson.optionalDecimal(node, "fee"),
        VenueJson.optionalText(node, "fee_currency"));
  }

  private static BigDecimal filledBase(JsonNode node, OrderSide side, BigDecimal averagePrice) {
    BigDecimal filledAmount = VenueJson.optionalDecimal(node, "filled_amount");
    if (filledAmount != null) {
      return filledAmount;
    }
    if (side == OrderSide.BUY) {
      // market buy amount and left are quote units here
      BigDecimal filledTotal = VenueJson.optionalDecimal(node, "filled_total");
      if (filledTotal == null || averagePrice == null) {
        return BigDecimal.ZERO;
      }
      return filledTotal.divide(averagePrice, MathContext.DECIMAL64);
    }
    BigDecimal amount = VenueJson.optionalDecimal(node, "amount");
    BigDecimal left = VenueJson.optionalDecimal(node, "left");
    if (amount == null || left == null) {
      return BigDecimal.ZERO;
    }
    return amount.subtract(left).max(BigDecimal.ZERO);
  }

  static OrderState mapState(String status, String finishAs, BigDecimal filled) {
    boolean anyFill = filled.signum() > 0;
    switch (status) {
      case "open":
        return anyFill ? OrderState.PARTIALLY_FILLED : OrderState.NEW;
      case "closed":
        if (finishAs.isEmpty() || "filled".equals(finishAs)) {
          return anyFill ? OrderState.FILLED : OrderState.CANCELED;
        }
        return anyFill ? OrderState.PARTIALLY_FILLED_CLOSED : OrderState.CANCELED;
      case "cancelled":
        return anyFill ? OrderState.PARTIALLY_FILLED_CLOSED : OrderState.CANCELED;
      default:
        return OrderState.UNKNOWN;
    }
  }

  private JsonNode signedGet(String path, String query, String action) {
    URI uri = config.baseUri().resolve(query.isEmpty() ? path : path + "?" + query);
    HttpRequest request =
        signer
            .sign(
                HttpRequest.newBuilder(uri)
                    .timeout(config.timeout())
                    .header("Accept", "application/json"),
                "GET",
                path,
                query,
                "")
            .GET()
            .build();
    return VenueJson.parse(objectMapper, VENUE_ID, transport.exchange(request, action));
  }

  private static void requirePositive(BigDecimal quantity) {
    if (quantity == null || quantity.signum() <= 0) {
      throw new IllegalArgumentException("quantity must be > 0");
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
