package com.hedgeplatform.integration.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.domain.hedge.Instrument;
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
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.integration.venue.VenueBalances;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import com.hedgeplatform.integration.venue.VenueHttpTransport;
import com.hedgeplatform.integration.venue.VenueJson;
import com.hedgeplatform.integration.venue.WebSocketBookStream;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Binance USDⓈ-M perpetual futures: the short leg of the hedge. */
public class BinanceFuturesVenueAdapter implements VenueAdapter {
  private static final Logger log = LoggerFactory.getLogger(BinanceFuturesVenueAdapter.class);

  public static final String VENUE_ID = "binance-usdm";

  private static final String ORDER_PATH = "/fapi/v1/order";
  private static final String USER_TRADES_PATH = "/fapi/v1/userTrades";
  private static final String BALANCE_PATH = "/fapi/v2/balance";
  private static final String POSITION_RISK_PATH = "/fapi/v2/positionRisk";
  private static final String LEVERAGE_PATH = "/fapi/v1/leverage";
  private static final String MARGIN_TYPE_PATH = "/fapi/v1/marginType";

  private final BinanceFuturesApiConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final BinanceRequestSigner signer;
  private final VenueHttpTransport transport;
  private final ReadRetryExecutor retryExecutor;
  private final MeterRegistry meterRegistry;
  private final Supplier<String> clientOrderIds;

  public BinanceFuturesVenueAdapter(
      BinanceFuturesApiConfig config,
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
        () -> "hx" + UUID.randomUUID().toString().replace("-", ""));
  }

  BinanceFuturesVenueAdapter(
      BinanceFuturesApiConfig config,
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
    this.signer = new BinanceRequestSigner(config.apiSecret(), config.recvWindowMs(), config.clock());
    this.transport =
        new VenueHttpTransport(VENUE_ID, httpClient, new BinanceErrorDecoder(VENUE_ID, objectMapper));
  }

  static String symbol(Instrument instrument) {
    return instrument.joined("");
  }

  @Override
  public String venueId() {
    return VENUE_ID;
  }

  @Override
  public OrderBookSubscription streamOrderBook(Instrument instrument, OrderBookListener listener) {
    String base = config.streamBaseUri().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    URI uri = URI.create(base + "/ws/" + symbol(instrument).toLowerCase(Locale.ROOT) + "@bookTicker");
    return new WebSocketBookStream(
            VENUE_ID,
            uri,
            instrument,
            new BinanceBookTickerCodec(VENUE_ID, objectMapper),
            listener,
            httpClient,
            config.clock(),
            config.timeout(),
            meterRegistry)
        .start();
  }

  @Override
  public OrderHandle placeMarketOrder(Instrument instrument, OrderSide side, BigDecimal quantity) {
    Map<String, String> params = orderParams(instrument, side, quantity);
    params.put("type", "MARKET");
    return submit(instrument, side, quantity, params);
  }

  @Override
  public OrderHandle placeLimitOrder(
      Instrument instrument, OrderSide side, BigDecimal quantity, BigDecimal price) {
    Map<String, String> params = orderParams(instrument, side, quantity);
    params.put("type", "LIMIT");
    params.put("timeInForce", "IOC");
    params.put("price", price.toPlainString());
    return submit(instrument, side, quantity, params);
  }

  @Override
  public OrderPollResult pollOrder(OrderHandle handle) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol(handle.instrument()));
    params.put("orderId", handle.orderId());
    try {
      JsonNode node =
          retryExecutor.execute(VENUE_ID, "poll_order", () -> signedGet(ORDER_PATH, params, "poll_order"));
      OrderStatusReport report = toReport(node);
      if (report.isTerminal() && report.filledQuantity().signum() > 0) {
        report = withCommission(handle, report);
      }
      return OrderPollResult.reported(report);
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      if (BinanceErrorDecoder.ORDER_DOES_NOT_EXIST.equals(ex.venueCode())) {
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
            VENUE_ID, "fetch_balances", () -> signedGet(BALANCE_PATH, new LinkedHashMap<>(), "fetch_balances"));
    if (!root.isArray()) {
      throw new MalformedResponseException(
          VENUE_ID, "Expected balance array response from Binance futures");
    }
    List<AssetBalance> balances = new ArrayList<>();
    for (JsonNode node : root) {
      BigDecimal walletBalance = VenueJson.decimal(node, "balance");
      BigDecimal available = VenueJson.decimal(node, "availableBalance");
      BigDecimal locked = walletBalance.subtract(available);
      balances.add(
          new AssetBalance(
              VenueJson.text(node, "asset"), available, locked.signum() < 0 ? BigDecimal.ZERO : locked));
    }
    return VenueBalances.of(VENUE_ID, balances, config.clock().instant());
  }

  @Override
  public PositionSnapshot fetchPosition(Instrument instrument) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol(instrument));
    JsonNode root =
        retryExecutor.execute(
            VENUE_ID, "fetch_position", () -> signedGet(POSITION_RISK_PATH, params, "fetch_position"));
    BigDecimal quantity = BigDecimal.ZERO;
    BigDecimal entryPrice = null;
    for (JsonNode node : root) {
      if (!symbol(instrument).equals(node.path("symbol").asText(""))) {
        continue;
      }
      BigDecimal amount = VenueJson.decimal(node, "positionAmt");
      if (amount.signum() != 0) {
        quantity = quantity.add(amount);
        entryPrice = VenueJson.optionalDecimal(node, "entryPrice");
      }
    }
    return new PositionSnapshot(VENUE_ID, instrument, quantity, entryPrice, config.clock().instant());
  }

  @Override
  public void configureInstrument(Instrument instrument, LeverageSettings settings) {
    Map<String, String> leverage = new LinkedHashMap<>();
    leverage.put("symbol", symbol(instrument));
    leverage.put("leverage", Integer.toString(settings.leverage()));
    signedPost(LEVERAGE_PATH, leverage, "set_leverage");

    Map<String, String> marginType = new LinkedHashMap<>();
    marginType.put("symbol", symbol(instrument));
    marginType.put("marginType", settings.marginMode().name());
    try {
      signedPost(MARGIN_TYPE_PATH, marginType, "set_margin_type");
    } catch (VenueConnectorException ex) {
      if (!BinanceErrorDecoder.NO_NEED_TO_CHANGE_MARGIN_TYPE.equals(ex.venueCode())) {
        throw ex;
      }
      log.debug("Margin type already set venue={} symbol={}", VENUE_ID, symbol(instrument));
    }
    log.info(
        "Configured instrument venue={} symbol={} leverage={} marginMode={}",
        VENUE_ID,
        symbol(instrument),
        settings.leverage(),
        settings.marginMode());
  }

  private Map<String, String> orderParams(Instrument instrument, OrderSide side, BigDecimal quantity) {
    if (quantity == null || quantity.signum() <= 0) {
      throw new IllegalArgumentException("quantity must be > 0");
    }
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol(instrument));
    params.put("side", side.name());
    if (config.dualSidePosition()) {
      // only the short side is ever traded: SELL opens it, BUY closes it
      params.put("positionSide", "SHORT");
    }
    params.put("quantity", quantity.stripTrailingZeros().toPlainString());
    params.put("newClientOrderId", clientOrderIds.get());
    params.put("newOrderRespType", "RESULT");
    return params;
  }

  private OrderHandle submit(
      Instrument instrument, OrderSide side, BigDecimal quantity, Map<String, String> params) {
    JsonNode node = signedPost(ORDER_PATH, params, "place_order");
    meterRegistry.counter("venue.order.placed.total", "venue", VENUE_ID, "side", side.name()).increment();
    OrderHandle handle =
        new OrderHandle(
            VENUE_ID,
            instrument,
            VenueJson.text(node, "orderId"),
            VenueJson.optionalText(node, "clientOrderId"),
            side,
            quantity,
            config.clock().instant());
    log.info(
        "Order accepted venue={} symbol={} side={} qty={} orderId={} status={}",
        VENUE_ID,
        symbol(instrument),
        side,
        quantity.toPlainString(),
        handle.orderId(),
        node.path("status").asText(""));
    return handle;
  }

  private OrderStatusReport toReport(JsonNode node) {
    BigDecimal executed = VenueJson.decimal(node, "executedQty");
    BigDecimal averagePrice = VenueJson.optionalDecimal(node, "avgPrice");
    if (averagePrice != null && averagePrice.signum() == 0) {
      averagePrice = null;
    }
    return new OrderStatusReport(
        VenueJson.text(node, "orderId"),
        mapState(VenueJson.text(node, "status"), executed),
        executed,
        averagePrice,
        BigDecimal.ZERO,
        null);
  }

  static OrderState mapState(String status, BigDecimal executed) {
    boolean anyFill = executed.signum() > 0;
    switch (status) {
      case "NEW":
        return OrderState.NEW;
      case "PARTIALLY_FILLED":
        return OrderState.PARTIALLY_FILLED;
      case "FILLED":
        return OrderState.FILLED;
      case "CANCELED":
      case "EXPIRED":
      case "EXPIRED_IN_MATCH":
        return anyFill ? OrderState.PARTIALLY_FILLED_CLOSED : OrderState.CANCELED;
      case "REJECTED":
        return OrderState.REJECTED;
      default:
        return OrderState.UNKNOWN;
    }
  }

  private OrderStatusReport withCommission(OrderHandle handle, OrderStatusReport report) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol(handle.instrument()));
    params.put("orderId", handle.orderId());
    try {
      JsonNode trades =
          retryExecutor.execute(
              VENUE_ID, "user_trades", () -> signedGet(USER_TRADES_PATH, params, "user_trades"));
      BigDecimal commission = BigDecimal.ZERO;
      String commissionAsset = null;
      for (JsonNode trade : trades) {
        BigDecimal fee = VenueJson.optionalDecimal(trade, "commission");
        if (fee != null) {
          commission = commission.add(fee.abs());
          commissionAsset = VenueJson.optionalText(trade, "commissionAsset");
        }
      }
      return new OrderStatusReport(
          report.orderId(),
          report.state(),
          report.filledQuantity(),
          report.averagePrice(),
          commission,
          commissionAsset);
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      log.warn(
          "Commission lookup failed, reporting fill without fee venue={} orderId={} status={}",
          VENUE_ID,
          handle.orderId(),
          ex.httpStatus());
      return report;
    }
  }

  private JsonNode signedGet(String path, Map<String, String> params, String action) {
    HttpRequest request =
        HttpRequest.newBuilder(config.baseUri().resolve(path + "?" + signer.signedQuery(params)))
            .timeout(config.timeout())
            .header("X-MBX-APIKEY", config.apiKey())
            .GET()
            .build();
    return VenueJson.parse(objectMapper, VENUE_ID, transport.exchange(request, action));
  }

  private JsonNode signedPost(String path, Map<String, String> params, String action) {
    HttpRequest request =
        HttpRequest.newBuilder(config.baseUri().resolve(path))
            .timeout(config.timeout())
            .header("X-MBX-APIKEY", config.apiKey())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(signer.signedQuery(params), StandardCharsets.UTF_8))
            .build();
    return VenueJson.parse(objectMapper, VENUE_ID, transport.exchange(request, action));
  }
}
