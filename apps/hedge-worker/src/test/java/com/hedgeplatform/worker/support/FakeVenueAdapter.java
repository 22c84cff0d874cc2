package com.hedgeplatform.worker.support;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.domain.hedge.OrderState;
import com.hedgeplatform.integration.venue.AssetBalance;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.LeverageSettings;
import com.hedgeplatform.integration.venue.OrderBookListener;
import com.hedgeplatform.integration.venue.OrderBookSubscription;
import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.OrderPollResult;
import com.hedgeplatform.integration.venue.OrderStatusReport;
import com.hedgeplatform.integration.venue.PositionSnapshot;
import com.hedgeplatform.integration.venue.RejectedOrderException;
import com.hedgeplatform.integration.venue.StreamDisconnectException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.integration.venue.VenueBalances;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory venue. Orders fill in full at {@link #fillPrice} unless a {@link Script} step says
 * otherwise. A spot venue reports its base balance as the position; a perpetual venue tracks a
 * signed position.
 */
public final class FakeVenueAdapter implements VenueAdapter {
  public enum Script {
    FILL,
    REJECT,
    FATAL,
    /** The order fills but the placement call fails with an unknown outcome. */
    LOST_AFTER_FILL,
    /** The order fills but status polls never find it. */
    FILL_NOT_REPORTED,
    /** The order fills but the status report says FILLED with nothing executed. */
    FILLED_ZERO_REPORTED,
    NO_FILL
  }

  public record PlacedOrder(OrderSide side, BigDecimal quantity) {}

  private final String venueId;
  private final Instrument instrument;
  private final boolean spot;
  private final Clock clock;
  private final Deque<Script> scripts = new ConcurrentLinkedDeque<>();
  private final Map<String, OrderStatusReport> reports = new ConcurrentHashMap<>();
  private final Map<String, BigDecimal> free = new ConcurrentHashMap<>();
  private final List<PlacedOrder> orders = new CopyOnWriteArrayList<>();
  private final List<LeverageSettings> configured = new CopyOnWriteArrayList<>();
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicInteger ids = new AtomicInteger();
  private final AtomicInteger polls = new AtomicInteger();
  private final AtomicInteger reads = new AtomicInteger();
  private volatile BigDecimal position = BigDecimal.ZERO;
  private volatile BigDecimal fillPrice = new BigDecimal("100");
  private volatile BigDecimal fillRatio = BigDecimal.ONE;
  private volatile int pendingPolls;
  private volatile OrderBookSnapshot autoBook;
  private volatile RuntimeException readFailure;
  private volatile int readsBeforeFailure;
  private volatile RuntimeException configureFailure;

  public FakeVenueAdapter(String venueId, Instrument instrument, boolean spot, Clock clock) {
    this.venueId = venueId;
    this.instrument = instrument;
    this.spot = spot;
    this.clock = clock;
  }

  public static FakeVenueAdapter spot(Instrument instrument, Clock clock) {
    return new FakeVenueAdapter("fake-spot", instrument, true, clock);
  }

  public static FakeVenueAdapter perpetual(Instrument instrument, Clock clock) {
    return new FakeVenueAdapter("fake-perp", instrument, false, clock);
  }

  public FakeVenueAdapter balance(String asset, String amount) {
    free.put(asset, new BigDecimal(amount));
    return this;
  }

  public FakeVenueAdapter position(String quantity) {
    position = new BigDecimal(quantity);
    return this;
  }

  public FakeVenueAdapter fillPrice(String price) {
    fillPrice = new BigDecimal(price);
    return this;
  }

  public FakeVenueAdapter fillRatio(String ratio) {
    fillRatio = new BigDecimal(ratio);
    return this;
  }

  public FakeVenueAdapter pendingPolls(int count) {
    pendingPolls = count;
    return this;
  }

  public FakeVenueAdapter script(Script... steps) {
    scripts.addAll(List.of(steps));
    return this;
  }

  /** Every new subscription immediately delivers this top of book, stamped with the clock. */
  public FakeVenueAdapter autoBook(String bid, String ask, String size) {
    autoBook = book(bid, ask, size);
    return this;
  }

  public FakeVenueAdapter failReads(RuntimeException failure) {
    return failReadsAfter(0, failure);
  }

  /** Balance and position reads succeed {@code successfulReads} times, then throw. */
  public FakeVenueAdapter failReadsAfter(int successfulReads, RuntimeException failure) {
    readsBeforeFailure = successfulReads;
    readFailure = failure;
    return this;
  }

  public FakeVenueAdapter failConfigure(RuntimeException failure) {
    configureFailure = failure;
    return this;
  }

  public OrderBookSnapshot book(String bid, String ask, String size) {
    return new OrderBookSnapshot(
        venueId,
        instrument,
        new BigDecimal(bid),
        new BigDecimal(size),
        new BigDecimal(ask),
        new BigDecimal(size),
        clock.instant());
  }

  public void emit(OrderBookSnapshot snapshot) {
    Subscription current = latestSubscription();
    if (current != null && current.isActive()) {
      current.listener.onSnapshot(snapshot);
    }
  }

  public void disconnect() {
    Subscription current = latestSubscription();
    if (current != null && current.isActive()) {
      current.active = false;
      current.listener.onDisconnected(
          new StreamDisconnectException(venueId, 1006, "abnormal closure", null));
    }
  }

  public int subscriptionCount() {
    return subscriptions.size();
  }

  public List<PlacedOrder> orders() {
    return new ArrayList<>(orders);
  }

  public List<LeverageSettings> configured() {
    return new ArrayList<>(configured);
  }

  public int pollCount() {
    return polls.get();
  }

  public BigDecimal currentPosition() {
    return spot ? free.getOrDefault(instrument.base(), BigDecimal.ZERO) : position;
  }

  @Override
  public String venueId() {
    return venueId;
  }

  @Override
  public OrderBookSubscription streamOrderBook(Instrument instrument, OrderBookListener listener) {
    Subscription subscription = new Subscription(listener);
    subscriptions.add(subscription);
    OrderBookSnapshot book = autoBook;
    if (book != null) {
      listener.onSnapshot(
          new OrderBookSnapshot(
              venueId,
              instrument,
              book.bidPrice(),
              book.bidSize(),
              book.askPrice(),
              book.askSize(),
              clock.instant()));
    }
    return subscription;
  }

  @Override
  public OrderHandle placeMarketOrder(Instrument instrument, OrderSide side, BigDecimal quantity) {
    orders.add(new PlacedOrder(side, quantity));
    Script step = scripts.poll();
    String orderId = venueId + "-" + ids.incrementAndGet();
    if (step == Script.REJECT) {
      throw new RejectedOrderException(venueId, "insufficient balance", 400, "BALANCE_NOT_ENOUGH");
    }
    if (step == Script.FATAL) {
      throw new FatalVenueException(venueId, "invalid api key", 401, "INVALID_KEY");
    }
    if (step == Script.LOST_AFTER_FILL) {
      applyFill(side, quantity);
      throw new VenueConnectorException(
          venueId, "connection reset", VenueConnectorException.IO_FAILURE_STATUS, null);
    }
    if (step == Script.FILL_NOT_REPORTED) {
      applyFill(side, quantity);
    } else if (step == Script.FILLED_ZERO_REPORTED) {
      applyFill(side, quantity);
      reports.put(
          orderId,
          new OrderStatusReport(orderId, OrderState.FILLED, BigDecimal.ZERO, null, null, null));
    } else if (step == Script.NO_FILL) {
      reports.put(
          orderId,
          new OrderStatusReport(orderId, OrderState.CANCELED, BigDecimal.ZERO, null, null, null));
    } else {
      BigDecimal filled = quantity.multiply(fillRatio);
      applyFill(side, filled);
      OrderState state =
          filled.compareTo(quantity) == 0 ? OrderState.FILLED : OrderState.PARTIALLY_FILLED_CLOSED;
      reports.put(
          orderId,
          new OrderStatusReport(
              orderId, state, filled, fillPrice, BigDecimal.ZERO, instrument.quote()));
    }
    return new OrderHandle(venueId, instrument, orderId, "c-" + orderId, side, quantity, clock.instant());
  }

  @Override
  public OrderHandle placeLimitOrder(
      Instrument instrument, OrderSide side, BigDecimal quantity, BigDecimal price) {
    return placeMarketOrder(instrument, side, quantity);
  }

  @Override
  public OrderPollResult pollOrder(OrderHandle handle) {
    int poll = polls.incrementAndGet();
    OrderStatusReport report = reports.get(handle.orderId());
    if (report == null || poll <= pendingPolls) {
      return OrderPollResult.notFoundYet("order " + handle.orderId() + " not visible");
    }
    return OrderPollResult.reported(report);
  }

  @Override
  public VenueBalances fetchBalances() {
    checkRead();
    List<AssetBalance> balances = new ArrayList<>();
    free.forEach((asset, amount) -> balances.add(new AssetBalance(asset, amount, BigDecimal.ZERO)));
    return VenueBalances.of(venueId, balances, clock.instant());
  }

  @Override
  public PositionSnapshot fetchPosition(Instrument instrument) {
    checkRead();
    return new PositionSnapshot(venueId, instrument, currentPosition(), null, clock.instant());
  }

  @Override
  public void configureInstrument(Instrument instrument, LeverageSettings settings) {
    if (configureFailure != null) {
      throw configureFailure;
    }
    configured.add(settings);
  }

  private void checkRead() {
    RuntimeException failure = readFailure;
    if (failure != null && reads.incrementAndGet() > readsBeforeFailure) {
      throw failure;
    }
  }

  private synchronized void applyFill(OrderSide side, BigDecimal quantity) {
    BigDecimal signed = side == OrderSide.BUY ? quantity : quantity.negate();
    if (spot) {
      free.merge(instrument.base(), signed, BigDecimal::add);
      free.merge(instrument.quote(), signed.multiply(fillPrice).negate(), BigDecimal::add);
    } else {
      position = position.add(signed);
    }
  }

  private Subscription latestSubscription() {
    return subscriptions.isEmpty() ? null : subscriptions.get(subscriptions.size() - 1);
  }

  private static final class Subscription implements OrderBookSubscription {
    private final OrderBookListener listener;
    private volatile boolean active = true;

    private Subscription(OrderBookListener listener) {
      this.listener = listener;
    }

    @Override
    public String venueId() {
      return "fake";
    }

    @Override
    public boolean isActive() {
      return active;
    }

    @Override
    public void close() {
      active = false;
    }
  }
}
