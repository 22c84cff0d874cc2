package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderSide;
import java.math.BigDecimal;

/**
 * One trading venue. Implementations hide symbol formats, signing and throttling, and must accept
 * concurrent reads while an order placement is outstanding.
 */
public interface VenueAdapter {
  String venueId();

  /**
   * Starts a new top-of-book feed. The returned subscription cannot be restarted; after {@link
   * OrderBookListener#onDisconnected} the caller subscribes again.
   */
  OrderBookSubscription streamOrderBook(Instrument instrument, OrderBookListener listener);

  /**
   * Sends a market order and returns without waiting for fills. Never retried.
   *
   * @throws RejectedOrderException when the venue refuses the order pre-trade
   * @throws FatalVenueException on authentication failures
   * @throws VenueConnectorException when the outcome is unknown
   */
  OrderHandle placeMarketOrder(Instrument instrument, OrderSide side, BigDecimal quantity);

  /** Immediate-or-cancel limit order with the same failure contract as market orders. */
  OrderHandle placeLimitOrder(
      Instrument instrument, OrderSide side, BigDecimal quantity, BigDecimal price);

  OrderPollResult pollOrder(OrderHandle handle);

  VenueBalances fetchBalances();

  PositionSnapshot fetchPosition(Instrument instrument);

  /** Idempotent leverage and margin-mode setup. */
  void configureInstrument(Instrument instrument, LeverageSettings settings);
}
