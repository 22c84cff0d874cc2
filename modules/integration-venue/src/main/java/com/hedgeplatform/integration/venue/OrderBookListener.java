package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.OrderBookSnapshot;

public interface OrderBookListener {
  void onSnapshot(OrderBookSnapshot snapshot);

  /** Called at most once per subscription. */
  void onDisconnected(StreamDisconnectException error);

  default void onConnected(String venueId) {}
}
