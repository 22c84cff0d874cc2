package com.hedgeplatform.integration.venue;

public interface OrderBookSubscription extends AutoCloseable {
  String venueId();

  boolean isActive();

  @Override
  void close();
}
