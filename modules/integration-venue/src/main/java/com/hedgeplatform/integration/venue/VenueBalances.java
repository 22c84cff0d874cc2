package com.hedgeplatform.integration.venue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

public record VenueBalances(String venueId, Map<String, AssetBalance> balances, Instant capturedAt) {
  public VenueBalances {
    Objects.requireNonNull(venueId, "venueId must not be null");
    balances = Map.copyOf(balances);
    Objects.requireNonNull(capturedAt, "capturedAt must not be null");
  }

  public static VenueBalances of(String venueId, List<AssetBalance> balances, Instant capturedAt) {
    return new VenueBalances(
        venueId,
        balances.stream()
            .collect(
                Collectors.toMap(
                    balance -> balance.asset().toUpperCase(Locale.ROOT),
                    Function.identity(),
                    (first, second) -> second)),
        capturedAt);
  }

  public BigDecimal free(String asset) {
    AssetBalance balance = balances.get(asset.toUpperCase(Locale.ROOT));
    return balance == null ? BigDecimal.ZERO : balance.free();
  }

  public BigDecimal total(String asset) {
    AssetBalance balance = balances.get(asset.toUpperCase(Locale.ROOT));
    return balance == null ? BigDecimal.ZERO : balance.total();
  }
}
