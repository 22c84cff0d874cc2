package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.integration.venue.PositionSnapshot;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.integration.venue.VenueBalances;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/** Reads both venues concurrently so the two halves of a snapshot are close in time. */
public class ExposureReader {
  private final VenueAdapter venueA;
  private final VenueAdapter venueB;
  private final Instrument instrument;
  private final Executor executor;
  private final Clock clock;

  public ExposureReader(
      VenueAdapter venueA, VenueAdapter venueB, Instrument instrument, Executor executor, Clock clock) {
    this.venueA = Objects.requireNonNull(venueA, "venueA is required");
    this.venueB = Objects.requireNonNull(venueB, "venueB is required");
    this.instrument = Objects.requireNonNull(instrument, "instrument is required");
    this.executor = Objects.requireNonNull(executor, "executor is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
  }

  public ExposureSnapshot capture() {
    CompletableFuture<VenueRead> readA = CompletableFuture.supplyAsync(() -> read(venueA), executor);
    CompletableFuture<VenueRead> readB = CompletableFuture.supplyAsync(() -> read(venueB), executor);
    VenueRead a = join(readA);
    VenueRead b = join(readB);
    return new ExposureSnapshot(a.balances(), a.position(), b.balances(), b.position(), clock.instant());
  }

  private VenueRead read(VenueAdapter venue) {
    return new VenueRead(venue.fetchBalances(), venue.fetchPosition(instrument));
  }

  private static VenueRead join(CompletableFuture<VenueRead> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw ex;
    }
  }

  private record VenueRead(VenueBalances balances, PositionSnapshot position) {}
}
