package com.hedgeplatform.integration.venue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ReadBackoffTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-25T12:00:00Z"), ZoneOffset.UTC);

  private final ReadBackoff backoff =
      new ReadBackoff(Duration.ofMillis(500), Duration.ofSeconds(3), false, CLOCK);

  @Test
  void shouldDoublePauseBetweenFailedReadsUntilCapped() {
    VenueConnectorException reset = transportFailure();

    assertEquals(Duration.ofMillis(500), backoff.delayAfter(1, reset));
    assertEquals(Duration.ofMillis(1000), backoff.delayAfter(2, reset));
    assertEquals(Duration.ofMillis(2000), backoff.delayAfter(3, reset));
    assertEquals(Duration.ofSeconds(3), backoff.delayAfter(4, reset));
    assertEquals(Duration.ofSeconds(3), backoff.delayAfter(40, reset));
  }

  @Test
  void shouldSpreadPauseBelowCeilingWhenJittered() {
    ReadBackoff jittered =
        new ReadBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), true, () -> 0.5d, CLOCK);

    assertEquals(Duration.ofMillis(50), jittered.delayAfter(1, transportFailure()));
    assertEquals(Duration.ofMillis(100), jittered.delayAfter(2, transportFailure()));
  }

  @Test
  void shouldObeyVenueRequestedWaitUpToCap() {
    assertEquals(Duration.ofSeconds(2), backoff.delayAfter(1, throttled(" 2 ")));
    assertEquals(Duration.ofSeconds(3), backoff.delayAfter(1, throttled("120")));
    assertEquals(Duration.ofSeconds(3), backoff.delayAfter(1, throttled("99999999999999999999")));
  }

  @Test
  void shouldReadHttpDateRetryAfterAgainstClock() {
    assertEquals(Duration.ofSeconds(1), backoff.delayAfter(3, throttled("Wed, 25 Feb 2026 12:00:01 GMT")));
    assertEquals(Duration.ZERO, backoff.delayAfter(3, throttled("Wed, 25 Feb 2026 11:59:00 GMT")));
  }

  @Test
  void shouldFallBackToScheduleWhenRetryAfterIsUnreadable() {
    assertEquals(Duration.ofMillis(1000), backoff.delayAfter(2, throttled("soon")));
    assertTrue(backoff.venueRequestedWait("").isEmpty());
    assertTrue(backoff.venueRequestedWait(null).isEmpty());
  }

  private static VenueConnectorException transportFailure() {
    return new VenueConnectorException(
        "gateio-spot", "connection reset", VenueConnectorException.IO_FAILURE_STATUS, null);
  }

  private static VenueConnectorException throttled(String retryAfter) {
    return new VenueConnectorException("binance-usdm", "too many requests", 429, "-1003", retryAfter, null);
  }
}
