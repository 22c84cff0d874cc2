package com.hedgeplatform.integration.venue;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry wrapper for idempotent venue reads. Order placement must never go through here.
 */
public class ReadRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(ReadRetryExecutor.class);
  private static final String RETRY_COUNTER = "venue.read.retry.total";
  private static final String EXHAUSTED_COUNTER = "venue.read.retry.exhausted.total";

  private final int maxAttempts;
  private final ReadBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public ReadRetryExecutor(int maxAttempts, ReadBackoff backoff, MeterRegistry meterRegistry) {
    this(maxAttempts, backoff, Sleeper.threadSleep(), meterRegistry);
  }

  public ReadRetryExecutor(
      int maxAttempts, ReadBackoff backoff, Sleeper sleeper, MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String venueId, String action, Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (VenueConnectorException ex) {
        if (!ex.isRetryable()) {
          throw ex;
        }
        String reason = ex.isRateLimited() ? "rate_limited" : "transient";
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "venue", venueId, "reason", reason).increment();
          throw ex;
        }
        Duration wait = backoff.delayAfter(attempt, ex);
        meterRegistry.counter(RETRY_COUNTER, "venue", venueId, "reason", reason).increment();
        log.debug(
            "Retrying venue read venue={} action={} attempt={} waitMs={} status={}",
            venueId,
            action,
            attempt,
            wait.toMillis(),
            ex.httpStatus());
        sleep(venueId, action, wait);
        attempt++;
      }
    }
  }

  private void sleep(String venueId, String action, Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new VenueConnectorException(
          venueId,
          "Interrupted while backing off " + action,
          VenueConnectorException.IO_FAILURE_STATUS,
          null,
          interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    /** Blocks the calling thread at millisecond granularity. */
    static Sleeper threadSleep() {
      return duration -> Thread.sleep(duration.toMillis());
    }
  }
}
