package com.hedgeplatform.integration.venue;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Pause before the next attempt of a failed venue read.
 *
 * <p>A venue that names its own wait in {@code Retry-After} (Binance on 418/429, Gate.io on 429) is
 * obeyed up to the cap. Otherwise the pause doubles per attempt from the base, optionally drawn
 * uniformly below that ceiling so the two venues' pollers do not retry in lockstep.
 */
public class ReadBackoff {
  private final Duration base;
  private final Duration cap;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;
  private final Clock clock;

  public ReadBackoff(Duration base, Duration cap, boolean jitterEnabled, Clock clock) {
    this(base, cap, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble(), clock);
  }

  public ReadBackoff(
      Duration base, Duration cap, boolean jitterEnabled, DoubleSupplier jitterSource, Clock clock) {
    Objects.requireNonNull(base, "base must not be null");
    Objects.requireNonNull(cap, "cap must not be null");
    this.base = base.isNegative() ? Duration.ZERO : base;
    this.cap = cap.compareTo(this.base) < 0 ? this.base : cap;
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * @param failedAttempt 1 for the first failed read
   */
  public Duration delayAfter(int failedAttempt, VenueConnectorException failure) {
    return failure.retryAfterHeader()
        .flatMap(this::venueRequestedWait)
        .map(wait -> wait.compareTo(cap) > 0 ? cap : wait)
        .orElseGet(() -> scheduled(failedAttempt));
  }

  public Duration cap() {
    return cap;
  }

  Duration scheduled(int failedAttempt) {
    Duration ceiling = base;
    for (int step = 1; step < failedAttempt && ceiling.compareTo(cap) < 0; step++) {
      ceiling = ceiling.multipliedBy(2);
    }
    if (ceiling.compareTo(cap) > 0) {
      ceiling = cap;
    }
    if (!jitterEnabled || ceiling.isZero()) {
      return ceiling;
    }
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    return Duration.ofMillis((long) Math.floor(factor * (ceiling.toMillis() + 1L)));
  }

  /** {@code Retry-After} as delta-seconds or an HTTP date; a date in the past means no wait. */
  Optional<Duration> venueRequestedWait(String header) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String value = header.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
      } catch (NumberFormatException overflow) {
        return Optional.of(cap);
      }
    }
    try {
      ZonedDateTime retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration wait = Duration.between(clock.instant(), retryAt.toInstant());
      return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
    } catch (DateTimeParseException unreadable) {
      return Optional.empty();
    }
  }
}
