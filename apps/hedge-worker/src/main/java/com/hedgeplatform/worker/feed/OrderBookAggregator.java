package com.hedgeplatform.worker.feed;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import com.hedgeplatform.domain.hedge.SnapshotPair;
import com.hedgeplatform.integration.venue.OrderBookListener;
import com.hedgeplatform.integration.venue.OrderBookSubscription;
import com.hedgeplatform.integration.venue.StreamDisconnectException;
import com.hedgeplatform.integration.venue.VenueAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the latest top of book from both venues and pairs them for the gate.
 *
 * <p>A leg whose snapshot is at least {@code maxSnapshotAge} old is never paired. Dropped streams
 * are resubscribed with doubling backoff; a live stream that goes silent for {@code stallTimeout}
 * is torn down and resubscribed by the watchdog.
 */
public class OrderBookAggregator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OrderBookAggregator.class);

  private final Instrument instrument;
  private final FeedSettings settings;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final LegFeed legA;
  private final LegFeed legB;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ReentrantLock updateLock = new ReentrantLock();
  private final Condition updated = updateLock.newCondition();
  private long updateCount;

  public OrderBookAggregator(
      VenueAdapter venueA,
      VenueAdapter venueB,
      Instrument instrument,
      FeedSettings settings,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.instrument = Objects.requireNonNull(instrument, "instrument is required");
    this.settings = Objects.requireNonNull(settings, "settings is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.legA = new LegFeed("A", Objects.requireNonNull(venueA, "venueA is required"));
    this.legB = new LegFeed("B", Objects.requireNonNull(venueB, "venueB is required"));
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "hedge-feed");
                thread.setDaemon(true);
                return thread;
              }
            });
  }

  /** Subscribes both venues and starts the stall watchdog. Calling it again has no effect. */
  public void start() {
    if (closed.get() || !running.compareAndSet(false, true)) {
      return;
    }
    log.info(
        "Starting order book feeds instrument={} venueA={} venueB={} maxSnapshotAgeMs={}",
        instrument,
        legA.venue.venueId(),
        legB.venue.venueId(),
        settings.maxSnapshotAge().toMillis());
    scheduler.execute(() -> legA.subscribe(false));
    scheduler.execute(() -> legB.subscribe(false));
    long periodMs = Math.max(100L, Math.min(1000L, settings.stallTimeout().toMillis() / 4));
    scheduler.scheduleAtFixedRate(this::checkStalls, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  public boolean isRunning() {
    return running.get();
  }

  /** The current pair, or empty while either leg is missing or too old. Never blocks. */
  public Optional<SnapshotPair> latest() {
    Instant now = clock.instant();
    OrderBookSnapshot a = legA.freshSnapshot(now);
    OrderBookSnapshot b = legB.freshSnapshot(now);
    if (a == null || b == null) {
      return Optional.empty();
    }
    return Optional.of(new SnapshotPair(a, b, now));
  }

  /**
   * Waits until either venue delivers a new snapshot or the timeout elapses, then returns {@link
   * #latest()}.
   */
  public Optional<SnapshotPair> awaitUpdate(Duration timeout) throws InterruptedException {
    updateLock.lock();
    try {
      long seen = updateCount;
      long remaining = timeout.toNanos();
      while (updateCount == seen && remaining > 0L && !closed.get()) {
        remaining = updated.awaitNanos(remaining);
      }
    } finally {
      updateLock.unlock();
    }
    return latest();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    running.set(false);
    scheduler.shutdownNow();
    for (LegFeed leg : List.of(legA, legB)) {
      leg.closeSubscription();
    }
    signalUpdate();
    log.info("Order book feeds stopped instrument={}", instrument);
  }

  long resubscriptions(String leg) {
    return ("A".equals(leg) ? legA : legB).resubscriptions.get();
  }

  void checkStalls() {
    if (!running.get()) {
      return;
    }
    Instant now = clock.instant();
    for (LegFeed leg : List.of(legA, legB)) {
      leg.checkStall(now);
    }
  }

  private void signalUpdate() {
    updateLock.lock();
    try {
      updateCount++;
      updated.signalAll();
    } finally {
      updateLock.unlock();
    }
  }

  private final class LegFeed {
    private final String label;
    private final VenueAdapter venue;
    private final AtomicReference<OrderBookSnapshot> latest = new AtomicReference<>();
    private final AtomicReference<OrderBookSubscription> subscription = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicLong resubscriptions = new AtomicLong();
    private final AtomicBoolean stale = new AtomicBoolean(false);
    private volatile Instant lastMessageAt;

    private LegFeed(String label, VenueAdapter venue) {
      this.label = label;
      this.venue = venue;
    }

    OrderBookSnapshot freshSnapshot(Instant now) {
      OrderBookSnapshot snapshot = latest.get();
      boolean fresh = snapshot != null && snapshot.ageAt(now).compareTo(settings.maxSnapshotAge()) < 0;
      if (!fresh && snapshot != null && stale.compareAndSet(false, true)) {
        meterRegistry.counter("hedge.feed.stale.total", "venue", venue.venueId()).increment();
        log.warn(
            "Order book went stale leg={} venue={} ageMs={} maxAgeMs={}",
            label,
            venue.venueId(),
            snapshot.ageAt(now).toMillis(),
            settings.maxSnapshotAge().toMillis());
      } else if (fresh && stale.compareAndSet(true, false)) {
        log.info("Order book fresh again leg={} venue={}", label, venue.venueId());
      }
      return fresh ? snapshot : null;
    }

    void subscribe(boolean resubscribe) {
      if (!running.get()) {
        return;
      }
      long current = generation.incrementAndGet();
      if (resubscribe) {
        resubscriptions.incrementAndGet();
        meterRegistry.counter("hedge.feed.resubscribe.total", "venue", venue.venueId()).increment();
      }
      lastMessageAt = clock.instant();
      try {
        OrderBookSubscription opened = venue.streamOrderBook(instrument, new Listener(current));
        OrderBookSubscription previous = subscription.getAndSet(opened);
        if (previous != null) {
          previous.close();
        }
        if (!running.get()) {
          opened.close();
        }
      } catch (RuntimeException ex) {
        log.warn("Order book subscribe failed leg={} venue={}", label, venue.venueId(), ex);
        scheduleResubscribe(current);
      }
    }

    void checkStall(Instant now) {
      OrderBookSubscription active = subscription.get();
      Instant last = lastMessageAt;
      if (active == null || last == null || !active.isActive()) {
        return;
      }
      Duration silent = Duration.between(last, now);
      if (silent.compareTo(settings.stallTimeout()) >= 0) {
        log.warn(
            "Order book stream stalled leg={} venue={} silentMs={}, resubscribing",
            label,
            venue.venueId(),
            silent.toMillis());
        latest.set(null);
        subscribe(true);
      }
    }

    void closeSubscription() {
      OrderBookSubscription active = subscription.getAndSet(null);
      if (active != null) {
        active.close();
      }
    }

    private void onSnapshot(long source, OrderBookSnapshot snapshot) {
      if (source != generation.get() || !running.get()) {
        return;
      }
      lastMessageAt = clock.instant();
      latest.set(snapshot);
      if (failures.getAndSet(0) > 0) {
        log.info("Order book stream recovered leg={} venue={}", label, venue.venueId());
      }
      signalUpdate();
    }

    private void onDisconnected(long source, StreamDisconnectException error) {
      if (source != generation.get() || !running.get()) {
        return;
      }
      latest.set(null);
      subscription.set(null);
      log.warn(
          "Order book stream dropped leg={} venue={} statusCode={} cause={}",
          label,
          venue.venueId(),
          error.statusCode(),
          error.getCause() == null ? "none" : error.getCause().toString());
      scheduleResubscribe(source);
      signalUpdate();
    }

    private void scheduleResubscribe(long source) {
      if (!running.get()) {
        return;
      }
      Duration delay = settings.resubscribeDelay(failures.incrementAndGet());
      log.info(
          "Resubscribing order book leg={} venue={} delayMs={}", label, venue.venueId(), delay.toMillis());
      scheduler.schedule(
          () -> {
            if (source == generation.get()) {
              subscribe(true);
            }
          },
          delay.toMillis(),
          TimeUnit.MILLISECONDS);
    }

    private final class Listener implements OrderBookListener {
      private final long source;

      private Listener(long source) {
        this.source = source;
      }

      @Override
      public void onSnapshot(OrderBookSnapshot snapshot) {
        LegFeed.this.onSnapshot(source, snapshot);
      }

      @Override
      public void onDisconnected(StreamDisconnectException error) {
        LegFeed.this.onDisconnected(source, error);
      }

      @Override
      public void onConnected(String venueId) {
        log.info("Order book stream connected leg={} venue={}", label, venueId);
      }
    }
  }
}
