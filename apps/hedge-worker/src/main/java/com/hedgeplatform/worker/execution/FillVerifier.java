package com.hedgeplatform.worker.execution;

import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.OrderPollResult;
import com.hedgeplatform.integration.venue.OrderStatusReport;
import com.hedgeplatform.integration.venue.ReadRetryExecutor;
import com.hedgeplatform.integration.venue.VenueAdapter;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls an accepted order until it reaches a terminal state or the wait budget is spent. An
 * interrupt does not cut polling short; the flag is restored before returning.
 */
public class FillVerifier {
  private static final Logger log = LoggerFactory.getLogger(FillVerifier.class);

  private final VerificationSettings settings;
  private final ReadRetryExecutor.Sleeper sleeper;

  public FillVerifier(VerificationSettings settings) {
    this(settings, ReadRetryExecutor.Sleeper.threadSleep());
  }

  public FillVerifier(VerificationSettings settings, ReadRetryExecutor.Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings is required");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
  }

  public LegVerification await(VenueAdapter venue, OrderHandle handle) {
    OrderStatusReport last = null;
    boolean interrupted = false;
    int maxPolls = settings.maxPolls();
    try {
      for (int poll = 1; poll <= maxPolls; poll++) {
        OrderPollResult result = venue.pollOrder(handle);
        if (result.kind() == OrderPollResult.Kind.REPORTED) {
          last = result.report();
          if (last.isTerminal()) {
            return new LegVerification(handle, last, true);
          }
        } else {
          log.debug(
              "Order status pending venue={} orderId={} kind={} poll={}",
              handle.venueId(),
              handle.orderId(),
              result.kind(),
              poll);
        }
        if (poll < maxPolls) {
          interrupted |= pause(settings.pollInterval());
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    log.warn(
        "Order not settled within wait budget venue={} orderId={} maxWaitMs={} lastState={}",
        handle.venueId(),
        handle.orderId(),
        settings.maxWait().toMillis(),
        last == null ? "none" : last.state());
    return new LegVerification(handle, last, false);
  }

  private boolean pause(Duration duration) {
    try {
      sleeper.sleep(duration);
      return false;
    } catch (InterruptedException ex) {
      return true;
    }
  }
}
