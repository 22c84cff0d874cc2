package com.hedgeplatform.worker.session;

import com.hedgeplatform.worker.config.HedgeEngineProperties;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the session on the main thread once the context is up. On shutdown it asks the session to
 * stop and holds context close until the in-flight trade is settled and the summary reported.
 */
@Component
@ConditionalOnProperty(
    prefix = "hedge.engine.session",
    name = "autostart",
    havingValue = "true",
    matchIfMissing = true)
public class HedgeSessionRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(HedgeSessionRunner.class);
  private static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(5);

  private final HedgeSession session;
  private final Duration shutdownGrace;

  public HedgeSessionRunner(HedgeSession session, HedgeEngineProperties engine) {
    this.session = session;
    // a trade and the rebalance that may follow it can each wait out a full verification
    this.shutdownGrace = engine.getVerification().getMaxWait().multipliedBy(2).plus(SHUTDOWN_MARGIN);
  }

  @Override
  public void run(ApplicationArguments args) {
    session.run();
  }

  @PreDestroy
  public void stop() {
    session.requestStop();
    try {
      if (!session.awaitCompletion(shutdownGrace)) {
        log.warn(
            "Hedge session still running after shutdown grace graceMs={}", shutdownGrace.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for hedge session to finish graceMs={}", shutdownGrace.toMillis());
    }
  }

  Duration shutdownGrace() {
    return shutdownGrace;
  }
}
