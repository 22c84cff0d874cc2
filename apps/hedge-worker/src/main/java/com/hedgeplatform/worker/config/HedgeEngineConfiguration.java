package com.hedgeplatform.worker.config;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OpportunityGate;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.StrategyParameters;
import com.hedgeplatform.integration.venue.CapitalReservoir;
import com.hedgeplatform.integration.venue.LeverageSettings;
import com.hedgeplatform.integration.venue.VenueAdapter;
import com.hedgeplatform.worker.execution.CollateralGuard;
import com.hedgeplatform.worker.execution.CollateralSettings;
import com.hedgeplatform.worker.execution.ExposureReader;
import com.hedgeplatform.worker.execution.FillVerifier;
import com.hedgeplatform.worker.execution.PairedExecutor;
import com.hedgeplatform.worker.execution.Rebalancer;
import com.hedgeplatform.worker.execution.VerificationSettings;
import com.hedgeplatform.worker.feed.FeedSettings;
import com.hedgeplatform.worker.feed.OrderBookAggregator;
import com.hedgeplatform.worker.observability.HedgeMetrics;
import com.hedgeplatform.worker.observability.SessionSummaryReporter;
import com.hedgeplatform.worker.session.HedgeSession;
import com.hedgeplatform.worker.session.SessionSettings;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({HedgeStrategyProperties.class, HedgeEngineProperties.class})
public class HedgeEngineConfiguration {

  @Bean
  public Instrument hedgeInstrument(HedgeStrategyProperties strategy) {
    return Instrument.parse(strategy.getInstrument());
  }

  @Bean
  @ConditionalOnMissingBean
  public PositionLedger positionLedger(Instrument hedgeInstrument, HedgeStrategyProperties strategy) {
    return new PositionLedger(
        hedgeInstrument, strategy.getDirection(), strategy.getRebalanceThreshold());
  }

  @Bean
  @ConditionalOnMissingBean
  public OpportunityGate opportunityGate(
      HedgeStrategyProperties strategy, HedgeEngineProperties engine) {
    return new OpportunityGate(
        new StrategyParameters(
            strategy.getDirection(),
            strategy.getMinSpread(),
            strategy.getMaxAbsSpread(),
            strategy.getDepthMultiplier(),
            strategy.getTradeSize(),
            engine.getFeed().getMaxSnapshotAge()));
  }

  @Bean
  @ConditionalOnMissingBean
  public HedgeMetrics hedgeMetrics(MeterRegistry meterRegistry, PositionLedger positionLedger) {
    HedgeMetrics metrics = new HedgeMetrics(meterRegistry);
    metrics.bindLedger(positionLedger);
    return metrics;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public OrderBookAggregator orderBookAggregator(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      Instrument hedgeInstrument,
      HedgeEngineProperties engine,
      Clock hedgeClock,
      MeterRegistry meterRegistry) {
    HedgeEngineProperties.Feed feed = engine.getFeed();
    return new OrderBookAggregator(
        venueA,
        venueB,
        hedgeInstrument,
        new FeedSettings(
            feed.getMaxSnapshotAge(),
            feed.getStallTimeout(),
            feed.getResubscribeBaseBackoff(),
            feed.getResubscribeMaxBackoff()),
        hedgeClock,
        meterRegistry);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService hedgeLegPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        2,
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "hedge-leg-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        });
  }

  @Bean
  public ReentrantLock hedgeExecutionLock() {
    return new ReentrantLock();
  }

  @Bean
  @ConditionalOnMissingBean
  public ExposureReader exposureReader(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      Instrument hedgeInstrument,
      ExecutorService hedgeLegPool,
      Clock hedgeClock) {
    return new ExposureReader(venueA, venueB, hedgeInstrument, hedgeLegPool, hedgeClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public CollateralGuard collateralGuard(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      CapitalReservoir capitalReservoir,
      HedgeEngineProperties engine,
      HedgeStrategyProperties strategy) {
    HedgeEngineProperties.Collateral collateral = engine.getCollateral();
    return new CollateralGuard(
        venueA.venueId(),
        venueB.venueId(),
        capitalReservoir,
        new CollateralSettings(
            collateral.getSpotBuffer(),
            collateral.getMarginBuffer(),
            collateral.getRedeemBuffer(),
            strategy.getLeverage()));
  }

  @Bean
  @ConditionalOnMissingBean
  public FillVerifier fillVerifier(HedgeEngineProperties engine) {
    HedgeEngineProperties.Verification verification = engine.getVerification();
    return new FillVerifier(
        new VerificationSettings(verification.getPollInterval(), verification.getMaxWait()));
  }

  @Bean
  @ConditionalOnMissingBean
  public PairedExecutor pairedExecutor(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      ExposureReader exposureReader,
      CollateralGuard collateralGuard,
      FillVerifier fillVerifier,
      PositionLedger positionLedger,
      ReentrantLock hedgeExecutionLock,
      ExecutorService hedgeLegPool,
      HedgeStrategyProperties strategy,
      HedgeMetrics hedgeMetrics) {
    return new PairedExecutor(
        venueA,
        venueB,
        exposureReader,
        collateralGuard,
        fillVerifier,
        positionLedger,
        hedgeExecutionLock,
        hedgeLegPool,
        strategy.getFillTolerance(),
        hedgeMetrics);
  }

  @Bean
  @ConditionalOnMissingBean
  public Rebalancer rebalancer(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      PositionLedger positionLedger,
      ExposureReader exposureReader,
      FillVerifier fillVerifier,
      ReentrantLock hedgeExecutionLock,
      HedgeStrategyProperties strategy,
      HedgeMetrics hedgeMetrics,
      Clock hedgeClock) {
    return new Rebalancer(
        venueA,
        venueB,
        positionLedger,
        exposureReader,
        fillVerifier,
        hedgeExecutionLock,
        strategy.getQuantityScale(),
        hedgeMetrics,
        hedgeClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public HedgeSession hedgeSession(
      @Qualifier("venueA") VenueAdapter venueA,
      @Qualifier("venueB") VenueAdapter venueB,
      OrderBookAggregator orderBookAggregator,
      OpportunityGate opportunityGate,
      PairedExecutor pairedExecutor,
      Rebalancer rebalancer,
      PositionLedger positionLedger,
      HedgeStrategyProperties strategy,
      HedgeEngineProperties engine,
      HedgeMetrics hedgeMetrics,
      SessionSummaryReporter sessionSummaryReporter,
      Clock hedgeClock) {
    HedgeEngineProperties.Session session = engine.getSession();
    SessionSettings settings =
        new SessionSettings(
            new LeverageSettings(strategy.getLeverage(), strategy.getMarginMode()),
            session.getIdleWait(),
            session.getTradeCooldown(),
            strategy.getMaxConsecutiveFailures(),
            strategy.getTargetTrades(),
            strategy.isDryRun());
    return new HedgeSession(
        venueA,
        venueB,
        orderBookAggregator,
        opportunityGate,
        pairedExecutor,
        rebalancer,
        positionLedger,
        settings,
        hedgeMetrics,
        sessionSummaryReporter,
        hedgeClock);
  }
}
