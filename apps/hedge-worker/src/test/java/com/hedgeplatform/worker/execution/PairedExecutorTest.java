package com.hedgeplatform.worker.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hedgeplatform.domain.hedge.FillSource;
import com.hedgeplatform.domain.hedge.HedgeDirection;
import com.hedgeplatform.domain.hedge.InsufficientCollateralException;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.domain.hedge.PairedTradeResult;
import com.hedgeplatform.domain.hedge.PositionLedger;
import com.hedgeplatform.domain.hedge.TradeIntent;
import com.hedgeplatform.domain.hedge.TradeOutcome;
import com.hedgeplatform.integration.venue.CapitalReservoir;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.worker.observability.HedgeMetrics;
import com.hedgeplatform.worker.support.FakeVenueAdapter;
import com.hedgeplatform.worker.support.FakeVenueAdapter.Script;
import com.hedgeplatform.worker.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PairedExecutorTest {
  private static final Instrument BTC_USDT = Instrument.parse("BTC/USDT");
  private static final BigDecimal QTY = new BigDecimal("0.001");

  private final MutableClock clock = new MutableClock(Instant.parse("2026-02-25T00:00:00Z"));
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final ExecutorService pool = Executors.newFixedThreadPool(2);
  private final FakeVenueAdapter spot =
      FakeVenueAdapter.spot(BTC_USDT, clock).balance("USDT", "1000").balance("BTC", "0").fillPrice("100");
  private final FakeVenueAdapter perp =
      FakeVenueAdapter.perpetual(BTC_USDT, clock).balance("USDT", "1000").fillPrice("100.5");
  private final PositionLedger ledger = new PositionLedger(BTC_USDT, HedgeDirection.OPEN, new BigDecimal("6"));

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void shouldRecordVerifiedTradeWhenBothLegsFill() {
    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(TradeOutcome.VERIFIED, result.outcome());
    assertEquals(FillSource.STATUS_REPORT, result.legA().fillSource());
    assertEquals(0, new BigDecimal("100").compareTo(result.legA().averagePrice()));
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
    assertEquals(1L, ledger.tradesExecuted());
    assertEquals(OrderSide.BUY, spot.orders().get(0).side());
    assertEquals(OrderSide.SELL, perp.orders().get(0).side());
    assertEquals(1.0, meterRegistry.get("hedge.trade.total").tag("outcome", "verified").counter().count());
  }

  @Test
  void shouldRecordOneLegFailureWhenPerpetualRejects() {
    perp.script(Script.REJECT);

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(TradeOutcome.ONE_LEG_FAILED, result.outcome());
    assertEquals(0, new BigDecimal("-0.001").compareTo(ledger.cumulativeDiff()));
    assertEquals(0L, ledger.tradesExecuted());
  }

  @Test
  void shouldFlagPartialHedgeAsFillMismatch() {
    perp.fillRatio("0.5");

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(TradeOutcome.FILL_MISMATCH, result.outcome());
    assertEquals(0, new BigDecimal("-0.0005").compareTo(ledger.cumulativeDiff()));
  }

  @Test
  void shouldRecordBothLegsFailedWithoutMovingImbalance() {
    spot.script(Script.REJECT);
    perp.script(Script.REJECT);

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(TradeOutcome.BOTH_LEGS_FAILED, result.outcome());
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
  }

  @Test
  void shouldInferFillFromExposureWhenPlacementOutcomeIsLost() {
    spot.script(Script.LOST_AFTER_FILL);

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(FillSource.BALANCE_DELTA, result.legA().fillSource());
    assertEquals(0, QTY.compareTo(result.legA().filledQuantity()));
    assertEquals(TradeOutcome.VERIFIED, result.outcome());
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
  }

  @Test
  void shouldInferFillFromPositionWhenStatusNeverAppears() {
    perp.script(Script.FILL_NOT_REPORTED);

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(FillSource.BALANCE_DELTA, result.legB().fillSource());
    assertEquals(0, QTY.compareTo(result.legB().filledQuantity()));
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
  }

  @Test
  void shouldInferFillFromExposureWhenFilledReportCarriesNoQuantity() {
    spot.script(Script.FILLED_ZERO_REPORTED);

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(FillSource.BALANCE_DELTA, result.legA().fillSource());
    assertEquals(0, QTY.compareTo(result.legA().filledQuantity()));
    assertEquals(FillSource.STATUS_REPORT, result.legB().fillSource());
    assertEquals(TradeOutcome.VERIFIED, result.outcome());
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
  }

  @Test
  void shouldStillRecordTradeWhenPostTradeExposureReadIsMalformed() {
    spot.script(Script.LOST_AFTER_FILL)
        .failReadsAfter(2, new IllegalStateException("response missing field: available"));

    PairedTradeResult result = executor(CapitalReservoir.none()).execute(intent("t-1"));

    assertEquals(TradeOutcome.ONE_LEG_FAILED, result.outcome());
    assertEquals(FillSource.NONE, result.legA().fillSource());
    assertEquals(0, QTY.compareTo(result.legB().filledQuantity()));
    assertEquals(0, QTY.compareTo(ledger.cumulativeDiff()));
    assertEquals(1L, ledger.snapshot().partialTrades());
    assertEquals(
        1.0, meterRegistry.get("hedge.trade.total").tag("outcome", "one_leg_failed").counter().count());
  }

  @Test
  void shouldRecordTradeBeforeRethrowingFatalError() {
    perp.script(Script.FATAL);
    PairedExecutor executor = executor(CapitalReservoir.none());

    assertThrows(FatalVenueException.class, () -> executor.execute(intent("t-1")));

    assertEquals(0, new BigDecimal("-0.001").compareTo(ledger.cumulativeDiff()));
    assertEquals(
        1.0, meterRegistry.get("hedge.trade.total").tag("outcome", "one_leg_failed").counter().count());
  }

  @Test
  void shouldNotDispatchWithoutCollateral() {
    spot.balance("USDT", "0.05");

    assertThrows(
        InsufficientCollateralException.class, () -> executor(CapitalReservoir.none()).execute(intent("t-1")));

    assertTrue(spot.orders().isEmpty());
    assertTrue(perp.orders().isEmpty());
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.cumulativeDiff()));
  }

  private PairedExecutor executor(CapitalReservoir reservoir) {
    ExposureReader exposureReader = new ExposureReader(spot, perp, BTC_USDT, pool, clock);
    CollateralGuard guard =
        new CollateralGuard(
            spot.venueId(),
            perp.venueId(),
            reservoir,
            new CollateralSettings(new BigDecimal("1.02"), new BigDecimal("1.05"), new BigDecimal("1.01"), 20));
    FillVerifier verifier =
        new FillVerifier(new VerificationSettings(Duration.ofMillis(1), Duration.ofMillis(3)), duration -> {});
    return new PairedExecutor(
        spot,
        perp,
        exposureReader,
        guard,
        verifier,
        ledger,
        new ReentrantLock(),
        pool,
        new BigDecimal("0.01"),
        new HedgeMetrics(meterRegistry));
  }

  private TradeIntent intent(String tradeId) {
    return new TradeIntent(
        tradeId,
        BTC_USDT,
        HedgeDirection.OPEN,
        QTY,
        new BigDecimal("100"),
        new BigDecimal("100.5"),
        new BigDecimal("0.005"),
        clock.instant());
  }
}
