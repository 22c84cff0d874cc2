package com.hedgeplatform.worker.session;

import com.hedgeplatform.domain.hedge.LegResult;
import com.hedgeplatform.domain.hedge.OrderSide;
import com.hedgeplatform.domain.hedge.PairedTradeResult;
import com.hedgeplatform.domain.hedge.TradeIntent;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Execution quality against the prices the gate saw.
 *
 * <p>Leg slippage is {@code (avg - expected) / expected}, sign-flipped for sells so that a positive
 * value is always a worse price. Spread slippage is realised minus expected spread, so negative is
 * worse.
 */
public class SlippageTracker {
  private final Accumulator legA = new Accumulator();
  private final Accumulator legB = new Accumulator();
  private final Accumulator spread = new Accumulator();

  public synchronized void record(PairedTradeResult result) {
    TradeIntent intent = result.intent();
    BigDecimal avgA = priced(result.legA());
    BigDecimal avgB = priced(result.legB());
    if (avgA != null) {
      legA.add(adverse(result.legA().side(), intent.expectedLegAPrice(), avgA));
    }
    if (avgB != null) {
      legB.add(adverse(result.legB().side(), intent.expectedLegBPrice(), avgB));
    }
    if (avgA != null && avgB != null) {
      BigDecimal realised = intent.direction().realizedSpread(avgA, avgB);
      spread.add(realised.subtract(intent.expectedSpread()));
    }
  }

  public synchronized SlippageStats legA() {
    return legA.stats();
  }

  public synchronized SlippageStats legB() {
    return legB.stats();
  }

  public synchronized SlippageStats spread() {
    return spread.stats();
  }

  static BigDecimal adverse(OrderSide side, BigDecimal expected, BigDecimal actual) {
    BigDecimal relative = actual.subtract(expected).divide(expected, MathContext.DECIMAL64);
    return side == OrderSide.BUY ? relative : relative.negate();
  }

  private static BigDecimal priced(LegResult leg) {
    if (!leg.isFilled() || leg.averagePrice() == null || leg.averagePrice().signum() == 0) {
      return null;
    }
    return leg.averagePrice();
  }

  private static final class Accumulator {
    private long count;
    private BigDecimal sum = BigDecimal.ZERO;
    private BigDecimal min;
    private BigDecimal max;

    void add(BigDecimal value) {
      count++;
      sum = sum.add(value);
      min = min == null ? value : min.min(value);
      max = max == null ? value : max.max(value);
    }

    SlippageStats stats() {
      if (count == 0) {
        return SlippageStats.empty();
      }
      return new SlippageStats(count, sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64), min, max);
    }
  }
}
