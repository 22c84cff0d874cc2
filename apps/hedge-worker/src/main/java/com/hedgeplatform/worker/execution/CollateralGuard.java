package com.hedgeplatform.worker.execution;

import com.hedgeplatform.domain.hedge.HedgeDirection;
import com.hedgeplatform.domain.hedge.InsufficientCollateralException;
import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.TradeIntent;
import com.hedgeplatform.integration.venue.CapitalReservoir;
import com.hedgeplatform.integration.venue.FatalVenueException;
import com.hedgeplatform.integration.venue.VenueConnectorException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pre-trade funding check.
 *
 * <p>OPEN needs quote for the spot buy on A and initial margin for the short on B. CLOSE needs the
 * base asset on A and an open short of at least the trade size on B. Only a spot shortfall can be
 * covered by redeeming from the capital reservoir, followed by one recheck.
 */
public class CollateralGuard {
  private static final Logger log = LoggerFactory.getLogger(CollateralGuard.class);

  private final String venueAId;
  private final String venueBId;
  private final CapitalReservoir reservoir;
  private final CollateralSettings settings;

  public CollateralGuard(
      String venueAId, String venueBId, CapitalReservoir reservoir, CollateralSettings settings) {
    this.venueAId = Objects.requireNonNull(venueAId, "venueAId is required");
    this.venueBId = Objects.requireNonNull(venueBId, "venueBId is required");
    this.reservoir = Objects.requireNonNull(reservoir, "reservoir is required");
    this.settings = Objects.requireNonNull(settings, "settings is required");
  }

  /**
   * Returns the snapshot the trade may proceed on: the given one, or a refreshed one after a
   * redemption.
   *
   * @throws InsufficientCollateralException when either venue cannot fund its leg
   */
  public ExposureSnapshot ensure(
      TradeIntent intent, ExposureSnapshot exposure, Supplier<ExposureSnapshot> refresh) {
    Requirement spot = spotRequirement(intent, exposure);
    if (spot.shortfall().signum() > 0) {
      exposure = redeemAndRefresh(spot, refresh);
      spot = spotRequirement(intent, exposure);
      if (spot.shortfall().signum() > 0) {
        throw new InsufficientCollateralException(venueAId, spot.asset(), spot.required(), spot.available());
      }
    }
    Requirement perp = perpRequirement(intent, exposure);
    if (perp.shortfall().signum() > 0) {
      throw new InsufficientCollateralException(venueBId, perp.asset(), perp.required(), perp.available());
    }
    return exposure;
  }

  Requirement spotRequirement(TradeIntent intent, ExposureSnapshot exposure) {
    Instrument instrument = intent.instrument();
    if (intent.direction() == HedgeDirection.OPEN) {
      BigDecimal required =
          intent.quantity().multiply(intent.expectedLegAPrice()).multiply(settings.spotBuffer());
      return new Requirement(instrument.quote(), required, exposure.balancesA().free(instrument.quote()));
    }
    return new Requirement(instrument.base(), intent.quantity(), exposure.balancesA().free(instrument.base()));
  }

  Requirement perpRequirement(TradeIntent intent, ExposureSnapshot exposure) {
    Instrument instrument = intent.instrument();
    if (intent.direction() == HedgeDirection.OPEN) {
      BigDecimal required =
          intent
              .quantity()
              .multiply(intent.expectedLegBPrice())
              .divide(BigDecimal.valueOf(settings.leverage()), MathContext.DECIMAL64)
              .multiply(settings.marginBuffer());
      return new Requirement(instrument.quote(), required, exposure.balancesB().free(instrument.quote()));
    }
    return new Requirement(instrument.base(), intent.quantity(), exposure.positionB().shortQuantity());
  }

  private ExposureSnapshot redeemAndRefresh(Requirement spot, Supplier<ExposureSnapshot> refresh) {
    if (!reservoir.isEnabled()) {
      throw new InsufficientCollateralException(venueAId, spot.asset(), spot.required(), spot.available());
    }
    BigDecimal amount = spot.shortfall().multiply(settings.redeemBuffer());
    log.info(
        "Redeeming from capital reservoir venue={} asset={} shortfall={} amount={}",
        venueAId,
        spot.asset(),
        spot.shortfall().toPlainString(),
        amount.toPlainString());
    try {
      reservoir.redeem(spot.asset(), amount);
    } catch (FatalVenueException ex) {
      throw ex;
    } catch (VenueConnectorException ex) {
      log.warn(
          "Capital reservoir redemption failed venue={} asset={} status={}",
          venueAId,
          spot.asset(),
          ex.httpStatus(),
          ex);
      throw new InsufficientCollateralException(venueAId, spot.asset(), spot.required(), spot.available());
    }
    return refresh.get();
  }

  record Requirement(String asset, BigDecimal required, BigDecimal available) {
    BigDecimal shortfall() {
      BigDecimal gap = required.subtract(available);
      return gap.signum() > 0 ? gap : BigDecimal.ZERO;
    }
  }
}
