package com.hedgeplatform.integration.venue;

import java.math.BigDecimal;

/** Moves idle funds (for example savings products) back into the tradable balance. */
public interface CapitalReservoir {
  /**
   * @throws VenueConnectorException when the redemption was not accepted
   */
  void redeem(String asset, BigDecimal amount);

  default boolean isEnabled() {
    return true;
  }

  static CapitalReservoir none() {
    return new CapitalReservoir() {
      @Override
      public void redeem(String asset, BigDecimal amount) {
        throw new UnsupportedOperationException("no capital reservoir configured");
      }

      @Override
      public boolean isEnabled() {
        return false;
      }
    };
  }
}
