package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;

public class InsufficientCollateralException extends HedgeDomainException {
  private final String venueId;
  private final String asset;
  private final BigDecimal required;
  private final BigDecimal available;

  public InsufficientCollateralException(
      String venueId, String asset, BigDecimal required, BigDecimal available) {
    super(
        String.format(
            "Insufficient %s collateral on venue %s: required=%s, available=%s",
            asset, venueId, required.toPlainString(), available.toPlainString()));
    this.venueId = venueId;
    this.asset = asset;
    this.required = required;
    this.available = available;
  }

  public String venueId() {
    return venueId;
  }

  public String asset() {
    return asset;
  }

  public BigDecimal required() {
    return required;
  }

  public BigDecimal available() {
    return available;
  }
}
