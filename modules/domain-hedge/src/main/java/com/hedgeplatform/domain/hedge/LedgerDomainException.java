package com.hedgeplatform.domain.hedge;

public class LedgerDomainException extends HedgeDomainException {
  public LedgerDomainException(String message) {
    super(message);
  }
}
