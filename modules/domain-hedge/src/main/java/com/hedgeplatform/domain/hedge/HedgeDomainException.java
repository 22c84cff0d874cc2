package com.hedgeplatform.domain.hedge;

public class HedgeDomainException extends RuntimeException {
  public HedgeDomainException(String message) {
    super(message);
  }
}
