package com.hedgeplatform.domain.hedge;

import java.util.Locale;

public record Instrument(String base, String quote) {
  public Instrument {
    base = requireAsset(base, "base");
    quote = requireAsset(quote, "quote");
  }

  public static Instrument parse(String value) {
    if (value == null || value.isBlank()) {
      throw new HedgeDomainException("instrument must not be blank");
    }
    int separator = value.indexOf('/');
    if (separator <= 0 || separator == value.length() - 1 || value.indexOf('/', separator + 1) >= 0) {
      throw new HedgeDomainException("instrument must look like BASE/QUOTE: " + value);
    }
    return new Instrument(value.substring(0, separator), value.substring(separator + 1));
  }

  public String joined(String separator) {
    return base + separator + quote;
  }

  @Override
  public String toString() {
    return base + "/" + quote;
  }

  private static String requireAsset(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new HedgeDomainException(fieldName + " must not be blank");
    }
    return value.trim().toUpperCase(Locale.ROOT);
  }
}
