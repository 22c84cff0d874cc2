package com.hedgeplatform.domain.hedge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class InstrumentTest {
  @Test
  void shouldParseAndNormalizeSymbol() {
    Instrument instrument = Instrument.parse("eth/usdt");

    assertEquals("ETH", instrument.base());
    assertEquals("USDT", instrument.quote());
    assertEquals("ETH_USDT", instrument.joined("_"));
    assertEquals("ETHUSDT", instrument.joined(""));
    assertEquals("ETH/USDT", instrument.toString());
  }

  @Test
  void shouldRejectMalformedSymbols() {
    assertThrows(HedgeDomainException.class, () -> Instrument.parse("ETHUSDT"));
    assertThrows(HedgeDomainException.class, () -> Instrument.parse("/USDT"));
    assertThrows(HedgeDomainException.class, () -> Instrument.parse("ETH/USDT/X"));
  }
}
