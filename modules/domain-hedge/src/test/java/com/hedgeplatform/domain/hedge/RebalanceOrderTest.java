package com.hedgeplatform.domain.hedge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RebalanceOrderTest {
  private static final Instrument ETH_USDT = Instrument.parse("ETH/USDT");
  private static final Instant NOW = Instant.parse("2026-02-25T12:00:00Z");

  @Test
  void shouldFailWhenSettledWithoutFill() {
    RebalanceOrder order =
        RebalanceOrder.create("r-1", RebalanceCorrection.OPEN_SHORT, "binance", ETH_USDT, BigDecimal.ONE, NOW)
            .submitted()
            .settled(LegResult.notFilled("binance", OrderSide.SELL, BigDecimal.ONE, OrderState.CANCELED, null));

    assertEquals(RebalanceState.FAILED, order.state());
    assertEquals(0, BigDecimal.ZERO.compareTo(order.netFilled()));
  }

  @Test
  void shouldRejectSettlingBeforeSubmission() {
    RebalanceOrder order =
        RebalanceOrder.create("r-1", RebalanceCorrection.BUY_SPOT, "gateio", ETH_USDT, BigDecimal.ONE, NOW);

    assertThrows(
        HedgeDomainException.class,
        () ->
            order.settled(
                LegResult.notFilled("gateio", OrderSide.BUY, BigDecimal.ONE, OrderState.CANCELED, null)));
  }

  @Test
  void shouldNotLeaveTerminalState() {
    RebalanceOrder failed =
        RebalanceOrder.create("r-1", RebalanceCorrection.BUY_SPOT, "gateio", ETH_USDT, BigDecimal.ONE, NOW)
            .failed(null);

    assertThrows(HedgeDomainException.class, failed::submitted);
  }
}
