package com.hedgeplatform.domain.hedge;

import java.math.BigDecimal;

public record LedgerSnapshot(
    LedgerState state,
    BigDecimal cumulativeDiff,
    BigDecimal cumulativeDiffValue,
    BigDecimal referencePrice,
    BigDecimal legAFilledTotal,
    BigDecimal legBFilledTotal,
    long tradesExecuted,
    long partialTrades,
    long rebalancesExecuted) {}
