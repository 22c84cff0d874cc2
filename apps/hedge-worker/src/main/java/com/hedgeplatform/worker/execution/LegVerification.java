package com.hedgeplatform.worker.execution;

import com.hedgeplatform.integration.venue.OrderHandle;
import com.hedgeplatform.integration.venue.OrderStatusReport;

/** Last known status of an accepted order; {@code report} is null if the venue never reported. */
public record LegVerification(OrderHandle handle, OrderStatusReport report, boolean settled) {}
