package com.hedgeplatform.integration.venue;

import java.util.Objects;

/**
 * Outcome of one status read. Only {@link Kind#REPORTED} carries a report; the other kinds mean
 * "poll again". Faults that should stop polling are thrown instead.
 */
public record OrderPollResult(Kind kind, OrderStatusReport report, String detail) {
  public enum Kind {
    REPORTED,
    NOT_FOUND_YET,
    UNAVAILABLE
  }

  public OrderPollResult {
    Objects.requireNonNull(kind, "kind must not be null");
    if (kind == Kind.REPORTED && report == null) {
      throw new IllegalArgumentException("report is required for REPORTED results");
    }
  }

  public static OrderPollResult reported(OrderStatusReport report) {
    return new OrderPollResult(Kind.REPORTED, report, null);
  }

  public static OrderPollResult notFoundYet(String detail) {
    return new OrderPollResult(Kind.NOT_FOUND_YET, null, detail);
  }

  public static OrderPollResult unavailable(String detail) {
    return new OrderPollResult(Kind.UNAVAILABLE, null, detail);
  }

  public boolean isTerminal() {
    return kind == Kind.REPORTED && report.isTerminal();
  }
}
