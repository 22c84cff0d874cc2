package com.hedgeplatform.worker.session;

/** The session stopped on a fatal or unexpected error. The summary has already been reported. */
public class HedgeSessionAbortedException extends RuntimeException {
  private final SessionSummary summary;

  public HedgeSessionAbortedException(SessionSummary summary, Throwable cause) {
    super("Hedge session aborted: " + summary.stopDetail(), cause);
    this.summary = summary;
  }

  public SessionSummary summary() {
    return summary;
  }
}
