package com.hedgeplatform.worker.observability;

import com.hedgeplatform.worker.session.SessionSummary;

public interface SessionSummaryReporter {
  void report(SessionSummary summary);
}
