package com.hedgeplatform.integration.venue;

public enum MarginMode {
  CROSSED,
  ISOLATED
}
