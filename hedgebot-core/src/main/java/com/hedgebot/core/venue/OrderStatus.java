package com.hedgebot.core.venue;

public enum OrderStatus {
  EXECUTABLE,
  EXECUTION_COMPLETE
}
