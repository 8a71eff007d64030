package com.hedgebot.core.venue;

public enum MarketStatus {
  INACTIVE,
  OPEN,
  SUSPENDED,
  CLOSED;

  public static MarketStatus parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return INACTIVE;
    }
    try {
      return MarketStatus.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return INACTIVE;
    }
  }
}
