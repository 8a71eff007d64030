package com.hedgebot.core.venue;

public record CancelResult(
    boolean success,
    double sizeCancelled,
    String errorCode
) {
  public static CancelResult cancelled(double sizeCancelled) {
    return new CancelResult(true, sizeCancelled, null);
  }

  public static CancelResult failed(String errorCode) {
    return new CancelResult(false, 0.0, errorCode == null ? "UNKNOWN" : errorCode);
  }
}
