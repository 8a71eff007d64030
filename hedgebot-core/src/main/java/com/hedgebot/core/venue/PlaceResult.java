package com.hedgebot.core.venue;

/**
 * Outcome of a placement. A rejection is a result, not an exception.
 */
public record PlaceResult(
    boolean success,
    String betId,
    double sizeMatched,
    Double averagePriceMatched,
    String errorCode
) {
  public static PlaceResult accepted(String betId, double sizeMatched, Double averagePriceMatched) {
    return new PlaceResult(true, betId, sizeMatched, averagePriceMatched, null);
  }

  public static PlaceResult rejected(String errorCode) {
    return new PlaceResult(false, null, 0.0, null, errorCode == null ? "UNKNOWN" : errorCode);
  }
}
