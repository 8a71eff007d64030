package com.hedgebot.core.venue;

/**
 * Order as listed by the venue's current-orders view (or rebuilt from the cleared view).
 */
public record CurrentOrder(
    String betId,
    Side side,
    OrderStatus status,
    double priceRequested,
    double sizeMatched,
    double sizeRemaining,
    Double averagePriceMatched
) {
  public boolean isOpen() {
    return status == OrderStatus.EXECUTABLE && sizeRemaining > 0;
  }
}
