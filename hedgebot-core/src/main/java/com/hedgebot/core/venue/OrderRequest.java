package com.hedgebot.core.venue;

import java.util.Objects;

/**
 * A limit order instruction. {@code customerRef} is echoed by the venue and makes a
 * re-submitted placement recognisable as the same instruction.
 */
public record OrderRequest(
    String marketId,
    long selectionId,
    Side side,
    double size,
    double price,
    PersistenceType persistence,
    String customerRef
) {
  public OrderRequest {
    Objects.requireNonNull(marketId, "marketId");
    Objects.requireNonNull(side, "side");
    if (persistence == null) {
      persistence = PersistenceType.LAPSE;
    }
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive: " + size);
    }
  }

  public OrderRequest withSizeAndPrice(double newSize, double newPrice, String newCustomerRef) {
    return new OrderRequest(marketId, selectionId, side, newSize, newPrice, persistence, newCustomerRef);
  }
}
