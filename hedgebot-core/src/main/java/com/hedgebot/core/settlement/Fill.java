package com.hedgebot.core.settlement;

/**
 * A matched (size, price) pair; several partial fills reduce to one via
 * {@link SettlementCalculator#aggregate(java.util.List)}.
 */
public record Fill(double size, double price) {

  public static final Fill NONE = new Fill(0.0, 0.0);

  public boolean isEmpty() {
    return size <= 0.0;
  }
}
