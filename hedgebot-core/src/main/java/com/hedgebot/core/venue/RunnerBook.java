package com.hedgebot.core.venue;

import java.util.List;

/**
 * One selection of a market book, best prices first.
 */
public record RunnerBook(
    long selectionId,
    double totalMatched,
    Double lastPriceTraded,
    List<PriceSize> availableToBack,
    List<PriceSize> availableToLay
) {
  public RunnerBook {
    availableToBack = availableToBack == null ? List.of() : List.copyOf(availableToBack);
    availableToLay = availableToLay == null ? List.of() : List.copyOf(availableToLay);
  }

  public Double bestBackPrice() {
    return availableToBack.isEmpty() ? null : availableToBack.get(0).price();
  }

  public Double bestLayPrice() {
    return availableToLay.isEmpty() ? null : availableToLay.get(0).price();
  }
}
