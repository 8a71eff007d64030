package com.hedgebot.core.venue;

import java.util.List;
import java.util.Optional;

public record MarketBook(
    String marketId,
    MarketStatus status,
    boolean inplay,
    double totalMatched,
    List<RunnerBook> runners
) {
  public MarketBook {
    if (status == null) {
      status = MarketStatus.INACTIVE;
    }
    runners = runners == null ? List.of() : List.copyOf(runners);
  }

  public boolean isClosed() {
    return status == MarketStatus.CLOSED;
  }

  public Optional<RunnerBook> runner(long selectionId) {
    return runners.stream()
        .filter(r -> r.selectionId() == selectionId)
        .findFirst();
  }
}
