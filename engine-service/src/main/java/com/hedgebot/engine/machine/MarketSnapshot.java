package com.hedgebot.engine.machine;

import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.RunnerBook;

import java.time.Instant;

/**
 * Book of the traded selection as read at the start of a tick. {@code runner} is null when the selection is missing
 * from the book (typically a closed market).
 */
public record MarketSnapshot(
        MarketBook book,
        RunnerBook runner,
        Instant observedAt
) {
    public Double back() {
        return runner == null ? null : runner.bestBackPrice();
    }

    public Double lay() {
        return runner == null ? null : runner.bestLayPrice();
    }

    /**
     * Best back, or the last traded price when the back side is empty.
     */
    public Double referencePrice() {
        Double back = back();
        if (back != null) {
            return back;
        }
        return runner == null ? null : runner.lastPriceTraded();
    }

    public boolean closed() {
        return book.isClosed();
    }

    /**
     * Matched volume of the market, falling back to the runner's when the market total is not reported.
     */
    public double liquidity() {
        if (book.totalMatched() > 0) {
            return book.totalMatched();
        }
        return runner == null ? 0.0 : runner.totalMatched();
    }
}
