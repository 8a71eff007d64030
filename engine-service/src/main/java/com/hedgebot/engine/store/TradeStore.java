package com.hedgebot.engine.store;

import com.hedgebot.engine.trade.Trade;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of trades. Each trade is an independent aggregate; every write is a single-row update.
 */
public interface TradeStore {

    Optional<Trade> findById(String id);

    /**
     * Trades the in-play loop has to look at: scheduled, in-play, or skipped with an open shadow observation.
     */
    List<Trade> findForProcessing(String strategyKey);

    /**
     * True when any trade is in an in-play status or still shadow monitoring.
     */
    boolean anyActive(String strategyKey);

    boolean anyScheduledKickedOffBetween(String strategyKey, Instant from, Instant to);

    Optional<Instant> nextScheduledKickoffAfter(String strategyKey, Instant after);

    /**
     * @return false when a trade for the same (strategy, event) already exists
     */
    boolean insertIfAbsent(Trade trade);

    /**
     * Writes the trade. Rejects a lower {@code backMatchedSize} than the stored one.
     *
     * @throws BackMatchedSizeRegressionException when the matched back size would decrease
     */
    void update(Trade trade);

    List<Trade> findRecent(String strategyKey, int limit);
}
