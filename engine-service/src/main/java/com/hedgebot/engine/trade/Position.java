package com.hedgebot.engine.trade;

import com.hedgebot.core.settlement.Fill;
import com.hedgebot.core.settlement.SettlementCalculator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Matched back position and the hedge fills collected against it so far.
 */
public record Position(
        List<String> entryBetIds,
        double requestedStake,
        double matchedSize,
        double entryPrice,
        Instant matchedAt,
        double targetLayPrice,
        List<Fill> hedgeFills,
        int hedgeAttempts
) {
    public Position {
        entryBetIds = entryBetIds == null ? List.of() : List.copyOf(entryBetIds);
        hedgeFills = hedgeFills == null ? List.of() : List.copyOf(hedgeFills);
    }

    public Position addHedgeFill(Fill fill) {
        if (fill == null || fill.isEmpty()) {
            return this;
        }
        List<Fill> fills = new ArrayList<>(hedgeFills);
        fills.add(fill);
        return new Position(entryBetIds, requestedStake, matchedSize, entryPrice, matchedAt, targetLayPrice, fills,
                hedgeAttempts);
    }

    public Position nextHedgeAttempt() {
        return new Position(entryBetIds, requestedStake, matchedSize, entryPrice, matchedAt, targetLayPrice, hedgeFills,
                hedgeAttempts + 1);
    }

    public Fill hedged() {
        return SettlementCalculator.aggregate(hedgeFills);
    }

    public double unhedgedBackStake() {
        return SettlementCalculator.unhedgedBackStake(matchedSize, entryPrice, hedged());
    }
}
