package com.hedgebot.engine.trade;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coarse lifecycle of a trade. The fine-grained position lives in {@link PhaseState}.
 */
public enum TradeStatus {
    SCHEDULED,
    WATCHING,
    ENTERING,
    LIVE,
    SETTLING,
    POST_TRADE_MONITOR,
    COMPLETED,
    SKIPPED,
    CANCELLED;

    /**
     * Statuses the in-play loop must keep ticking.
     */
    public static final Set<TradeStatus> IN_PLAY = EnumSet.of(WATCHING, ENTERING, LIVE, SETTLING, POST_TRADE_MONITOR);

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == CANCELLED;
    }
}
