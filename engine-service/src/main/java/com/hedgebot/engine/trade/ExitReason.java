package com.hedgebot.engine.trade;

public enum ExitReason {
    PROFIT_TARGET_HIT,
    HEDGE_MATCHED_DURING_TRIGGER,
    EMERGENCY_HEDGE_FILLED,
    STOP_LOSS,
    UNRESOLVED_EXPOSURE,
    MARKET_CLOSED,
    GAME_ENDED
}
