package com.hedgebot.engine.trade;

public enum SkipReason {
    MARKET_LIQUIDITY_TOO_LOW,
    TRIGGER_AFTER_CUTOFF,
    PRICE_ABOVE_MAX,
    PRICE_BELOW_MIN,
    ENTRY_NOT_MATCHED
}
