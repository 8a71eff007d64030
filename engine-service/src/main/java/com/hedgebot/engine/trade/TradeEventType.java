package com.hedgebot.engine.trade;

public enum TradeEventType {
    TRADE_CREATED,
    WATCHING_STARTED,
    BASELINE_UPDATED,
    TRIGGER_DETECTED,
    TRIGGER_PRICE_SNAPSHOT,
    TRIGGER_REVERTED,
    PRICE_BELOW_MIN_WAITING,
    TRADE_SKIPPED,
    ENTRY_PLACED,
    ENTRY_PLACEMENT_FAILED,
    ENTRY_RETRY_PLACED,
    ENTRY_CANCEL_UNCONFIRMED,
    POSITION_ENTERED,
    HEDGE_PLACED,
    HEDGE_PLACEMENT_FAILED,
    HEDGE_NOT_FOUND,
    HEDGE_CLOSED_UNMATCHED,
    EMERGENCY_HEDGE_PLACED,
    EMERGENCY_HEDGE_FAILED,
    SECOND_TRIGGER_DETECTED,
    HEDGE_CANCEL_UNCONFIRMED,
    HEDGE_PARTIAL_ON_TRIGGER,
    REHEDGE_PLACED,
    RECOVERY_ORDER_PLACED,
    RECOVERY_PLACEMENT_FAILED,
    RECOVERY_ORDER_REPLACED,
    RECOVERY_EXHAUSTED,
    TRADE_SETTLED,
    MARKET_CLOSED,
    GAME_ENDED,
    SHADOW_ENTRY_DETECTED,
    SHADOW_FROZEN,
    SHADOW_MONITORING_COMPLETED
}
