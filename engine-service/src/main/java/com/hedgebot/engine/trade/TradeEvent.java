package com.hedgebot.engine.trade;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record of a phase transition or order outcome.
 */
public record TradeEvent(
        String tradeId,
        TradeEventType type,
        Map<String, Object> payload,
        Instant occurredAt
) {
    public TradeEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
