package com.hedgebot.engine.machine;

import com.hedgebot.engine.store.TradeEventLog;
import com.hedgebot.engine.store.TradeStore;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEvent;
import com.hedgebot.engine.trade.TradeEventType;
import com.hedgebot.engine.trade.TradeStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes trades and their audit events.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeRecorder {

    private final TradeStore tradeStore;
    private final TradeEventLog eventLog;
    private final Clock clock;

    public Trade save(Trade trade) {
        Trade stamped = trade.withUpdatedAt(clock.instant());
        tradeStore.update(stamped);
        return stamped;
    }

    /**
     * Moves the trade to {@code next}, with the status that belongs to its phase.
     */
    public Trade transition(Trade trade, PhaseState next) {
        return trade.withPhaseState(next).withStatus(next.phase().status());
    }

    public Trade cancel(Trade trade, String reason) {
        return trade.withPhaseState(new PhaseState.Completed(reason, null))
                .withStatus(TradeStatus.CANCELLED)
                .withLastError(reason);
    }

    /**
     * Appends an event; {@code keyValues} alternate key and value, null values are left out.
     * A failed write is logged and does not fail the tick.
     */
    public void event(Trade trade, TradeEventType type, Object... keyValues) {
        try {
            eventLog.append(new TradeEvent(trade.id(), type, payload(keyValues), clock.instant()));
        } catch (DataAccessException e) {
            log.warn("failed to append {} for trade {}: {}", type, trade.id(), e.getMessage());
        }
    }

    static Map<String, Object> payload(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("event payload needs key/value pairs");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                payload.put(String.valueOf(keyValues[i]), value instanceof Enum<?> e ? e.name() : value);
            }
        }
        return payload;
    }
}
