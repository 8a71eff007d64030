package com.hedgebot.engine.store;

import com.hedgebot.engine.trade.TradeEvent;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class JdbcTradeEventLog implements TradeEventLog {

    private final JdbcTemplate jdbcTemplate;
    private final PhaseStateCodec codec;

    @Override
    public void append(TradeEvent event) {
        String sql = """
                INSERT INTO trade_events (trade_id, event_type, payload, occurred_at)
                VALUES (?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql,
                event.tradeId(),
                event.type().name(),
                codec.writePayload(event.payload()),
                JdbcTradeStore.ts(event.occurredAt())
        );
    }

    @Override
    public List<TradeEvent> findByTrade(String tradeId) {
        String sql = """
                SELECT trade_id, event_type, payload, occurred_at
                FROM trade_events
                WHERE trade_id = ?
                ORDER BY occurred_at, id
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new TradeEvent(
                rs.getString("trade_id"),
                TradeEventType.valueOf(rs.getString("event_type")),
                codec.readPayload(rs.getString("payload")),
                JdbcTradeStore.instant(rs, "occurred_at")
        ), tradeId);
    }
}
