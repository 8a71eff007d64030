package com.hedgebot.engine.store;

import com.hedgebot.engine.trade.Fixture;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

@RequiredArgsConstructor
public class JdbcFixtureStore implements FixtureStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Fixture> findKickingOffBetween(Instant from, Instant to) {
        String sql = """
                SELECT event_id, event_name, competition, kickoff_at, venue_market_id, venue_selection_id
                FROM fixtures
                WHERE kickoff_at >= ? AND kickoff_at <= ?
                ORDER BY kickoff_at
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            long selectionId = rs.getLong("venue_selection_id");
            return new Fixture(
                    rs.getString("event_id"),
                    rs.getString("event_name"),
                    rs.getString("competition"),
                    JdbcTradeStore.instant(rs, "kickoff_at"),
                    rs.getString("venue_market_id"),
                    rs.wasNull() ? null : selectionId
            );
        }, JdbcTradeStore.ts(from), JdbcTradeStore.ts(to));
    }
}
