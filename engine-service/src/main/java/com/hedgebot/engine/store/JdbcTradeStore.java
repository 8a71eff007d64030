package com.hedgebot.engine.store;

import com.hedgebot.core.settlement.PnlBasis;
import com.hedgebot.engine.shadow.ShadowObservation;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
public class JdbcTradeStore implements TradeStore {

    private static final String IN_PLAY_STATUSES = TradeStatus.IN_PLAY.stream()
            .map(s -> "'" + s.name() + "'")
            .collect(Collectors.joining(", "));

    private static final String SELECT_TRADE = """
            SELECT id, strategy_key, event_id, event_name, competition, status, phase_state, kickoff_at,
                   venue_market_id, venue_selection_id, back_price, back_stake, back_matched_size,
                   lay_price, lay_size, lay_matched_size, target_stake, realised_pnl, pnl_basis,
                   last_error, settled_at, exposure_seconds, created_at, updated_at
            FROM trades
            """;

    private final JdbcTemplate jdbcTemplate;
    private final PhaseStateCodec codec;

    @Override
    public Optional<Trade> findById(String id) {
        List<Trade> rows = jdbcTemplate.query(SELECT_TRADE + " WHERE id = ?", tradeMapper(), id);
        return rows.stream().findFirst();
    }

    @Override
    public List<Trade> findForProcessing(String strategyKey) {
        String sql = SELECT_TRADE + """
                WHERE strategy_key = ?
                  AND (status = 'SCHEDULED' OR status IN (%s) OR (status = 'SKIPPED' AND shadow_active = TRUE))
                ORDER BY kickoff_at
                """.formatted(IN_PLAY_STATUSES);
        return jdbcTemplate.query(sql, tradeMapper(), strategyKey);
    }

    @Override
    public boolean anyActive(String strategyKey) {
        String sql = """
                SELECT COUNT(*) FROM trades
                WHERE strategy_key = ?
                  AND (status IN (%s) OR shadow_active = TRUE)
                """.formatted(IN_PLAY_STATUSES);
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, strategyKey);
        return count != null && count > 0;
    }

    @Override
    public boolean anyScheduledKickedOffBetween(String strategyKey, Instant from, Instant to) {
        String sql = """
                SELECT COUNT(*) FROM trades
                WHERE strategy_key = ? AND status = 'SCHEDULED'
                  AND kickoff_at >= ? AND kickoff_at <= ?
                """;
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, strategyKey, ts(from), ts(to));
        return count != null && count > 0;
    }

    @Override
    public Optional<Instant> nextScheduledKickoffAfter(String strategyKey, Instant after) {
        String sql = """
                SELECT MIN(kickoff_at) FROM trades
                WHERE strategy_key = ? AND status = 'SCHEDULED' AND kickoff_at > ?
                """;
        Timestamp next = jdbcTemplate.queryForObject(sql, Timestamp.class, strategyKey, ts(after));
        return Optional.ofNullable(next).map(Timestamp::toInstant);
    }

    @Override
    public boolean insertIfAbsent(Trade trade) {
        String sql = """
                INSERT INTO trades
                (id, strategy_key, event_id, event_name, competition, status, phase_state, kickoff_at,
                 venue_market_id, venue_selection_id, target_stake, shadow_active, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?)
                """;
        try {
            jdbcTemplate.update(sql,
                    trade.id(),
                    trade.strategyKey(),
                    trade.eventId(),
                    trade.eventName(),
                    trade.competition(),
                    trade.status().name(),
                    codec.write(trade.phaseState()),
                    ts(trade.kickoffAt()),
                    trade.marketId(),
                    trade.selectionId(),
                    trade.targetStake(),
                    ts(trade.createdAt()),
                    ts(trade.updatedAt())
            );
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("trade for {} / {} already exists", trade.strategyKey(), trade.eventId());
            return false;
        }
    }

    @Override
    public void update(Trade trade) {
        ShadowObservation shadow = trade.shadow().orElse(null);
        boolean skipped = trade.status() == TradeStatus.SKIPPED;
        String sql = """
                UPDATE trades SET
                  status = ?, phase_state = ?, venue_market_id = ?, venue_selection_id = ?,
                  back_price = ?, back_stake = ?, back_matched_size = ?,
                  lay_price = ?, lay_size = ?, lay_matched_size = ?, target_stake = ?,
                  realised_pnl = ?, pnl_basis = ?, last_error = ?, settled_at = ?, exposure_seconds = ?,
                  shadow_active = ?, theoretical_entry_price = ?, min_post_entry_price = ?,
                  max_potential_profit_pct = ?, seconds_to_max_profit = ?,
                  seconds_to_10_pct = ?, seconds_to_15_pct = ?, seconds_to_20_pct = ?,
                  seconds_to_25_pct = ?, seconds_to_30_pct = ?,
                  updated_at = ?
                WHERE id = ?
                  AND (back_matched_size IS NULL OR back_matched_size <= ?)
                """;
        int updated = jdbcTemplate.update(sql,
                trade.status().name(),
                codec.write(trade.phaseState()),
                trade.marketId(),
                trade.selectionId(),
                trade.backPrice(),
                trade.backStake(),
                trade.backMatchedSize(),
                trade.layPrice(),
                trade.laySize(),
                trade.layMatchedSize(),
                trade.targetStake(),
                trade.realisedPnl(),
                trade.pnlBasis() == null ? null : trade.pnlBasis().name(),
                trade.lastError(),
                ts(trade.settledAt()),
                trade.exposureSeconds(),
                shadow != null && shadow.active(),
                shadow != null && skipped ? shadow.entryPrice() : null,
                shadow == null ? null : shadow.minPrice(),
                shadow == null ? null : shadow.maxPotentialProfitPct(),
                shadow == null ? null : shadow.secondsToMaxProfit(),
                shadow == null ? null : shadow.secondsTo(10),
                shadow == null ? null : shadow.secondsTo(15),
                shadow == null ? null : shadow.secondsTo(20),
                shadow == null ? null : shadow.secondsTo(25),
                shadow == null ? null : shadow.secondsTo(30),
                ts(trade.updatedAt()),
                trade.id(),
                trade.backMatchedSize() == null ? 0.0 : trade.backMatchedSize()
        );
        if (updated == 0) {
            if (findById(trade.id()).isPresent()) {
                throw new BackMatchedSizeRegressionException(trade.id(), trade.backMatchedSize());
            }
            throw new IllegalStateException("trade " + trade.id() + " does not exist");
        }
    }

    @Override
    public List<Trade> findRecent(String strategyKey, int limit) {
        String sql = SELECT_TRADE + " WHERE strategy_key = ? ORDER BY kickoff_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, tradeMapper(), strategyKey, Math.max(1, limit));
    }

    private RowMapper<Trade> tradeMapper() {
        return (rs, rowNum) -> new Trade(
                rs.getString("id"),
                rs.getString("strategy_key"),
                rs.getString("event_id"),
                rs.getString("event_name"),
                rs.getString("competition"),
                TradeStatus.valueOf(rs.getString("status")),
                codec.read(rs.getString("phase_state")),
                instant(rs, "kickoff_at"),
                rs.getString("venue_market_id"),
                longOrNull(rs, "venue_selection_id"),
                doubleOrNull(rs, "back_price"),
                doubleOrNull(rs, "back_stake"),
                doubleOrNull(rs, "back_matched_size"),
                doubleOrNull(rs, "lay_price"),
                doubleOrNull(rs, "lay_size"),
                doubleOrNull(rs, "lay_matched_size"),
                doubleOrNull(rs, "target_stake"),
                rs.getBigDecimal("realised_pnl"),
                rs.getString("pnl_basis") == null ? null : PnlBasis.valueOf(rs.getString("pnl_basis")),
                rs.getString("last_error"),
                instant(rs, "settled_at"),
                longOrNull(rs, "exposure_seconds"),
                instant(rs, "created_at"),
                instant(rs, "updated_at")
        );
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    private static Double doubleOrNull(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value == null ? null : value.doubleValue();
    }

    private static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
