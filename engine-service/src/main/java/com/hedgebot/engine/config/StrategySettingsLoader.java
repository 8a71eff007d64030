package com.hedgebot.engine.config;

import com.hedgebot.core.config.HedgeBotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves {@link StrategySettings} from configuration plus the {@code strategy_settings} table.
 */
@Slf4j
@RequiredArgsConstructor
public class StrategySettingsLoader {

    private final JdbcTemplate jdbcTemplate;

    public StrategySettings load(HedgeBotProperties.Strategy strategy) {
        Map<String, String> overrides = readOverrides(strategy.key());
        StrategySettings settings = StrategySettings.from(strategy, overrides);
        log.info("strategy settings resolved (key={}, overrides={}, triggerPct={}, cutoff={}m, entryBand=[{}, {}], profitTarget={}%, stopLoss={}%)",
                settings.key(), overrides.keySet(), settings.triggerPct(), settings.triggerCutoffMinutes(),
                settings.minEntryPrice(), settings.maxEntryPrice(), settings.profitTargetPct(), settings.stopLossPct());
        return settings;
    }

    private Map<String, String> readOverrides(String strategyKey) {
        String sql = """
                SELECT setting_name, setting_value
                FROM strategy_settings
                WHERE strategy_key = ?
                """;
        Map<String, String> overrides = new LinkedHashMap<>();
        try {
            jdbcTemplate.query(sql, rs -> {
                overrides.put(rs.getString("setting_name"), rs.getString("setting_value"));
            }, strategyKey);
        } catch (DataAccessException e) {
            log.warn("strategy_settings unavailable, using configured defaults: {}", e.getMessage());
            return Map.of();
        }
        return overrides;
    }
}
