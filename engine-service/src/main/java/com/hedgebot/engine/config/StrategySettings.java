package com.hedgebot.engine.config;

import com.hedgebot.core.config.HedgeBotProperties;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Trading policy of one strategy, fixed for the lifetime of the engine.
 *
 * Built from {@code hedgebot.strategy.*} with overrides from the {@code strategy_settings} table applied once,
 * at startup. Override names are the snake_case form of the component names.
 */
public record StrategySettings(
        String key,
        double defaultStake,
        double triggerPct,
        int triggerCutoffMinutes,
        Duration triggerSettle,
        double minEntryPrice,
        double maxEntryPrice,
        double baselineStabilityPct,
        int baselineStableReadings,
        double profitTargetPct,
        double stopLossPct,
        Duration confirmWait,
        double commissionRate,
        double minMarketLiquidity,
        Duration belowMinRecheck,
        int recoveryMaxRetries,
        Duration postTradeMonitor,
        int fixtureLookaheadDays,
        int gameEndMinutes
) {

    public StrategySettings {
        if (minEntryPrice > maxEntryPrice) {
            throw new IllegalArgumentException("min_entry_price " + minEntryPrice + " exceeds max_entry_price " + maxEntryPrice);
        }
        if (commissionRate < 0 || commissionRate >= 1) {
            throw new IllegalArgumentException("commission_rate must be in [0, 1): " + commissionRate);
        }
    }

    public static StrategySettings from(HedgeBotProperties.Strategy strategy) {
        return from(strategy, Map.of());
    }

    public static StrategySettings from(HedgeBotProperties.Strategy s, Map<String, String> overrides) {
        Map<String, String> o = overrides == null ? Map.of() : overrides;
        return new StrategySettings(
                s.key(),
                value(o, "default_stake", s.defaultStake(), Double::parseDouble),
                value(o, "trigger_pct", s.triggerPct(), Double::parseDouble),
                value(o, "trigger_cutoff_minutes", s.triggerCutoffMinutes(), Integer::parseInt),
                Duration.ofSeconds(value(o, "trigger_settle_seconds", s.triggerSettleSeconds(), Integer::parseInt)),
                value(o, "min_entry_price", s.minEntryPrice(), Double::parseDouble),
                value(o, "max_entry_price", s.maxEntryPrice(), Double::parseDouble),
                value(o, "baseline_stability_pct", s.baselineStabilityPct(), Double::parseDouble),
                value(o, "baseline_stable_readings", s.baselineStableReadings(), Integer::parseInt),
                value(o, "profit_target_pct", s.profitTargetPct(), Double::parseDouble),
                value(o, "stop_loss_pct", s.stopLossPct(), Double::parseDouble),
                Duration.ofSeconds(value(o, "confirm_wait_seconds", s.confirmWaitSeconds(), Integer::parseInt)),
                value(o, "commission_rate", s.commissionRate(), Double::parseDouble),
                value(o, "min_market_liquidity", s.minMarketLiquidity(), Double::parseDouble),
                Duration.ofSeconds(value(o, "below_min_recheck_seconds", s.belowMinRecheckSeconds(), Integer::parseInt)),
                value(o, "recovery_max_retries", s.recoveryMaxRetries(), Integer::parseInt),
                Duration.ofMinutes(value(o, "post_trade_monitor_minutes", s.postTradeMonitorMinutes(), Integer::parseInt)),
                value(o, "fixture_lookahead_days", s.fixtureLookaheadDays(), Integer::parseInt),
                value(o, "game_end_minutes", s.gameEndMinutes(), Integer::parseInt)
        );
    }

    public static StrategySettings defaults() {
        return from(new HedgeBotProperties(null, null, null, null, null).strategy());
    }

    private static <T> T value(Map<String, String> overrides, String name, T fallback, Function<String, T> parser) {
        String raw = overrides.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for strategy setting " + name + ": " + raw, e);
        }
    }
}
