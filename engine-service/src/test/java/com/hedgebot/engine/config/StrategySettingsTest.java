package com.hedgebot.engine.config;

import com.hedgebot.core.config.HedgeBotProperties;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategySettingsTest {

    private final HedgeBotProperties.Strategy configured = new HedgeBotProperties(null, null, null, null, null).strategy();

    @Test
    void defaultsComeFromConfiguration() {
        StrategySettings settings = StrategySettings.defaults();

        assertThat(settings.key()).isEqualTo("goal_react");
        assertThat(settings.triggerPct()).isEqualTo(30.0);
        assertThat(settings.triggerSettle()).isEqualTo(Duration.ofSeconds(90));
        assertThat(settings.postTradeMonitor()).isEqualTo(Duration.ofMinutes(100));
        assertThat(settings.commissionRate()).isEqualTo(0.0175);
    }

    @Test
    void overridesReplaceConfiguredValues() {
        StrategySettings settings = StrategySettings.from(configured,
                Map.of("profit_target_pct", "10", "confirm_wait_seconds", " 45 ", "max_entry_price", ""));

        assertThat(settings.profitTargetPct()).isEqualTo(10.0);
        assertThat(settings.confirmWait()).isEqualTo(Duration.ofSeconds(45));
        assertThat(settings.maxEntryPrice()).isEqualTo(5.5);
    }

    @Test
    void malformedOverrideNamesTheSetting() {
        assertThatThrownBy(() -> StrategySettings.from(configured, Map.of("trigger_pct", "thirty")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trigger_pct");
    }

    @Test
    void inconsistentEntryBandIsRejected() {
        assertThatThrownBy(() -> StrategySettings.from(configured, Map.of("min_entry_price", "6.0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min_entry_price");
        assertThatThrownBy(() -> StrategySettings.from(configured, Map.of("commission_rate", "1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loaderAppliesRowsForItsStrategyOnly() {
        EmbeddedDatabase database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        try {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
            jdbcTemplate.update("INSERT INTO strategy_settings VALUES ('goal_react', 'trigger_pct', '25')");
            jdbcTemplate.update("INSERT INTO strategy_settings VALUES ('other', 'trigger_pct', '50')");

            StrategySettings settings = new StrategySettingsLoader(jdbcTemplate).load(configured);

            assertThat(settings.triggerPct()).isEqualTo(25.0);
            assertThat(settings.stopLossPct()).isEqualTo(20.0);
        } finally {
            database.shutdown();
        }
    }

    @Test
    void loaderFallsBackWhenTableIsMissing() {
        EmbeddedDatabase database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .build();
        try {
            StrategySettings settings = new StrategySettingsLoader(new JdbcTemplate(database)).load(configured);

            assertThat(settings).isEqualTo(StrategySettings.defaults());
        } finally {
            database.shutdown();
        }
    }
}
