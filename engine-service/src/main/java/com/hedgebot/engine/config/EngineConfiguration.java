package com.hedgebot.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.venue.MarketVenue;
import com.hedgebot.core.venue.VenueGateway;
import com.hedgebot.core.venue.VenueSession;
import com.hedgebot.engine.execution.OrderVerificationController;
import com.hedgebot.engine.execution.Sleeper;
import com.hedgebot.engine.machine.EntryHandler;
import com.hedgebot.engine.machine.HedgeHandler;
import com.hedgebot.engine.machine.TradeRecorder;
import com.hedgebot.engine.machine.TradeSettler;
import com.hedgebot.engine.machine.TradeStateMachine;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.scheduler.EngineScheduler;
import com.hedgebot.engine.scheduler.FixtureSeedPoller;
import com.hedgebot.engine.scheduler.FixtureTradeSeeder;
import com.hedgebot.engine.shadow.ShadowMonitor;
import com.hedgebot.engine.sim.PaperMarketVenue;
import com.hedgebot.engine.store.FixtureStore;
import com.hedgebot.engine.store.JdbcFixtureStore;
import com.hedgebot.engine.store.JdbcTradeEventLog;
import com.hedgebot.engine.store.JdbcTradeStore;
import com.hedgebot.engine.store.PhaseStateCodec;
import com.hedgebot.engine.store.TradeEventLog;
import com.hedgebot.engine.store.TradeStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Wires the execution engine for one strategy.
 *
 * In PAPER mode the venue is the in-memory {@link PaperMarketVenue}; in LIVE mode a {@link MarketVenue} and
 * {@link VenueSession} for the real exchange must be provided by another configuration.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(HedgeBotProperties.class)
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "hedgebot", name = "mode", havingValue = "PAPER", matchIfMissing = true)
    public PaperMarketVenue paperMarketVenue(HedgeBotProperties properties) {
        return new PaperMarketVenue(properties.paper());
    }

    @Bean
    @ConditionalOnMissingBean
    public VenueSession venueSession(HedgeBotProperties properties) {
        if (properties.mode() == HedgeBotProperties.TradingMode.LIVE) {
            throw new IllegalStateException("LIVE mode needs a VenueSession bean for the exchange");
        }
        return VenueSession.fixed("paper");
    }

    @Bean
    public VenueGateway venueGateway(MarketVenue venue, VenueSession session, MeterRegistry meterRegistry) {
        return new VenueGateway(venue, session, meterRegistry);
    }

    @Bean
    public PhaseStateCodec phaseStateCodec(ObjectMapper objectMapper) {
        return new PhaseStateCodec(objectMapper);
    }

    @Bean
    public TradeStore tradeStore(JdbcTemplate jdbcTemplate, PhaseStateCodec codec) {
        return new JdbcTradeStore(jdbcTemplate, codec);
    }

    @Bean
    public TradeEventLog tradeEventLog(JdbcTemplate jdbcTemplate, PhaseStateCodec codec) {
        return new JdbcTradeEventLog(jdbcTemplate, codec);
    }

    @Bean
    public FixtureStore fixtureStore(JdbcTemplate jdbcTemplate) {
        return new JdbcFixtureStore(jdbcTemplate);
    }

    @Bean
    public StrategySettings strategySettings(HedgeBotProperties properties, JdbcTemplate jdbcTemplate) {
        return new StrategySettingsLoader(jdbcTemplate).load(properties.strategy());
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry meterRegistry, StrategySettings settings) {
        return new EngineMetrics(meterRegistry, settings.key());
    }

    @Bean
    public OrderVerificationController orderVerificationController(
            VenueGateway gateway,
            HedgeBotProperties properties,
            Clock clock
    ) {
        return new OrderVerificationController(gateway, properties.verification(), Sleeper.system(), clock);
    }

    @Bean
    public TradeRecorder tradeRecorder(TradeStore tradeStore, TradeEventLog eventLog, Clock clock) {
        return new TradeRecorder(tradeStore, eventLog, clock);
    }

    @Bean
    public HedgeHandler hedgeHandler(
            StrategySettings settings,
            HedgeBotProperties properties,
            OrderVerificationController controller,
            TradeRecorder recorder,
            EngineMetrics metrics,
            Clock clock
    ) {
        return new HedgeHandler(settings, properties.verification(), controller, recorder, metrics, clock);
    }

    @Bean
    public EntryHandler entryHandler(
            StrategySettings settings,
            HedgeBotProperties properties,
            OrderVerificationController controller,
            HedgeHandler hedgeHandler,
            TradeRecorder recorder,
            EngineMetrics metrics,
            Clock clock
    ) {
        return new EntryHandler(settings, properties.verification(), controller, hedgeHandler, recorder, metrics, clock);
    }

    @Bean
    public TradeSettler tradeSettler(StrategySettings settings, TradeRecorder recorder, EngineMetrics metrics, Clock clock) {
        return new TradeSettler(settings, recorder, metrics, clock);
    }

    @Bean
    public ShadowMonitor shadowMonitor(StrategySettings settings, TradeRecorder recorder, Clock clock) {
        return new ShadowMonitor(settings, recorder, clock);
    }

    @Bean
    public TradeStateMachine tradeStateMachine(
            TradeStore tradeStore,
            VenueGateway gateway,
            OrderVerificationController controller,
            EntryHandler entryHandler,
            HedgeHandler hedgeHandler,
            TradeSettler settler,
            ShadowMonitor shadowMonitor,
            TradeRecorder recorder,
            Clock clock
    ) {
        return new TradeStateMachine(tradeStore, gateway, controller, entryHandler, hedgeHandler, settler,
                shadowMonitor, recorder, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hedgebot.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EngineScheduler engineScheduler(
            TradeStore tradeStore,
            TradeStateMachine stateMachine,
            StrategySettings settings,
            HedgeBotProperties properties,
            EngineMetrics metrics,
            Clock clock
    ) {
        return new EngineScheduler(tradeStore, stateMachine, settings, properties.scheduler(), metrics, clock);
    }

    @Bean
    public FixtureTradeSeeder fixtureTradeSeeder(
            FixtureStore fixtureStore,
            TradeStore tradeStore,
            TradeRecorder recorder,
            StrategySettings settings,
            Clock clock,
            ObjectProvider<EngineScheduler> scheduler
    ) {
        return new FixtureTradeSeeder(fixtureStore, tradeStore, recorder, settings, clock, scheduler.getIfAvailable());
    }

    @Bean
    @ConditionalOnProperty(prefix = "hedgebot.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FixtureSeedPoller fixtureSeedPoller(FixtureTradeSeeder seeder) {
        return new FixtureSeedPoller(seeder);
    }
}
