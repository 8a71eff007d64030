package com.hedgebot.engine.support;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.MarketStatus;
import com.hedgebot.core.venue.PriceSize;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.core.venue.VenueGateway;
import com.hedgebot.core.venue.VenueSession;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.execution.OrderVerificationController;
import com.hedgebot.engine.machine.EntryHandler;
import com.hedgebot.engine.machine.HedgeHandler;
import com.hedgebot.engine.machine.TradeRecorder;
import com.hedgebot.engine.machine.TradeSettler;
import com.hedgebot.engine.machine.TradeStateMachine;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.shadow.ShadowMonitor;
import com.hedgebot.engine.sim.PaperMarketVenue;
import com.hedgebot.engine.trade.Fixture;
import com.hedgebot.engine.trade.Trade;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The full engine wired against the paper venue, an in-memory store and a clock that only moves when the
 * verification loops sleep or a test advances it.
 */
public class EngineHarness {

    public static final Instant KICKOFF = Instant.parse("2026-03-14T15:00:00Z");
    public static final String MARKET_ID = "1.234567";
    public static final long SELECTION_ID = 47972L;
    public static final double LIQUIDITY = 50_000.0;

    public final MutableClock clock = new MutableClock(KICKOFF);
    public final InMemoryTradeStore tradeStore = new InMemoryTradeStore();
    public final InMemoryTradeEventLog eventLog = new InMemoryTradeEventLog();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final HedgeBotProperties.Verification verification =
            new HedgeBotProperties.Verification(2_000L, 2_000L, 500L, 3_000L, 500L, 3, 3, 1);
    public final PaperMarketVenue venue;
    public final ScriptedVenue scripted;
    public final StrategySettings settings;
    public final EngineMetrics metrics;
    public final OrderVerificationController controller;
    public final TradeRecorder recorder;
    public final ShadowMonitor shadowMonitor;
    public final TradeStateMachine machine;

    public EngineHarness() {
        this(Map.of(), new HedgeBotProperties.Paper(true, false));
    }

    public EngineHarness(Map<String, String> overrides, HedgeBotProperties.Paper paper) {
        HedgeBotProperties properties = new HedgeBotProperties(null, null, null, null, null);
        this.settings = StrategySettings.from(properties.strategy(), overrides);
        this.venue = new PaperMarketVenue(paper);
        this.scripted = new ScriptedVenue(venue);
        this.metrics = new EngineMetrics(meterRegistry, settings.key());
        VenueGateway gateway = new VenueGateway(scripted, VenueSession.fixed("paper"), meterRegistry);
        this.controller = new OrderVerificationController(gateway, verification,
                millis -> clock.advance(Duration.ofMillis(millis)), clock);
        this.recorder = new TradeRecorder(tradeStore, eventLog, clock);
        HedgeHandler hedgeHandler = new HedgeHandler(settings, verification, controller, recorder, metrics, clock);
        EntryHandler entryHandler = new EntryHandler(settings, verification, controller, hedgeHandler, recorder,
                metrics, clock);
        TradeSettler settler = new TradeSettler(settings, recorder, metrics, clock);
        this.shadowMonitor = new ShadowMonitor(settings, recorder, clock);
        this.machine = new TradeStateMachine(tradeStore, gateway, controller, entryHandler, hedgeHandler, settler,
                shadowMonitor, recorder, clock);
    }

    public Trade schedule(String eventId) {
        Fixture fixture = new Fixture(eventId, "Home v Away", "Premier League", KICKOFF, MARKET_ID, SELECTION_ID);
        Trade trade = Trade.scheduled(settings.key(), fixture, settings.defaultStake(), clock.instant());
        tradeStore.insertIfAbsent(trade);
        return trade;
    }

    public void atMinute(double minute) {
        clock.set(KICKOFF.plusMillis((long) (minute * 60_000)));
    }

    public void advanceSeconds(long seconds) {
        clock.advance(Duration.ofSeconds(seconds));
    }

    /**
     * Publishes an in-play book with 1000 available at each given best price; null leaves that side empty.
     */
    public void book(Double back, Double lay) {
        book(back, 1_000.0, lay, true, LIQUIDITY);
    }

    public void book(Double back, double backSize, Double lay, boolean inplay, double totalMatched) {
        venue.publishBook(new MarketBook(MARKET_ID, MarketStatus.OPEN, inplay, totalMatched,
                List.of(runner(back, backSize, lay))));
    }

    public Trade tick(String tradeId) throws InterruptedException {
        machine.tick(tradeId);
        return tradeStore.get(tradeId);
    }

    public Trade endGame(String tradeId) throws InterruptedException {
        machine.endGame(tradeId);
        return tradeStore.get(tradeId);
    }

    public static RunnerBook runner(Double back, double backSize, Double lay) {
        List<PriceSize> backs = new ArrayList<>();
        if (back != null) {
            backs.add(new PriceSize(back, backSize));
        }
        List<PriceSize> lays = new ArrayList<>();
        if (lay != null) {
            lays.add(new PriceSize(lay, 1_000.0));
        }
        return new RunnerBook(SELECTION_ID, 0.0, back, backs, lays);
    }
}
