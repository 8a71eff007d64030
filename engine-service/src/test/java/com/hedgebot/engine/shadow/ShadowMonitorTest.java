package com.hedgebot.engine.shadow;

import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.machine.TradeRecorder;
import com.hedgebot.engine.support.InMemoryTradeEventLog;
import com.hedgebot.engine.support.InMemoryTradeStore;
import com.hedgebot.engine.support.MutableClock;
import com.hedgebot.engine.trade.ExitReason;
import com.hedgebot.engine.trade.Fixture;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.SkipReason;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import com.hedgebot.engine.trade.TradeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ShadowMonitorTest {

    private static final Instant START = Instant.parse("2026-03-14T15:50:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final InMemoryTradeEventLog eventLog = new InMemoryTradeEventLog();
    private final StrategySettings settings = StrategySettings.defaults();

    private ShadowMonitor monitor;
    private Trade base;

    @BeforeEach
    void setUp() {
        monitor = new ShadowMonitor(settings, new TradeRecorder(new InMemoryTradeStore(), eventLog, clock), clock);
        Fixture fixture = new Fixture("evt-1", "Home v Away", "Premier League", START.minus(Duration.ofMinutes(50)),
                "1.234567", 47972L);
        base = Trade.scheduled(settings.key(), fixture, 200.0, START);
    }

    @Test
    void tracksMinimumAndProfitMilestonesFromEntry() {
        Trade trade = skipped(ShadowObservation.fromEntry("TRIGGER_AFTER_CUTOFF", START, 3.0, 3.0, START));

        clock.advance(Duration.ofSeconds(60));
        trade = monitor.onTick(trade, 2.7);
        clock.advance(Duration.ofSeconds(60));
        trade = monitor.onTick(trade, 2.5);
        clock.advance(Duration.ofSeconds(60));
        trade = monitor.onTick(trade, 2.6);

        ShadowObservation shadow = trade.shadow().orElseThrow();
        assertThat(shadow.minPrice()).isEqualTo(2.5);
        assertThat(shadow.maxPotentialProfitPct()).isEqualTo(20.0);
        assertThat(shadow.secondsToMaxProfit()).isEqualTo(120L);
        assertThat(shadow.secondsTo(10)).isEqualTo(60L);
        assertThat(shadow.secondsTo(15)).isEqualTo(120L);
        assertThat(shadow.secondsTo(20)).isEqualTo(120L);
        assertThat(shadow.secondsTo(25)).isNull();
        assertThat(trade.status()).isEqualTo(TradeStatus.SKIPPED);
    }

    @Test
    void furtherTriggerFreezesTheMinimum() {
        Trade trade = skipped(ShadowObservation.fromEntry("TRIGGER_AFTER_CUTOFF", START, 3.0, 3.0, START));
        trade = monitor.onTick(trade, 2.5);

        clock.advance(Duration.ofSeconds(30));
        trade = monitor.onTick(trade, 3.3);
        trade = monitor.onTick(trade, 2.0);

        ShadowObservation shadow = trade.shadow().orElseThrow();
        assertThat(shadow.frozen()).isTrue();
        assertThat(shadow.frozenAt()).isEqualTo(START.plusSeconds(30));
        assertThat(shadow.minPrice()).isEqualTo(2.5);
        assertThat(eventLog.types(trade.id())).contains(TradeEventType.SHADOW_FROZEN);
    }

    @Test
    void skippedBeforeTriggerWaitsForTheoreticalEntry() {
        Trade trade = skipped(ShadowObservation.awaitingTrigger("MARKET_LIQUIDITY_TOO_LOW", START, 2.0));

        trade = monitor.onTick(trade, 2.1);
        assertThat(trade.shadow().orElseThrow().entryPrice()).isNull();

        clock.advance(Duration.ofMinutes(3));
        trade = monitor.onTick(trade, 2.8);

        ShadowObservation shadow = trade.shadow().orElseThrow();
        assertThat(shadow.entryPrice()).isEqualTo(2.8);
        assertThat(shadow.entryAt()).isEqualTo(START.plus(Duration.ofMinutes(3)));
        assertThat(shadow.minPrice()).isEqualTo(2.8);
        assertThat(eventLog.types(trade.id())).containsExactly(TradeEventType.SHADOW_ENTRY_DETECTED);
    }

    @Test
    void observationExpiresAfterMonitorWindow() {
        Trade trade = skipped(ShadowObservation.fromEntry("PRICE_ABOVE_MAX", START, 6.0, 6.0, START));

        clock.advance(settings.postTradeMonitor());
        Trade after = monitor.onTick(trade, 5.0);

        assertThat(after.shadowActive()).isFalse();
        assertThat(after.shadow().orElseThrow().closeReason()).isEqualTo(ShadowMonitor.CLOSED_EXPIRED);
        assertThat(after.shadow().orElseThrow().minPrice()).isEqualTo(6.0);
        assertThat(after.status()).isEqualTo(TradeStatus.SKIPPED);
        assertThat(eventLog.last(trade.id(), TradeEventType.SHADOW_MONITORING_COMPLETED).payload())
                .containsEntry("reason", "EXPIRED");
    }

    @Test
    void closingPostTradeMonitorCompletesTheTrade() {
        ShadowObservation shadow = ShadowObservation.fromEntry("POST_TRADE", START, 1.8, 2.0, START);
        Trade trade = base.withPhaseState(new PhaseState.PostTradeMonitor(ExitReason.PROFIT_TARGET_HIT, shadow))
                .withStatus(TradeStatus.POST_TRADE_MONITOR);

        Trade after = monitor.close(trade, "MARKET_CLOSED");

        assertThat(after.status()).isEqualTo(TradeStatus.COMPLETED);
        PhaseState.Completed completed = (PhaseState.Completed) after.phaseState();
        assertThat(completed.reason()).isEqualTo("PROFIT_TARGET_HIT");
        assertThat(completed.shadow().closed()).isTrue();
        assertThat(completed.shadow().closeReason()).isEqualTo("MARKET_CLOSED");
    }

    @Test
    void closedObservationIsLeftAlone() {
        ShadowObservation closed = ShadowObservation.fromEntry("PRICE_BELOW_MIN", START, 1.9, 1.9, START)
                .withClosed(true).withCloseReason("EXPIRED");
        Trade trade = skipped(closed);

        assertThat(monitor.onTick(trade, 1.5)).isSameAs(trade);
    }

    private Trade skipped(ShadowObservation shadow) {
        return base.withPhaseState(new PhaseState.Skipped(SkipReason.TRIGGER_AFTER_CUTOFF, shadow))
                .withStatus(TradeStatus.SKIPPED);
    }
}
