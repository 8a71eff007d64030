package com.hedgebot.engine.scheduler;

import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.machine.TradeRecorder;
import com.hedgebot.engine.store.FixtureStore;
import com.hedgebot.engine.store.TradeStore;
import com.hedgebot.engine.trade.Fixture;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Creates one SCHEDULED trade per upcoming fixture. Fixtures that already have a trade for this strategy are left
 * alone, so seeding can run any number of times.
 */
@Slf4j
@RequiredArgsConstructor
public class FixtureTradeSeeder {

    private final @NonNull FixtureStore fixtureStore;
    private final @NonNull TradeStore tradeStore;
    private final @NonNull TradeRecorder recorder;
    private final @NonNull StrategySettings settings;
    private final @NonNull Clock clock;
    private final EngineScheduler scheduler;

    /**
     * @return number of trades created
     */
    public int seed() {
        Instant now = clock.instant();
        Instant until = now.plus(Duration.ofDays(settings.fixtureLookaheadDays()));
        int created = 0;
        for (Fixture fixture : fixtureStore.findKickingOffBetween(now, until)) {
            if (fixture.marketId() == null || fixture.selectionId() == null) {
                log.debug("fixture {} has no resolved market yet", fixture.eventId());
                continue;
            }
            Trade trade = Trade.scheduled(settings.key(), fixture, settings.defaultStake(), now);
            if (tradeStore.insertIfAbsent(trade)) {
                recorder.event(trade, TradeEventType.TRADE_CREATED, "eventId", fixture.eventId(),
                        "kickoffAt", fixture.kickoffAt(), "marketId", fixture.marketId(),
                        "targetStake", settings.defaultStake());
                created++;
            }
        }
        if (created > 0) {
            log.info("scheduled {} new trades (strategy={}, lookaheadDays={})",
                    created, settings.key(), settings.fixtureLookaheadDays());
            if (scheduler != null) {
                scheduler.reschedule();
            }
        }
        return created;
    }
}
