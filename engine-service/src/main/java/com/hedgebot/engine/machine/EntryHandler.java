package com.hedgebot.engine.machine;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.ladder.PriceLadder;
import com.hedgebot.core.venue.OrderRequest;
import com.hedgebot.core.venue.PersistenceType;
import com.hedgebot.core.venue.RunnerBook;
import com.hedgebot.core.venue.Side;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.execution.CustomerRefs;
import com.hedgebot.engine.execution.OrderVerificationController;
import com.hedgebot.engine.execution.VerificationResult;
import com.hedgebot.engine.execution.VerifyOptions;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.shadow.ShadowObservation;
import com.hedgebot.engine.trade.HedgePurpose;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.PlacedOrder;
import com.hedgebot.engine.trade.Position;
import com.hedgebot.engine.trade.SkipReason;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Phases before a position exists: SCHEDULED, WATCHING and TRIGGER_WAIT, ending in LIVE or SKIPPED.
 */
@Slf4j
@RequiredArgsConstructor
public class EntryHandler {

    static final int[] SNAPSHOT_OFFSETS_SECONDS = {30, 60, 90, 120};
    private static final double BASELINE_MIN_DRIFT_PCT = 1.0;

    private final StrategySettings settings;
    private final HedgeBotProperties.Verification verification;
    private final OrderVerificationController controller;
    private final HedgeHandler hedgeHandler;
    private final TradeRecorder recorder;
    private final EngineMetrics metrics;
    private final Clock clock;

    public Trade onScheduled(Trade trade, MarketSnapshot market) {
        if (!market.book().inplay()) {
            log.debug("market for {} not in-play yet", trade.label());
            return trade;
        }
        Instant now = clock.instant();
        double liquidity = market.liquidity();
        if (liquidity < settings.minMarketLiquidity()) {
            log.info("market liquidity too low, skipping (trade={}, matched={}, min={})",
                    trade.label(), liquidity, settings.minMarketLiquidity());
            ShadowObservation shadow = ShadowObservation.awaitingTrigger(SkipReason.MARKET_LIQUIDITY_TOO_LOW.name(), now,
                    market.referencePrice());
            return skip(trade, SkipReason.MARKET_LIQUIDITY_TOO_LOW, shadow,
                    "totalMatched", liquidity, "minLiquidity", settings.minMarketLiquidity());
        }
        Double price = market.referencePrice();
        if (price == null) {
            log.debug("no price yet for {}", trade.label());
            return trade;
        }
        recorder.event(trade, TradeEventType.WATCHING_STARTED, "baselinePrice", price,
                "minutesFromKickoff", HedgeHandler.round1(trade.minutesFromKickoff(now)), "totalMatched", liquidity);
        log.info("watching started (trade={}, baseline={})", trade.label(), price);
        return recorder.transition(trade, PhaseState.Watching.startingAt(price));
    }

    public Trade onWatching(Trade trade, PhaseState.Watching watching, MarketSnapshot market) {
        Double price = market.referencePrice();
        if (price == null) {
            return trade;
        }
        Instant now = clock.instant();
        List<Double> readings = TriggerDetector.window(watching.recentPrices(), price, settings.baselineStableReadings());
        double baseline = watching.baselinePrice();

        if (TriggerDetector.isStable(readings, settings.baselineStableReadings(), settings.baselineStabilityPct())) {
            double drift = Math.abs(TriggerDetector.movePct(baseline, price));
            if (drift > BASELINE_MIN_DRIFT_PCT) {
                recorder.event(trade, TradeEventType.BASELINE_UPDATED, "oldBaseline", baseline, "newBaseline", price,
                        "driftPct", HedgeHandler.round1(drift), "recentPrices", readings);
                log.info("baseline updated (trade={}, {} -> {})", trade.label(), baseline, price);
                baseline = price;
            }
        }

        double movePct = TriggerDetector.movePct(baseline, price);
        if (movePct < settings.triggerPct()) {
            log.debug("watching {} (price={}, baseline={}, move={}%)", trade.label(), price, baseline,
                    HedgeHandler.round1(movePct));
            return recorder.transition(trade, new PhaseState.Watching(baseline, price, readings));
        }

        double minute = trade.minutesFromKickoff(now);
        recorder.event(trade, TradeEventType.TRIGGER_DETECTED, "baselinePrice", baseline, "price", price,
                "movePct", HedgeHandler.round1(movePct), "minutesFromKickoff", HedgeHandler.round1(minute));
        if (minute > settings.triggerCutoffMinutes()) {
            log.info("trigger after cutoff, skipping (trade={}, minute={}, cutoff={})",
                    trade.label(), HedgeHandler.round1(minute), settings.triggerCutoffMinutes());
            ShadowObservation shadow = ShadowObservation.fromEntry(SkipReason.TRIGGER_AFTER_CUTOFF.name(), now, price,
                    price, now);
            return skip(trade, SkipReason.TRIGGER_AFTER_CUTOFF, shadow, "minutesFromKickoff", HedgeHandler.round1(minute),
                    "cutoffMinutes", settings.triggerCutoffMinutes());
        }
        log.info("trigger detected (trade={}, baseline={}, price={}, move={}%)", trade.label(), baseline, price,
                HedgeHandler.round1(movePct));
        return recorder.transition(trade,
                new PhaseState.TriggerWait(baseline, now, price, List.of(), null, List.of(), false));
    }

    public Trade onTriggerWait(Trade trade, PhaseState.TriggerWait wait, MarketSnapshot market)
            throws InterruptedException {
        double stake = stakeOf(trade);
        if (!wait.entryOrders().isEmpty()) {
            log.info("resolving recorded entry orders (trade={}, orders={})", trade.label(), wait.entryOrders().size());
            VerificationResult result = controller.resolve(wait.entryOrders(), trade.marketId(), stake);
            return afterEntry(trade, wait, result, stake, wait.entryOrders().get(0).price());
        }

        Double back = market.back();
        Double lay = market.lay();
        if (back == null) {
            return trade;
        }
        Instant now = clock.instant();
        long elapsed = Duration.between(wait.triggerAt(), now).getSeconds();

        for (int offset : SNAPSHOT_OFFSETS_SECONDS) {
            if (elapsed >= offset && !wait.snapshotsLogged().contains(offset)) {
                recorder.event(trade, TradeEventType.TRIGGER_PRICE_SNAPSHOT, "offsetSeconds", offset,
                        "backPrice", back, "layPrice", lay, "triggerPrice", wait.triggerPrice());
                wait = wait.withSnapshot(offset);
            }
        }

        if (TriggerDetector.isReverted(wait.baselinePrice(), back, settings.triggerPct())) {
            recorder.event(trade, TradeEventType.TRIGGER_REVERTED, "baselinePrice", wait.baselinePrice(),
                    "price", back, "phase", "TRIGGER_WAIT");
            log.info("price returned towards baseline, false alarm (trade={}, baseline={}, price={})",
                    trade.label(), wait.baselinePrice(), back);
            return recorder.transition(trade, PhaseState.Watching.startingAt(back));
        }

        if (elapsed < settings.triggerSettle().getSeconds()) {
            return recorder.transition(trade, wait);
        }

        if (back > settings.maxEntryPrice()) {
            log.info("price above max entry, skipping (trade={}, price={}, max={})",
                    trade.label(), back, settings.maxEntryPrice());
            ShadowObservation shadow = ShadowObservation.fromEntry(SkipReason.PRICE_ABOVE_MAX.name(), now, back, back, now);
            return skip(trade, SkipReason.PRICE_ABOVE_MAX, shadow, "price", back, "maxEntryPrice", settings.maxEntryPrice());
        }
        if (back < settings.minEntryPrice()) {
            if (wait.belowMinSince() == null) {
                recorder.event(trade, TradeEventType.PRICE_BELOW_MIN_WAITING, "price", back,
                        "minEntryPrice", settings.minEntryPrice(), "recheckSeconds", settings.belowMinRecheck().getSeconds());
                log.info("price below min entry, rechecking (trade={}, price={}, min={})",
                        trade.label(), back, settings.minEntryPrice());
                return recorder.transition(trade, wait.withBelowMinSince(now));
            }
            if (Duration.between(wait.belowMinSince(), now).compareTo(settings.belowMinRecheck()) < 0) {
                return recorder.transition(trade, wait);
            }
            log.info("price still below min entry after recheck, skipping (trade={}, price={})", trade.label(), back);
            ShadowObservation shadow = ShadowObservation.fromEntry(SkipReason.PRICE_BELOW_MIN.name(), now, back, back, now);
            return skip(trade, SkipReason.PRICE_BELOW_MIN, shadow, "price", back, "minEntryPrice", settings.minEntryPrice());
        }
        if (wait.belowMinSince() != null) {
            wait = wait.withBelowMinSince(null);
        }
        if (lay == null) {
            log.debug("no lay price, entry deferred for {}", trade.label());
            return recorder.transition(trade, wait);
        }

        double entryPrice = entryPrice(back, lay);
        OrderRequest request = new OrderRequest(trade.marketId(), trade.selectionId(), Side.BACK, stake, entryPrice,
                PersistenceType.LAPSE, CustomerRefs.of(trade.id(), "entry", 0));
        VerifyOptions options = new VerifyOptions(verification.entryWaitMillis(), verification.pollMillis(),
                verification.entryMaxRetries(), verification.retryWaitMillis(), EntryHandler::retryPrice);
        log.info("placing entry back (trade={}, stake={}, price={}, back={}, lay={})",
                trade.label(), stake, entryPrice, back, lay);

        AtomicReference<Trade> current = new AtomicReference<>(recorder.transition(trade, wait));
        VerificationResult result = controller.placeAndVerify(request, options, placed -> recordEntryOrder(current, placed, stake));
        Trade latest = current.get();
        return afterEntry(latest, (PhaseState.TriggerWait) latest.phaseState(), result, stake, entryPrice);
    }

    /**
     * Best back when the spread is within one tick, otherwise the ladder mid.
     */
    static double entryPrice(double back, double lay) {
        if (PriceLadder.isWithinTicks(back, lay, 1)) {
            return PriceLadder.snap(back);
        }
        return PriceLadder.middlePrice(back, lay);
    }

    /**
     * Price for re-placing an unmatched entry remainder: best back on a tight spread, else one tick under best lay.
     */
    static Double retryPrice(RunnerBook runner) {
        Double back = runner.bestBackPrice();
        Double lay = runner.bestLayPrice();
        if (back == null || lay == null) {
            return null;
        }
        if (PriceLadder.isWithinTicks(back, lay, 1)) {
            return PriceLadder.snap(back);
        }
        return PriceLadder.ticksBelow(lay, 1);
    }

    private void recordEntryOrder(AtomicReference<Trade> current, PlacedOrder placed, double stake) {
        Trade trade = current.get();
        PhaseState.TriggerWait wait = (PhaseState.TriggerWait) trade.phaseState();
        boolean retry = !wait.entryOrders().isEmpty();
        Trade saved = recorder.save(recorder.transition(trade, wait.withEntryOrder(placed))
                .withBackPrice(placed.price())
                .withBackStake(stake));
        recorder.event(saved, retry ? TradeEventType.ENTRY_RETRY_PLACED : TradeEventType.ENTRY_PLACED,
                "betId", placed.betId(), "price", placed.price(), "size", placed.size(), "customerRef", placed.customerRef());
        current.set(saved);
    }

    private Trade afterEntry(Trade trade, PhaseState.TriggerWait wait, VerificationResult result, double stake,
                             double requestedPrice) {
        Instant now = clock.instant();
        switch (result.outcome()) {
            case REJECTED -> {
                recorder.event(trade, TradeEventType.ENTRY_PLACEMENT_FAILED, "errorCode", result.errorCode(),
                        "price", requestedPrice, "size", stake);
                return recorder.transition(trade, wait).withLastError("ENTRY_PLACEMENT_FAILED: " + result.errorCode());
            }
            case CANCEL_UNCONFIRMED -> {
                recorder.event(trade, TradeEventType.ENTRY_CANCEL_UNCONFIRMED, "betIds", result.betIds(),
                        "matchedSoFar", result.matchedSize());
                log.warn("entry remainder cancel unconfirmed, resolving next tick (trade={}, betIds={})",
                        trade.label(), result.betIds());
                return recorder.transition(trade, wait).withLastError("ENTRY_CANCEL_UNCONFIRMED");
            }
            case UNVERIFIED -> {
                recorder.event(trade, TradeEventType.ENTRY_CANCEL_UNCONFIRMED, "betIds", result.betIds(),
                        "matchedSoFar", result.matchedSize(), "reason", "NOT_FOUND");
                log.error("entry order missing from both order views, fill unknown (trade={}, betIds={})",
                        trade.label(), result.betIds());
                return recorder.transition(trade, wait).withLastError("ENTRY_STATE_UNVERIFIED");
            }
            case NONE -> {
                log.info("entry not matched, skipping (trade={}, price={})", trade.label(), requestedPrice);
                ShadowObservation shadow = ShadowObservation.fromEntry(SkipReason.ENTRY_NOT_MATCHED.name(), now,
                        requestedPrice, requestedPrice, now);
                return skip(trade.withBackMatchedSize(0.0), SkipReason.ENTRY_NOT_MATCHED, shadow,
                        "betIds", result.betIds(), "price", requestedPrice);
            }
            default -> {
                return enter(trade, wait, result, stake);
            }
        }
    }

    private Trade enter(Trade trade, PhaseState.TriggerWait wait, VerificationResult result, double stake) {
        Instant now = clock.instant();
        double entryPrice = result.matchedPrice();
        double targetLayPrice = PriceLadder.snap(entryPrice / (1.0 + settings.profitTargetPct() / 100.0));
        Position position = new Position(result.betIds(), stake, result.matchedSize(), entryPrice, now, targetLayPrice,
                List.of(), 0);
        Trade entered = trade.withBackPrice(entryPrice)
                .withBackStake(stake)
                .withBackMatchedSize(result.matchedSize())
                .withLastError(null);
        if (wait.entered()) {
            log.info("entry already recorded, retrying hedge placement (trade={}, matched={}@{})",
                    trade.label(), result.matchedSize(), entryPrice);
        } else {
            // persisted before the hedge call; a retried tick must see the entry as recorded
            entered = recorder.save(recorder.transition(entered, wait.markEntered()));
            recorder.event(entered, TradeEventType.POSITION_ENTERED, "matchedSize", result.matchedSize(),
                    "averagePrice", entryPrice, "requestedStake", stake, "outcome", result.outcome(),
                    "targetLayPrice", targetLayPrice);
            metrics.tradeEntered();
            log.info("position entered (trade={}, matched={}@{}, outcome={}, target={})",
                    trade.label(), result.matchedSize(), entryPrice, result.outcome(), targetLayPrice);
        }
        return hedgeHandler.placeHedge(entered, position, HedgePurpose.PROFIT_TARGET, targetLayPrice, entryPrice);
    }

    private Trade skip(Trade trade, SkipReason reason, ShadowObservation shadow, Object... details) {
        Object[] payload = new Object[details.length + 2];
        payload[0] = "reason";
        payload[1] = reason;
        System.arraycopy(details, 0, payload, 2, details.length);
        recorder.event(trade, TradeEventType.TRADE_SKIPPED, payload);
        metrics.tradeSkipped(reason);
        return recorder.transition(trade, new PhaseState.Skipped(reason, shadow)).withLastError(reason.name());
    }

    private double stakeOf(Trade trade) {
        return trade.targetStake() != null && trade.targetStake() > 0 ? trade.targetStake() : settings.defaultStake();
    }
}
