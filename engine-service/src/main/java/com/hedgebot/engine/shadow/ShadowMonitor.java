package com.hedgebot.engine.shadow;

import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.machine.TradeRecorder;
import com.hedgebot.engine.machine.TriggerDetector;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracks the best price a trade could have exited at, for skipped trades and for the window after a real exit.
 * Observation only: nothing here touches the venue.
 */
@Slf4j
@RequiredArgsConstructor
public class ShadowMonitor {

    public static final String CLOSED_EXPIRED = "EXPIRED";

    private final StrategySettings settings;
    private final TradeRecorder recorder;
    private final Clock clock;

    /**
     * One observation step for a SKIPPED or POST_TRADE_MONITOR trade.
     */
    public Trade onTick(Trade trade, Double price) {
        ShadowObservation observation = trade.shadow().orElse(null);
        if (observation == null || observation.closed()) {
            return trade;
        }
        Instant now = clock.instant();
        if (Duration.between(observation.startedAt(), now).compareTo(settings.postTradeMonitor()) >= 0) {
            return close(trade, CLOSED_EXPIRED);
        }
        ShadowObservation next = advance(trade, observation, price, now);
        return next == observation ? trade : withObservation(trade, next);
    }

    /**
     * Ends the observation and records its outcome. A POST_TRADE_MONITOR trade completes.
     */
    public Trade close(Trade trade, String reason) {
        ShadowObservation observation = trade.shadow().orElse(null);
        if (observation == null || observation.closed()) {
            if (trade.phaseState() instanceof PhaseState.PostTradeMonitor monitor) {
                return recorder.transition(trade, new PhaseState.Completed(monitor.exitReason().name(), observation));
            }
            return trade;
        }
        Instant now = clock.instant();
        ShadowObservation closed = observation.withClosed(true).withCloseReason(reason).withClosedAt(now);
        recorder.event(trade, TradeEventType.SHADOW_MONITORING_COMPLETED, "reason", reason,
                "entryPrice", closed.entryPrice(), "minPrice", closed.minPrice(),
                "maxPotentialProfitPct", closed.maxPotentialProfitPct(),
                "secondsToMaxProfit", closed.secondsToMaxProfit(), "frozen", closed.frozen());
        log.info("shadow monitoring completed (trade={}, reason={}, maxPotentialProfitPct={})",
                trade.label(), reason, closed.maxPotentialProfitPct());
        if (trade.phaseState() instanceof PhaseState.PostTradeMonitor monitor) {
            return recorder.transition(trade, new PhaseState.Completed(monitor.exitReason().name(), closed));
        }
        return withObservation(trade, closed);
    }

    ShadowObservation advance(Trade trade, ShadowObservation observation, Double price, Instant now) {
        if (price == null) {
            return observation;
        }
        if (observation.entryPrice() == null) {
            Double reference = observation.referencePrice();
            if (reference != null && TriggerDetector.isTrigger(reference, price, settings.triggerPct())) {
                recorder.event(trade, TradeEventType.SHADOW_ENTRY_DETECTED, "referencePrice", reference,
                        "theoreticalEntryPrice", price);
                log.info("shadow entry detected (trade={}, reference={}, price={})", trade.label(), reference, price);
                return observation.withEntryPrice(price).withEntryAt(now).withMinPrice(price).withMinPriceAt(now)
                        .withReferencePrice(price);
            }
            return observation.withReferencePrice(price);
        }
        if (observation.frozen()) {
            return observation;
        }
        Double reference = observation.referencePrice();
        if (reference != null && TriggerDetector.isTrigger(reference, price, settings.triggerPct())) {
            recorder.event(trade, TradeEventType.SHADOW_FROZEN, "referencePrice", reference, "price", price,
                    "minPrice", observation.minPrice());
            log.info("shadow minimum frozen by further trigger (trade={}, min={})", trade.label(), observation.minPrice());
            return observation.withFrozen(true).withFrozenAt(now);
        }

        ShadowObservation next = observation.withReferencePrice(price);
        if (observation.minPrice() == null || price < observation.minPrice()) {
            next = next.withMinPrice(price).withMinPriceAt(now).withSecondsToMilestone(
                    milestones(observation, price, now));
        }
        return next;
    }

    private static Map<Integer, Long> milestones(ShadowObservation observation, double price, Instant now) {
        Map<Integer, Long> reached = new HashMap<>(observation.secondsToMilestone());
        double profitPct = ShadowObservation.profitPct(observation.entryPrice(), price);
        long seconds = Duration.between(observation.entryAt(), now).getSeconds();
        for (int milestone : ShadowObservation.MILESTONES_PCT) {
            if (profitPct >= milestone && !reached.containsKey(milestone)) {
                reached.put(milestone, seconds);
            }
        }
        return reached;
    }

    private Trade withObservation(Trade trade, ShadowObservation observation) {
        PhaseState state = trade.phaseState();
        if (state instanceof PhaseState.Skipped skipped) {
            return trade.withPhaseState(new PhaseState.Skipped(skipped.reason(), observation));
        }
        if (state instanceof PhaseState.PostTradeMonitor monitor) {
            return trade.withPhaseState(new PhaseState.PostTradeMonitor(monitor.exitReason(), observation));
        }
        if (state instanceof PhaseState.Completed completed) {
            return trade.withPhaseState(new PhaseState.Completed(completed.reason(), observation));
        }
        return trade;
    }
}
