package com.hedgebot.engine.machine;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.core.ladder.PriceLadder;
import com.hedgebot.core.settlement.Fill;
import com.hedgebot.core.settlement.SettlementCalculator;
import com.hedgebot.core.venue.OrderRequest;
import com.hedgebot.core.venue.PersistenceType;
import com.hedgebot.core.venue.PlaceResult;
import com.hedgebot.core.venue.Side;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.execution.CancelConfirmation;
import com.hedgebot.engine.execution.CustomerRefs;
import com.hedgebot.engine.execution.OrderVerificationController;
import com.hedgebot.engine.execution.OrderView;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.trade.ExitReason;
import com.hedgebot.engine.trade.HedgeOrder;
import com.hedgebot.engine.trade.HedgePurpose;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.Position;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Phases with a matched position: LIVE, CONFIRM_WAIT and RECOVERY_PENDING.
 *
 * A resting hedge is only trusted after its true state has been read back from the venue. A position never leaves
 * these phases as "safe" unless the hedge fills say so.
 */
@Slf4j
@RequiredArgsConstructor
public class HedgeHandler {

    static final String HEDGE_PLACEMENT_FAILED_EXPOSED = "HEDGE_PLACEMENT_FAILED_EXPOSED";
    static final String EMERGENCY_HEDGE_FAILED_NO_PRICE = "EMERGENCY_HEDGE_FAILED_NO_PRICE";
    static final String HEDGE_CANCEL_UNCONFIRMED = "HEDGE_CANCEL_UNCONFIRMED";
    static final String UNRESOLVED_EXPOSURE = "UNRESOLVED_EXPOSURE";
    static final String HEDGE_STATE_UNVERIFIED = "HEDGE_STATE_UNVERIFIED";

    private static final double MIN_HEDGE_STAKE = 0.01;

    private final StrategySettings settings;
    private final HedgeBotProperties.Verification verification;
    private final OrderVerificationController controller;
    private final TradeRecorder recorder;
    private final EngineMetrics metrics;
    private final Clock clock;

    /**
     * Places a protective lay for the unhedged part of {@code position} and moves the trade to LIVE. A rejected
     * placement leaves the trade LIVE without a hedge, which later ticks treat as exposed.
     */
    public Trade placeHedge(Trade trade, Position position, HedgePurpose purpose, double price, double lastStablePrice) {
        double unhedged = position.unhedgedBackStake();
        if (unhedged < MIN_HEDGE_STAKE) {
            return recorder.transition(trade, new PhaseState.Settling(position, ExitReason.PROFIT_TARGET_HIT, true));
        }
        double layPrice = PriceLadder.snap(price);
        Position next = position.nextHedgeAttempt();
        double layStake = SettlementCalculator.quoteLay(unhedged, position.entryPrice(), layPrice, settings.commissionRate())
                .layStake();
        String ref = CustomerRefs.of(trade.id(), purpose.refTag(), next.hedgeAttempts());
        OrderRequest request = new OrderRequest(trade.marketId(), trade.selectionId(), Side.LAY, layStake, layPrice,
                PersistenceType.PERSIST, ref);
        PlaceResult result = controller.place(request, purpose.refTag() + " lay for " + trade.label());

        if (!result.success()) {
            TradeEventType failed = purpose == HedgePurpose.EMERGENCY
                    ? TradeEventType.EMERGENCY_HEDGE_FAILED : TradeEventType.HEDGE_PLACEMENT_FAILED;
            recorder.event(trade, failed, "purpose", purpose, "price", layPrice, "size", layStake,
                    "errorCode", result.errorCode());
            log.error("{} lay rejected, position exposed (trade={}, size={}, price={}, errorCode={})",
                    purpose.refTag(), trade.label(), layStake, layPrice, result.errorCode());
            return recorder.transition(trade, new PhaseState.Live(next, null, lastStablePrice, 0))
                    .withLastError(HEDGE_PLACEMENT_FAILED_EXPOSED);
        }

        HedgeOrder hedge = new HedgeOrder(result.betId(), purpose, layPrice, layStake, ref, clock.instant());
        recorder.event(trade, placedEvent(purpose), "betId", hedge.betId(), "price", layPrice, "size", layStake,
                "unhedgedBackStake", unhedged, "customerRef", ref);
        if (purpose == HedgePurpose.EMERGENCY) {
            metrics.emergencyHedge();
        }
        return recorder.transition(trade, new PhaseState.Live(next, hedge, lastStablePrice, 0))
                .withLayPrice(layPrice)
                .withLaySize(layStake)
                .withLastError(null);
    }

    public Trade onLive(Trade trade, PhaseState.Live live, MarketSnapshot market) throws InterruptedException {
        Position position = live.position();
        HedgeOrder hedge = live.hedge();
        if (hedge == null) {
            return emergencyHedge(trade, live, position, market, "NO_RESTING_HEDGE");
        }

        OrderView view = controller.inspect(hedge.betId(), hedge.size());
        switch (view.state()) {
            case FULLY_MATCHED -> {
                ExitReason reason = hedge.purpose() == HedgePurpose.EMERGENCY
                        ? ExitReason.EMERGENCY_HEDGE_FILLED : ExitReason.PROFIT_TARGET_HIT;
                log.info("hedge fully matched (trade={}, betId={}, size={}, price={})",
                        trade.label(), hedge.betId(), view.sizeMatched(), view.averagePrice());
                return recorder.transition(trade,
                        new PhaseState.Settling(position.addHedgeFill(view.fill()), reason, true));
            }
            case CLOSED_WITH_PARTIAL, CLOSED_UNMATCHED -> {
                recorder.event(trade, TradeEventType.HEDGE_CLOSED_UNMATCHED, "betId", hedge.betId(),
                        "sizeMatched", view.sizeMatched(), "size", hedge.size());
                log.warn("hedge closed without full match (trade={}, betId={}, matched={} of {})",
                        trade.label(), hedge.betId(), view.sizeMatched(), hedge.size());
                return emergencyHedge(trade, live, position.addHedgeFill(view.fill()), market, view.state().name());
            }
            case NOT_FOUND -> {
                int count = live.hedgeNotFoundCount() + 1;
                recorder.event(trade, TradeEventType.HEDGE_NOT_FOUND, "betId", hedge.betId(), "consecutive", count);
                Trade next = recorder.transition(trade, new PhaseState.Live(position, hedge, live.lastStablePrice(), count));
                if (count < verification.notFoundThreshold()) {
                    log.warn("hedge not found in either order view (trade={}, betId={}, consecutive={})",
                            trade.label(), hedge.betId(), count);
                    return next;
                }
                // no replacement lay while the missing hedge may have matched
                log.error("hedge missing from both order views, state unverified (trade={}, betId={}, consecutive={})",
                        trade.label(), hedge.betId(), count);
                return next.withLastError(HEDGE_STATE_UNVERIFIED);
            }
            default -> {
                return checkSecondTrigger(trade, live, market);
            }
        }
    }

    public Trade onConfirmWait(Trade trade, PhaseState.ConfirmWait wait, MarketSnapshot market) {
        Double back = market.back();
        if (back == null) {
            return trade;
        }
        double min = Math.min(wait.minPriceSinceTrigger(), back);
        Instant now = clock.instant();
        if (Duration.between(wait.triggerAt(), now).compareTo(settings.confirmWait()) < 0) {
            return recorder.transition(trade, new PhaseState.ConfirmWait(wait.position(), wait.triggerAt(),
                    wait.triggerPrice(), wait.preTriggerPrice(), wait.cancelledHedge(), wait.hedgeVerified(), min));
        }

        if (TriggerDetector.isReverted(wait.preTriggerPrice(), back, settings.triggerPct())) {
            double movePct = TriggerDetector.movePct(wait.preTriggerPrice(), back);
            recorder.event(trade, TradeEventType.TRIGGER_REVERTED, "preTriggerPrice", wait.preTriggerPrice(),
                    "price", back, "movePct", round1(movePct), "phase", "CONFIRM_WAIT");
            log.info("second trigger reverted, re-hedging (trade={}, preTrigger={}, price={})",
                    trade.label(), wait.preTriggerPrice(), back);
            return placeHedge(trade, wait.position(), HedgePurpose.REHEDGE, wait.position().targetLayPrice(), back);
        }

        double stopBaseline = back;
        double stopPrice = PriceLadder.snap(stopBaseline * (1.0 - settings.stopLossPct() / 100.0));
        log.info("second trigger confirmed, placing recovery lay (trade={}, stopBaseline={}, stopPrice={})",
                trade.label(), stopBaseline, stopPrice);
        return placeRecovery(trade, wait.position(), stopBaseline, stopPrice, stopPrice, 0, min);
    }

    public Trade onRecoveryPending(Trade trade, PhaseState.RecoveryPending pending, MarketSnapshot market) {
        Double back = market.back();
        double min = back == null ? pending.minPriceSinceTrigger() : Math.min(pending.minPriceSinceTrigger(), back);
        Position position = pending.position();
        HedgeOrder order = pending.recoveryOrder();
        if (order == null) {
            return replaceRecovery(trade, pending, position, market, min);
        }

        OrderView view = controller.inspect(order.betId(), order.size());
        switch (view.state()) {
            case FULLY_MATCHED -> {
                log.info("recovery lay fully matched (trade={}, size={}, price={})",
                        trade.label(), view.sizeMatched(), view.averagePrice());
                return recorder.transition(trade, new PhaseState.Settling(position.addHedgeFill(view.fill()),
                        ExitReason.STOP_LOSS, true, min));
            }
            case CLOSED_WITH_PARTIAL, CLOSED_UNMATCHED -> {
                return replaceRecovery(trade, pending, position.addHedgeFill(view.fill()), market, min);
            }
            case NOT_FOUND -> {
                int count = pending.notFoundCount() + 1;
                recorder.event(trade, TradeEventType.HEDGE_NOT_FOUND, "betId", order.betId(), "consecutive", count,
                        "purpose", HedgePurpose.RECOVERY);
                Trade next = recorder.transition(trade, new PhaseState.RecoveryPending(position, pending.stopBaseline(),
                        pending.stopPrice(), order, pending.retries(), count, min));
                if (count < verification.notFoundThreshold()) {
                    return next;
                }
                log.error("recovery lay missing from both order views, state unverified (trade={}, betId={}, consecutive={})",
                        trade.label(), order.betId(), count);
                return next.withLastError(HEDGE_STATE_UNVERIFIED);
            }
            default -> {
                return recorder.transition(trade, new PhaseState.RecoveryPending(position, pending.stopBaseline(),
                        pending.stopPrice(), order, pending.retries(), 0, min));
            }
        }
    }

    /**
     * Cancels (or reads back) a resting hedge at close-out and reports the definitive fill. The fill counts as
     * verified only when the order was seen closed in one of the venue views.
     */
    public HedgeCloseOut closeOut(Trade trade, HedgeOrder hedge) throws InterruptedException {
        if (hedge == null) {
            return new HedgeCloseOut(Fill.NONE, true);
        }
        OrderView view = controller.inspect(hedge.betId(), hedge.size());
        if (!view.isClosed()) {
            CancelConfirmation cancel = controller.cancelAndConfirm(hedge.betId(), trade.marketId(), hedge.size());
            view = cancel.lastView();
        }
        if (view.isClosed()) {
            return new HedgeCloseOut(view.fill(), true);
        }
        log.warn("hedge state unverifiable at close-out (trade={}, betId={}, state={})",
                trade.label(), hedge.betId(), view.state());
        return new HedgeCloseOut(view.fill(), false);
    }

    private Trade checkSecondTrigger(Trade trade, PhaseState.Live live, MarketSnapshot market) throws InterruptedException {
        Double back = market.back();
        if (back == null) {
            return trade;
        }
        double lastStable = live.lastStablePrice();
        if (!TriggerDetector.isTrigger(lastStable, back, settings.triggerPct())) {
            return recorder.transition(trade,
                    new PhaseState.Live(live.position(), live.hedge(), back, 0));
        }

        HedgeOrder hedge = live.hedge();
        double movePct = TriggerDetector.movePct(lastStable, back);
        log.warn("second trigger, cancelling hedge (trade={}, lastStable={}, price={}, movePct={})",
                trade.label(), lastStable, back, round1(movePct));
        CancelConfirmation cancel = controller.cancelAndConfirm(hedge.betId(), trade.marketId(), hedge.size());
        if (!cancel.closed()) {
            recorder.event(trade, TradeEventType.HEDGE_CANCEL_UNCONFIRMED, "betId", hedge.betId(),
                    "attempts", cancel.attempts(), "reason", cancel.reason());
            return recorder.transition(trade, new PhaseState.Live(live.position(), hedge, lastStable, 0))
                    .withLastError(cancel.missing() ? HEDGE_STATE_UNVERIFIED : HEDGE_CANCEL_UNCONFIRMED);
        }

        OrderView view = cancel.lastView();
        Position position = live.position();
        if (view.state() == OrderView.State.FULLY_MATCHED) {
            log.info("hedge matched during second trigger (trade={}, size={}, price={})",
                    trade.label(), view.sizeMatched(), view.averagePrice());
            return recorder.transition(trade, new PhaseState.Settling(position.addHedgeFill(view.fill()),
                    ExitReason.HEDGE_MATCHED_DURING_TRIGGER, true));
        }
        if (view.state() == OrderView.State.CLOSED_WITH_PARTIAL) {
            position = position.addHedgeFill(view.fill());
            recorder.event(trade, TradeEventType.HEDGE_PARTIAL_ON_TRIGGER, "betId", hedge.betId(),
                    "sizeMatched", view.sizeMatched(), "price", view.averagePrice(), "size", hedge.size(),
                    "unhedgedBackStake", position.unhedgedBackStake());
        }
        recorder.event(trade, TradeEventType.SECOND_TRIGGER_DETECTED, "lastStablePrice", lastStable, "price", back,
                "movePct", round1(movePct), "partialHedgeSize", position.hedged().size());
        return recorder.transition(trade, new PhaseState.ConfirmWait(position, clock.instant(), back, lastStable,
                hedge, !view.isNotFound(), back)).withLastError(null);
    }

    private Trade emergencyHedge(Trade trade, PhaseState.Live live, Position position, MarketSnapshot market,
                                 String cause) {
        if (position.unhedgedBackStake() < MIN_HEDGE_STAKE) {
            return recorder.transition(trade,
                    new PhaseState.Settling(position, ExitReason.EMERGENCY_HEDGE_FILLED, true));
        }
        Double lay = market.lay();
        if (lay == null) {
            recorder.event(trade, TradeEventType.EMERGENCY_HEDGE_FAILED, "reason", "NO_PRICE", "cause", cause,
                    "unhedgedBackStake", position.unhedgedBackStake());
            log.error("no lay price for emergency hedge, position exposed (trade={}, unhedged={})",
                    trade.label(), position.unhedgedBackStake());
            return recorder.transition(trade, new PhaseState.Live(position, null, live.lastStablePrice(), 0))
                    .withLastError(EMERGENCY_HEDGE_FAILED_NO_PRICE);
        }
        log.warn("placing emergency hedge (trade={}, cause={}, unhedged={}, lay={})",
                trade.label(), cause, position.unhedgedBackStake(), lay);
        return placeHedge(trade, position, HedgePurpose.EMERGENCY, lay, live.lastStablePrice());
    }

    private Trade replaceRecovery(Trade trade, PhaseState.RecoveryPending pending, Position position,
                                  MarketSnapshot market, double min) {
        if (position.unhedgedBackStake() < MIN_HEDGE_STAKE) {
            return recorder.transition(trade, new PhaseState.Settling(position, ExitReason.STOP_LOSS, true, min));
        }
        if (pending.retries() >= settings.recoveryMaxRetries()) {
            recorder.event(trade, TradeEventType.RECOVERY_EXHAUSTED, "retries", pending.retries(),
                    "unhedgedBackStake", position.unhedgedBackStake(), "minPriceAfterSecondTrigger", min);
            log.error("recovery retries exhausted, exposure unresolved (trade={}, unhedged={})",
                    trade.label(), position.unhedgedBackStake());
            return recorder.transition(trade,
                            new PhaseState.Settling(position, ExitReason.UNRESOLVED_EXPOSURE, true, min))
                    .withLastError(UNRESOLVED_EXPOSURE);
        }
        Double lay = market.lay();
        if (lay == null) {
            recorder.event(trade, TradeEventType.RECOVERY_PLACEMENT_FAILED, "reason", "NO_PRICE",
                    "retries", pending.retries());
            return recorder.transition(trade, new PhaseState.RecoveryPending(position, pending.stopBaseline(),
                    pending.stopPrice(), null, pending.retries(), 0, min)).withLastError(EMERGENCY_HEDGE_FAILED_NO_PRICE);
        }
        return placeRecovery(trade, position, pending.stopBaseline(), pending.stopPrice(), lay, pending.retries() + 1, min);
    }

    private Trade placeRecovery(Trade trade, Position position, double stopBaseline, double stopPrice, double price,
                                int retries, double min) {
        double unhedged = position.unhedgedBackStake();
        if (unhedged < MIN_HEDGE_STAKE) {
            return recorder.transition(trade,
                    new PhaseState.Settling(position, ExitReason.HEDGE_MATCHED_DURING_TRIGGER, true, min));
        }
        double layPrice = PriceLadder.snap(price);
        Position next = position.nextHedgeAttempt();
        double layStake = SettlementCalculator.quoteLay(unhedged, position.entryPrice(), layPrice, settings.commissionRate())
                .layStake();
        String ref = CustomerRefs.of(trade.id(), HedgePurpose.RECOVERY.refTag(), next.hedgeAttempts());
        OrderRequest request = new OrderRequest(trade.marketId(), trade.selectionId(), Side.LAY, layStake, layPrice,
                PersistenceType.PERSIST, ref);
        PlaceResult result = controller.place(request, "recovery lay for " + trade.label());

        if (!result.success()) {
            recorder.event(trade, TradeEventType.RECOVERY_PLACEMENT_FAILED, "price", layPrice, "size", layStake,
                    "errorCode", result.errorCode(), "retries", retries);
            return recorder.transition(trade,
                            new PhaseState.RecoveryPending(next, stopBaseline, stopPrice, null, retries, 0, min))
                    .withLastError(HEDGE_PLACEMENT_FAILED_EXPOSED);
        }
        HedgeOrder order = new HedgeOrder(result.betId(), HedgePurpose.RECOVERY, layPrice, layStake, ref, clock.instant());
        recorder.event(trade, retries == 0 ? TradeEventType.RECOVERY_ORDER_PLACED : TradeEventType.RECOVERY_ORDER_REPLACED,
                "betId", order.betId(), "price", layPrice, "size", layStake, "stopBaseline", stopBaseline,
                "stopLossPct", settings.stopLossPct(), "unhedgedBackStake", unhedged, "retries", retries,
                "minPriceAfterSecondTrigger", min);
        return recorder.transition(trade, new PhaseState.RecoveryPending(next, stopBaseline, stopPrice, order, retries, 0, min))
                .withLayPrice(layPrice)
                .withLaySize(layStake)
                .withLastError(null);
    }

    private static TradeEventType placedEvent(HedgePurpose purpose) {
        return switch (purpose) {
            case EMERGENCY -> TradeEventType.EMERGENCY_HEDGE_PLACED;
            case REHEDGE -> TradeEventType.REHEDGE_PLACED;
            case RECOVERY -> TradeEventType.RECOVERY_ORDER_PLACED;
            case PROFIT_TARGET -> TradeEventType.HEDGE_PLACED;
        };
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    /**
     * Definitive hedge fill at close-out.
     */
    public record HedgeCloseOut(Fill fill, boolean verified) {}
}
