package com.hedgebot.engine.machine;

import com.hedgebot.core.settlement.Fill;
import com.hedgebot.core.venue.MarketBook;
import com.hedgebot.core.venue.VenueGateway;
import com.hedgebot.engine.execution.OrderVerificationController;
import com.hedgebot.engine.execution.VerificationResult;
import com.hedgebot.engine.shadow.ShadowMonitor;
import com.hedgebot.engine.store.TradeStore;
import com.hedgebot.engine.trade.ExitReason;
import com.hedgebot.engine.trade.HedgeOrder;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.Position;
import com.hedgebot.engine.trade.Trade;
import com.hedgebot.engine.trade.TradeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Advances one trade by one tick: reload, read the market, run the handler for the current phase, save.
 *
 * Callers must not tick the same trade concurrently.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeStateMachine {

    private final TradeStore tradeStore;
    private final VenueGateway gateway;
    private final OrderVerificationController controller;
    private final EntryHandler entryHandler;
    private final HedgeHandler hedgeHandler;
    private final TradeSettler settler;
    private final ShadowMonitor shadowMonitor;
    private final TradeRecorder recorder;
    private final Clock clock;

    public void tick(String tradeId) throws InterruptedException {
        Optional<Trade> loaded = tradeStore.findById(tradeId);
        if (loaded.isEmpty()) {
            log.warn("trade {} vanished before its tick", tradeId);
            return;
        }
        Trade trade = loaded.get();
        if (trade.status().isTerminal() && !trade.shadowActive()) {
            return;
        }
        if (!trade.hasMarket()) {
            log.warn("trade {} has no market or selection, skipping tick", trade.label());
            return;
        }

        MarketBook book = gateway.marketBook(trade.marketId(), "book " + trade.label());
        MarketSnapshot market = new MarketSnapshot(book, book.runner(trade.selectionId()).orElse(null), clock.instant());

        Trade next;
        if (market.closed()) {
            next = onMarketClosed(trade, market);
        } else if (market.runner() == null) {
            log.warn("selection {} missing from book {} ({})", trade.selectionId(), trade.marketId(), trade.label());
            return;
        } else {
            next = dispatch(trade, market);
        }
        if (next.phaseState() instanceof PhaseState.Settling settling) {
            next = settler.settle(next, settling, market.referencePrice());
        }
        if (!next.equals(trade)) {
            recorder.save(next);
        }
    }

    /**
     * Closes out a trade whose game is over. Exposure is settled from the fills on record; a trade that never
     * entered is cancelled.
     */
    public void endGame(String tradeId) throws InterruptedException {
        Optional<Trade> loaded = tradeStore.findById(tradeId);
        if (loaded.isEmpty()) {
            return;
        }
        Trade trade = loaded.get();
        if (trade.status().isTerminal() && !trade.shadowActive()) {
            return;
        }
        recorder.event(trade, TradeEventType.GAME_ENDED, "phase", trade.phase(),
                "minutesFromKickoff", HedgeHandler.round1(trade.minutesFromKickoff(clock.instant())));
        log.info("game ended, closing out trade (trade={}, phase={})", trade.label(), trade.phase());
        Trade next = closeOut(trade, ExitReason.GAME_ENDED, "GAME_ENDED");
        if (next.phaseState() instanceof PhaseState.Settling settling) {
            next = settler.settle(next, settling, null);
        }
        if (!next.equals(trade)) {
            recorder.save(next);
        }
    }

    Trade dispatch(Trade trade, MarketSnapshot market) throws InterruptedException {
        PhaseState state = trade.phaseState() == null ? new PhaseState.Scheduled() : trade.phaseState();
        return switch (state.phase()) {
            case SCHEDULED -> entryHandler.onScheduled(trade, market);
            case WATCHING -> entryHandler.onWatching(trade, (PhaseState.Watching) state, market);
            case TRIGGER_WAIT -> entryHandler.onTriggerWait(trade, (PhaseState.TriggerWait) state, market);
            case LIVE -> hedgeHandler.onLive(trade, (PhaseState.Live) state, market);
            case CONFIRM_WAIT -> hedgeHandler.onConfirmWait(trade, (PhaseState.ConfirmWait) state, market);
            case RECOVERY_PENDING -> hedgeHandler.onRecoveryPending(trade, (PhaseState.RecoveryPending) state, market);
            case SETTLING -> trade;
            case POST_TRADE_MONITOR, SKIPPED, COMPLETED -> shadowMonitor.onTick(trade, market.referencePrice());
        };
    }

    Trade onMarketClosed(Trade trade, MarketSnapshot market) throws InterruptedException {
        recorder.event(trade, TradeEventType.MARKET_CLOSED, "phase", trade.phase(), "marketId", trade.marketId());
        log.info("market closed (trade={}, phase={})", trade.label(), trade.phase());
        return closeOut(trade, ExitReason.MARKET_CLOSED, "MARKET_CLOSED");
    }

    private Trade closeOut(Trade trade, ExitReason reason, String cancelReason) throws InterruptedException {
        PhaseState state = trade.phaseState() == null ? new PhaseState.Scheduled() : trade.phaseState();
        if (state instanceof PhaseState.Scheduled || state instanceof PhaseState.Watching) {
            return recorder.cancel(trade, cancelReason);
        }
        if (state instanceof PhaseState.TriggerWait wait) {
            return closeOutEntry(trade, wait, reason, cancelReason);
        }
        if (state instanceof PhaseState.Live live) {
            return settleWithHedge(trade, live.position(), live.hedge(), reason, null);
        }
        if (state instanceof PhaseState.ConfirmWait wait) {
            return recorder.transition(trade, new PhaseState.Settling(wait.position(), reason, wait.hedgeVerified(),
                    wait.minPriceSinceTrigger()));
        }
        if (state instanceof PhaseState.RecoveryPending pending) {
            return settleWithHedge(trade, pending.position(), pending.recoveryOrder(), reason,
                    pending.minPriceSinceTrigger());
        }
        if (state.phase() == PhaseState.Phase.SETTLING) {
            return trade;
        }
        return shadowMonitor.close(trade, reason.name());
    }

    private Trade closeOutEntry(Trade trade, PhaseState.TriggerWait wait, ExitReason reason, String cancelReason)
            throws InterruptedException {
        if (wait.entryOrders().isEmpty()) {
            return recorder.cancel(trade, cancelReason);
        }
        double stake = wait.entryOrders().get(0).size();
        VerificationResult result = controller.resolve(wait.entryOrders(), trade.marketId(), stake);
        boolean verified = !result.outcome().unresolved();
        if (!result.hasMatch() && verified) {
            return recorder.cancel(trade.withBackMatchedSize(0.0), cancelReason);
        }
        double price = result.hasMatch() ? result.matchedPrice() : wait.entryOrders().get(0).price();
        Position position = new Position(result.betIds(), stake, result.matchedSize(), price,
                wait.entryOrders().get(0).placedAt(), 0.0, List.of(), 0);
        if (verified) {
            log.warn("entry matched at close-out without a hedge (trade={}, matched={}@{})",
                    trade.label(), result.matchedSize(), result.matchedPrice());
        } else {
            log.error("entry fill unverifiable at close-out (trade={}, outcome={}, matchedSoFar={})",
                    trade.label(), result.outcome(), result.matchedSize());
        }
        return recorder.transition(trade.withBackMatchedSize(result.matchedSize()),
                new PhaseState.Settling(position, reason, verified));
    }

    private Trade settleWithHedge(Trade trade, Position position, HedgeOrder hedge, ExitReason reason, Double minPrice)
            throws InterruptedException {
        HedgeHandler.HedgeCloseOut closeOut = hedgeHandler.closeOut(trade, hedge);
        Fill fill = closeOut.fill();
        return recorder.transition(trade,
                new PhaseState.Settling(position.addHedgeFill(fill), reason, closeOut.verified(), minPrice));
    }
}
