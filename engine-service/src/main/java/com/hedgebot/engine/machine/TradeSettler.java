package com.hedgebot.engine.machine;

import com.hedgebot.core.settlement.Fill;
import com.hedgebot.core.settlement.Pnl;
import com.hedgebot.core.settlement.SettlementCalculator;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.shadow.ShadowObservation;
import com.hedgebot.engine.trade.ExitReason;
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
 * Turns a SETTLING trade into realised PnL. Runs at most once per trade: a trade with {@code settledAt} set is
 * only moved on, never recomputed.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeSettler {

    static final String POST_TRADE = "POST_TRADE";

    private final StrategySettings settings;
    private final TradeRecorder recorder;
    private final EngineMetrics metrics;
    private final Clock clock;

    public Trade settle(Trade trade, PhaseState.Settling settling, Double currentPrice) {
        if (trade.settledAt() != null) {
            log.info("trade {} already settled at {}, not recomputing", trade.label(), trade.settledAt());
            return next(trade, settling, currentPrice, clock.instant());
        }
        Instant now = clock.instant();
        Position position = settling.position();
        Fill hedge = position.hedged();
        Pnl pnl = pnlOf(position, hedge, settling);
        long exposureSeconds = position.matchedAt() == null ? 0L
                : Math.max(0L, Duration.between(position.matchedAt(), now).getSeconds());

        Trade settled = trade.withBackMatchedSize(position.matchedSize())
                .withBackPrice(position.entryPrice())
                .withLayPrice(hedge.isEmpty() ? trade.layPrice() : hedge.price())
                .withLayMatchedSize(hedge.size())
                .withRealisedPnl(pnl.amount())
                .withPnlBasis(pnl.basis())
                .withSettledAt(now)
                .withExposureSeconds(exposureSeconds);
        recorder.event(settled, TradeEventType.TRADE_SETTLED, "exitReason", settling.exitReason(),
                "realisedPnl", pnl.amount(), "pnlBasis", pnl.basis(), "backMatchedSize", position.matchedSize(),
                "backPrice", position.entryPrice(), "layMatchedSize", hedge.size(),
                "layPrice", hedge.isEmpty() ? null : hedge.price(), "hedgeVerified", settling.hedgeVerified(),
                "exposureSeconds", exposureSeconds, "minPriceAfterSecondTrigger", settling.minPriceAfterSecondTrigger());
        metrics.tradeSettled(settling.exitReason(), pnl.basis());
        log.info("trade settled (trade={}, reason={}, pnl={}, basis={}, exposureSeconds={})",
                trade.label(), settling.exitReason(), pnl.amount(), pnl.basis(), exposureSeconds);
        return next(settled, settling, currentPrice, now);
    }

    Pnl pnlOf(Position position, Fill hedge, PhaseState.Settling settling) {
        if (settling.exitReason() == ExitReason.UNRESOLVED_EXPOSURE || !settling.hedgeVerified()) {
            return Pnl.unknown();
        }
        if (hedge.isEmpty() && settling.exitReason() == ExitReason.MARKET_CLOSED && position.matchedSize() > 0) {
            return SettlementCalculator.settleVerifiedUnhedged(position.matchedSize());
        }
        return SettlementCalculator.settle(position.matchedSize(), position.entryPrice(),
                hedge.isEmpty() ? null : hedge.size(), hedge.isEmpty() ? null : hedge.price(),
                settings.commissionRate());
    }

    private Trade next(Trade trade, PhaseState.Settling settling, Double currentPrice, Instant now) {
        ExitReason reason = settling.exitReason();
        if (reason == ExitReason.MARKET_CLOSED || reason == ExitReason.GAME_ENDED) {
            return recorder.transition(trade, new PhaseState.Completed(reason.name(), null));
        }
        Position position = settling.position();
        Instant entryAt = position.matchedAt() != null ? position.matchedAt() : now;
        ShadowObservation shadow = ShadowObservation.fromEntry(POST_TRADE, now, currentPrice, position.entryPrice(),
                entryAt);
        return recorder.transition(trade, new PhaseState.PostTradeMonitor(reason, shadow));
    }
}
