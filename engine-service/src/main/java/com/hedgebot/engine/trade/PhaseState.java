package com.hedgebot.engine.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hedgebot.engine.shadow.ShadowObservation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Working memory of one trade, one variant per phase. Each variant carries only what its phase needs; a
 * transition builds the next variant instead of mutating shared fields.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PhaseState.Scheduled.class, name = "SCHEDULED"),
        @JsonSubTypes.Type(value = PhaseState.Watching.class, name = "WATCHING"),
        @JsonSubTypes.Type(value = PhaseState.TriggerWait.class, name = "TRIGGER_WAIT"),
        @JsonSubTypes.Type(value = PhaseState.Live.class, name = "LIVE"),
        @JsonSubTypes.Type(value = PhaseState.ConfirmWait.class, name = "CONFIRM_WAIT"),
        @JsonSubTypes.Type(value = PhaseState.RecoveryPending.class, name = "RECOVERY_PENDING"),
        @JsonSubTypes.Type(value = PhaseState.Settling.class, name = "SETTLING"),
        @JsonSubTypes.Type(value = PhaseState.PostTradeMonitor.class, name = "POST_TRADE_MONITOR"),
        @JsonSubTypes.Type(value = PhaseState.Completed.class, name = "COMPLETED"),
        @JsonSubTypes.Type(value = PhaseState.Skipped.class, name = "SKIPPED"),
})
public sealed interface PhaseState permits PhaseState.Scheduled, PhaseState.Watching, PhaseState.TriggerWait,
        PhaseState.Live, PhaseState.ConfirmWait, PhaseState.RecoveryPending, PhaseState.Settling,
        PhaseState.PostTradeMonitor, PhaseState.Completed, PhaseState.Skipped {

    @JsonIgnore
    Phase phase();

    enum Phase {
        SCHEDULED(TradeStatus.SCHEDULED),
        WATCHING(TradeStatus.WATCHING),
        TRIGGER_WAIT(TradeStatus.ENTERING),
        LIVE(TradeStatus.LIVE),
        CONFIRM_WAIT(TradeStatus.LIVE),
        RECOVERY_PENDING(TradeStatus.LIVE),
        SETTLING(TradeStatus.SETTLING),
        POST_TRADE_MONITOR(TradeStatus.POST_TRADE_MONITOR),
        COMPLETED(TradeStatus.COMPLETED),
        SKIPPED(TradeStatus.SKIPPED);

        private final TradeStatus status;

        Phase(TradeStatus status) {
            this.status = status;
        }

        /**
         * Coarse status written next to this phase. A cancelled trade overrides it.
         */
        public TradeStatus status() {
            return status;
        }
    }

    record Scheduled() implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.SCHEDULED;
        }
    }

    record Watching(
            double baselinePrice,
            double lastPrice,
            List<Double> recentPrices
    ) implements PhaseState {
        public Watching {
            recentPrices = recentPrices == null ? List.of() : List.copyOf(recentPrices);
        }

        public static Watching startingAt(double price) {
            return new Watching(price, price, List.of(price));
        }

        @Override
        public Phase phase() {
            return Phase.WATCHING;
        }
    }

    /**
     * Waiting for the market to settle after a trigger; {@code entryOrders} is recorded before any verification
     * wait so an interrupted entry is resolved rather than placed twice.
     */
    record TriggerWait(
            double baselinePrice,
            Instant triggerAt,
            double triggerPrice,
            List<Integer> snapshotsLogged,
            Instant belowMinSince,
            List<PlacedOrder> entryOrders,
            boolean entered
    ) implements PhaseState {
        public TriggerWait {
            snapshotsLogged = snapshotsLogged == null ? List.of() : List.copyOf(snapshotsLogged);
            entryOrders = entryOrders == null ? List.of() : List.copyOf(entryOrders);
        }

        public TriggerWait withSnapshot(int offsetSeconds) {
            List<Integer> logged = new ArrayList<>(snapshotsLogged);
            logged.add(offsetSeconds);
            return new TriggerWait(baselinePrice, triggerAt, triggerPrice, logged, belowMinSince, entryOrders, entered);
        }

        public TriggerWait withBelowMinSince(Instant since) {
            return new TriggerWait(baselinePrice, triggerAt, triggerPrice, snapshotsLogged, since, entryOrders, entered);
        }

        public TriggerWait withEntryOrder(PlacedOrder order) {
            List<PlacedOrder> orders = new ArrayList<>(entryOrders);
            orders.add(order);
            return new TriggerWait(baselinePrice, triggerAt, triggerPrice, snapshotsLogged, belowMinSince, orders, entered);
        }

        /**
         * Marks the entry as recorded, so a hedge placement that fails and is retried does not record it twice.
         */
        public TriggerWait markEntered() {
            return new TriggerWait(baselinePrice, triggerAt, triggerPrice, snapshotsLogged, belowMinSince, entryOrders, true);
        }

        @Override
        public Phase phase() {
            return Phase.TRIGGER_WAIT;
        }
    }

    /**
     * Position entered; {@code hedge} is the resting protective lay, null while the position is exposed.
     */
    record Live(
            Position position,
            HedgeOrder hedge,
            double lastStablePrice,
            int hedgeNotFoundCount
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.LIVE;
        }
    }

    /**
     * Hedge cancelled on a second trigger. {@code hedgeVerified} is set only when the cancelled hedge was read back
     * closed from a venue view.
     */
    record ConfirmWait(
            Position position,
            Instant triggerAt,
            double triggerPrice,
            double preTriggerPrice,
            HedgeOrder cancelledHedge,
            boolean hedgeVerified,
            double minPriceSinceTrigger
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.CONFIRM_WAIT;
        }
    }

    record RecoveryPending(
            Position position,
            double stopBaseline,
            double stopPrice,
            HedgeOrder recoveryOrder,
            int retries,
            int notFoundCount,
            double minPriceSinceTrigger
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.RECOVERY_PENDING;
        }
    }

    /**
     * Capital is no longer at risk (or can no longer be reduced); settlement is due.
     * {@code hedgeVerified} is false when the last hedge order could not be found in either venue view.
     * {@code minPriceAfterSecondTrigger} is kept for stop-loss calibration.
     */
    record Settling(
            Position position,
            ExitReason exitReason,
            boolean hedgeVerified,
            Double minPriceAfterSecondTrigger
    ) implements PhaseState {
        public Settling(Position position, ExitReason exitReason, boolean hedgeVerified) {
            this(position, exitReason, hedgeVerified, null);
        }

        @Override
        public Phase phase() {
            return Phase.SETTLING;
        }
    }

    record PostTradeMonitor(
            ExitReason exitReason,
            ShadowObservation shadow
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.POST_TRADE_MONITOR;
        }
    }

    record Completed(
            String reason,
            ShadowObservation shadow
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.COMPLETED;
        }
    }

    record Skipped(
            SkipReason reason,
            ShadowObservation shadow
    ) implements PhaseState {
        @Override
        public Phase phase() {
            return Phase.SKIPPED;
        }
    }
}
