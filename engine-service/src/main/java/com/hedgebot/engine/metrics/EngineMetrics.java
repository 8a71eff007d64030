package com.hedgebot.engine.metrics;

import com.hedgebot.core.settlement.PnlBasis;
import com.hedgebot.engine.trade.ExitReason;
import com.hedgebot.engine.trade.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;

import java.util.function.Supplier;

/**
 * Trade lifecycle counters. Reason-tagged counters are resolved per call; the registry caches them.
 */
public class EngineMetrics {

    private final MeterRegistry meterRegistry;
    private final String strategyKey;
    private final Counter tradesEnteredCounter;
    private final Counter emergencyHedgesCounter;
    private final Counter tickFailuresCounter;

    public EngineMetrics(@NonNull MeterRegistry meterRegistry, @NonNull String strategyKey) {
        this.meterRegistry = meterRegistry;
        this.strategyKey = strategyKey;

        this.tradesEnteredCounter = Counter.builder("hedgebot.trades.entered")
                .description("Positions entered")
                .tag("strategy", strategyKey)
                .register(meterRegistry);

        this.emergencyHedgesCounter = Counter.builder("hedgebot.hedges.emergency")
                .description("Emergency hedges placed for exposed positions")
                .tag("strategy", strategyKey)
                .register(meterRegistry);

        this.tickFailuresCounter = Counter.builder("hedgebot.ticks.failed")
                .description("Trade ticks abandoned after an error")
                .tag("strategy", strategyKey)
                .register(meterRegistry);
    }

    public void tradeEntered() {
        tradesEnteredCounter.increment();
    }

    public void tradeSkipped(SkipReason reason) {
        Counter.builder("hedgebot.trades.skipped")
                .description("Trades skipped by a policy guard")
                .tag("strategy", strategyKey)
                .tag("reason", reason.name())
                .register(meterRegistry)
                .increment();
    }

    public void tradeSettled(ExitReason reason, PnlBasis basis) {
        Counter.builder("hedgebot.trades.settled")
                .description("Trades settled")
                .tag("strategy", strategyKey)
                .tag("reason", reason.name())
                .tag("basis", basis.name())
                .register(meterRegistry)
                .increment();
    }

    public void emergencyHedge() {
        emergencyHedgesCounter.increment();
    }

    public void tickFailed() {
        tickFailuresCounter.increment();
    }

    public void registerActivity(Supplier<Number> activeTrades, Supplier<Number> pollingActive) {
        Gauge.builder("hedgebot.trades.active", activeTrades)
                .description("Trades ticked by the last poll cycle")
                .tag("strategy", strategyKey)
                .register(meterRegistry);

        Gauge.builder("hedgebot.polling.active", pollingActive)
                .description("1 while the in-play polling loop runs")
                .tag("strategy", strategyKey)
                .register(meterRegistry);
    }
}
