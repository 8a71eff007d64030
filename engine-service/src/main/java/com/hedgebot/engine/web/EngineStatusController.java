package com.hedgebot.engine.web;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.scheduler.EngineScheduler;
import com.hedgebot.engine.scheduler.FixtureTradeSeeder;
import com.hedgebot.engine.store.TradeStore;
import com.hedgebot.engine.trade.Trade;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/engine")
@Validated
@RequiredArgsConstructor
public class EngineStatusController {

    private final @NonNull HedgeBotProperties properties;
    private final @NonNull StrategySettings settings;
    private final @NonNull TradeStore tradeStore;
    private final @NonNull FixtureTradeSeeder seeder;
    private final @NonNull ObjectProvider<EngineScheduler> scheduler;

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        EngineScheduler engine = scheduler.getIfAvailable();
        if (engine == null) {
            return ResponseEntity.ok(new StatusResponse(properties.mode(), settings.key(), false, null, null));
        }
        return ResponseEntity.ok(new StatusResponse(properties.mode(), settings.key(), true, engine.status(),
                engine.nextWake().getSeconds()));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<TradeSummary>> trades(
            @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(500) int limit
    ) {
        List<TradeSummary> out = tradeStore.findRecent(settings.key(), limit).stream()
                .map(TradeSummary::of)
                .toList();
        return ResponseEntity.ok(out);
    }

    @PostMapping("/seed")
    public ResponseEntity<SeedResponse> seed() {
        return ResponseEntity.ok(new SeedResponse(seeder.seed()));
    }

    public record StatusResponse(
            HedgeBotProperties.TradingMode mode,
            String strategyKey,
            boolean schedulerEnabled,
            EngineScheduler.SchedulerStatus scheduler,
            Long nextWakeSeconds
    ) {}

    public record TradeSummary(
            String id,
            String eventName,
            Instant kickoffAt,
            String status,
            String phase,
            Double backPrice,
            Double backMatchedSize,
            Double layPrice,
            Double layMatchedSize,
            BigDecimal realisedPnl,
            String pnlBasis,
            String lastError
    ) {
        static TradeSummary of(Trade trade) {
            return new TradeSummary(trade.id(), trade.label(), trade.kickoffAt(), trade.status().name(),
                    trade.phase().name(), trade.backPrice(), trade.backMatchedSize(), trade.layPrice(),
                    trade.layMatchedSize(), trade.realisedPnl(),
                    trade.pnlBasis() == null ? null : trade.pnlBasis().name(), trade.lastError());
        }
    }

    public record SeedResponse(int created) {}
}
