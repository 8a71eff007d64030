package com.hedgebot.engine.trade;

import com.hedgebot.core.settlement.PnlBasis;
import com.hedgebot.engine.shadow.ShadowObservation;
import lombok.With;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One market position lifecycle, unique per (strategy, venue event).
 */
@With
public record Trade(
        String id,
        String strategyKey,
        String eventId,
        String eventName,
        String competition,
        TradeStatus status,
        PhaseState phaseState,
        Instant kickoffAt,
        String marketId,
        Long selectionId,
        Double backPrice,
        Double backStake,
        Double backMatchedSize,
        Double layPrice,
        Double laySize,
        Double layMatchedSize,
        Double targetStake,
        BigDecimal realisedPnl,
        PnlBasis pnlBasis,
        String lastError,
        Instant settledAt,
        Long exposureSeconds,
        Instant createdAt,
        Instant updatedAt
) {
    public static Trade scheduled(String strategyKey, Fixture fixture, Double targetStake, Instant now) {
        return new Trade(
                UUID.randomUUID().toString(),
                strategyKey,
                fixture.eventId(),
                fixture.eventName(),
                fixture.competition(),
                TradeStatus.SCHEDULED,
                new PhaseState.Scheduled(),
                fixture.kickoffAt(),
                fixture.marketId(),
                fixture.selectionId(),
                null, null, null, null, null, null,
                targetStake,
                null, null, null, null, null,
                now,
                now
        );
    }

    public PhaseState.Phase phase() {
        return phaseState == null ? PhaseState.Phase.SCHEDULED : phaseState.phase();
    }

    public double minutesFromKickoff(Instant now) {
        return Duration.between(kickoffAt, now).toMillis() / 60_000.0;
    }

    public boolean hasMarket() {
        return marketId != null && !marketId.isBlank() && selectionId != null;
    }

    public Optional<ShadowObservation> shadow() {
        if (phaseState instanceof PhaseState.Skipped skipped) {
            return Optional.ofNullable(skipped.shadow());
        }
        if (phaseState instanceof PhaseState.PostTradeMonitor monitor) {
            return Optional.ofNullable(monitor.shadow());
        }
        if (phaseState instanceof PhaseState.Completed completed) {
            return Optional.ofNullable(completed.shadow());
        }
        return Optional.empty();
    }

    public boolean shadowActive() {
        return shadow().map(ShadowObservation::active).orElse(false);
    }

    /**
     * Name used in log lines.
     */
    public String label() {
        return eventName != null ? eventName : eventId;
    }
}
