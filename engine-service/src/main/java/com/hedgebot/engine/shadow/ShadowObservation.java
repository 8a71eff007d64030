package com.hedgebot.engine.shadow;

import lombok.With;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * What-if tracking of a trade's best post-entry price.
 *
 * {@code entryPrice} is the real entry for settled trades and the theoretical one for skipped trades; it stays
 * null until a theoretical trigger is seen. Once {@code frozen}, the minimum no longer moves.
 */
@With
public record ShadowObservation(
        String reason,
        Instant startedAt,
        Double referencePrice,
        Double entryPrice,
        Instant entryAt,
        Double minPrice,
        Instant minPriceAt,
        Map<Integer, Long> secondsToMilestone,
        boolean frozen,
        Instant frozenAt,
        boolean closed,
        String closeReason,
        Instant closedAt
) {
    public static final int[] MILESTONES_PCT = {10, 15, 20, 25, 30};

    public ShadowObservation {
        secondsToMilestone = secondsToMilestone == null ? Map.of() : Map.copyOf(new TreeMap<>(secondsToMilestone));
    }

    /**
     * Observation of a trade skipped before any trigger: tracking starts at the first theoretical trigger.
     */
    public static ShadowObservation awaitingTrigger(String reason, Instant startedAt, Double referencePrice) {
        return new ShadowObservation(reason, startedAt, referencePrice, null, null, null, null, Map.of(),
                false, null, false, null, null);
    }

    /**
     * Observation that starts tracking right away from a real or theoretical entry.
     */
    public static ShadowObservation fromEntry(String reason, Instant startedAt, Double referencePrice,
                                              double entryPrice, Instant entryAt) {
        return new ShadowObservation(reason, startedAt, referencePrice, entryPrice, entryAt, entryPrice, entryAt,
                Map.of(), false, null, false, null, null);
    }

    public boolean active() {
        return !closed;
    }

    public Double maxPotentialProfitPct() {
        if (entryPrice == null || minPrice == null || minPrice <= 0) {
            return null;
        }
        return profitPct(entryPrice, minPrice);
    }

    /**
     * Profit of backing at {@code entryPrice} and laying at {@code price}, in percent to two decimals.
     */
    public static double profitPct(double entryPrice, double price) {
        return BigDecimal.valueOf(entryPrice / price - 1.0)
                .multiply(BigDecimal.valueOf(100))
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public Long secondsToMaxProfit() {
        if (entryAt == null || minPriceAt == null) {
            return null;
        }
        return Duration.between(entryAt, minPriceAt).getSeconds();
    }

    public Long secondsTo(int milestonePct) {
        return secondsToMilestone.get(milestonePct);
    }
}
