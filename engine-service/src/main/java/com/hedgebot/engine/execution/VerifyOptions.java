package com.hedgebot.engine.execution;

import com.hedgebot.core.venue.RunnerBook;

import java.util.function.Function;

/**
 * Timing and retry policy of one {@link OrderVerificationController#placeAndVerify} call.
 *
 * @param repricer price for a re-placement of the unmatched remainder, or null to leave it; null disables retries
 */
public record VerifyOptions(
        long maxWaitMillis,
        long pollMillis,
        int maxRetries,
        long retryWaitMillis,
        Function<RunnerBook, Double> repricer
) {
    public static VerifyOptions once(long maxWaitMillis, long pollMillis) {
        return new VerifyOptions(maxWaitMillis, pollMillis, 0, 0L, null);
    }
}
