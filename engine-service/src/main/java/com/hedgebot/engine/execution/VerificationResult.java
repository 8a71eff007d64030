package com.hedgebot.engine.execution;

import com.hedgebot.core.settlement.Fill;

import java.util.List;

/**
 * Matched size and size-weighted price across every order of one verified placement.
 */
public record VerificationResult(
        double matchedSize,
        Double matchedPrice,
        double remainingSize,
        VerificationOutcome outcome,
        List<String> betIds,
        String errorCode
) {
    public VerificationResult {
        betIds = betIds == null ? List.of() : List.copyOf(betIds);
    }

    public static VerificationResult rejected(String errorCode, double requestedSize) {
        return new VerificationResult(0.0, null, requestedSize, VerificationOutcome.REJECTED, List.of(), errorCode);
    }

    public boolean hasMatch() {
        return matchedSize > 0 && matchedPrice != null;
    }

    public Fill fill() {
        return hasMatch() ? new Fill(matchedSize, matchedPrice) : Fill.NONE;
    }
}
