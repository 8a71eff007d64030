package com.hedgebot.engine.execution;

/**
 * Result of {@link OrderVerificationController#cancelAndConfirm}. {@code lastView} is the last state read.
 *
 * An order that stayed missing from both venue views is never {@code closed}: absence does not prove the order
 * went unmatched, so it is reported as {@link #missing()} and its fill is unknown.
 */
public record CancelConfirmation(
        boolean closed,
        int attempts,
        long elapsedMillis,
        OrderView lastView,
        String reason
) {

    public static final String NOT_FOUND = "NOT_FOUND";

    public boolean missing() {
        return !closed && NOT_FOUND.equals(reason);
    }
}
