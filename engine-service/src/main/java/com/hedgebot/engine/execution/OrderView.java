package com.hedgebot.engine.execution;

import com.hedgebot.core.settlement.Fill;

/**
 * True state of one order, read from the current-orders view with the cleared-orders view as fallback.
 */
public record OrderView(
        String betId,
        State state,
        double sizeMatched,
        double sizeRemaining,
        Double averagePrice
) {
    public enum State {
        OPEN,
        FULLY_MATCHED,
        CLOSED_WITH_PARTIAL,
        CLOSED_UNMATCHED,
        /**
         * In neither view. Says nothing about exposure on its own.
         */
        NOT_FOUND
    }

    public static OrderView notFound(String betId) {
        return new OrderView(betId, State.NOT_FOUND, 0.0, 0.0, null);
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isNotFound() {
        return state == State.NOT_FOUND;
    }

    /**
     * Closed on the venue side: nothing of the order can match any more.
     */
    public boolean isClosed() {
        return state == State.FULLY_MATCHED || state == State.CLOSED_WITH_PARTIAL || state == State.CLOSED_UNMATCHED;
    }

    public Fill fill() {
        if (sizeMatched <= 0 || averagePrice == null) {
            return Fill.NONE;
        }
        return new Fill(sizeMatched, averagePrice);
    }
}
