package com.hedgebot.engine.execution;

public enum VerificationOutcome {
    FILLED,
    PARTIAL,
    NONE,
    REJECTED,
    /**
     * A remainder may still be resting on the venue; the caller must resolve the placed orders before acting.
     */
    CANCEL_UNCONFIRMED,
    /**
     * An order went missing from both the current and the cleared views. Its fill is unknown and the reported
     * match is only a lower bound.
     */
    UNVERIFIED;

    /**
     * True when the reported match may not be the whole story.
     */
    public boolean unresolved() {
        return this == CANCEL_UNCONFIRMED || this == UNVERIFIED;
    }
}
