package com.hedgebot.engine.trade;

public enum HedgePurpose {
    PROFIT_TARGET("hedge"),
    REHEDGE("rehedge"),
    EMERGENCY("emergency"),
    RECOVERY("recovery");

    private final String refTag;

    HedgePurpose(String refTag) {
        this.refTag = refTag;
    }

    public String refTag() {
        return refTag;
    }
}
