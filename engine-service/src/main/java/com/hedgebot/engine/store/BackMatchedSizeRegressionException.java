package com.hedgebot.engine.store;

public class BackMatchedSizeRegressionException extends IllegalStateException {

    public BackMatchedSizeRegressionException(String tradeId, Double attempted) {
        super("back_matched_size of trade " + tradeId + " may not decrease (attempted " + attempted + ")");
    }
}
