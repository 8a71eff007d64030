package com.hedgebot.core.venue;

public record ClearedOrder(
    String betId,
    Side side,
    double sizeSettled,
    Double priceMatched
) {}
