package com.hedgebot.engine.trade;

import java.time.Instant;

/**
 * An order the engine placed and still has to account for.
 */
public record PlacedOrder(
        String betId,
        double price,
        double size,
        String customerRef,
        Instant placedAt
) {}
