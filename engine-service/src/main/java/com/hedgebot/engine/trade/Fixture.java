package com.hedgebot.engine.trade;

import java.time.Instant;

/**
 * A discovered fixture with its resolved market. Written by the discovery service, read here.
 */
public record Fixture(
        String eventId,
        String eventName,
        String competition,
        Instant kickoffAt,
        String marketId,
        Long selectionId
) {}
