package com.hedgebot.engine.trade;

import java.time.Instant;

public record HedgeOrder(
        String betId,
        HedgePurpose purpose,
        double price,
        double size,
        String customerRef,
        Instant placedAt
) {}
