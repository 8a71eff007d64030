package com.hedgebot.engine.store;

import com.hedgebot.engine.trade.Fixture;

import java.time.Instant;
import java.util.List;

public interface FixtureStore {

    List<Fixture> findKickingOffBetween(Instant from, Instant to);
}
