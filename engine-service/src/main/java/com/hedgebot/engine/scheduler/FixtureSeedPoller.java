package com.hedgebot.engine.scheduler;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

@RequiredArgsConstructor
@Slf4j
public class FixtureSeedPoller {

    private final @NonNull FixtureTradeSeeder seeder;

    @Scheduled(initialDelay = 0, fixedDelayString = "#{${hedgebot.scheduler.fixture-seed-seconds:300} * 1000}")
    public void tick() {
        try {
            seeder.seed();
        } catch (Exception e) {
            log.warn("fixture seeding failed: {}", e.toString());
        }
    }
}
