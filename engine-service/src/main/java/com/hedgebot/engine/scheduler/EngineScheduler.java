package com.hedgebot.engine.scheduler;

import com.hedgebot.core.config.HedgeBotProperties;
import com.hedgebot.engine.config.StrategySettings;
import com.hedgebot.engine.machine.TradeStateMachine;
import com.hedgebot.engine.metrics.EngineMetrics;
import com.hedgebot.engine.store.TradeStore;
import com.hedgebot.engine.trade.Trade;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides when the engine has work and runs the in-play polling loop while it does.
 *
 * A smart loop wakes at {@link #nextWake()}, starts active polling when work is due and stops it once nothing
 * needs sub-minute attention. Each poll cycle ticks every due trade on a bounded worker pool, one tick per trade at
 * a time.
 */
@Slf4j
public class EngineScheduler {

    static final Duration MIN_WAKE = Duration.ofMinutes(1);
    static final Duration MAX_WAKE = Duration.ofHours(24);

    private final TradeStore tradeStore;
    private final TradeStateMachine stateMachine;
    private final StrategySettings settings;
    private final HedgeBotProperties.Scheduler config;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final ExecutionGuard guard = new ExecutionGuard();
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicInteger activeTrades = new AtomicInteger();
    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "hedgebot-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService workers;

    private ScheduledFuture<?> pollingTask;
    private ScheduledFuture<?> wakeTask;
    private volatile boolean stopping;

    public EngineScheduler(@NonNull TradeStore tradeStore,
                           @NonNull TradeStateMachine stateMachine,
                           @NonNull StrategySettings settings,
                           @NonNull HedgeBotProperties.Scheduler config,
                           @NonNull EngineMetrics metrics,
                           @NonNull Clock clock) {
        this.tradeStore = tradeStore;
        this.stateMachine = stateMachine;
        this.settings = settings;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.maxConcurrentTrades(), r -> {
            Thread t = new Thread(r, "hedgebot-trade-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        metrics.registerActivity(activeTrades::get, () -> isPolling() ? 1 : 0);
    }

    @PostConstruct
    void start() {
        if (!Boolean.TRUE.equals(config.enabled())) {
            log.info("engine scheduler is disabled");
            return;
        }
        log.info("engine scheduler started (strategy={}, activePollSeconds={}, maxConcurrentTrades={})",
                settings.key(), config.activePollSeconds(), config.maxConcurrentTrades());
        scheduleWake(Duration.ZERO);
    }

    /**
     * Zero when work is due now, otherwise the time until the next kickoff (less the lead), clamped to
     * [1 min, 24 h]; 24 h when nothing is scheduled.
     */
    public Duration nextWake() {
        Instant now = clock.instant();
        if (tradeStore.anyActive(settings.key())) {
            return Duration.ZERO;
        }
        Instant windowStart = now.minus(Duration.ofMinutes(config.kickoffWindowMinutes()));
        if (tradeStore.anyScheduledKickedOffBetween(settings.key(), windowStart, now)) {
            return Duration.ZERO;
        }
        Optional<Instant> nextKickoff = tradeStore.nextScheduledKickoffAfter(settings.key(), now);
        if (nextKickoff.isEmpty()) {
            return MAX_WAKE;
        }
        Duration until = Duration.between(now, nextKickoff.get().minusSeconds(config.kickoffLeadSeconds()));
        if (until.compareTo(MIN_WAKE) < 0) {
            return MIN_WAKE;
        }
        return until.compareTo(MAX_WAKE) > 0 ? MAX_WAKE : until;
    }

    /**
     * @return false when polling was already running
     */
    public synchronized boolean startActivePolling() {
        if (pollingTask != null && !pollingTask.isDone()) {
            return false;
        }
        pollingTask = loop.scheduleAtFixedRate(this::pollCycle, 0, config.activePollSeconds(), TimeUnit.SECONDS);
        log.info("active polling started (intervalSeconds={})", config.activePollSeconds());
        return true;
    }

    /**
     * @return false when polling was already stopped
     */
    public synchronized boolean stopActivePolling() {
        if (pollingTask == null) {
            return false;
        }
        pollingTask.cancel(false);
        pollingTask = null;
        activeTrades.set(0);
        log.info("active polling stopped");
        return true;
    }

    public synchronized boolean isPolling() {
        return pollingTask != null && !pollingTask.isDone();
    }

    /**
     * Re-evaluates the wake time now, e.g. after new trades were scheduled.
     */
    public synchronized void reschedule() {
        if (stopping || !Boolean.TRUE.equals(config.enabled())) {
            return;
        }
        if (wakeTask != null) {
            wakeTask.cancel(false);
        }
        scheduleWake(Duration.ZERO);
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(settings.key(), isPolling(), cycleInFlight.get(), activeTrades.get(),
                guard.heldCount());
    }

    void smartLoop() {
        Duration delay;
        try {
            Duration wake = nextWake();
            if (wake.isZero()) {
                startActivePolling();
                delay = Duration.ofSeconds(cycleInFlight.get() ? config.busyRecheckSeconds() : config.activeRecheckSeconds());
            } else if (isPolling() && kickoffImminent()) {
                delay = Duration.ofSeconds(config.activeRecheckSeconds());
            } else {
                stopActivePolling();
                delay = wake;
                log.info("nothing in play, next wake in {}m", delay.toMinutes());
            }
        } catch (RuntimeException e) {
            log.error("scheduler evaluation failed, retrying in {}s", config.errorRetrySeconds(), e);
            delay = Duration.ofSeconds(config.errorRetrySeconds());
        }
        scheduleWake(delay);
    }

    /**
     * One pass over the trades that need a tick. Skipped while the previous pass is still running.
     */
    void pollCycle() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.debug("previous poll cycle still running, skipping");
            return;
        }
        try {
            Instant now = clock.instant();
            List<CompletableFuture<Void>> ticks = new ArrayList<>();
            for (Trade trade : tradeStore.findForProcessing(settings.key())) {
                if (trade.kickoffAt() != null && trade.kickoffAt().isAfter(now)) {
                    continue;
                }
                boolean gameEnded = trade.minutesFromKickoff(now) > settings.gameEndMinutes();
                String tradeId = trade.id();
                ticks.add(CompletableFuture.runAsync(() -> runGuarded(tradeId, gameEnded), workers));
            }
            activeTrades.set(ticks.size());
            CompletableFuture.allOf(ticks.toArray(CompletableFuture[]::new))
                    .whenComplete((ignored, error) -> cycleInFlight.set(false));
        } catch (RuntimeException e) {
            cycleInFlight.set(false);
            log.error("poll cycle failed, continuing scheduler loop", e);
        }
    }

    void runGuarded(String tradeId, boolean gameEnded) {
        boolean ran = guard.tryRun(tradeId, () -> tickTrade(tradeId, gameEnded));
        if (!ran) {
            log.debug("trade {} still being processed, skipping tick", tradeId);
        }
    }

    private void tickTrade(String tradeId, boolean gameEnded) {
        try {
            if (gameEnded) {
                stateMachine.endGame(tradeId);
            } else {
                stateMachine.tick(tradeId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("tick of trade {} interrupted", tradeId);
        } catch (RuntimeException e) {
            metrics.tickFailed();
            log.error("tick of trade {} failed, continuing scheduler loop", tradeId, e);
        }
    }

    private boolean kickoffImminent() {
        Instant now = clock.instant();
        return tradeStore.nextScheduledKickoffAfter(settings.key(), now)
                .map(kickoff -> !kickoff.isAfter(now.plus(Duration.ofMinutes(config.upcomingKickoffMinutes()))))
                .orElse(false);
    }

    private synchronized void scheduleWake(Duration delay) {
        if (stopping || loop.isShutdown()) {
            return;
        }
        wakeTask = loop.schedule(this::smartLoop, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        log.info("engine scheduler shutting down");
        synchronized (this) {
            stopping = true;
        }
        loop.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("trade ticks still running after {}s, interrupting", config.shutdownGraceSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    public record SchedulerStatus(
            String strategyKey,
            boolean polling,
            boolean cycleInFlight,
            int activeTrades,
            int ticksRunning
    ) {}
}
