package com.hedgebot.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "hedgebot")
public record HedgeBotProperties(
    TradingMode mode,
    @Valid Strategy strategy,
    @Valid Scheduler scheduler,
    @Valid Verification verification,
    @Valid Paper paper
) {

  public HedgeBotProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (strategy == null) {
      strategy = defaultStrategy();
    }
    if (scheduler == null) {
      scheduler = defaultScheduler();
    }
    if (verification == null) {
      verification = defaultVerification();
    }
    if (paper == null) {
      paper = defaultPaper();
    }
  }

  private static Strategy defaultStrategy() {
    return new Strategy(null, null, null, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null, null, null);
  }

  private static Scheduler defaultScheduler() {
    return new Scheduler(null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Verification defaultVerification() {
    return new Verification(null, null, null, null, null, null, null, null);
  }

  private static Paper defaultPaper() {
    return new Paper(null, null);
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  /**
   * Trading policy defaults. Rows in the {@code strategy_settings} table override these once at startup.
   */
  public record Strategy(
      @NotBlank String key,
      @NotNull @Positive Double defaultStake,
      /**
       * Relative move from baseline (percent) that counts as a trigger (e.g. a goal).
       */
      @NotNull @Positive Double triggerPct,
      /**
       * Triggers detected later than this many minutes after kickoff are skipped.
       */
      @NotNull @Min(1) Integer triggerCutoffMinutes,
      @NotNull @PositiveOrZero Integer triggerSettleSeconds,
      @NotNull @DecimalMin("1.01") Double minEntryPrice,
      @NotNull @DecimalMax("1000") Double maxEntryPrice,
      @NotNull @Positive Double baselineStabilityPct,
      @NotNull @Min(2) Integer baselineStableReadings,
      @NotNull @Positive Double profitTargetPct,
      @NotNull @Positive @DecimalMax("99") Double stopLossPct,
      /**
       * Wait after a second trigger before deciding between re-hedge and recovery.
       */
      @NotNull @PositiveOrZero Integer confirmWaitSeconds,
      @NotNull @PositiveOrZero @DecimalMax("0.5") Double commissionRate,
      @NotNull @PositiveOrZero Double minMarketLiquidity,
      @NotNull @PositiveOrZero Integer belowMinRecheckSeconds,
      @NotNull @PositiveOrZero Integer recoveryMaxRetries,
      @NotNull @Min(1) Integer postTradeMonitorMinutes,
      @NotNull @Min(1) Integer fixtureLookaheadDays,
      /**
       * Trades still open this many minutes after kickoff are closed out.
       */
      @NotNull @Min(1) Integer gameEndMinutes
  ) {
    public Strategy {
      if (key == null || key.isBlank()) {
        key = "goal_react";
      }
      if (defaultStake == null) {
        defaultStake = 200.0;
      }
      if (triggerPct == null) {
        triggerPct = 30.0;
      }
      if (triggerCutoffMinutes == null) {
        triggerCutoffMinutes = 45;
      }
      if (triggerSettleSeconds == null) {
        triggerSettleSeconds = 90;
      }
      if (minEntryPrice == null) {
        minEntryPrice = 2.0;
      }
      if (maxEntryPrice == null) {
        maxEntryPrice = 5.5;
      }
      if (baselineStabilityPct == null) {
        baselineStabilityPct = 5.0;
      }
      if (baselineStableReadings == null) {
        baselineStableReadings = 4;
      }
      if (profitTargetPct == null) {
        profitTargetPct = 12.0;
      }
      if (stopLossPct == null) {
        stopLossPct = 20.0;
      }
      if (confirmWaitSeconds == null) {
        confirmWaitSeconds = 90;
      }
      if (commissionRate == null) {
        commissionRate = 0.0175;
      }
      if (minMarketLiquidity == null) {
        minMarketLiquidity = 1000.0;
      }
      if (belowMinRecheckSeconds == null) {
        belowMinRecheckSeconds = 30;
      }
      if (recoveryMaxRetries == null) {
        recoveryMaxRetries = 3;
      }
      if (postTradeMonitorMinutes == null) {
        postTradeMonitorMinutes = 100;
      }
      if (fixtureLookaheadDays == null) {
        fixtureLookaheadDays = 7;
      }
      if (gameEndMinutes == null) {
        gameEndMinutes = 120;
      }
    }
  }

  public record Scheduler(
      Boolean enabled,
      /**
       * Interval of the in-play polling loop while trades need attention.
       */
      @NotNull @Min(5) @Max(30) Integer activePollSeconds,
      @NotNull @Min(1) Integer activeRecheckSeconds,
      @NotNull @Min(1) Integer busyRecheckSeconds,
      @NotNull @Min(1) Integer errorRetrySeconds,
      /**
       * A scheduled trade whose kickoff lies within this trailing window wakes the engine immediately.
       */
      @NotNull @Min(1) Integer kickoffWindowMinutes,
      @NotNull @PositiveOrZero Integer kickoffLeadSeconds,
      /**
       * Keep polling while a kickoff is this close, even with nothing active.
       */
      @NotNull @PositiveOrZero Integer upcomingKickoffMinutes,
      @NotNull @Min(1) Integer maxConcurrentTrades,
      @NotNull @Min(10) Integer fixtureSeedSeconds,
      @NotNull @Min(1) Integer shutdownGraceSeconds
  ) {
    public Scheduler {
      if (enabled == null) {
        enabled = true;
      }
      if (activePollSeconds == null) {
        activePollSeconds = 15;
      }
      if (activeRecheckSeconds == null) {
        activeRecheckSeconds = 5;
      }
      if (busyRecheckSeconds == null) {
        busyRecheckSeconds = 10;
      }
      if (errorRetrySeconds == null) {
        errorRetrySeconds = 60;
      }
      if (kickoffWindowMinutes == null) {
        kickoffWindowMinutes = 90;
      }
      if (kickoffLeadSeconds == null) {
        kickoffLeadSeconds = 0;
      }
      if (upcomingKickoffMinutes == null) {
        upcomingKickoffMinutes = 10;
      }
      if (maxConcurrentTrades == null) {
        maxConcurrentTrades = 4;
      }
      if (fixtureSeedSeconds == null) {
        fixtureSeedSeconds = 300;
      }
      if (shutdownGraceSeconds == null) {
        shutdownGraceSeconds = 30;
      }
    }
  }

  /**
   * Timings of the order verification loops.
   */
  public record Verification(
      @NotNull @Min(1) Long entryWaitMillis,
      @NotNull @Min(1) Long retryWaitMillis,
      @NotNull @Min(10) Long pollMillis,
      @NotNull @Min(1) Long cancelConfirmMillis,
      @NotNull @Min(10) Long cancelPollMillis,
      @NotNull @Min(1) Integer maxCancelAttempts,
      @NotNull @Min(1) Integer notFoundThreshold,
      @NotNull @PositiveOrZero Integer entryMaxRetries
  ) {
    public Verification {
      if (entryWaitMillis == null) {
        entryWaitMillis = 30_000L;
      }
      if (retryWaitMillis == null) {
        retryWaitMillis = 60_000L;
      }
      if (pollMillis == null) {
        pollMillis = 500L;
      }
      if (cancelConfirmMillis == null) {
        cancelConfirmMillis = 10_000L;
      }
      if (cancelPollMillis == null) {
        cancelPollMillis = 500L;
      }
      if (maxCancelAttempts == null) {
        maxCancelAttempts = 5;
      }
      if (notFoundThreshold == null) {
        notFoundThreshold = 3;
      }
      if (entryMaxRetries == null) {
        entryMaxRetries = 1;
      }
    }
  }

  /**
   * In-memory paper venue used when {@code mode=PAPER}.
   */
  public record Paper(
      /**
       * Resting orders fill against pushed book snapshots when the opposite side crosses their price.
       */
      Boolean fillOnCross,
      /**
       * Fully matched orders drop out of the current-orders view and are only visible as cleared.
       */
      Boolean hideCompletedOrders
  ) {
    public Paper {
      if (fillOnCross == null) {
        fillOnCross = true;
      }
      if (hideCompletedOrders == null) {
        hideCompletedOrders = false;
      }
    }
  }
}
