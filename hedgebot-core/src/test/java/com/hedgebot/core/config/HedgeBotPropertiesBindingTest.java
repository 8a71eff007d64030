package com.hedgebot.core.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class HedgeBotPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "hedgebot.mode=LIVE",
        "hedgebot.strategy.key=late_goal",
        "hedgebot.strategy.trigger-pct=25",
        "hedgebot.strategy.trigger-cutoff-minutes=60",
        "hedgebot.strategy.commission-rate=0.02",
        "hedgebot.scheduler.active-poll-seconds=10",
        "hedgebot.scheduler.max-concurrent-trades=8",
        "hedgebot.verification.not-found-threshold=5",
        "hedgebot.paper.hide-completed-orders=true"
    ).run(context -> {
      HedgeBotProperties properties = context.getBean(HedgeBotProperties.class);

      assertThat(properties.mode()).isEqualTo(HedgeBotProperties.TradingMode.LIVE);
      assertThat(properties.strategy().key()).isEqualTo("late_goal");
      assertThat(properties.strategy().triggerPct()).isEqualTo(25.0);
      assertThat(properties.strategy().triggerCutoffMinutes()).isEqualTo(60);
      assertThat(properties.strategy().commissionRate()).isEqualTo(0.02);
      assertThat(properties.scheduler().activePollSeconds()).isEqualTo(10);
      assertThat(properties.scheduler().maxConcurrentTrades()).isEqualTo(8);
      assertThat(properties.verification().notFoundThreshold()).isEqualTo(5);
      assertThat(properties.paper().hideCompletedOrders()).isTrue();
    });
  }

  @Test
  void fillsDefaultsWhenNothingIsSet() {
    runner.run(context -> {
      HedgeBotProperties properties = context.getBean(HedgeBotProperties.class);

      assertThat(properties.mode()).isEqualTo(HedgeBotProperties.TradingMode.PAPER);
      assertThat(properties.strategy().key()).isEqualTo("goal_react");
      assertThat(properties.strategy().triggerCutoffMinutes()).isEqualTo(45);
      assertThat(properties.strategy().profitTargetPct()).isEqualTo(12.0);
      assertThat(properties.scheduler().enabled()).isTrue();
      assertThat(properties.verification().entryWaitMillis()).isEqualTo(30_000L);
      assertThat(properties.paper().fillOnCross()).isTrue();
    });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(HedgeBotProperties.class)
  static class TestConfig {
  }
}
