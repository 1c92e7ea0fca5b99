package com.polybot.oms.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class OmsPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "oms.strategy-id=winbet",
        "oms.execution.mode=PARALLEL",
        "oms.hedge.offset-cents=3",
        "oms.hedge.allow-negative-profit-on-reorder=true",
        "oms.hedge.fak-timeout-seconds=45",
        "oms.entry-budget.max-reorders=5",
        "oms.price-stop.enabled=true",
        "oms.price-stop.hard-loss-cents=-12",
        "oms.settlement.merge-trigger-delay-seconds=20"
    ).run(context -> {
      OmsProperties properties = context.getBean(OmsProperties.class);

      assertThat(properties.strategyId()).isEqualTo("winbet");
      assertThat(properties.execution().mode()).isEqualTo(OmsProperties.ExecutionMode.PARALLEL);
      assertThat(properties.hedge().offsetCents()).isEqualTo(3);
      assertThat(properties.hedge().allowNegativeProfitOnReorder()).isTrue();
      assertThat(properties.hedge().fakTimeoutSeconds()).isEqualTo(45);
      assertThat(properties.entryBudget().maxReorders()).isEqualTo(5);
      assertThat(properties.entryBudget().maxCancels()).isEqualTo(6);
      assertThat(properties.priceStop().enabled()).isTrue();
      assertThat(properties.priceStop().hardLossCents()).isEqualTo(-12);
      assertThat(properties.priceStop().softLossCents()).isEqualTo(-5);
      assertThat(properties.settlement().mergeTriggerDelaySeconds()).isEqualTo(20);
    });
  }

  @Test
  void missingSectionsResolveToDefaults() {
    runner.run(context -> {
      OmsProperties properties = context.getBean(OmsProperties.class);

      assertThat(properties.strategyId()).isEqualTo("strategy");
      assertThat(properties.execution().mode()).isEqualTo(OmsProperties.ExecutionMode.SEQUENTIAL);
      assertThat(properties.execution().sequentialMaxWaitMillis()).isEqualTo(2_000L);
      assertThat(properties.hedge().reorderTimeoutSeconds()).isEqualTo(15);
      assertThat(properties.hedge().minOrderUsdc()).isEqualByComparingTo(new BigDecimal("1.01"));
      assertThat(properties.gate().capacity()).isEqualTo(256);
      assertThat(properties.gate().minIntervalMillis()).isEqualTo(25L);
      assertThat(properties.limits().reorderCapacity()).isEqualTo(30.0);
      assertThat(properties.limits().fakRefillPerMinute()).isEqualTo(10.0);
      assertThat(properties.entryBudget().maxAgeSeconds()).isEqualTo(120);
      assertThat(properties.priceStop().enabled()).isFalse();
      assertThat(properties.priceStop().confirmTicks()).isEqualTo(2);
      assertThat(properties.settlement().mergeTriggerDelaySeconds()).isEqualTo(15);
      assertThat(properties.paper().enabled()).isTrue();
    });
  }

  @Test
  void nonPositiveMergeDelayFallsBackToDefault() {
    OmsProperties.Settlement settlement = new OmsProperties.Settlement(0, null);

    assertThat(settlement.mergeTriggerDelaySeconds()).isEqualTo(15);
    assertThat(settlement.reconcileSettleMillis()).isEqualTo(500L);
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(OmsProperties.class)
  static class TestConfig {
  }
}
