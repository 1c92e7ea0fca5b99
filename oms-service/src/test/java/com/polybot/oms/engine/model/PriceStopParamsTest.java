package com.polybot.oms.engine.model;

import com.polybot.oms.config.OmsProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PriceStopParamsTest {

    @Test
    void shouldBeDisabledUnlessEnabledExplicitly() {
        PriceStopParams params = PriceStopParams.from(new OmsProperties.PriceStop(null, -3, -8, 4, null, 0L, 3, 0L));

        assertThat(params.enabled()).isFalse();
    }

    @Test
    void shouldSwapThresholdsWhenSoftIsBelowHard() {
        // When
        PriceStopParams params = PriceStopParams.from(new OmsProperties.PriceStop(true, -12, -4, 0, 2, 0L, 2, 0L));

        // Then
        assertThat(params.softLossCents()).isEqualTo(-4);
        assertThat(params.hardLossCents()).isEqualTo(-12);
        assertThat(params.takeProfitEnabled()).isFalse();
    }

    @Test
    void shouldFallBackToDefaultThresholdsForZero() {
        PriceStopParams params = PriceStopParams.from(new OmsProperties.PriceStop(true, 0, 0, 0, 2, 0L, 2, 0L));

        assertThat(params.softLossCents()).isEqualTo(-5);
        assertThat(params.hardLossCents()).isEqualTo(-10);
    }

    @Test
    void shouldClampIntervalAndConfirmTicks() {
        // When
        PriceStopParams fast = PriceStopParams.from(new OmsProperties.PriceStop(true, -5, -10, 3, 50, 5L, 0, 0L));
        PriceStopParams slow = PriceStopParams.from(new OmsProperties.PriceStop(true, -5, -10, 3, 1, 10_000L, 1, 0L));

        // Then
        assertThat(fast.interval()).isEqualTo(Duration.ofMillis(20));
        assertThat(fast.confirmTicks()).isEqualTo(2);
        assertThat(fast.takeProfitConfirmTicks()).isEqualTo(10);
        assertThat(slow.interval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(slow.confirmTicks()).isEqualTo(1);
        assertThat(slow.takeProfitEnabled()).isTrue();
    }

    @Test
    void shouldEvaluateEveryEventWithoutInterval() {
        PriceStopParams params = PriceStopParams.from(new OmsProperties.PriceStop(true, -5, -10, 0, 2, 0L, 2, 0L));

        assertThat(params.interval()).isEqualTo(Duration.ZERO);
    }
}
