package com.polybot.oms.engine;

import com.polybot.oms.engine.model.CooldownStatus;
import com.polybot.oms.engine.model.EntryGuardLimits;
import com.polybot.oms.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EntryGuardTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final String MARKET = "btc-updown-15m-1";

    private MutableClock clock;
    private EntryGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        guard = new EntryGuard(new OmsState(), EntryGuardLimits.defaults(), clock);
    }

    @Test
    void shouldRefuseFourthReorderAndCoolDownMarket() {
        // Given
        guard.initEntryBudget("e1", MARKET, NOW);

        // When
        boolean first = guard.consumeReorderAttempt("e1", MARKET, NOW);
        boolean second = guard.consumeReorderAttempt("e1", MARKET, NOW);
        boolean third = guard.consumeReorderAttempt("e1", MARKET, NOW);
        boolean fourth = guard.consumeReorderAttempt("e1", MARKET, NOW);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isTrue();
        assertThat(fourth).isFalse();
        CooldownStatus status = guard.cooldownStatus(MARKET);
        assertThat(status.active()).isTrue();
        assertThat(status.reason()).contains("entry_reorder_exceeded 3");
        assertThat(status.remaining()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldRefuseReorderOfEntryOlderThanMaxAge() {
        // Given
        guard.initEntryBudget("e1", MARKET, NOW);
        clock.advance(Duration.ofSeconds(121));

        // When
        boolean allowed = guard.consumeReorderAttempt("e1", MARKET, NOW);

        // Then
        assertThat(allowed).isFalse();
        assertThat(guard.cooldownStatus(MARKET).reason()).isEqualTo("entry_age_exceeded 121s");
    }

    @Test
    void shouldOnlyExtendCooldownButAlwaysReplaceReason() {
        // Given
        guard.setCooldown(MARKET, Duration.ofSeconds(60), "first");

        // When
        guard.setCooldown(MARKET, Duration.ofSeconds(10), "second");

        // Then
        CooldownStatus status = guard.cooldownStatus(MARKET);
        assertThat(status.remaining()).isEqualTo(Duration.ofSeconds(60));
        assertThat(status.reason()).isEqualTo("second");
    }

    @Test
    void shouldExtendCooldownWhenNewUntilIsLater() {
        // Given
        guard.setCooldown(MARKET, Duration.ofSeconds(10), "first");

        // When
        guard.setCooldown(MARKET, Duration.ofSeconds(45), "second");

        // Then
        assertThat(guard.cooldownStatus(MARKET).remaining()).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void shouldUseDefaultDurationForNonPositiveCooldown() {
        // When
        guard.setCooldown(MARKET, Duration.ZERO, "manual");

        // Then
        assertThat(guard.cooldownStatus(MARKET).remaining()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldExpireCooldown() {
        // Given
        guard.setCooldown(MARKET, Duration.ofSeconds(30), "manual");

        // When
        clock.advance(Duration.ofSeconds(30));

        // Then
        assertThat(guard.isMarketInCooldown(MARKET)).isFalse();
        assertThat(guard.cooldownStatus(MARKET)).isEqualTo(CooldownStatus.NONE);
    }

    @Test
    void shouldCoolDownWhenCancelsOverrunButNeverRefuseThem() {
        // When
        for (int i = 0; i < 6; i++) {
            guard.recordCancel("e1", MARKET);
        }

        // Then
        assertThat(guard.isMarketInCooldown(MARKET)).isFalse();

        // When
        guard.recordCancel("e1", MARKET);

        // Then
        assertThat(guard.cooldownStatus(MARKET).reason()).isEqualTo("entry_cancel_exceeded 7");
    }

    @Test
    void shouldCoolDownOnSecondForcedFill() {
        // When
        guard.recordFak("e1", MARKET);
        boolean afterFirst = guard.isMarketInCooldown(MARKET);
        guard.recordFak("e1", MARKET);

        // Then
        assertThat(afterFirst).isFalse();
        assertThat(guard.cooldownStatus(MARKET).reason()).isEqualTo("entry_fak_exceeded 2");
    }

    @Test
    void shouldStartFreshBudgetAfterClear() {
        // Given
        for (int i = 0; i < 3; i++) {
            guard.consumeReorderAttempt("e1", MARKET, NOW);
        }

        // When
        guard.clearEntryBudget("e1");

        // Then
        assertThat(guard.consumeReorderAttempt("e1", MARKET, NOW)).isTrue();
    }

    @Test
    void shouldIgnoreBlankIdentifiers() {
        // When
        guard.recordFak("", MARKET);
        guard.recordFak("", MARKET);

        // Then
        assertThat(guard.consumeReorderAttempt("", MARKET, NOW)).isTrue();
        assertThat(guard.isMarketInCooldown(MARKET)).isFalse();
        assertThat(guard.cooldownStatus("")).isEqualTo(CooldownStatus.NONE);
    }
}
