package com.polybot.oms.engine.limit;

import com.polybot.oms.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TokenBucketLimiterTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private MutableClock clock;
    private TokenBucketLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        limiter = new TokenBucketLimiter(3, 6, clock);
    }

    @Test
    void shouldAllowBurstUpToCapacity() {
        // When
        boolean first = limiter.allow("m1");
        boolean second = limiter.allow("m1");
        boolean third = limiter.allow("m1");
        boolean fourth = limiter.allow("m1");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isTrue();
        assertThat(fourth).isFalse();
    }

    @Test
    void shouldRefillContinuously() {
        // Given: bucket drained
        for (int i = 0; i < 3; i++) {
            limiter.allow("m1");
        }
        assertThat(limiter.allow("m1")).isFalse();

        // When: 6/min refill means one token every 10s
        clock.advance(Duration.ofSeconds(10));

        // Then
        assertThat(limiter.allow("m1")).isTrue();
        assertThat(limiter.allow("m1")).isFalse();
    }

    @Test
    void shouldNeverExceedCapacityAfterLongIdle() {
        // Given
        limiter.allow("m1");

        // When
        clock.advance(Duration.ofHours(1));

        // Then
        assertThat(limiter.tokens("m1")).isEqualTo(2.0);
        assertThat(limiter.allow("m1")).isTrue();
        assertThat(limiter.tokens("m1")).isEqualTo(2.0);
    }

    @Test
    void shouldBoundSuccessesByCapacityPlusRefillPerMinute() {
        // Given: one attempt every second over a rolling minute
        int allowed = 0;

        // When
        for (int i = 0; i < 60; i++) {
            if (limiter.allow("m1")) {
                allowed++;
            }
            clock.advance(Duration.ofSeconds(1));
        }

        // Then
        assertThat(allowed).isLessThanOrEqualTo(3 + 6);
        assertThat(allowed).isGreaterThanOrEqualTo(7);
    }

    @Test
    void shouldKeepMarketsIndependent() {
        // Given
        for (int i = 0; i < 3; i++) {
            limiter.allow("m1");
        }

        // When / Then
        assertThat(limiter.allow("m1")).isFalse();
        assertThat(limiter.allow("m2")).isTrue();
    }

    @Test
    void shouldNotLimitBlankKeys() {
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.allow("")).isTrue();
        }
    }

    @Test
    void shouldDenyCostAboveAvailableTokensWithoutDebiting() {
        // When
        boolean denied = limiter.allow("m1", 4);

        // Then
        assertThat(denied).isFalse();
        assertThat(limiter.tokens("m1")).isEqualTo(3.0);
    }
}
