package com.polybot.oms.engine.model;

import com.polybot.oms.config.OmsProperties;

import java.time.Duration;

/**
 * Normalised price-stop thresholds.
 *
 * @param interval minimum spacing between evaluations of one watch, {@link Duration#ZERO} for none
 */
public record PriceStopParams(
        boolean enabled,
        int softLossCents,
        int hardLossCents,
        int takeProfitCents,
        Duration interval,
        int confirmTicks,
        int takeProfitConfirmTicks
) {

    private static final Duration MIN_INTERVAL = Duration.ofMillis(20);
    private static final Duration MAX_INTERVAL = Duration.ofSeconds(2);

    public static PriceStopParams disabled() {
        return new PriceStopParams(false, -5, -10, 0, Duration.ZERO, 2, 2);
    }

    public static PriceStopParams from(OmsProperties.PriceStop cfg) {
        if (cfg == null || !Boolean.TRUE.equals(cfg.enabled())) {
            return disabled();
        }
        int soft = nonZeroOr(cfg.softLossCents(), -5);
        int hard = nonZeroOr(cfg.hardLossCents(), -10);
        if (soft < hard) {
            int swap = soft;
            soft = hard;
            hard = swap;
        }
        Duration interval = Duration.ZERO;
        if (cfg.checkIntervalMillis() != null && cfg.checkIntervalMillis() > 0) {
            interval = Duration.ofMillis(cfg.checkIntervalMillis());
            if (interval.compareTo(MIN_INTERVAL) < 0) {
                interval = MIN_INTERVAL;
            }
            if (interval.compareTo(MAX_INTERVAL) > 0) {
                interval = MAX_INTERVAL;
            }
        }
        return new PriceStopParams(
                true,
                soft,
                hard,
                cfg.takeProfitCents() == null ? 0 : cfg.takeProfitCents(),
                interval,
                clampTicks(cfg.confirmTicks()),
                clampTicks(cfg.takeProfitConfirmTicks())
        );
    }

    public boolean takeProfitEnabled() {
        return takeProfitCents > 0;
    }

    private static int nonZeroOr(Integer value, int fallback) {
        return value == null || value == 0 ? fallback : value;
    }

    private static int clampTicks(Integer value) {
        int n = value == null || value <= 0 ? 2 : value;
        return Math.max(1, Math.min(10, n));
    }
}
