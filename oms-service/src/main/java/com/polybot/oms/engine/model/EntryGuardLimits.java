package com.polybot.oms.engine.model;

import com.polybot.oms.config.OmsProperties;

import java.time.Duration;

public record EntryGuardLimits(
        int maxReorders,
        int maxCancels,
        int maxFak,
        Duration maxAge,
        Duration cooldown
) {

    public static EntryGuardLimits defaults() {
        return new EntryGuardLimits(3, 6, 1, Duration.ofSeconds(120), Duration.ofSeconds(30));
    }

    /**
     * Configured values override the defaults only when positive.
     */
    public static EntryGuardLimits from(OmsProperties.EntryBudget cfg) {
        EntryGuardLimits d = defaults();
        if (cfg == null) {
            return d;
        }
        return new EntryGuardLimits(
                positiveOr(cfg.maxReorders(), d.maxReorders()),
                positiveOr(cfg.maxCancels(), d.maxCancels()),
                positiveOr(cfg.maxFak(), d.maxFak()),
                cfg.maxAgeSeconds() != null && cfg.maxAgeSeconds() > 0 ? Duration.ofSeconds(cfg.maxAgeSeconds()) : d.maxAge(),
                cfg.cooldownSeconds() != null && cfg.cooldownSeconds() > 0 ? Duration.ofSeconds(cfg.cooldownSeconds()) : d.cooldown()
        );
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
