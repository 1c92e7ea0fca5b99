package com.polybot.oms.engine.model;

import java.time.Duration;

/**
 * Result of a market cooldown query.
 */
public record CooldownStatus(boolean active, Duration remaining, String reason) {

    public static final CooldownStatus NONE = new CooldownStatus(false, Duration.ZERO, "");
}
