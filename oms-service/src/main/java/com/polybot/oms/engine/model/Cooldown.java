package com.polybot.oms.engine.model;

import java.time.Instant;

public record Cooldown(Instant until, String reason) {}
