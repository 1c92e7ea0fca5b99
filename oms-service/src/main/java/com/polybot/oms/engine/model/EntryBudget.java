package com.polybot.oms.engine.model;

import lombok.Data;

import java.time.Instant;

/**
 * Guarded-action counters of one filled entry.
 */
@Data
public class EntryBudget {
    private final String marketSlug;
    private final Instant startedAt;
    private int reorders;
    private int cancels;
    private int faks;
}
