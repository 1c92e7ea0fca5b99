package com.polybot.oms.engine.model;

/**
 * Point-in-time operational counters of the coordinator.
 */
public record OpsMetrics(
        int queueLength,
        int pendingHedges,
        int exposures,
        double hedgeEwmaSeconds,
        long reorderBudgetSkips,
        long fakBudgetWarnings,
        double cooldownRemainingSeconds,
        String cooldownReason
) {}
