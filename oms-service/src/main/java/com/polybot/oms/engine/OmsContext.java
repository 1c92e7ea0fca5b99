package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.engine.limit.TokenBucketLimiter;
import com.polybot.oms.engine.metrics.HedgeTimingTracker;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators shared by the coordinator and the components it starts. Built once by
 * {@link OrderManagementSystem} and handed to every monitor and evaluator it creates.
 */
public record OmsContext(
        OmsProperties properties,
        Clock clock,
        OmsState state,
        GatedTrading trading,
        EntryGuard entryGuard,
        RiskRegistry riskRegistry,
        TokenBucketLimiter reorderLimiter,
        TokenBucketLimiter fakLimiter,
        HedgeTimingTracker timing,
        OmsMeters meters,
        ReorderActivity activity,
        MergeScheduler merges,
        ScheduledExecutorService scheduler
) {

    /**
     * Sleeps for the given settle pause.
     *
     * @return false when the thread was interrupted, with its interrupt flag restored
     */
    static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
