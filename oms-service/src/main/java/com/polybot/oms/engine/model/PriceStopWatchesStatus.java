package com.polybot.oms.engine.model;

import java.time.Instant;
import java.util.List;

public record PriceStopWatchesStatus(
        boolean enabled,
        int activeWatches,
        List<PriceStopWatchInfo> watchDetails,
        int softLossCents,
        int hardLossCents,
        int takeProfitCents,
        int confirmTicks,
        Instant lastEvaluatedAt
) {

    public static PriceStopWatchesStatus disabled() {
        return new PriceStopWatchesStatus(false, 0, List.of(), 0, 0, 0, 0, null);
    }
}
