package com.polybot.oms.engine.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceStopWatchInfo(
        String entryOrderId,
        String entryTokenType,
        int entryPriceCents,
        BigDecimal entrySize,
        String hedgeOrderId,
        int currentProfitCents,
        int softHits,
        int takeProfitHits,
        Instant lastEvaluatedAt,
        Status status
) {

    public enum Status {
        MONITORING,
        TRIGGERED,
        COMPLETED
    }
}
