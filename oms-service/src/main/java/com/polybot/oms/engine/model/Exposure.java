package com.polybot.oms.engine.model;

import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.TokenType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * A filled entry whose hedge is not yet confirmed filled.
 */
public record Exposure(
        String marketSlug,
        String entryOrderId,
        TokenType entryToken,
        BigDecimal entrySize,
        int entryPriceCents,
        Instant entryFilledTime,
        String hedgeOrderId,
        OrderStatus hedgeStatus,
        int maxLossCents
) {

    public double exposureSeconds(Instant now) {
        if (entryFilledTime == null) {
            return 0;
        }
        return Math.max(0, Duration.between(entryFilledTime, now).toMillis() / 1000.0);
    }

    public boolean hasHedge() {
        return hedgeOrderId != null && !hedgeOrderId.isBlank();
    }

    public Exposure withHedge(String hedgeId, OrderStatus status) {
        return new Exposure(marketSlug, entryOrderId, entryToken, entrySize, entryPriceCents, entryFilledTime,
                hedgeId, status, maxLossCents);
    }
}
