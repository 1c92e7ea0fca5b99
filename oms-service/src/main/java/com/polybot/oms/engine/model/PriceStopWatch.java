package com.polybot.oms.engine.model;

import com.polybot.oms.domain.TokenType;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-entry state of the event-driven price stop. Mutated only under the coordinator lock.
 */
@Data
public class PriceStopWatch {
    private final String marketSlug;
    private final TokenType entryToken;
    private final int entryPriceCents;
    private final BigDecimal entryFilledSize;
    private final String firstHedgeOrderId;

    private int softHits;
    private int takeProfitHits;
    private boolean triggered;
    private Instant lastEvaluatedAt;
}
