package com.polybot.oms.domain;

import java.math.BigDecimal;

/**
 * Entry/hedge intent produced by a strategy. Prices and sizes are decided upstream.
 */
public record Decision(
    TokenType direction,
    Price entryPrice,
    Price hedgePrice,
    BigDecimal entrySize,
    BigDecimal hedgeSize
) {
}
