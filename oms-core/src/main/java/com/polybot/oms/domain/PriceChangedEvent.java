package com.polybot.oms.domain;

import java.time.Instant;

public record PriceChangedEvent(
    Market market,
    TokenType tokenType,
    Price newPrice,
    Instant at
) {
}
