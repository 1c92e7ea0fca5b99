package com.polybot.oms.domain;

import java.math.BigDecimal;

public record Position(
    String id,
    String marketSlug,
    TokenType tokenType,
    BigDecimal size,
    boolean open
) {
}
