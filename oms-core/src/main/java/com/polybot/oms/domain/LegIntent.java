package com.polybot.oms.domain;

import java.math.BigDecimal;

public record LegIntent(
    String name,
    String assetId,
    TokenType tokenType,
    OrderSide side,
    Price price,
    BigDecimal size,
    OrderType orderType,
    boolean entry,
    boolean bypassRiskOff,
    boolean disableSizeAdjust
) {
}
