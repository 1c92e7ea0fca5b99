package com.polybot.oms.engine.model;

import java.math.BigDecimal;

public record RiskExposureInfo(
        String entryOrderId,
        String entryTokenType,
        BigDecimal entrySize,
        int entryPriceCents,
        String hedgeOrderId,
        String hedgeStatus,
        double exposureSeconds,
        int maxLossCents,
        int originalHedgePriceCents,
        int newHedgePriceCents,
        double countdownSeconds
) {}
