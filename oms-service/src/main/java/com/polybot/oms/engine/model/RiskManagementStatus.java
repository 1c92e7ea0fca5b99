package com.polybot.oms.engine.model;

import java.time.Instant;
import java.util.List;

/**
 * Unhedged exposures plus what the hedge monitors are currently doing.
 */
public record RiskManagementStatus(
        int riskExposuresCount,
        List<RiskExposureInfo> riskExposures,
        String currentAction,
        String currentActionEntry,
        String currentActionHedge,
        Instant currentActionTime,
        String currentActionDesc,
        int totalReorders,
        int totalFakEats,
        int repriceOldPriceCents,
        int repriceNewPriceCents,
        int repricePriceChangeCents,
        String repriceStrategy,
        int repriceEntryCostCents,
        int repriceMarketAskCents,
        int repriceIdealPriceCents,
        int repriceTotalCostCents,
        int repriceProfitCents
) {}
