package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.Position;
import com.polybot.oms.trading.SettlementGateway;
import com.polybot.oms.trading.TradingGateway;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Defers the settlement merge after a hedge completes so that position data has time to propagate.
 */
@Slf4j
public class MergeScheduler {

    private final TradingGateway gateway;
    private final SettlementGateway settlement;
    private final OmsProperties.Settlement config;
    private final ScheduledExecutorService scheduler;

    public MergeScheduler(TradingGateway gateway, SettlementGateway settlement, OmsProperties.Settlement config,
                          ScheduledExecutorService scheduler) {
        this.gateway = gateway;
        this.settlement = settlement;
        this.config = config;
        this.scheduler = scheduler;
    }

    public Duration defaultDelay() {
        return Duration.ofSeconds(config.mergeTriggerDelaySeconds());
    }

    public void scheduleMerge(String reason) {
        scheduleMerge(reason, defaultDelay());
    }

    /**
     * Runs the merge for the current market after {@code delay}. Nothing happens without a current market.
     */
    public void scheduleMerge(String reason, Duration delay) {
        if (settlement == null) {
            return;
        }
        log.debug("merge scheduled in {}ms ({})", delay.toMillis(), reason);
        scheduler.schedule(() -> runMerge(reason), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void runMerge(String reason) {
        try {
            Market market = gateway.getCurrentMarketInfo().orElse(null);
            if (market == null || !market.isValid()) {
                log.debug("merge skipped, no current market ({})", reason);
                return;
            }
            try {
                gateway.reconcileMarketPositions(market);
            } catch (RuntimeException e) {
                log.warn("position reconcile before merge failed market={}: {}", market.slug(), e.getMessage());
            }
            if (!OmsContext.pause(config.reconcileSettleMillis())) {
                return;
            }
            List<Position> open = gateway.getOpenPositionsForMarket(market.slug());
            log.info("merge market={} openPositions={} ({})", market.slug(), open.size(), reason);
            settlement.tryMergeCurrentCycle(market);
        } catch (RuntimeException e) {
            log.warn("merge failed ({}): {}", reason, e.getMessage(), e);
        }
    }
}
