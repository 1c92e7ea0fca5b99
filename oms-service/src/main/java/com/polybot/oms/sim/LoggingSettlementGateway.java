package com.polybot.oms.sim;

import com.polybot.oms.domain.Market;
import com.polybot.oms.trading.SettlementGateway;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settlement collaborator that only records merge requests. Used when no on-chain settlement is wired.
 */
@Slf4j
public class LoggingSettlementGateway implements SettlementGateway {

    private final AtomicInteger mergeRequests = new AtomicInteger();

    @Override
    public void tryMergeCurrentCycle(Market market) {
        int n = mergeRequests.incrementAndGet();
        log.info("[DRY-RUN] merge requested market={} (request #{})", market.slug(), n);
    }

    public int mergeRequests() {
        return mergeRequests.get();
    }
}
