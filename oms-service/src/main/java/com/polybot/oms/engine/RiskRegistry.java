package com.polybot.oms.engine;

import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.engine.model.Exposure;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Filled entries whose hedge has not been confirmed filled yet.
 */
@Slf4j
public class RiskRegistry {

    private final OmsState state;
    private final int maxLossCents;
    private final Clock clock;

    public RiskRegistry(OmsState state, int maxLossCents, Clock clock) {
        this.state = state;
        this.maxLossCents = maxLossCents;
        this.clock = clock;
    }

    /**
     * Records or refreshes the exposure of a filled entry. Orders that are not filled entries are ignored.
     */
    public void registerEntry(Order entryOrder, String hedgeOrderId) {
        if (entryOrder == null || !entryOrder.entry() || !entryOrder.isFilled() || !entryOrder.hasId()) {
            return;
        }
        Exposure exposure = new Exposure(
                entryOrder.marketSlug(),
                entryOrder.orderId(),
                entryOrder.tokenType(),
                entryOrder.executedSize(),
                entryOrder.costCents(),
                entryOrder.filledAt() != null ? entryOrder.filledAt() : clock.instant(),
                hedgeOrderId == null ? "" : hedgeOrderId,
                OrderStatus.PENDING,
                maxLossCents
        );
        state.write(() -> {
            state.exposures().put(entryOrder.orderId(), exposure);
        });
        log.info("exposure registered entry={} token={} price={}c size={} hedge={}",
                entryOrder.orderId(), entryOrder.tokenType(), exposure.entryPriceCents(), exposure.entrySize(),
                exposure.hedgeOrderId());
    }

    /**
     * Applies a hedge status callback. A filled hedge closes its exposure.
     */
    public void updateHedgeStatus(String hedgeOrderId, OrderStatus status) {
        if (OmsState.isBlank(hedgeOrderId)) {
            return;
        }
        state.write(() -> {
            var it = state.exposures().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Exposure> e = it.next();
                if (!hedgeOrderId.equals(e.getValue().hedgeOrderId())) {
                    continue;
                }
                if (status == OrderStatus.FILLED) {
                    it.remove();
                    log.info("exposure closed entry={} hedge={}", e.getKey(), hedgeOrderId);
                } else {
                    e.setValue(e.getValue().withHedge(hedgeOrderId, status));
                }
            }
        });
    }

    /**
     * Attaches a hedge to an exposure that has none.
     */
    public void updateHedgeOrderId(String entryOrderId, String hedgeOrderId) {
        state.write(() -> {
            Exposure exposure = state.exposures().get(entryOrderId);
            if (exposure != null && !exposure.hasHedge()) {
                state.exposures().put(entryOrderId, exposure.withHedge(hedgeOrderId, OrderStatus.PENDING));
            }
        });
    }

    /**
     * Points the exposure at the hedge that superseded the previous one.
     */
    public void replaceHedgeOrderId(String entryOrderId, String hedgeOrderId) {
        state.write(() -> {
            Exposure exposure = state.exposures().get(entryOrderId);
            if (exposure != null) {
                state.exposures().put(entryOrderId, exposure.withHedge(hedgeOrderId, OrderStatus.PENDING));
            }
        });
    }

    public void removeExposure(String entryOrderId) {
        state.write(() -> {
            state.exposures().remove(entryOrderId);
        });
    }

    public List<Exposure> getExposures() {
        return state.read(() -> new ArrayList<>(state.exposures().values()));
    }

    public boolean hasExposures() {
        return state.exposureCount() > 0;
    }
}
