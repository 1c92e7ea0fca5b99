package com.polybot.oms.engine;

import com.polybot.oms.domain.BookSnapshot;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.PriceChangedEvent;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.engine.model.PriceStopParams;
import com.polybot.oms.engine.model.PriceStopWatch;
import com.polybot.oms.engine.model.PriceStopWatchInfo;
import com.polybot.oms.engine.model.PriceStopWatchesStatus;
import com.polybot.oms.trading.TradingException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-evaluates the locked profit of every watched entry on each price event and forces the hedge through when a
 * stop or take-profit threshold is crossed.
 *
 * <p>Locked profit is {@code 100 - (entry cents + hedge-side ask cents)}. The hard stop fires on the first breach,
 * the soft stop and take profit after their confirm-tick counts of consecutive breaches.
 */
@Slf4j
public class PriceStopEvaluator {

    static final Duration SNAPSHOT_MAX_AGE = Duration.ofSeconds(3);
    private static final Duration MERGE_AFTER_FILL = Duration.ofMillis(500);

    /**
     * A fired watch, acted upon outside the coordinator lock.
     */
    record Trigger(String entryOrderId, PriceStopWatch watch, Market market, String hedgeOrderId, Price ask,
                   int profitCents, String reason, long generation) {}

    private record Candidate(String entryOrderId, PriceStopWatch watch, String hedgeOrderId) {}

    private final OmsContext ctx;
    private final PriceStopParams params;

    public PriceStopEvaluator(OmsContext ctx, PriceStopParams params) {
        this.ctx = ctx;
        this.params = params;
    }

    public PriceStopParams params() {
        return params;
    }

    /**
     * Starts watching a filled entry. Does nothing when disabled, already watched or the entry has no usable price
     * or size.
     */
    public void startWatch(Order entryOrder, String hedgeOrderId) {
        if (!params.enabled() || entryOrder == null || !entryOrder.hasId()) {
            return;
        }
        int entryCents = entryOrder.costCents();
        BigDecimal size = entryOrder.executedSize();
        if (entryCents <= 0 || size == null || size.signum() <= 0) {
            return;
        }
        PriceStopWatch watch = new PriceStopWatch(entryOrder.marketSlug(), entryOrder.tokenType(), entryCents, size,
                hedgeOrderId);
        boolean added = ctx.state().write(() -> ctx.state().priceStopWatches().putIfAbsent(entryOrder.orderId(), watch) == null);
        if (added) {
            log.info("price stop armed entry={} token={} price={}c size={} soft={}c hard={}c",
                    entryOrder.orderId(), entryOrder.tokenType(), entryCents, size,
                    params.softLossCents(), params.hardLossCents());
        }
    }

    public void clear() {
        ctx.state().write(() -> {
            ctx.state().priceStopWatches().clear();
        });
    }

    public int activeWatches() {
        return ctx.state().read(() -> ctx.state().priceStopWatches().size());
    }

    /**
     * Evaluates every watch of the event's market. Protective orders are sent asynchronously.
     */
    public void onPriceChanged(PriceChangedEvent event) {
        for (Trigger trigger : evaluate(event)) {
            ctx.scheduler().execute(() -> {
                try {
                    lockLossByFak(trigger);
                } catch (RuntimeException e) {
                    log.error("price stop action failed entry={}: {}", trigger.entryOrderId(), e.getMessage(), e);
                }
            });
        }
    }

    List<Trigger> evaluate(PriceChangedEvent event) {
        if (!params.enabled() || event == null || event.market() == null) {
            return List.of();
        }
        Instant now = ctx.clock().instant();
        Optional<BookSnapshot> snapshot = ctx.trading().gateway().bestBookSnapshot();
        if (snapshot.isEmpty() || !snapshot.get().isFresh(now, SNAPSHOT_MAX_AGE)) {
            log.debug("price stop skipped, book snapshot missing or stale");
            return List.of();
        }
        BookSnapshot book = snapshot.get();
        String marketSlug = event.market().slug();

        List<Candidate> candidates = collect(marketSlug, now);
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, Order> hedges = new HashMap<>();
        for (Candidate c : candidates) {
            try {
                ctx.trading().gateway().getOrder(c.hedgeOrderId()).ifPresent(o -> hedges.put(c.hedgeOrderId(), o));
            } catch (TradingException e) {
                log.debug("price stop hedge lookup failed {}: {}", c.hedgeOrderId(), e.getMessage());
            }
        }

        return ctx.state().write(() -> {
            List<Trigger> fired = new ArrayList<>();
            long generation = ctx.state().generation();
            Map<String, PriceStopWatch> watches = ctx.state().priceStopWatches();
            for (Candidate c : candidates) {
                PriceStopWatch watch = watches.get(c.entryOrderId());
                if (watch != c.watch() || watch.isTriggered()) {
                    continue;
                }
                Order hedge = hedges.get(c.hedgeOrderId());
                if (hedge != null) {
                    if (hedge.isFilled() || unhedged(c.entryOrderId(), watch, hedge).signum() <= 0) {
                        watches.remove(c.entryOrderId());
                        continue;
                    }
                }
                TokenType hedgeToken = watch.getEntryToken().opposite();
                Price ask = book.askFor(hedgeToken);
                if (!ask.isPositive()) {
                    continue;
                }
                int profitNow = 100 - (watch.getEntryPriceCents() + ask.toCents());
                String reason = decide(watch, profitNow);
                if (reason != null) {
                    watch.setTriggered(true);
                    watches.remove(c.entryOrderId());
                    fired.add(new Trigger(c.entryOrderId(), watch, event.market(), c.hedgeOrderId(), ask, profitNow, reason,
                            generation));
                }
            }
            return fired;
        });
    }

    /**
     * Applies the thresholds to one sample and updates the debounce counters.
     *
     * @return the trigger reason, or null when nothing fires
     */
    private String decide(PriceStopWatch watch, int profitNow) {
        if (profitNow <= params.hardLossCents()) {
            return "hard_stop";
        }
        if (profitNow <= params.softLossCents()) {
            watch.setSoftHits(watch.getSoftHits() + 1);
            if (watch.getSoftHits() >= params.confirmTicks()) {
                return "soft_stop";
            }
        } else {
            watch.setSoftHits(0);
        }
        if (params.takeProfitEnabled() && profitNow >= params.takeProfitCents()) {
            watch.setTakeProfitHits(watch.getTakeProfitHits() + 1);
            if (watch.getTakeProfitHits() >= params.takeProfitConfirmTicks()) {
                return "take_profit";
            }
        } else {
            watch.setTakeProfitHits(0);
        }
        return null;
    }

    private List<Candidate> collect(String marketSlug, Instant now) {
        return ctx.state().write(() -> {
            List<Candidate> out = new ArrayList<>();
            var it = ctx.state().priceStopWatches().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, PriceStopWatch> e = it.next();
                PriceStopWatch watch = e.getValue();
                if (!marketSlug.equals(watch.getMarketSlug())) {
                    continue;
                }
                String hedgeId = ctx.state().pendingHedge(e.getKey()).orElse(null);
                if (hedgeId == null) {
                    it.remove();
                    continue;
                }
                Instant last = watch.getLastEvaluatedAt();
                if (!params.interval().isZero() && last != null
                        && Duration.between(last, now).compareTo(params.interval()) < 0) {
                    continue;
                }
                watch.setLastEvaluatedAt(now);
                out.add(new Candidate(e.getKey(), watch, hedgeId));
            }
            return out;
        });
    }

    /**
     * Cancels the live hedge and takes the hedge-side ask for exactly the size still unhedged.
     */
    void lockLossByFak(Trigger trigger) {
        String entry = trigger.entryOrderId();
        PriceStopWatch watch = trigger.watch();
        if (ctx.state().generation() != trigger.generation()) {
            log.info("price stop for entry {} dropped, cycle was reset", entry);
            return;
        }
        String marketSlug = watch.getMarketSlug();
        ctx.meters().priceStopTriggered(trigger.reason());
        log.warn("price stop {} entry={} profit={}c ask={}", trigger.reason(), entry, trigger.profitCents(), trigger.ask());

        ctx.entryGuard().recordFak(entry, marketSlug);
        String hedgeId = trigger.hedgeOrderId();
        if (!OmsState.isBlank(hedgeId)) {
            ctx.entryGuard().recordCancel(entry, marketSlug);
            try {
                ctx.trading().cancelOrder(hedgeId);
            } catch (TradingException e) {
                log.warn("price stop cancel failed hedge={}: {}", hedgeId, e.getMessage());
            }
            if (!OmsContext.pause(ctx.properties().priceStop().cancelSettleMillis())) {
                return;
            }
        }

        Order hedge = lookup(hedgeId);
        if (hedge != null && hedge.isFilled()) {
            log.info("price stop: hedge {} filled during cancel", hedgeId);
            return;
        }
        BigDecimal remaining = unhedged(entry, watch, hedge);
        if (remaining.signum() <= 0) {
            return;
        }

        TokenType hedgeToken = watch.getEntryToken().opposite();
        Order fak = Order.buy(marketSlug, trigger.market().assetFor(hedgeToken), hedgeToken, trigger.ask(), remaining,
                        OrderType.FAK, false, ctx.clock().instant())
                .withLinkedOrderId(entry)
                .withRiskFlags(true, true);
        Order placed;
        try {
            placed = ctx.trading().placeOrder(fak);
        } catch (TradingException e) {
            log.error("price stop forced fill failed entry={} size={}: {}", entry, remaining, e.getMessage());
            return;
        }
        BigDecimal replacedFilled = hedge == null ? BigDecimal.ZERO : hedge.filledSize();
        if (!ctx.state().replacePendingHedgeIf(trigger.generation(), entry, hedgeId, placed.orderId(), replacedFilled)) {
            log.warn("price stop fill {} of entry {} left untracked, hedge replaced elsewhere", placed.orderId(), entry);
            return;
        }
        ctx.riskRegistry().replaceHedgeOrderId(entry, placed.orderId());
        log.info("price stop forced fill entry={} order={} size={} status={}", entry, placed.orderId(), remaining,
                placed.status());

        if (placed.isFilled()) {
            ctx.state().removePendingHedgeIf(entry, placed.orderId());
            ctx.entryGuard().clearEntryBudget(entry);
            ctx.merges().scheduleMerge("price_stop " + entry, MERGE_AFTER_FILL);
            ctx.state().write(() -> {
                ctx.state().priceStopWatches().remove(entry, watch);
            });
        }
    }

    /**
     * Entry shares not yet covered by the hedges placed so far.
     */
    private BigDecimal unhedged(String entryOrderId, PriceStopWatch watch, Order currentHedge) {
        BigDecimal open = watch.getEntryFilledSize().subtract(ctx.state().replacedHedgeFill(entryOrderId));
        return currentHedge == null || currentHedge.filledSize() == null ? open : open.subtract(currentHedge.filledSize());
    }

    private Order lookup(String orderId) {
        if (OmsState.isBlank(orderId)) {
            return null;
        }
        try {
            return ctx.trading().gateway().getOrder(orderId).orElse(null);
        } catch (TradingException e) {
            log.warn("price stop hedge lookup failed {}: {}", orderId, e.getMessage());
            return null;
        }
    }

    /**
     * Watches of one market, or of all markets when {@code marketSlug} is null.
     */
    public PriceStopWatchesStatus status(String marketSlug) {
        if (!params.enabled()) {
            return PriceStopWatchesStatus.disabled();
        }
        Instant now = ctx.clock().instant();
        BookSnapshot book = ctx.trading().gateway().bestBookSnapshot()
                .filter(s -> s.isFresh(now, SNAPSHOT_MAX_AGE))
                .orElse(null);
        Map<String, PriceStopWatch> watches = ctx.state().read(() -> new HashMap<>(ctx.state().priceStopWatches()));
        Map<String, String> pending = ctx.state().pendingHedgesSnapshot();

        List<PriceStopWatchInfo> details = new ArrayList<>();
        Instant lastEvaluated = null;
        for (Map.Entry<String, PriceStopWatch> e : watches.entrySet()) {
            PriceStopWatch w = e.getValue();
            if (marketSlug != null && !marketSlug.equals(w.getMarketSlug())) {
                continue;
            }
            String hedgeId = pending.getOrDefault(e.getKey(), w.getFirstHedgeOrderId());
            int profit = 0;
            if (book != null) {
                Price ask = book.askFor(w.getEntryToken().opposite());
                if (ask.isPositive()) {
                    profit = 100 - (w.getEntryPriceCents() + ask.toCents());
                }
            }
            PriceStopWatchInfo.Status status = PriceStopWatchInfo.Status.MONITORING;
            if (w.isTriggered()) {
                status = PriceStopWatchInfo.Status.TRIGGERED;
            } else if (!OmsState.isBlank(hedgeId)
                    && ctx.trading().gateway().getOrder(hedgeId).map(Order::isFilled).orElse(false)) {
                status = PriceStopWatchInfo.Status.COMPLETED;
            }
            if (w.getLastEvaluatedAt() != null && (lastEvaluated == null || w.getLastEvaluatedAt().isAfter(lastEvaluated))) {
                lastEvaluated = w.getLastEvaluatedAt();
            }
            details.add(new PriceStopWatchInfo(e.getKey(), w.getEntryToken().name(), w.getEntryPriceCents(),
                    w.getEntryFilledSize(), hedgeId, profit, w.getSoftHits(), w.getTakeProfitHits(),
                    w.getLastEvaluatedAt(), status));
        }
        return new PriceStopWatchesStatus(true, details.size(), details, params.softLossCents(), params.hardLossCents(),
                params.takeProfitCents(), params.confirmTicks(), lastEvaluated);
    }
}
