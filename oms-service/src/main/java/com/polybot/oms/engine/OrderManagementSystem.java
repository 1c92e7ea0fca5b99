package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.Decision;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Position;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.PriceChangedEvent;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.domain.TopOfBook;
import com.polybot.oms.engine.limit.TokenBucketLimiter;
import com.polybot.oms.engine.metrics.HedgeTimingTracker;
import com.polybot.oms.engine.model.CooldownStatus;
import com.polybot.oms.engine.model.EntryGuardLimits;
import com.polybot.oms.engine.model.Exposure;
import com.polybot.oms.engine.model.OpsMetrics;
import com.polybot.oms.engine.model.PriceStopParams;
import com.polybot.oms.engine.model.PriceStopWatchesStatus;
import com.polybot.oms.engine.model.RiskExposureInfo;
import com.polybot.oms.engine.model.RiskManagementStatus;
import com.polybot.oms.trading.OrderUpdateListener;
import com.polybot.oms.trading.SettlementGateway;
import com.polybot.oms.trading.TradingException;
import com.polybot.oms.trading.TradingGateway;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates entry and hedge orders: places them, reacts to order and price updates, keeps every filled entry
 * hedged through the reorder monitors and the price stop, and triggers the settlement merge once a pair completes.
 */
@Slf4j
public class OrderManagementSystem implements OrderUpdateListener {

    private static final Duration FALLBACK_DELAY = Duration.ofMillis(100);
    private static final Duration RESUME_DELAY = Duration.ofSeconds(2);
    private static final BigDecimal IMBALANCE_EPSILON = new BigDecimal("0.0001");

    private final OmsProperties properties;
    private final Clock clock;
    private final OmsState state;
    private final ScheduledExecutorService scheduler;
    private final OmsContext ctx;
    private final OrderExecutor executor;
    private final PriceStopEvaluator priceStops;

    private ScheduledFuture<?> metricsLoop;

    public OrderManagementSystem(OmsProperties properties,
                                 TradingGateway gateway,
                                 SettlementGateway settlement,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.state = new OmsState();
        AtomicInteger threadIds = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(4, r -> {
            Thread t = new Thread(r, "oms-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        OmsProperties.Limits limits = properties.limits();
        GatedTrading trading = new GatedTrading(gateway, properties.gate());
        OmsMeters meters = new OmsMeters(meterRegistry);
        this.ctx = new OmsContext(
                properties,
                clock,
                state,
                trading,
                new EntryGuard(state, EntryGuardLimits.from(properties.entryBudget()), clock),
                new RiskRegistry(state, properties.risk().maxAcceptableLossCents(), clock),
                new TokenBucketLimiter(limits.reorderCapacity(), limits.reorderRefillPerMinute(), clock),
                new TokenBucketLimiter(limits.fakCapacity(), limits.fakRefillPerMinute(), clock),
                new HedgeTimingTracker(clock),
                meters,
                new ReorderActivity(clock),
                new MergeScheduler(gateway, settlement, properties.settlement(), scheduler),
                scheduler
        );
        meters.bindGauges(state, trading::queueLength);
        this.executor = new OrderExecutor(ctx, this::launchMonitor);
        this.priceStops = new PriceStopEvaluator(ctx, PriceStopParams.from(properties.priceStop()));
    }

    @PostConstruct
    public synchronized void start() {
        ctx.trading().reopen();
        scheduler.schedule(this::resumeExistingHedges, RESUME_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        if (metricsLoop == null) {
            long every = properties.metrics().logIntervalSeconds();
            metricsLoop = scheduler.scheduleAtFixedRate(this::logMetricsOnce, every, every, TimeUnit.SECONDS);
        }
        log.info("order management started mode={} priceStop={} fakTimeout={}s reorderTimeout={}s",
                properties.execution().mode(), priceStops.params().enabled(),
                properties.hedge().fakTimeoutSeconds(), properties.hedge().reorderTimeoutSeconds());
    }

    public synchronized void stop() {
        ctx.trading().close();
        priceStops.clear();
        for (HedgeReorderMonitor monitor : state.monitorsSnapshot()) {
            monitor.cancel();
            state.unregisterMonitor(monitor.entryOrderId(), monitor);
        }
        if (metricsLoop != null) {
            metricsLoop.cancel(false);
            metricsLoop = null;
        }
        log.info("order management stopped");
    }

    @PreDestroy
    void shutdown() {
        stop();
        scheduler.shutdownNow();
    }

    // Strategy-facing operations

    public List<Order> executeOrder(Market market, Decision decision) {
        return executor.execute(market, decision);
    }

    /**
     * Applies an order status transition. Must be called for every update of every order.
     */
    @Override
    public void onOrderUpdate(Order order) {
        if (order == null || !order.hasId()) {
            return;
        }
        boolean isEntry = order.entry() || state.isPendingHedgeOrEntry(order.orderId());
        if (isEntry && order.isFilled()) {
            onEntryFilled(order);
        } else if (!order.entry()) {
            ctx.riskRegistry().updateHedgeStatus(order.orderId(), order.status());
        }
        if (order.isFilled() && !order.entry()) {
            onHedgeFilled(order);
        }
    }

    /**
     * Evaluates price stops and nudges the reorder monitors of the event's market.
     */
    public void onPriceChanged(PriceChangedEvent event) {
        if (event == null || event.market() == null) {
            return;
        }
        priceStops.onPriceChanged(event);
        for (HedgeReorderMonitor monitor : state.monitorsSnapshot()) {
            if (event.market().slug().equals(monitor.marketSlug())) {
                scheduler.execute(monitor::tickSafely);
            }
        }
    }

    /**
     * Market rollover: stops every monitor and forgets all per-entry and per-market state.
     */
    public void onCycle(Market oldMarket, Market newMarket) {
        List<HedgeReorderMonitor> running = state.reset();
        for (HedgeReorderMonitor monitor : running) {
            monitor.cancel();
        }
        ctx.timing().clearPendingEntries();
        log.info("cycle {} -> {}: state reset, {} monitors stopped",
                oldMarket == null ? "-" : oldMarket.slug(), newMarket == null ? "-" : newMarket.slug(), running.size());
    }

    /**
     * Places a resting hedge for {@code size} shares of {@code hedgeDirection}.
     *
     * @param entryOrder the entry being covered, or null for a free-standing rebalance
     * @return the placed hedge
     */
    public Order autoHedgePosition(Market market, TokenType hedgeDirection, BigDecimal size, Order entryOrder) {
        if (market == null || !market.isValid() || hedgeDirection == null || size == null || size.signum() <= 0) {
            throw new IllegalArgumentException("market, hedge direction and a positive size are required");
        }
        TopOfBook book = ctx.trading().gateway().getTopOfBook(market);
        Price price = book.askFor(hedgeDirection);
        int entryCents = entryOrder == null ? 0 : entryOrder.costCents();
        if (entryCents > 0) {
            int ideal = 100 - entryCents - properties.hedge().offsetCents();
            if (ideal >= 1 && ideal <= 99 && ideal < price.toCents()) {
                price = Price.ofCents(ideal);
            }
        }
        if (!price.isPositive()) {
            throw new TradingException("no usable hedge price for " + hedgeDirection + " in " + market.slug());
        }

        BigDecimal priceDecimal = price.toDecimal().setScale(2, RoundingMode.HALF_UP);
        BigDecimal hedgeSize = size.setScale(2, RoundingMode.HALF_UP);
        if (hedgeSize.compareTo(OrderExecutor.MIN_GTC_SHARES) < 0) {
            log.warn("hedge size {} below the 5 share minimum, raised to 5", hedgeSize);
            hedgeSize = OrderExecutor.MIN_GTC_SHARES.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal minUsdc = properties.hedge().minOrderUsdc();
        BigDecimal notional = hedgeSize.multiply(priceDecimal).setScale(4, RoundingMode.HALF_UP);
        if (notional.compareTo(minUsdc) < 0) {
            if (entryOrder != null) {
                log.warn("hedge notional {} below minimum {} size={} price={} entry={}",
                        notional, minUsdc, hedgeSize, priceDecimal, entryOrder.orderId());
            } else {
                hedgeSize = minUsdc.divide(priceDecimal, 2, RoundingMode.UP).max(hedgeSize);
                log.warn("hedge size raised to {} to reach the {} USDC minimum", hedgeSize, minUsdc);
            }
        }

        Order request = Order.buy(market.slug(), market.assetFor(hedgeDirection), hedgeDirection,
                        Price.fromDecimal(priceDecimal), hedgeSize, OrderType.GTC, false, clock.instant())
                .withRiskFlags(true, true);
        if (entryOrder != null && entryOrder.hasId()) {
            request = request.withLinkedOrderId(entryOrder.orderId());
        }
        Order placed = ctx.trading().placeOrder(request);
        if (placed == null || !placed.hasId()) {
            throw new TradingException("hedge order was not created");
        }
        log.info("auto hedge placed market={} direction={} size={} price={} order={}",
                market.slug(), hedgeDirection, hedgeSize, priceDecimal, placed.orderId());
        if (entryOrder != null && entryOrder.hasId()) {
            state.recordPendingHedge(entryOrder.orderId(), placed.orderId());
            priceStops.startWatch(entryOrder, placed.orderId());
        }
        return placed;
    }

    /**
     * True when a hedge is outstanding or the market's open positions are not balanced.
     */
    public boolean hasUnhedgedRisk(String marketSlug) {
        if (state.pendingHedgeCount() > 0) {
            return true;
        }
        BigDecimal up = BigDecimal.ZERO;
        BigDecimal down = BigDecimal.ZERO;
        for (Position p : ctx.trading().gateway().getOpenPositionsForMarket(marketSlug)) {
            if (p == null || !p.open() || p.size() == null || p.size().signum() <= 0) {
                continue;
            }
            if (p.tokenType() == TokenType.UP) {
                up = up.add(p.size());
            } else {
                down = down.add(p.size());
            }
        }
        if (up.signum() > 0 != down.signum() > 0) {
            return true;
        }
        return up.subtract(down).abs().compareTo(IMBALANCE_EPSILON) > 0;
    }

    public void recordPendingHedge(String entryOrderId, String hedgeOrderId) {
        state.recordPendingHedge(entryOrderId, hedgeOrderId);
    }

    public Map<String, String> getPendingHedges() {
        return state.pendingHedgesSnapshot();
    }

    public RiskRegistry getRiskRegistry() {
        return ctx.riskRegistry();
    }

    public EntryGuard getEntryGuard() {
        return ctx.entryGuard();
    }

    public OrderExecutor getOrderExecutor() {
        return executor;
    }

    // Status surfaces

    public OpsMetrics getOpsMetrics(String marketSlug) {
        double ewma = 0;
        CooldownStatus cooldown = CooldownStatus.NONE;
        if (!OmsState.isBlank(marketSlug)) {
            ewma = ctx.timing().ewmaSeconds(marketSlug);
            cooldown = ctx.entryGuard().cooldownStatus(marketSlug);
        }
        return new OpsMetrics(
                ctx.trading().queueLength(),
                state.pendingHedgeCount(),
                state.exposureCount(),
                ewma,
                ctx.meters().reorderBudgetSkips(),
                ctx.meters().fakBudgetWarnings(),
                cooldown.active() ? cooldown.remaining().toMillis() / 1000.0 : 0,
                cooldown.active() ? cooldown.reason() : ""
        );
    }

    public RiskManagementStatus getRiskManagementStatus() {
        Instant now = clock.instant();
        ReorderActivity.Snapshot activity = ctx.activity().snapshot();
        double horizon = properties.risk().aggressiveHedgeTimeoutSeconds() > 0
                ? properties.risk().aggressiveHedgeTimeoutSeconds() : 60;

        List<RiskExposureInfo> infos = new ArrayList<>();
        for (Exposure e : ctx.riskRegistry().getExposures()) {
            if (e.hedgeStatus() == OrderStatus.FILLED) {
                continue;
            }
            double exposureSeconds = e.exposureSeconds(now);
            int original = 0;
            if (e.hasHedge()) {
                original = ctx.trading().gateway().getOrder(e.hedgeOrderId()).map(o -> o.price().toCents()).orElse(0);
            }
            int repriced = 0;
            if (e.entryOrderId().equals(activity.entryOrderId())) {
                repriced = activity.newPriceCents();
                if (original == 0) {
                    original = activity.oldPriceCents();
                }
            }
            infos.add(new RiskExposureInfo(e.entryOrderId(), e.entryToken() == null ? "" : e.entryToken().name(),
                    e.entrySize(), e.entryPriceCents(), e.hedgeOrderId(), e.hedgeStatus().name(), exposureSeconds,
                    e.maxLossCents(), original, repriced, Math.max(0, horizon - exposureSeconds)));
        }
        boolean busy = !ReorderActivity.IDLE.equals(activity.action());
        return new RiskManagementStatus(
                infos.size(),
                infos,
                activity.action(),
                busy ? activity.entryOrderId() : "",
                busy ? activity.hedgeOrderId() : "",
                busy ? activity.at() : null,
                busy ? activity.description() : "",
                activity.totalReorders(),
                activity.totalFakEats(),
                busy ? activity.oldPriceCents() : 0,
                busy ? activity.newPriceCents() : 0,
                busy ? activity.priceChangeCents() : 0,
                busy ? activity.strategy() : "",
                busy ? activity.entryCostCents() : 0,
                busy ? activity.marketAskCents() : 0,
                busy ? activity.idealPriceCents() : 0,
                busy ? activity.totalCostCents() : 0,
                busy ? activity.profitCents() : 0
        );
    }

    public PriceStopWatchesStatus getPriceStopWatchesStatus(String marketSlug) {
        return priceStops.status(marketSlug);
    }

    // Internals

    private void onEntryFilled(Order order) {
        Instant filledAt = order.filledAt() != null ? order.filledAt() : clock.instant();
        ctx.entryGuard().initEntryBudget(order.orderId(), order.marketSlug(), filledAt);
        ctx.timing().recordEntryFilled(order.orderId(), order.marketSlug(), filledAt);

        String hedgeId = state.pendingHedge(order.orderId()).orElse("");
        if (hedgeId.isEmpty() && properties.execution().mode() == OmsProperties.ExecutionMode.SEQUENTIAL
                && state.markHedgeFallback(order.orderId())) {
            scheduler.schedule(() -> runHedgeFallback(order), FALLBACK_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        }

        if (properties.risk().enabled()) {
            ctx.riskRegistry().registerEntry(order, hedgeId);
        }
        if (hedgeId.isEmpty()) {
            return;
        }
        Optional<Order> hedge = ctx.trading().gateway().getOrder(hedgeId);
        if (hedge.map(Order::isFilled).orElse(false)) {
            return;
        }
        Optional<Market> market = ctx.trading().gateway().getCurrentMarketInfo();
        if (market.isPresent() && market.get().isValid()) {
            startMonitor(market.get(), order, hedgeId, hedge.orElse(null));
        }
        priceStops.startWatch(order, hedgeId);
    }

    private void onHedgeFilled(Order order) {
        String entryForMetrics = order.linkedOrderId();
        Optional<String> entry = state.entryForHedge(order.orderId(), order.linkedOrderId());
        if (entry.isPresent()) {
            state.removePendingHedgeIf(entry.get(), order.orderId());
            ctx.entryGuard().clearEntryBudget(entry.get());
            if (OmsState.isBlank(entryForMetrics)) {
                entryForMetrics = entry.get();
            }
            log.info("hedge filled entry={} hedge={}", entry.get(), order.orderId());
        } else {
            log.debug("filled hedge {} not tracked, merge still triggered", order.orderId());
        }
        if (!OmsState.isBlank(entryForMetrics)) {
            ctx.timing().recordHedgeFilled(entryForMetrics, order.filledAt() != null ? order.filledAt() : clock.instant());
        }
        ctx.merges().scheduleMerge("hedge " + order.orderId() + " filled");
    }

    private void runHedgeFallback(Order entry) {
        try {
            Optional<String> hedgeId = state.pendingHedge(entry.orderId());
            if (hedgeId.isPresent()) {
                ctx.riskRegistry().updateHedgeOrderId(entry.orderId(), hedgeId.get());
                priceStops.startWatch(entry, hedgeId.get());
                log.debug("hedge {} found late for entry {}", hedgeId.get(), entry.orderId());
                return;
            }
            if (state.hasHadHedge(entry.orderId())) {
                log.debug("entry {} already hedged, no fallback needed", entry.orderId());
                return;
            }
            Optional<Market> market = ctx.trading().gateway().getCurrentMarketInfo();
            if (market.isEmpty() || !market.get().slug().equals(entry.marketSlug())) {
                return;
            }
            log.warn("entry {} filled without a hedge, placing one", entry.orderId());
            Order hedge = autoHedgePosition(market.get(), entry.tokenType().opposite(), entry.executedSize(), entry);
            ctx.riskRegistry().updateHedgeOrderId(entry.orderId(), hedge.orderId());
        } catch (RuntimeException e) {
            log.error("fallback hedge failed entry={}: {}", entry.orderId(), e.getMessage(), e);
        }
    }

    private void launchMonitor(Market market, Order entryOrder, Order hedgeOrder) {
        startMonitor(market, entryOrder, hedgeOrder.orderId(), hedgeOrder);
        priceStops.startWatch(entryOrder, hedgeOrder.orderId());
    }

    private void startMonitor(Market market, Order entryOrder, String hedgeId, Order hedgeOrder) {
        int entryCents = entryOrder.costCents();
        TokenType hedgeToken = entryOrder.tokenType().opposite();
        HedgeReorderMonitor.Assignment assignment;
        if (hedgeOrder != null) {
            assignment = new HedgeReorderMonitor.Assignment(market, entryOrder.orderId(), entryOrder.tokenType(),
                    entryCents, entryOrder.filledAt(), hedgeId, hedgeOrder.assetId(), hedgeOrder.price(),
                    hedgeOrder.size());
        } else {
            assignment = new HedgeReorderMonitor.Assignment(market, entryOrder.orderId(), entryOrder.tokenType(),
                    entryCents, entryOrder.filledAt(), hedgeId, market.assetFor(hedgeToken),
                    Price.ofCents(100 - entryCents), entryOrder.executedSize());
        }
        new HedgeReorderMonitor(ctx, assignment).start();
    }

    private void resumeExistingHedges() {
        try {
            Map<String, String> pending = state.pendingHedgesSnapshot();
            if (pending.isEmpty()) {
                return;
            }
            Optional<Market> market = ctx.trading().gateway().getCurrentMarketInfo();
            if (market.isEmpty() || !market.get().isValid()) {
                return;
            }
            for (Map.Entry<String, String> e : pending.entrySet()) {
                Optional<Order> entry = ctx.trading().gateway().getOrder(e.getKey());
                if (entry.isEmpty() || !entry.get().isFilled()) {
                    continue;
                }
                Optional<Order> hedge = ctx.trading().gateway().getOrder(e.getValue());
                if (hedge.isEmpty()) {
                    continue;
                }
                if (hedge.get().isFilled()) {
                    state.removePendingHedgeIf(e.getKey(), e.getValue());
                    continue;
                }
                startMonitor(market.get(), entry.get(), e.getValue(), hedge.get());
            }
        } catch (RuntimeException e) {
            log.warn("resuming hedge monitors failed: {}", e.getMessage(), e);
        }
    }

    void logMetricsOnce() {
        try {
            String market = ctx.trading().gateway().getCurrentMarketInfo().map(Market::slug).orElse("");
            OpsMetrics m = getOpsMetrics(market);
            log.debug("ops metrics market={} queue={} pending={} exposures={} hedgeEwma={}s reorderSkips={} fakWarn={}",
                    market, m.queueLength(), m.pendingHedges(), m.exposures(), String.format("%.1f", m.hedgeEwmaSeconds()),
                    m.reorderBudgetSkips(), m.fakBudgetWarnings());
        } catch (RuntimeException e) {
            log.warn("ops metrics logging failed: {}", e.getMessage());
        }
    }
}
