package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.Decision;
import com.polybot.oms.domain.LegIntent;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.MultiLegRequest;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderSide;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.domain.TopOfBook;
import com.polybot.oms.trading.TradingException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Places the entry and hedge legs of a decision, either one after the other or as a single two-leg request.
 */
@Slf4j
public class OrderExecutor {

    static final BigDecimal MIN_GTC_SHARES = new BigDecimal("5");

    /**
     * Starts the reorder monitor of a freshly placed hedge.
     */
    @FunctionalInterface
    public interface HedgeMonitorLauncher {
        void launch(Market market, Order entryOrder, Order hedgeOrder);
    }

    private final OmsContext ctx;
    private final HedgeMonitorLauncher launcher;

    public OrderExecutor(OmsContext ctx, HedgeMonitorLauncher launcher) {
        this.ctx = ctx;
        this.launcher = launcher;
    }

    /**
     * Executes a decision in the configured mode.
     *
     * @return the entry order followed by its hedge
     * @throws IllegalArgumentException when the market or the decision is unusable
     * @throws TradingException when a leg cannot be placed or the entry does not fill in time
     */
    public List<Order> execute(Market market, Decision decision) {
        validate(market, decision);
        if (ctx.properties().execution().mode() == OmsProperties.ExecutionMode.PARALLEL) {
            return executeParallel(market, decision);
        }
        return executeSequential(market, decision);
    }

    List<Order> executeSequential(Market market, Decision decision) {
        BigDecimal size = decision.entrySize().min(decision.hedgeSize());
        TokenType direction = decision.direction();

        Order entryRequest = Order.buy(market.slug(), market.assetFor(direction), direction, decision.entryPrice(), size,
                OrderType.FAK, true, ctx.clock().instant());
        Order entry = ctx.trading().placeOrder(entryRequest);
        if (entry == null || !entry.hasId()) {
            throw new TradingException("entry order was not created");
        }
        log.debug("entry submitted id={} direction={} price={} size={}", entry.orderId(), direction,
                decision.entryPrice(), size);

        Order filled = awaitFill(entry.orderId())
                .orElseThrow(() -> new TradingException("entry order " + entry.orderId() + " not filled"));

        BigDecimal hedgeSize = filled.filledSize().signum() > 0 ? filled.filledSize() : size;
        Price hedgePrice = calcInitialHedgePrice(market, direction, filled.costCents(), decision.hedgePrice());
        Order hedge = ctx.trading().placeOrder(hedgeOrder(market, direction, hedgePrice, hedgeSize)
                .withLinkedOrderId(filled.orderId()));
        if (hedge == null || !hedge.hasId()) {
            throw new TradingException("hedge order was not created");
        }
        ctx.state().recordPendingHedge(filled.orderId(), hedge.orderId());
        ctx.riskRegistry().updateHedgeOrderId(filled.orderId(), hedge.orderId());
        log.info("hedge placed entry={} hedge={} price={} size={} type={}", filled.orderId(), hedge.orderId(),
                hedgePrice, hedgeSize, hedge.orderType());

        launcher.launch(market, filled, hedge);
        return List.of(filled, hedge);
    }

    List<Order> executeParallel(Market market, Decision decision) {
        BigDecimal size = decision.entrySize().min(decision.hedgeSize());
        TokenType direction = decision.direction();
        Price hedgePrice = calcInitialHedgePrice(market, direction, decision.entryPrice().toCents(), decision.hedgePrice());

        MultiLegRequest request = new MultiLegRequest(
                ctx.properties().strategyId() + "_entry_hedge",
                market.slug(),
                List.of(
                        new LegIntent("entry", market.assetFor(direction), direction, OrderSide.BUY,
                                decision.entryPrice(), size, OrderType.FAK, true, false, false),
                        new LegIntent("hedge", market.assetFor(direction.opposite()), direction.opposite(),
                                OrderSide.BUY, hedgePrice, size, OrderType.GTC, false, true, true)
                )
        );
        List<Order> created = ctx.trading().executeMultiLeg(request);
        if (created == null || created.size() < 2) {
            throw new TradingException("multi-leg request incomplete: expected 2 orders, got "
                    + (created == null ? 0 : created.size()));
        }
        ctx.state().recordPendingHedge(created.get(0).orderId(), created.get(1).orderId());
        log.info("entry and hedge submitted entry={} hedge={} hedgePrice={}", created.get(0).orderId(),
                created.get(1).orderId(), hedgePrice);
        return List.of(created.get(0), created.get(1));
    }

    /**
     * Initial limit of a hedge, in whole cents.
     *
     * @param entryCents cost of the entry; when not positive, {@code fallback} is returned
     */
    public Price calcInitialHedgePrice(Market market, TokenType direction, int entryCents, Price fallback) {
        if (entryCents <= 0 || market == null) {
            return fallback;
        }
        TopOfBook book;
        try {
            book = ctx.trading().gateway().getTopOfBook(market);
        } catch (TradingException e) {
            log.debug("hedge pricing without book: {}", e.getMessage());
            return fallback;
        }
        int ask = book.askFor(direction.opposite()).toCents();
        OmsProperties.Hedge hedge = ctx.properties().hedge();
        int ideal = clamp(100 - entryCents - hedge.offsetCents(), 1, 99);

        int limit;
        if (hedge.allowNegativeProfitOnReorder()) {
            int maxAllowed = clamp(ideal + hedge.maxNegativeProfitCents() + hedgePriceExtraCents(market.slug()), 1, 99);
            OmsProperties.PriceStop stop = ctx.properties().priceStop();
            if (stop.enabled()) {
                maxAllowed = clamp(Math.min(maxAllowed, 99 - entryCents - stop.hardLossCents()), 1, 99);
            }
            limit = ask > 0 && ask <= maxAllowed ? ask : maxAllowed;
        } else {
            limit = ideal;
            if (ask > 0 && limit >= ask) {
                limit = ask - 1;
            }
            limit = Math.max(1, limit);
        }
        return Price.ofCents(limit);
    }

    /**
     * Extra cents worth paying for a faster hedge: more when risk is already open or hedges have been slow to fill.
     */
    public int hedgePriceExtraCents(String marketSlug) {
        int extra = 0;
        if (ctx.riskRegistry().hasExposures()) {
            extra += 2;
        }
        extra += Math.min(ctx.state().pendingHedgeCount(), 3);
        double ewma = ctx.timing().ewmaSeconds(marketSlug);
        if (ewma > 25) {
            extra += 4;
        } else if (ewma > 15) {
            extra += 2;
        } else if (ewma > 8) {
            extra += 1;
        }
        return clamp(extra, 0, 8);
    }

    private Order hedgeOrder(Market market, TokenType direction, Price price, BigDecimal size) {
        TokenType hedgeToken = direction.opposite();
        // Small hedges go out immediate-or-cancel so the venue minimum never inflates them.
        OrderType type = size.compareTo(MIN_GTC_SHARES) < 0 ? OrderType.FAK : OrderType.GTC;
        return Order.buy(market.slug(), market.assetFor(hedgeToken), hedgeToken, price, size, type, false,
                        ctx.clock().instant())
                .withRiskFlags(true, true);
    }

    private Optional<Order> awaitFill(String orderId) {
        OmsProperties.Execution cfg = ctx.properties().execution();
        long polls = Math.max(1, cfg.sequentialMaxWaitMillis() / cfg.sequentialCheckIntervalMillis());
        for (long i = 0; i <= polls; i++) {
            Optional<Order> order = ctx.trading().gateway().getOrder(orderId);
            if (order.isPresent() && order.get().isFilled()) {
                return order;
            }
            if (i < polls && !OmsContext.pause(cfg.sequentialCheckIntervalMillis())) {
                throw new TradingException("interrupted while waiting for entry " + orderId);
            }
        }
        log.warn("entry {} not filled within {}ms", orderId, cfg.sequentialMaxWaitMillis());
        return Optional.empty();
    }

    private static void validate(Market market, Decision decision) {
        if (market == null || !market.isValid()) {
            throw new IllegalArgumentException("market with slug and both asset ids is required");
        }
        if (decision == null || decision.direction() == null) {
            throw new IllegalArgumentException("decision with a direction is required");
        }
        if (decision.entryPrice() == null || !decision.entryPrice().isPositive()) {
            throw new IllegalArgumentException("entry price must be positive");
        }
        if (decision.hedgePrice() == null) {
            throw new IllegalArgumentException("hedge price is required");
        }
        if (decision.entrySize() == null || decision.entrySize().signum() <= 0
                || decision.hedgeSize() == null || decision.hedgeSize().signum() <= 0) {
            throw new IllegalArgumentException("entry and hedge sizes must be positive");
        }
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
