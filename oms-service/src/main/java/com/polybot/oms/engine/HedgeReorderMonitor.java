package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.domain.TopOfBook;
import com.polybot.oms.trading.TradingException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one entry's hedge until it is filled: reprices a resting hedge that does not fill in time, and forces the
 * fill with an immediate-or-cancel order once the forced-fill deadline or the entry's age budget runs out.
 *
 * A monitor is ticked on a fixed delay and, additionally, on price events of its market. Ticks never overlap; a
 * tick arriving while another runs is skipped.
 */
@Slf4j
public class HedgeReorderMonitor {

    private static final Duration BUDGET_RETRY = Duration.ofSeconds(5);
    private static final Duration RATE_LIMIT_RETRY = Duration.ofSeconds(3);
    private static final Duration FAILED_REORDER_RETRY = Duration.ofSeconds(5);
    private static final Duration ACTIVITY_RESET = Duration.ofSeconds(5);

    /**
     * The pair being watched.
     *
     * @param hedgePrice price of the hedge as placed, used to report the reprice delta
     */
    public record Assignment(
            Market market,
            String entryOrderId,
            TokenType entryToken,
            int entryPriceCents,
            Instant entryFilledAt,
            String hedgeOrderId,
            String hedgeAssetId,
            Price hedgePrice,
            BigDecimal hedgeSize
    ) {
        public TokenType hedgeToken() {
            return entryToken.opposite();
        }
    }

    private final OmsContext ctx;
    private final OmsProperties.Hedge config;
    private final Assignment assignment;
    private final ReentrantLock tickLock = new ReentrantLock();

    private final Instant fakDeadline;
    private final long generation;
    private Instant reorderDeadline;
    private String hedgeOrderId;
    // hedge this monitor canceled but has not replaced yet
    private String selfCanceledHedge;
    private int hedgePriceCents;
    private int attempts;
    private boolean abandoned;

    private volatile boolean finished;
    private volatile ScheduledFuture<?> schedule;

    public HedgeReorderMonitor(OmsContext ctx, Assignment assignment) {
        this.ctx = ctx;
        this.config = ctx.properties().hedge();
        this.assignment = assignment;
        this.generation = ctx.state().generation();
        this.hedgeOrderId = assignment.hedgeOrderId();
        this.hedgePriceCents = assignment.hedgePrice() == null ? 0 : assignment.hedgePrice().toCents();

        Instant filledAt = assignment.entryFilledAt() != null ? assignment.entryFilledAt() : ctx.clock().instant();
        int reorderTimeout = config.reorderTimeoutSeconds() > 0 ? config.reorderTimeoutSeconds() : 15;
        this.reorderDeadline = filledAt.plusSeconds(reorderTimeout);
        this.fakDeadline = config.fakTimeoutSeconds() > 0 ? filledAt.plusSeconds(config.fakTimeoutSeconds()) : null;
    }

    public String entryOrderId() {
        return assignment.entryOrderId();
    }

    public String marketSlug() {
        return assignment.market().slug();
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Registers the monitor and schedules its ticks.
     *
     * @return false when the entry already has a running monitor
     */
    public boolean start() {
        if (!ctx.state().registerMonitor(entryOrderId(), this)) {
            return false;
        }
        long interval = config.checkIntervalMillis();
        schedule = ctx.scheduler().scheduleWithFixedDelay(this::tickSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("hedge monitor started entry={} hedge={} reorderDeadline={} fakDeadline={}",
                entryOrderId(), hedgeOrderId, reorderDeadline, fakDeadline);
        return true;
    }

    /**
     * Stops ticking without touching any order.
     */
    public void cancel() {
        finished = true;
        ScheduledFuture<?> s = schedule;
        if (s != null) {
            s.cancel(false);
        }
    }

    void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.warn("hedge monitor tick failed entry={}: {}", entryOrderId(), e.getMessage(), e);
        }
    }

    /**
     * Runs one check.
     *
     * @return true once the monitor has reached a terminal state
     */
    public boolean tick() {
        if (finished) {
            return true;
        }
        if (!tickLock.tryLock()) {
            return false;
        }
        try {
            if (finished) {
                return true;
            }
            if (step()) {
                finish();
            }
            return finished;
        } finally {
            tickLock.unlock();
        }
    }

    private boolean step() {
        Instant now = ctx.clock().instant();
        String entry = entryOrderId();

        Instant startedAt = assignment.entryFilledAt() != null ? assignment.entryFilledAt() : now;
        if (Duration.between(startedAt, now).compareTo(ctx.entryGuard().limits().maxAge()) > 0) {
            log.warn("entry {} exceeded max age {}s, forcing hedge fill", entry,
                    ctx.entryGuard().limits().maxAge().toSeconds());
            forceFill();
            return true;
        }

        Optional<String> tracked = ctx.state().pendingHedge(entry);
        if (tracked.isPresent() && !tracked.get().equals(hedgeOrderId)) {
            log.info("hedge of entry {} superseded by {}, monitor exits", entry, tracked.get());
            return true;
        }

        Order hedge = lookup(hedgeOrderId);
        boolean awaitingReplacement = hedgeOrderId != null && hedgeOrderId.equals(selfCanceledHedge);
        if (hedge != null) {
            if (hedge.isFilled() || outstandingSize(hedge).signum() <= 0) {
                ctx.state().removePendingHedgeIf(entry, hedgeOrderId);
                log.info("hedge filled entry={} hedge={}", entry, hedgeOrderId);
                return true;
            }
            if (!awaitingReplacement
                    && (hedge.status() == OrderStatus.CANCELED || hedge.status() == OrderStatus.FAILED)) {
                ctx.state().removePendingHedgeIf(entry, hedgeOrderId);
                log.info("hedge {} of entry {} is {}, monitor exits", hedgeOrderId, entry, hedge.status());
                return true;
            }
        }

        if (fakDeadline != null && now.isAfter(fakDeadline)) {
            log.info("forced-fill deadline passed entry={} hedge={}", entry, hedgeOrderId);
            forceFill();
            return true;
        }

        if (!now.isAfter(reorderDeadline)) {
            return false;
        }
        if (attempts >= config.maxReorderAttempts()) {
            if (awaitingReplacement) {
                log.warn("entry {} out of reorder attempts with its hedge canceled, forcing fill", entry);
                forceFill();
                return true;
            }
            // Out of attempts: wait for the forced-fill deadline if one is still ahead.
            return fakDeadline == null || now.isAfter(fakDeadline);
        }
        if (!ctx.entryGuard().consumeReorderAttempt(entry, marketSlug(), assignment.entryFilledAt())) {
            reorderDeadline = now.plus(BUDGET_RETRY);
            return false;
        }
        if (!ctx.reorderLimiter().allow(marketSlug())) {
            ctx.meters().reorderBudgetSkipped();
            log.warn("reorder rate limit reached market={}, reprice of {} postponed", marketSlug(), entry);
            reorderDeadline = now.plus(RATE_LIMIT_RETRY);
            return false;
        }
        Optional<String> replaced = reprice();
        attempts++;
        if (abandoned) {
            return true;
        }
        if (replaced.isPresent()) {
            hedgeOrderId = replaced.get();
            reorderDeadline = ctx.clock().instant().plusSeconds(config.reorderTimeoutSeconds());
        } else {
            reorderDeadline = ctx.clock().instant().plus(FAILED_REORDER_RETRY);
        }
        return false;
    }

    /**
     * Cancels the resting hedge and replaces it with one at the current reprice target.
     */
    private Optional<String> reprice() {
        if (isStale()) {
            abandoned = true;
            return Optional.empty();
        }
        String entry = entryOrderId();
        String oldHedge = hedgeOrderId;
        int oldPrice = hedgePriceCents;
        ctx.activity().canceling(entry, oldHedge, oldPrice);

        if (!oldHedge.equals(selfCanceledHedge)) {
            ctx.entryGuard().recordCancel(entry, marketSlug());
            try {
                ctx.trading().cancelOrder(oldHedge);
            } catch (TradingException e) {
                log.warn("reprice cancel failed entry={} hedge={}: {}", entry, oldHedge, e.getMessage());
                ctx.activity().idle();
                return Optional.empty();
            }
            selfCanceledHedge = oldHedge;
            if (!OmsContext.pause(config.cancelSettleMillis())) {
                return Optional.empty();
            }
        }

        Order old = lookup(oldHedge);
        BigDecimal size = outstandingSize(old);
        if (size.signum() <= 0) {
            log.info("hedge {} filled during cancel, nothing to reprice", oldHedge);
            ctx.activity().idle();
            return Optional.empty();
        }

        TopOfBook book;
        try {
            book = ctx.trading().gateway().getTopOfBook(assignment.market());
        } catch (TradingException e) {
            log.warn("reprice book read failed entry={}: {}", entry, e.getMessage());
            ctx.activity().idle();
            return Optional.empty();
        }
        int ask = book.askFor(assignment.hedgeToken()).toCents();
        int entryCents = assignment.entryPriceCents();
        int ideal = 100 - entryCents - config.offsetCents();

        int newPrice;
        String strategy;
        if (config.allowNegativeProfitOnReorder()) {
            int maxAllowed = ideal + config.maxNegativeProfitCents();
            OmsProperties.PriceStop stop = ctx.properties().priceStop();
            if (stop.enabled()) {
                maxAllowed = Math.min(maxAllowed, 99 - entryCents - stop.hardLossCents());
            }
            newPrice = ask > 0 && ask <= maxAllowed ? ask : maxAllowed;
            strategy = "negative_profit_allowed";
        } else {
            newPrice = ideal;
            if (ask > 0 && newPrice >= ask) {
                newPrice = ask - 1;
            }
            strategy = "profit_locked";
        }
        ctx.activity().pricing(strategy, entryCents, ask, ideal, newPrice);
        if (newPrice <= 0 || newPrice >= 100) {
            log.warn("reprice target {}c out of range entry={} ask={}c ideal={}c", newPrice, entry, ask, ideal);
            ctx.activity().idle();
            return Optional.empty();
        }

        Order replacement = Order.buy(marketSlug(), assignment.hedgeAssetId(), assignment.hedgeToken(),
                        Price.ofCents(newPrice), size, OrderType.GTC, false, ctx.clock().instant())
                .withLinkedOrderId(entry)
                .withRiskFlags(true, true);
        Order placed;
        try {
            placed = ctx.trading().placeOrder(replacement);
        } catch (TradingException e) {
            log.warn("reprice placement failed entry={} price={}c: {}", entry, newPrice, e.getMessage());
            ctx.activity().idle();
            return Optional.empty();
        }

        if (!ctx.state().replacePendingHedgeIf(generation, entry, oldHedge, placed.orderId(), filledOf(old))) {
            log.info("hedge of entry {} replaced elsewhere during reprice, canceling {}", entry, placed.orderId());
            try {
                ctx.trading().cancelOrder(placed.orderId());
            } catch (TradingException e) {
                log.warn("cancel of surplus hedge {} failed: {}", placed.orderId(), e.getMessage());
            }
            ctx.activity().idle();
            abandoned = true;
            return Optional.empty();
        }
        ctx.riskRegistry().replaceHedgeOrderId(entry, placed.orderId());
        selfCanceledHedge = null;
        hedgePriceCents = newPrice;
        ctx.meters().hedgeReordered();
        ctx.activity().reordered(entry, oldHedge, placed.orderId(), oldPrice, newPrice);
        Instant markedAt = ctx.clock().instant();
        ctx.scheduler().schedule(() -> ctx.activity().idleIfUnchangedSince(markedAt),
                ACTIVITY_RESET.toMillis(), TimeUnit.MILLISECONDS);
        log.info("hedge repriced entry={} {} -> {} {}c -> {}c ({})",
                entry, oldHedge, placed.orderId(), oldPrice, newPrice, strategy);
        return Optional.of(placed.orderId());
    }

    /**
     * Cancels the current hedge and takes the hedge-side ask for whatever is still unfilled.
     */
    private void forceFill() {
        if (isStale()) {
            return;
        }
        String entry = entryOrderId();
        String oldHedge = hedgeOrderId;
        ctx.activity().fakEating(entry, oldHedge);
        ctx.entryGuard().recordFak(entry, marketSlug());
        if (!ctx.fakLimiter().allow(marketSlug())) {
            ctx.meters().fakBudgetWarned();
            log.warn("forced-fill rate limit reached market={}, forcing hedge of {} anyway", marketSlug(), entry);
        }

        if (!OmsState.isBlank(oldHedge) && !oldHedge.equals(selfCanceledHedge)) {
            ctx.entryGuard().recordCancel(entry, marketSlug());
            try {
                ctx.trading().cancelOrder(oldHedge);
            } catch (TradingException e) {
                log.warn("forced-fill cancel failed entry={} hedge={}: {}", entry, oldHedge, e.getMessage());
            }
            if (!OmsContext.pause(config.cancelSettleMillis())) {
                ctx.activity().idle();
                return;
            }
        }

        Order old = lookup(oldHedge);
        BigDecimal size = outstandingSize(old);
        if (size.signum() <= 0) {
            ctx.state().removePendingHedgeIf(entry, oldHedge);
            ctx.activity().idle();
            return;
        }
        Optional<String> tracked = ctx.state().pendingHedge(entry);
        if (isStale() || (tracked.isPresent() && !tracked.get().equals(oldHedge))) {
            log.info("hedge of entry {} replaced elsewhere, forced fill dropped", entry);
            ctx.activity().idle();
            return;
        }

        Price ask;
        try {
            ask = ctx.trading().gateway().getTopOfBook(assignment.market()).askFor(assignment.hedgeToken());
        } catch (TradingException e) {
            log.error("forced fill aborted entry={}, book unavailable: {}", entry, e.getMessage());
            ctx.activity().idle();
            return;
        }
        if (!ask.isPositive()) {
            log.error("forced fill aborted entry={}, no ask on {}", entry, assignment.hedgeToken());
            ctx.activity().idle();
            return;
        }

        Order fak = Order.buy(marketSlug(), assignment.hedgeAssetId(), assignment.hedgeToken(), ask, size,
                        OrderType.FAK, false, ctx.clock().instant())
                .withLinkedOrderId(entry)
                .withRiskFlags(true, true);
        Order placed;
        try {
            placed = ctx.trading().placeOrder(fak);
        } catch (TradingException e) {
            log.error("forced fill failed entry={} size={} ask={}: {}", entry, size, ask, e.getMessage());
            ctx.activity().idle();
            return;
        }
        ctx.meters().forcedFill();
        if (placed.isFilled()) {
            ctx.state().removePendingHedgeIf(entry, oldHedge, placed.orderId());
        } else if (ctx.state().replacePendingHedgeIf(generation, entry, oldHedge, placed.orderId(), filledOf(old))) {
            ctx.riskRegistry().replaceHedgeOrderId(entry, placed.orderId());
        } else {
            log.warn("forced fill {} of entry {} left untracked, hedge replaced elsewhere", placed.orderId(), entry);
        }
        selfCanceledHedge = null;
        hedgeOrderId = placed.orderId();
        ctx.activity().fakEaten();
        log.info("forced hedge fill entry={} order={} size={} ask={} status={}",
                entry, placed.orderId(), size, ask, placed.status());
    }

    /**
     * Shares still unhedged: the hedge size less everything filled on replaced hedges and on {@code current}.
     */
    private BigDecimal outstandingSize(Order current) {
        if (current != null && current.isFilled()) {
            return BigDecimal.ZERO;
        }
        BigDecimal open = assignment.hedgeSize().subtract(ctx.state().replacedHedgeFill(entryOrderId()));
        return current == null ? open : open.subtract(filledOf(current));
    }

    private static BigDecimal filledOf(Order order) {
        return order == null || order.filledSize() == null ? BigDecimal.ZERO : order.filledSize();
    }

    private boolean isStale() {
        return finished || ctx.state().generation() != generation;
    }

    private Order lookup(String orderId) {
        if (OmsState.isBlank(orderId)) {
            return null;
        }
        try {
            return ctx.trading().gateway().getOrder(orderId).orElse(null);
        } catch (TradingException e) {
            log.debug("order lookup failed {}: {}", orderId, e.getMessage());
            return null;
        }
    }

    private void finish() {
        finished = true;
        ScheduledFuture<?> s = schedule;
        if (s != null) {
            s.cancel(false);
        }
        ctx.state().unregisterMonitor(entryOrderId(), this);
    }
}
