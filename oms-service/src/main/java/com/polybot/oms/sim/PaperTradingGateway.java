package com.polybot.oms.sim;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.BookSnapshot;
import com.polybot.oms.domain.LegIntent;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.MultiLegRequest;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Position;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.domain.TopOfBook;
import com.polybot.oms.trading.OrderRejectedException;
import com.polybot.oms.trading.OrderUpdateListener;
import com.polybot.oms.trading.TradingException;
import com.polybot.oms.trading.TradingGateway;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory trading substrate for paper trading and tests.
 *
 * Immediate-or-cancel orders fill in full at the ask when their limit reaches it and are canceled otherwise.
 * Resting orders stay open until {@link #fillOrder} or a cancel. Every status change is pushed to the registered
 * listeners on the calling thread.
 */
@Slf4j
public class PaperTradingGateway implements TradingGateway {

    private final OmsProperties.Paper config;
    private final Clock clock;

    private final ConcurrentMap<String, Order> ordersById = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BigDecimal> positionsByKey = new ConcurrentHashMap<>();
    private final List<OrderUpdateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Market currentMarket;
    private volatile TopOfBook topOfBook;
    private volatile Instant bookUpdatedAt;

    public PaperTradingGateway(OmsProperties.Paper config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void addListener(OrderUpdateListener listener) {
        listeners.add(listener);
    }

    public void setCurrentMarket(Market market) {
        this.currentMarket = market;
        log.info("paper market set to {}", market == null ? "-" : market.slug());
    }

    /**
     * Replaces the book and stamps it with the current time.
     */
    public void updateBook(TopOfBook book) {
        this.topOfBook = book;
        this.bookUpdatedAt = clock.instant();
    }

    @Override
    public Order placeOrder(Order order) {
        if (order == null || order.price() == null || !order.price().isPositive()
                || order.size() == null || order.size().signum() <= 0) {
            throw new OrderRejectedException("paper order needs a positive price and size");
        }
        Instant now = clock.instant();
        Order placed = order.withOrderId("paper-" + UUID.randomUUID()).withStatus(OrderStatus.OPEN);
        if (placed.orderType() == OrderType.FAK) {
            Price ask = topOfBook == null ? Price.ZERO : topOfBook.askFor(placed.tokenType());
            boolean crosses = ask.isPositive() && placed.price().pips() >= ask.pips();
            if (Boolean.TRUE.equals(config.fillFakAtOrAboveAsk()) && crosses) {
                placed = placed.withFill(OrderStatus.FILLED, placed.size(), ask, now);
                addPosition(placed, placed.size());
            } else {
                placed = placed.withStatus(OrderStatus.CANCELED);
            }
        }
        ordersById.put(placed.orderId(), placed);
        log.debug("paper order {} {} {} {}@{} -> {}", placed.orderId(), placed.orderType(), placed.tokenType(),
                placed.size(), placed.price(), placed.status());
        publish(placed);
        return placed;
    }

    @Override
    public void cancelOrder(String orderId) {
        Order order = ordersById.get(orderId);
        if (order == null) {
            throw new OrderRejectedException("unknown paper order " + orderId);
        }
        if (order.isTerminal()) {
            return;
        }
        Order canceled = order.withStatus(OrderStatus.CANCELED);
        ordersById.put(orderId, canceled);
        publish(canceled);
    }

    /**
     * Fills {@code size} more shares of a resting order at its limit price.
     */
    public Order fillOrder(String orderId, BigDecimal size) {
        Order order = ordersById.get(orderId);
        if (order == null) {
            throw new TradingException("unknown paper order " + orderId);
        }
        if (order.isTerminal()) {
            return order;
        }
        BigDecimal remaining = order.size().subtract(order.filledSize());
        BigDecimal fill = size == null || size.compareTo(remaining) > 0 ? remaining : size;
        BigDecimal filled = order.filledSize().add(fill);
        OrderStatus status = filled.compareTo(order.size()) >= 0 ? OrderStatus.FILLED : OrderStatus.PARTIAL;
        Order updated = order.withFill(status, filled, order.price(), clock.instant());
        ordersById.put(orderId, updated);
        addPosition(updated, fill);
        publish(updated);
        return updated;
    }

    public Order fillOrder(String orderId) {
        return fillOrder(orderId, null);
    }

    @Override
    public List<Order> executeMultiLeg(MultiLegRequest request) {
        List<Order> created = new ArrayList<>();
        for (LegIntent leg : request.legs()) {
            Order order = new Order(null, request.marketSlug(), leg.assetId(), leg.tokenType(), leg.side(), leg.price(),
                    leg.size(), leg.orderType(), OrderStatus.PENDING, leg.entry(), null, BigDecimal.ZERO, null, null,
                    clock.instant(), leg.disableSizeAdjust(), leg.bypassRiskOff());
            created.add(placeOrder(order));
        }
        log.debug("paper multi-leg {} placed {} orders", request.name(), created.size());
        return created;
    }

    @Override
    public Optional<Order> getOrder(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ordersById.get(orderId));
    }

    @Override
    public TopOfBook getTopOfBook(Market market) {
        TopOfBook book = topOfBook;
        if (book == null) {
            throw new TradingException("no paper book for " + (market == null ? "-" : market.slug()));
        }
        return book;
    }

    @Override
    public Optional<BookSnapshot> bestBookSnapshot() {
        TopOfBook book = topOfBook;
        if (book == null) {
            return Optional.empty();
        }
        return Optional.of(new BookSnapshot(book.yesBid(), book.yesAsk(), book.noBid(), book.noAsk(), bookUpdatedAt));
    }

    @Override
    public List<Position> getOpenPositionsForMarket(String marketSlug) {
        List<Position> positions = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> e : positionsByKey.entrySet()) {
            String[] key = e.getKey().split("\\|", 2);
            if (key[0].equals(marketSlug) && e.getValue().signum() > 0) {
                positions.add(new Position(e.getKey(), marketSlug, TokenType.valueOf(key[1]), e.getValue(), true));
            }
        }
        return positions;
    }

    @Override
    public Optional<Market> getCurrentMarketInfo() {
        return Optional.ofNullable(currentMarket);
    }

    @Override
    public void reconcileMarketPositions(Market market) {
        log.debug("paper positions are authoritative, nothing to reconcile for {}", market.slug());
    }

    private void addPosition(Order order, BigDecimal shares) {
        if (shares.signum() <= 0) {
            return;
        }
        positionsByKey.merge(order.marketSlug() + "|" + order.tokenType().name(), shares, BigDecimal::add);
    }

    private void publish(Order order) {
        for (OrderUpdateListener listener : listeners) {
            try {
                listener.onOrderUpdate(order);
            } catch (RuntimeException e) {
                log.warn("order listener failed for {}: {}", order.orderId(), e.getMessage(), e);
            }
        }
    }
}
