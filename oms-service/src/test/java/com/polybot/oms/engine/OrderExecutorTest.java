package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.Decision;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.sim.PaperTradingGateway;
import com.polybot.oms.support.MutableClock;
import com.polybot.oms.trading.SettlementGateway;
import com.polybot.oms.trading.TradingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static com.polybot.oms.engine.OmsFixtures.MARKET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class OrderExecutorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private SettlementGateway settlement;

    @Mock
    private ScheduledExecutorService scheduler;

    private MutableClock clock;
    private PaperTradingGateway paper;
    private OmsContext ctx;
    private OrderExecutor executor;
    private final List<Order[]> launched = new ArrayList<>();

    @AfterEach
    void tearDown() {
        if (ctx != null) {
            ctx.trading().close();
        }
    }

    private void setUp(OmsProperties properties, int yesAsk, int noAsk) {
        clock = new MutableClock(NOW);
        paper = new PaperTradingGateway(new OmsProperties.Paper(true, true), clock);
        paper.setCurrentMarket(MARKET);
        paper.updateBook(OmsFixtures.book(yesAsk, noAsk));
        ctx = OmsFixtures.context(properties, paper, settlement, scheduler, clock);
        executor = new OrderExecutor(ctx, (market, entry, hedge) -> launched.add(new Order[]{entry, hedge}));
    }

    private static Decision decision(int entryCents, int hedgeCents, String entrySize, String hedgeSize) {
        return new Decision(TokenType.UP, Price.ofCents(entryCents), Price.ofCents(hedgeCents),
                new BigDecimal(entrySize), new BigDecimal(hedgeSize));
    }

    @Test
    void shouldHedgeFilledEntrySequentially() {
        // Given: ideal 59 would cross the 58c ask
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, false), null), 40, 58);

        // When
        List<Order> orders = executor.execute(MARKET, decision(40, 59, "10", "12"));

        // Then
        Order entry = orders.get(0);
        Order hedge = orders.get(1);
        assertThat(entry.isFilled()).isTrue();
        assertThat(entry.size()).isEqualByComparingTo("10");
        assertThat(hedge.tokenType()).isEqualTo(TokenType.DOWN);
        assertThat(hedge.price().toCents()).isEqualTo(57);
        assertThat(hedge.size()).isEqualByComparingTo("10");
        assertThat(hedge.orderType()).isEqualTo(OrderType.GTC);
        assertThat(hedge.linkedOrderId()).isEqualTo(entry.orderId());
        assertThat(hedge.disableSizeAdjust()).isTrue();
        assertThat(ctx.state().pendingHedge(entry.orderId())).contains(hedge.orderId());
        assertThat(launched).hasSize(1);
        assertThat(launched.get(0)[1].orderId()).isEqualTo(hedge.orderId());
    }

    @Test
    void shouldSendSmallHedgeImmediateOrCancel() {
        // Given
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, false), null), 40, 58);

        // When
        List<Order> orders = executor.execute(MARKET, decision(40, 59, "3", "3"));

        // Then
        assertThat(orders.get(1).orderType()).isEqualTo(OrderType.FAK);
        assertThat(orders.get(1).size()).isEqualByComparingTo("3");
    }

    @Test
    void shouldFailWhenEntryDoesNotFill() {
        // Given: entry limit below the ask is canceled by the paper exchange
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, false), null), 45, 58);

        // When / Then
        assertThatThrownBy(() -> executor.execute(MARKET, decision(40, 59, "10", "10")))
                .isInstanceOf(TradingException.class)
                .hasMessageContaining("not filled");
        assertThat(ctx.state().pendingHedgeCount()).isZero();
        assertThat(launched).isEmpty();
    }

    @Test
    void shouldSubmitBothLegsTogetherInParallelMode() {
        // Given
        OmsProperties properties = OmsFixtures.properties(
                new OmsProperties.Execution(OmsProperties.ExecutionMode.PARALLEL, 1L, 5L),
                OmsFixtures.hedge(0, false), null, null);
        setUp(properties, 40, 58);

        // When
        List<Order> orders = executor.execute(MARKET, decision(40, 59, "10", "10"));

        // Then
        Order entry = orders.get(0);
        Order hedge = orders.get(1);
        assertThat(entry.entry()).isTrue();
        assertThat(entry.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(hedge.entry()).isFalse();
        assertThat(hedge.status()).isEqualTo(OrderStatus.OPEN);
        assertThat(hedge.price().toCents()).isEqualTo(57);
        assertThat(hedge.bypassRiskOff()).isTrue();
        assertThat(ctx.state().pendingHedge(entry.orderId())).contains(hedge.orderId());
        assertThat(launched).isEmpty();
    }

    @Test
    void shouldRejectInvalidRequests() {
        // Given
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, false), null), 40, 58);

        // When / Then
        assertThatThrownBy(() -> executor.execute(new Market("m", "", "no"), decision(40, 59, "10", "10")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(MARKET, new Decision(null, Price.ofCents(40), Price.ofCents(59),
                BigDecimal.TEN, BigDecimal.TEN)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(MARKET, decision(0, 59, "10", "10")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(MARKET, decision(40, 59, "0", "10")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPayUpToNegativeProfitAllowanceForInitialHedge() {
        // Given: ideal 59, allowance 5
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, true), null), 40, 62);

        // When
        Price withinAllowance = executor.calcInitialHedgePrice(MARKET, TokenType.UP, 40, Price.ofCents(50));
        paper.updateBook(OmsFixtures.book(40, 70));
        Price capped = executor.calcInitialHedgePrice(MARKET, TokenType.UP, 40, Price.ofCents(50));

        // Then
        assertThat(withinAllowance.toCents()).isEqualTo(62);
        assertThat(capped.toCents()).isEqualTo(64);
    }

    @Test
    void shouldCapInitialHedgeByHardStop() {
        // Given
        OmsProperties properties = OmsFixtures.properties(OmsFixtures.hedge(0, true), OmsFixtures.priceStop(-2, -3, 0));
        setUp(properties, 40, 70);

        // When
        Price price = executor.calcInitialHedgePrice(MARKET, TokenType.UP, 40, Price.ofCents(50));

        // Then
        assertThat(price.toCents()).isEqualTo(62);
    }

    @Test
    void shouldFallBackWithoutEntryPrice() {
        // Given
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, false), null), 40, 58);

        // When
        Price price = executor.calcInitialHedgePrice(MARKET, TokenType.UP, 0, Price.ofCents(50));

        // Then
        assertThat(price.toCents()).isEqualTo(50);
    }

    @Test
    void shouldPayExtraForOpenRiskAndSlowHedges() {
        // Given
        setUp(OmsFixtures.properties(OmsFixtures.hedge(0, true), null), 40, 58);
        assertThat(executor.hedgePriceExtraCents(MARKET.slug())).isZero();
        for (int i = 0; i < 4; i++) {
            ctx.state().recordPendingHedge("e" + i, "h" + i);
        }
        Order entry = OmsFixtures.fillEntry(paper, TokenType.UP, 40, "10", clock);
        ctx.riskRegistry().registerEntry(entry, "");

        // When
        int withRisk = executor.hedgePriceExtraCents(MARKET.slug());
        ctx.timing().recordEntryFilled("e-slow", MARKET.slug(), NOW);
        ctx.timing().recordHedgeFilled("e-slow", NOW.plus(Duration.ofSeconds(30)));
        int withSlowHedges = executor.hedgePriceExtraCents(MARKET.slug());

        // Then: 2 + 3 pending, then capped at 8
        assertThat(withRisk).isEqualTo(5);
        assertThat(withSlowHedges).isEqualTo(8);
    }
}
