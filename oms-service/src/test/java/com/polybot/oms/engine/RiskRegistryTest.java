package com.polybot.oms.engine;

import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.OrderStatus;
import com.polybot.oms.domain.OrderType;
import com.polybot.oms.domain.Price;
import com.polybot.oms.domain.TokenType;
import com.polybot.oms.engine.model.Exposure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class RiskRegistryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private OmsState state;
    private RiskRegistry registry;

    @BeforeEach
    void setUp() {
        state = new OmsState();
        registry = new RiskRegistry(state, 5, Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void shouldRegisterFilledEntryWithFillPrice() {
        // Given
        Order entry = filledEntry("e1", 41);

        // When
        registry.registerEntry(entry, "h1");

        // Then
        assertThat(registry.getExposures()).singleElement().satisfies(e -> {
            assertThat(e.entryOrderId()).isEqualTo("e1");
            assertThat(e.entryToken()).isEqualTo(TokenType.UP);
            assertThat(e.entryPriceCents()).isEqualTo(41);
            assertThat(e.entrySize()).isEqualByComparingTo("10");
            assertThat(e.hedgeOrderId()).isEqualTo("h1");
            assertThat(e.hedgeStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(e.maxLossCents()).isEqualTo(5);
        });
        assertThat(state.exposureCount()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreOrdersThatAreNotFilledEntries() {
        // Given
        Order open = Order.buy("m1", "yes", TokenType.UP, Price.ofCents(40), BigDecimal.TEN, OrderType.FAK, true, NOW)
                .withOrderId("e1");
        Order hedge = filledEntry("h1", 58);
        Order notEntry = new Order(hedge.orderId(), hedge.marketSlug(), hedge.assetId(), hedge.tokenType(),
                hedge.side(), hedge.price(), hedge.size(), hedge.orderType(), hedge.status(), false, null,
                hedge.filledSize(), hedge.filledPrice(), hedge.filledAt(), hedge.createdAt(), false, false);

        // When
        registry.registerEntry(open, "");
        registry.registerEntry(notEntry, "");

        // Then
        assertThat(registry.hasExposures()).isFalse();
    }

    @Test
    void shouldCloseExposureWhenHedgeFills() {
        // Given
        registry.registerEntry(filledEntry("e1", 40), "h1");

        // When
        registry.updateHedgeStatus("h1", OrderStatus.FILLED);

        // Then
        assertThat(registry.hasExposures()).isFalse();
    }

    @Test
    void shouldTrackNonTerminalHedgeStatus() {
        // Given
        registry.registerEntry(filledEntry("e1", 40), "h1");

        // When
        registry.updateHedgeStatus("h1", OrderStatus.PARTIAL);
        registry.updateHedgeStatus("other", OrderStatus.FILLED);

        // Then
        assertThat(registry.getExposures()).extracting(Exposure::hedgeStatus).containsExactly(OrderStatus.PARTIAL);
    }

    @Test
    void shouldAttachHedgeOnlyWhenNoneIsKnown() {
        // Given
        registry.registerEntry(filledEntry("e1", 40), "");
        registry.registerEntry(filledEntry("e2", 40), "h2");

        // When
        registry.updateHedgeOrderId("e1", "h1");
        registry.updateHedgeOrderId("e2", "h-late");

        // Then
        assertThat(registry.getExposures())
                .extracting(Exposure::hedgeOrderId)
                .containsExactlyInAnyOrder("h1", "h2");
    }

    @Test
    void shouldFollowReplacedHedge() {
        // Given
        registry.registerEntry(filledEntry("e1", 40), "h1");

        // When
        registry.replaceHedgeOrderId("e1", "h2");
        registry.updateHedgeStatus("h2", OrderStatus.FILLED);

        // Then
        assertThat(registry.hasExposures()).isFalse();
    }

    @Test
    void shouldMeasureExposureAge() {
        // Given
        registry.registerEntry(filledEntry("e1", 40), "h1");

        // When
        Exposure exposure = registry.getExposures().get(0);

        // Then
        assertThat(exposure.exposureSeconds(NOW.plusSeconds(12))).isEqualTo(12.0);
        assertThat(exposure.exposureSeconds(NOW.minusSeconds(5))).isZero();
    }

    private static Order filledEntry(String id, int fillCents) {
        return Order.buy("m1", "yes", TokenType.UP, Price.ofCents(45), BigDecimal.TEN, OrderType.FAK, true, NOW)
                .withOrderId(id)
                .withFill(OrderStatus.FILLED, BigDecimal.TEN, Price.ofCents(fillCents), NOW);
    }
}
