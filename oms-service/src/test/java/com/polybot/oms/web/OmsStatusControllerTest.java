package com.polybot.oms.web;

import com.polybot.oms.domain.Market;
import com.polybot.oms.engine.OrderManagementSystem;
import com.polybot.oms.engine.model.OpsMetrics;
import com.polybot.oms.engine.model.PriceStopWatchesStatus;
import com.polybot.oms.trading.TradingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OmsStatusControllerTest {

    private static final Market MARKET = new Market("btc-updown-15m-1", "yes", "no");

    @Mock
    private OrderManagementSystem oms;

    @Mock
    private TradingGateway tradingGateway;

    private OmsStatusController controller;

    @BeforeEach
    void setUp() {
        controller = new OmsStatusController(oms, tradingGateway);
    }

    @Test
    void shouldReportStatusOfCurrentMarket() {
        // Given
        OpsMetrics metrics = new OpsMetrics(0, 1, 1, 4.5, 0, 0, 0, "");
        when(tradingGateway.getCurrentMarketInfo()).thenReturn(Optional.of(MARKET));
        when(oms.getOpsMetrics(MARKET.slug())).thenReturn(metrics);
        when(oms.getPendingHedges()).thenReturn(Map.of("e1", "h1"));
        when(oms.hasUnhedgedRisk(MARKET.slug())).thenReturn(true);

        // When
        ResponseEntity<OmsStatusController.OmsStatusResponse> response = controller.status();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        OmsStatusController.OmsStatusResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.market()).isEqualTo(MARKET.slug());
        assertThat(body.metrics()).isEqualTo(metrics);
        assertThat(body.pendingHedges()).containsEntry("e1", "h1");
        assertThat(body.unhedgedRisk()).isTrue();
    }

    @Test
    void shouldSkipRiskCheckWithoutMarket() {
        // Given
        when(tradingGateway.getCurrentMarketInfo()).thenReturn(Optional.empty());
        when(oms.getPendingHedges()).thenReturn(Map.of());

        // When
        OmsStatusController.OmsStatusResponse body = controller.status().getBody();

        // Then
        assertThat(body).isNotNull();
        assertThat(body.market()).isNull();
        assertThat(body.unhedgedRisk()).isFalse();
        verify(oms, never()).hasUnhedgedRisk(org.mockito.ArgumentMatchers.anyString());
    }

    @Test
    void shouldReportPriceStopsOfCurrentMarket() {
        // Given
        when(tradingGateway.getCurrentMarketInfo()).thenReturn(Optional.of(MARKET));
        when(oms.getPriceStopWatchesStatus(MARKET.slug())).thenReturn(PriceStopWatchesStatus.disabled());

        // When
        ResponseEntity<PriceStopWatchesStatus> response = controller.priceStops();

        // Then
        assertThat(response.getBody()).isEqualTo(PriceStopWatchesStatus.disabled());
    }
}
