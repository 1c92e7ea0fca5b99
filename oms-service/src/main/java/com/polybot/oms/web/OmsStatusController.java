package com.polybot.oms.web;

import com.polybot.oms.domain.Market;
import com.polybot.oms.engine.OrderManagementSystem;
import com.polybot.oms.engine.model.OpsMetrics;
import com.polybot.oms.engine.model.PriceStopWatchesStatus;
import com.polybot.oms.engine.model.RiskManagementStatus;
import com.polybot.oms.trading.TradingGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/oms")
@RequiredArgsConstructor
public class OmsStatusController {

    private final @NonNull OrderManagementSystem oms;
    private final @NonNull TradingGateway tradingGateway;

    @GetMapping("/status")
    public ResponseEntity<OmsStatusResponse> status() {
        String market = currentMarketSlug();
        return ResponseEntity.ok(new OmsStatusResponse(
                market,
                oms.getOpsMetrics(market),
                oms.getPendingHedges(),
                market != null && oms.hasUnhedgedRisk(market)
        ));
    }

    @GetMapping("/risk")
    public ResponseEntity<RiskManagementStatus> risk() {
        return ResponseEntity.ok(oms.getRiskManagementStatus());
    }

    @GetMapping("/price-stops")
    public ResponseEntity<PriceStopWatchesStatus> priceStops() {
        return ResponseEntity.ok(oms.getPriceStopWatchesStatus(currentMarketSlug()));
    }

    private String currentMarketSlug() {
        return tradingGateway.getCurrentMarketInfo().map(Market::slug).orElse(null);
    }

    public record OmsStatusResponse(
            String market,
            OpsMetrics metrics,
            Map<String, String> pendingHedges,
            boolean unhedgedRisk
    ) {
    }
}
