package com.polybot.oms.config;

import com.polybot.oms.engine.OrderManagementSystem;
import com.polybot.oms.sim.LoggingSettlementGateway;
import com.polybot.oms.sim.PaperTradingGateway;
import com.polybot.oms.trading.SettlementGateway;
import com.polybot.oms.trading.TradingGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the coordinator. The paper substrate and the logging settlement stand in unless real ones are provided.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OmsProperties.class)
public class OmsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "oms.paper", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PaperTradingGateway paperTradingGateway(OmsProperties properties, Clock clock) {
        log.info("paper trading substrate enabled (fillFakAtOrAboveAsk={})", properties.paper().fillFakAtOrAboveAsk());
        return new PaperTradingGateway(properties.paper(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SettlementGateway settlementGateway() {
        return new LoggingSettlementGateway();
    }

    @Bean
    public OrderManagementSystem orderManagementSystem(
            OmsProperties properties,
            TradingGateway tradingGateway,
            SettlementGateway settlementGateway,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        OrderManagementSystem oms = new OrderManagementSystem(properties, tradingGateway, settlementGateway,
                meterRegistry, clock);
        if (tradingGateway instanceof PaperTradingGateway paper) {
            paper.addListener(oms);
        }
        return oms;
    }
}
