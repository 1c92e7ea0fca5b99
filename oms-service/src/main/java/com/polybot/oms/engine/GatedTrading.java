package com.polybot.oms.engine;

import com.polybot.oms.config.OmsProperties;
import com.polybot.oms.domain.MultiLegRequest;
import com.polybot.oms.domain.Order;
import com.polybot.oms.engine.gate.QueuedExecutionGate;
import com.polybot.oms.trading.TradingGateway;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes every order write through the {@link QueuedExecutionGate}. Reads go straight to the gateway.
 */
public class GatedTrading {

    private final TradingGateway gateway;
    private final OmsProperties.Gate config;
    private final AtomicReference<QueuedExecutionGate> gate = new AtomicReference<>();

    public GatedTrading(TradingGateway gateway, OmsProperties.Gate config) {
        this.gateway = gateway;
        this.config = config;
        this.gate.set(newGate());
    }

    public TradingGateway gateway() {
        return gateway;
    }

    public Order placeOrder(Order order) {
        return gate.get().submit("place_order", () -> gateway.placeOrder(order), timeout());
    }

    public void cancelOrder(String orderId) {
        gate.get().submit("cancel_order", () -> {
            gateway.cancelOrder(orderId);
            return null;
        }, timeout());
    }

    public List<Order> executeMultiLeg(MultiLegRequest request) {
        return gate.get().submit("multi_leg", () -> gateway.executeMultiLeg(request), timeout());
    }

    public int queueLength() {
        return gate.get().queueLength();
    }

    /**
     * Replaces a closed gate with a fresh one.
     */
    public void reopen() {
        QueuedExecutionGate current = gate.get();
        if (current.isClosed()) {
            gate.compareAndSet(current, newGate());
        }
    }

    public void close() {
        gate.get().close();
    }

    public boolean isClosed() {
        return gate.get().isClosed();
    }

    private QueuedExecutionGate newGate() {
        return new QueuedExecutionGate(config.capacity(), Duration.ofMillis(config.minIntervalMillis()));
    }

    private Duration timeout() {
        return Duration.ofMillis(config.timeoutMillis());
    }
}
