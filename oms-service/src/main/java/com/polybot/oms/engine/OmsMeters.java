package com.polybot.oms.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer meters of the coordinator. Counter values also feed {@code getOpsMetrics}.
 */
public class OmsMeters {

    private final MeterRegistry registry;
    private final Counter reorderBudgetSkips;
    private final Counter fakBudgetWarnings;
    private final Counter hedgeReorders;
    private final Counter forcedFills;

    public OmsMeters(MeterRegistry registry) {
        this.registry = registry;
        this.reorderBudgetSkips = Counter.builder("oms.reorder.budget.skips")
                .description("Reprices postponed by the reorder rate limit")
                .register(registry);
        this.fakBudgetWarnings = Counter.builder("oms.fak.budget.warnings")
                .description("Forced fills sent although the forced-fill rate limit was exhausted")
                .register(registry);
        this.hedgeReorders = Counter.builder("oms.hedge.reorders")
                .description("Hedges canceled and replaced at a new price")
                .register(registry);
        this.forcedFills = Counter.builder("oms.hedge.forced.fills")
                .description("Immediate-or-cancel hedges sent by the reorder monitor")
                .register(registry);
    }

    /**
     * Registers the state gauges. Called once the coordinator exists.
     */
    public void bindGauges(OmsState state, Supplier<Integer> queueLength) {
        Gauge.builder("oms.pending.hedges", state, OmsState::pendingHedgeCount)
                .description("Entries with a tracked hedge order")
                .register(registry);
        Gauge.builder("oms.exposures", state, OmsState::exposureCount)
                .description("Filled entries awaiting a filled hedge")
                .register(registry);
        Gauge.builder("oms.gate.queue.length", queueLength, s -> s.get())
                .description("Order writes waiting in the trading gate")
                .register(registry);
    }

    void reorderBudgetSkipped() {
        reorderBudgetSkips.increment();
    }

    void fakBudgetWarned() {
        fakBudgetWarnings.increment();
    }

    void hedgeReordered() {
        hedgeReorders.increment();
    }

    void forcedFill() {
        forcedFills.increment();
    }

    void priceStopTriggered(String reason) {
        Counter.builder("oms.price.stop.triggers")
                .description("Price-stop forced fills by trigger reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public long reorderBudgetSkips() {
        return (long) reorderBudgetSkips.count();
    }

    public long fakBudgetWarnings() {
        return (long) fakBudgetWarnings.count();
    }

    public long hedgeReorders() {
        return (long) hedgeReorders.count();
    }

    public long forcedFills() {
        return (long) forcedFills.count();
    }
}
