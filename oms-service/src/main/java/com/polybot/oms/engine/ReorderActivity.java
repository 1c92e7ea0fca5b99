package com.polybot.oms.engine;

import java.time.Clock;
import java.time.Instant;

/**
 * What the hedge monitors did most recently, kept for status surfaces.
 */
public class ReorderActivity {

    public static final String IDLE = "idle";
    public static final String CANCELING = "canceling";
    public static final String REORDERING = "reordering";
    public static final String FAK_EATING = "fak_eating";

    public record Snapshot(
            String action,
            String entryOrderId,
            String hedgeOrderId,
            Instant at,
            String description,
            int totalReorders,
            int totalFakEats,
            int oldPriceCents,
            int newPriceCents,
            int priceChangeCents,
            String strategy,
            int entryCostCents,
            int marketAskCents,
            int idealPriceCents,
            int totalCostCents,
            int profitCents
    ) {}

    private final Clock clock;

    private String action = IDLE;
    private String entryOrderId = "";
    private String hedgeOrderId = "";
    private Instant at;
    private String description = "";
    private int totalReorders;
    private int totalFakEats;
    private int oldPriceCents;
    private int newPriceCents;
    private String strategy = "";
    private int entryCostCents;
    private int marketAskCents;
    private int idealPriceCents;
    private int totalCostCents;
    private int profitCents;

    public ReorderActivity(Clock clock) {
        this.clock = clock;
    }

    synchronized void canceling(String entry, String hedge, int oldPrice) {
        mark(CANCELING, entry, hedge, "canceling hedge " + hedge);
        this.oldPriceCents = oldPrice;
    }

    synchronized void pricing(String strategy, int entryCost, int marketAsk, int ideal, int newPrice) {
        this.strategy = strategy;
        this.entryCostCents = entryCost;
        this.marketAskCents = marketAsk;
        this.idealPriceCents = ideal;
        this.totalCostCents = entryCost + newPrice;
        this.profitCents = 100 - entryCost - newPrice;
    }

    synchronized void reordered(String entry, String oldHedge, String newHedge, int oldPrice, int newPrice) {
        mark(REORDERING, entry, newHedge,
                String.format("reordered %s -> %s at %dc (was %dc)", oldHedge, newHedge, newPrice, oldPrice));
        this.oldPriceCents = oldPrice;
        this.newPriceCents = newPrice;
        this.totalReorders++;
    }

    synchronized void fakEating(String entry, String hedge) {
        mark(FAK_EATING, entry, hedge, "forcing hedge fill for entry " + entry);
    }

    synchronized void fakEaten() {
        this.totalFakEats++;
        this.action = IDLE;
    }

    synchronized void idle() {
        this.action = IDLE;
    }

    /**
     * Returns to idle only if nothing newer has been recorded since {@code since}.
     */
    synchronized void idleIfUnchangedSince(Instant since) {
        if (at != null && !at.isAfter(since)) {
            this.action = IDLE;
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(action, entryOrderId, hedgeOrderId, at, description, totalReorders, totalFakEats,
                oldPriceCents, newPriceCents, newPriceCents - oldPriceCents, strategy, entryCostCents,
                marketAskCents, idealPriceCents, totalCostCents, profitCents);
    }

    private void mark(String newAction, String entry, String hedge, String desc) {
        this.action = newAction;
        this.entryOrderId = entry;
        this.hedgeOrderId = hedge;
        this.description = desc;
        this.at = clock.instant();
    }
}
