package com.polybot.oms.engine.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Entry-to-hedge fill latency per market, smoothed with an exponentially weighted moving average.
 */
public class HedgeTimingTracker {

    static final double ALPHA = 0.2;

    private final Clock clock;
    private final Map<String, EntryFill> pendingEntries = new HashMap<>(1024);
    private final Map<String, MarketLatency> byMarket = new HashMap<>(64);

    private record EntryFill(String marketSlug, Instant at) {}

    /**
     * Smoothed latency of one market.
     */
    public record MarketLatency(double ewmaSeconds, int samples, Instant updatedAt) {}

    public HedgeTimingTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Remembers when an entry filled. Repeated updates for the same entry keep the first timestamp.
     */
    public synchronized void recordEntryFilled(String entryOrderId, String marketSlug, Instant at) {
        if (isBlank(entryOrderId) || isBlank(marketSlug)) {
            return;
        }
        pendingEntries.putIfAbsent(entryOrderId, new EntryFill(marketSlug, at != null ? at : clock.instant()));
    }

    /**
     * Folds the entry-to-hedge latency into the market average. The pending entry record is consumed,
     * so a second call for the same entry is a no-op.
     */
    public synchronized void recordHedgeFilled(String entryOrderId, Instant hedgeFilledAt) {
        if (isBlank(entryOrderId)) {
            return;
        }
        EntryFill entry = pendingEntries.remove(entryOrderId);
        if (entry == null) {
            return;
        }
        Instant filledAt = hedgeFilledAt != null ? hedgeFilledAt : clock.instant();
        double seconds = Duration.between(entry.at(), filledAt).toMillis() / 1000.0;
        if (seconds <= 0) {
            return;
        }
        MarketLatency current = byMarket.get(entry.marketSlug());
        double ewma;
        int samples;
        if (current == null || current.samples() == 0 || current.ewmaSeconds() <= 0) {
            ewma = seconds;
            samples = 1;
        } else {
            ewma = ALPHA * seconds + (1.0 - ALPHA) * current.ewmaSeconds();
            samples = current.samples() + 1;
        }
        byMarket.put(entry.marketSlug(), new MarketLatency(ewma, samples, clock.instant()));
    }

    /**
     * Forgets every entry still waiting for its hedge. Market averages are kept.
     */
    public synchronized void clearPendingEntries() {
        pendingEntries.clear();
    }

    public synchronized int pendingEntryCount() {
        return pendingEntries.size();
    }

    public synchronized double ewmaSeconds(String marketSlug) {
        MarketLatency latency = byMarket.get(marketSlug);
        return latency == null ? 0 : latency.ewmaSeconds();
    }

    public synchronized MarketLatency latency(String marketSlug) {
        return byMarket.get(marketSlug);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
