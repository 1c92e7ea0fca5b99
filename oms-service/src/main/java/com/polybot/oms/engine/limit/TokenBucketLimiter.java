package com.polybot.oms.engine.limit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-market token bucket for costly recovery actions (hedge reprices, forced fills).
 * Each market starts with a full bucket and refills continuously at {@code refillPerMinute / 60} tokens per second.
 */
public class TokenBucketLimiter {

    private final double capacity;
    private final double refillPerSecond;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new HashMap<>(64);

    public TokenBucketLimiter(double capacity, double refillPerMinute, Clock clock) {
        double cap = capacity <= 0 ? 1 : capacity;
        double refill = refillPerMinute <= 0 ? cap : refillPerMinute;
        this.capacity = cap;
        this.refillPerSecond = refill / 60.0;
        this.clock = clock;
    }

    /**
     * Debits {@code cost} tokens from the market's bucket. A denied call leaves the bucket untouched apart from refill.
     * Blank keys are never limited.
     */
    public synchronized boolean allow(String marketSlug, int cost) {
        if (marketSlug == null || marketSlug.isBlank()) {
            return true;
        }
        double debit = cost <= 0 ? 1 : cost;
        Instant now = clock.instant();
        Bucket bucket = buckets.computeIfAbsent(marketSlug, k -> new Bucket(capacity, now));

        double elapsedSeconds = Duration.between(bucket.lastRefill, now).toNanos() / 1_000_000_000.0;
        if (elapsedSeconds > 0) {
            bucket.tokens = Math.min(capacity, bucket.tokens + elapsedSeconds * refillPerSecond);
            bucket.lastRefill = now;
        }
        if (bucket.tokens >= debit) {
            bucket.tokens -= debit;
            return true;
        }
        return false;
    }

    public boolean allow(String marketSlug) {
        return allow(marketSlug, 1);
    }

    synchronized double tokens(String marketSlug) {
        Bucket bucket = buckets.get(marketSlug);
        return bucket == null ? capacity : bucket.tokens;
    }

    private static final class Bucket {
        private double tokens;
        private Instant lastRefill;

        private Bucket(double tokens, Instant lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }
    }
}
