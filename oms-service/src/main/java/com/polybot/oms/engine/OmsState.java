package com.polybot.oms.engine;

import com.polybot.oms.engine.model.Cooldown;
import com.polybot.oms.engine.model.EntryBudget;
import com.polybot.oms.engine.model.Exposure;
import com.polybot.oms.engine.model.PriceStopWatch;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Every per-entry and per-market map of the coordinator, guarded by one read/write lock.
 *
 * Components never keep their own copy of this state; they go through the accessors below or, inside this
 * package, through {@link #read} and {@link #write}. The write lock must never be requested while the calling
 * thread holds the read lock. No I/O happens while either lock is held.
 */
public class OmsState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // entry order id -> current hedge order id
    private final Map<String, String> pendingHedges = new LinkedHashMap<>();
    private final Map<String, PriceStopWatch> priceStopWatches = new LinkedHashMap<>();
    private final Map<String, EntryBudget> entryBudgets = new HashMap<>();
    private final Map<String, Cooldown> cooldowns = new HashMap<>();
    private final Map<String, Exposure> exposures = new LinkedHashMap<>();
    private final Set<String> hedgeFallbacks = new HashSet<>();
    // entries that have had a hedge recorded this cycle, filled or not
    private final Set<String> hedgedEntries = new HashSet<>();
    private final Map<String, HedgeReorderMonitor> monitors = new HashMap<>();
    // entry order id -> shares filled on hedges that were since replaced
    private final Map<String, BigDecimal> replacedHedgeFills = new HashMap<>();
    private long generation;

    <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Raw maps, valid only under the matching lock.

    Map<String, PriceStopWatch> priceStopWatches() {
        return priceStopWatches;
    }

    Map<String, EntryBudget> entryBudgets() {
        return entryBudgets;
    }

    Map<String, Cooldown> cooldowns() {
        return cooldowns;
    }

    Map<String, Exposure> exposures() {
        return exposures;
    }

    public Optional<String> pendingHedge(String entryOrderId) {
        return read(() -> Optional.ofNullable(pendingHedges.get(entryOrderId)));
    }

    public void recordPendingHedge(String entryOrderId, String hedgeOrderId) {
        if (isBlank(entryOrderId) || isBlank(hedgeOrderId)) {
            return;
        }
        write(() -> {
            pendingHedges.put(entryOrderId, hedgeOrderId);
            hedgedEntries.add(entryOrderId);
        });
    }

    /**
     * Swaps the entry's pending hedge from {@code expectedHedgeId} to {@code newHedgeId} and adds the shares the
     * replaced hedge had filled to the entry's running total.
     *
     * @param cycle generation the caller observed, see {@link #generation()}
     * @return false, with nothing written, when the cycle was reset or the pending hedge is no longer the expected one
     */
    public boolean replacePendingHedgeIf(long cycle, String entryOrderId, String expectedHedgeId, String newHedgeId,
                                         BigDecimal replacedFilled) {
        if (isBlank(entryOrderId) || isBlank(newHedgeId)) {
            return false;
        }
        return write(() -> {
            if (cycle != generation || !Objects.equals(pendingHedges.get(entryOrderId), expectedHedgeId)) {
                return false;
            }
            pendingHedges.put(entryOrderId, newHedgeId);
            hedgedEntries.add(entryOrderId);
            if (replacedFilled != null && replacedFilled.signum() > 0) {
                replacedHedgeFills.merge(entryOrderId, replacedFilled, BigDecimal::add);
            }
            return true;
        });
    }

    /**
     * Shares filled on the entry's earlier, replaced hedges.
     */
    public BigDecimal replacedHedgeFill(String entryOrderId) {
        return read(() -> replacedHedgeFills.getOrDefault(entryOrderId, BigDecimal.ZERO));
    }

    /**
     * Incremented by every {@link #reset()}.
     */
    public long generation() {
        return read(() -> generation);
    }

    /**
     * Removes the entry's pending hedge only when it is one of {@code expectedHedgeIds}.
     *
     * @return true when a mapping was removed
     */
    public boolean removePendingHedgeIf(String entryOrderId, String... expectedHedgeIds) {
        return write(() -> {
            String current = pendingHedges.get(entryOrderId);
            if (current == null) {
                return false;
            }
            for (String expected : expectedHedgeIds) {
                if (current.equals(expected)) {
                    pendingHedges.remove(entryOrderId);
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Finds the entry whose pending hedge is {@code hedgeOrderId}, falling back to {@code linkedEntryId} when its
     * pending hedge matches.
     */
    public Optional<String> entryForHedge(String hedgeOrderId, String linkedEntryId) {
        return read(() -> {
            for (Map.Entry<String, String> e : pendingHedges.entrySet()) {
                if (e.getValue().equals(hedgeOrderId)) {
                    return Optional.of(e.getKey());
                }
            }
            if (!isBlank(linkedEntryId) && Objects.equals(pendingHedges.get(linkedEntryId), hedgeOrderId)) {
                return Optional.of(linkedEntryId);
            }
            return Optional.empty();
        });
    }

    public boolean isPendingHedgeOrEntry(String orderId) {
        return read(() -> pendingHedges.containsKey(orderId));
    }

    public Map<String, String> pendingHedgesSnapshot() {
        return read(() -> new LinkedHashMap<>(pendingHedges));
    }

    public int pendingHedgeCount() {
        return read(pendingHedges::size);
    }

    public int exposureCount() {
        return read(exposures::size);
    }

    /**
     * True once any hedge has been recorded for the entry, even if it has filled since.
     */
    public boolean hasHadHedge(String entryOrderId) {
        return read(() -> hedgedEntries.contains(entryOrderId));
    }

    /**
     * Marks a one-shot hedge fallback for the entry.
     *
     * @return false when one was already scheduled
     */
    public boolean markHedgeFallback(String entryOrderId) {
        return write(() -> hedgeFallbacks.add(entryOrderId));
    }

    /**
     * Registers the monitor of an entry unless one is already running.
     */
    boolean registerMonitor(String entryOrderId, HedgeReorderMonitor monitor) {
        return write(() -> monitors.putIfAbsent(entryOrderId, monitor) == null);
    }

    void unregisterMonitor(String entryOrderId, HedgeReorderMonitor monitor) {
        write(() -> {
            monitors.remove(entryOrderId, monitor);
        });
    }

    List<HedgeReorderMonitor> monitorsSnapshot() {
        return read(() -> new ArrayList<>(monitors.values()));
    }

    /**
     * Clears every map at once and hands back the monitors that were running so the caller can stop them.
     */
    List<HedgeReorderMonitor> reset() {
        return write(() -> {
            List<HedgeReorderMonitor> running = new ArrayList<>(monitors.values());
            pendingHedges.clear();
            priceStopWatches.clear();
            entryBudgets.clear();
            cooldowns.clear();
            exposures.clear();
            hedgeFallbacks.clear();
            hedgedEntries.clear();
            monitors.clear();
            replacedHedgeFills.clear();
            generation++;
            return running;
        });
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
