package com.polybot.oms.engine;

import com.polybot.oms.engine.model.Cooldown;
import com.polybot.oms.engine.model.CooldownStatus;
import com.polybot.oms.engine.model.EntryBudget;
import com.polybot.oms.engine.model.EntryGuardLimits;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Per-entry retry budget and per-market cooldown ledger.
 *
 * Reorders are refused once the budget or the entry's age is exhausted. Cancels and forced fills are never refused,
 * only counted; overrunning their limits puts the market into cooldown so that no new entries are opened there.
 */
@Slf4j
public class EntryGuard {

    private final OmsState state;
    private final EntryGuardLimits limits;
    private final Clock clock;

    public EntryGuard(OmsState state, EntryGuardLimits limits, Clock clock) {
        this.state = state;
        this.limits = limits;
        this.clock = clock;
    }

    public EntryGuardLimits limits() {
        return limits;
    }

    /**
     * Creates the budget of an entry if it has none yet. A null start time means now.
     */
    public void initEntryBudget(String entryOrderId, String marketSlug, Instant startedAt) {
        if (OmsState.isBlank(entryOrderId)) {
            return;
        }
        state.write(() -> {
            budgetLocked(entryOrderId, marketSlug, startedAt);
        });
    }

    /**
     * Consumes one reorder from the entry's budget.
     *
     * @return false, with the market put into cooldown, when the entry is too old or has no reorders left
     */
    public boolean consumeReorderAttempt(String entryOrderId, String marketSlug, Instant startedAt) {
        if (OmsState.isBlank(entryOrderId)) {
            return true;
        }
        Instant now = clock.instant();
        return state.write(() -> {
            EntryBudget budget = budgetLocked(entryOrderId, marketSlug, startedAt);
            Duration age = Duration.between(budget.getStartedAt(), now);
            if (age.compareTo(limits.maxAge()) > 0) {
                cooldownLocked(marketSlug, limits.cooldown(),
                        String.format(Locale.ROOT, "entry_age_exceeded %.0fs", age.toMillis() / 1000.0), now);
                return false;
            }
            if (budget.getReorders() >= limits.maxReorders()) {
                cooldownLocked(marketSlug, limits.cooldown(), "entry_reorder_exceeded " + budget.getReorders(), now);
                return false;
            }
            budget.setReorders(budget.getReorders() + 1);
            return true;
        });
    }

    public void recordCancel(String entryOrderId, String marketSlug) {
        if (OmsState.isBlank(entryOrderId)) {
            return;
        }
        Instant now = clock.instant();
        state.write(() -> {
            EntryBudget budget = budgetLocked(entryOrderId, marketSlug, now);
            budget.setCancels(budget.getCancels() + 1);
            if (budget.getCancels() > limits.maxCancels()) {
                cooldownLocked(marketSlug, limits.cooldown(), "entry_cancel_exceeded " + budget.getCancels(), now);
            }
        });
    }

    public void recordFak(String entryOrderId, String marketSlug) {
        if (OmsState.isBlank(entryOrderId)) {
            return;
        }
        Instant now = clock.instant();
        state.write(() -> {
            EntryBudget budget = budgetLocked(entryOrderId, marketSlug, now);
            budget.setFaks(budget.getFaks() + 1);
            if (budget.getFaks() > limits.maxFak()) {
                cooldownLocked(marketSlug, limits.cooldown(), "entry_fak_exceeded " + budget.getFaks(), now);
            }
        });
    }

    public void clearEntryBudget(String entryOrderId) {
        if (OmsState.isBlank(entryOrderId)) {
            return;
        }
        state.write(() -> {
            state.entryBudgets().remove(entryOrderId);
        });
    }

    /**
     * Puts the market into cooldown. An existing cooldown is only ever extended; the reason is always replaced.
     */
    public void setCooldown(String marketSlug, Duration duration, String reason) {
        Instant now = clock.instant();
        state.write(() -> {
            cooldownLocked(marketSlug, duration, reason, now);
        });
    }

    /**
     * Current cooldown of the market. An expired cooldown is dropped on query.
     */
    public CooldownStatus cooldownStatus(String marketSlug) {
        if (OmsState.isBlank(marketSlug)) {
            return CooldownStatus.NONE;
        }
        Instant now = clock.instant();
        Cooldown cooldown = state.read(() -> state.cooldowns().get(marketSlug));
        if (cooldown == null) {
            return CooldownStatus.NONE;
        }
        if (!now.isBefore(cooldown.until())) {
            state.write(() -> {
                Cooldown current = state.cooldowns().get(marketSlug);
                if (current != null && !now.isBefore(current.until())) {
                    state.cooldowns().remove(marketSlug);
                }
            });
            return CooldownStatus.NONE;
        }
        return new CooldownStatus(true, Duration.between(now, cooldown.until()), cooldown.reason());
    }

    public boolean isMarketInCooldown(String marketSlug) {
        return cooldownStatus(marketSlug).active();
    }

    private EntryBudget budgetLocked(String entryOrderId, String marketSlug, Instant startedAt) {
        return state.entryBudgets().computeIfAbsent(entryOrderId,
                id -> new EntryBudget(marketSlug, startedAt == null ? clock.instant() : startedAt));
    }

    private void cooldownLocked(String marketSlug, Duration duration, String reason, Instant now) {
        if (OmsState.isBlank(marketSlug)) {
            return;
        }
        Duration d = duration == null || duration.isZero() || duration.isNegative() ? Duration.ofSeconds(30) : duration;
        Instant until = now.plus(d);
        Cooldown existing = state.cooldowns().get(marketSlug);
        if (existing != null && existing.until().isAfter(until)) {
            until = existing.until();
        }
        state.cooldowns().put(marketSlug, new Cooldown(until, reason));
        log.warn("market {} in cooldown until {} ({})", marketSlug, until, reason);
    }
}
