package com.polybot.oms.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="oms")
public record OmsProperties(
    /**
     * Prefix used to name multi-leg requests so orders of different strategies are told apart.
     */
    String strategyId,
    @Valid Execution execution,
    @Valid Hedge hedge,
    @Valid Risk risk,
    @Valid EntryBudget entryBudget,
    @Valid PriceStop priceStop,
    @Valid Gate gate,
    @Valid Limits limits,
    @Valid Settlement settlement,
    @Valid Metrics metrics,
    @Valid Paper paper
) {

  public OmsProperties {
    if (strategyId == null || strategyId.isBlank()) {
      strategyId = "strategy";
    }
    if (execution == null) {
      execution = defaultExecution();
    }
    if (hedge == null) {
      hedge = defaultHedge();
    }
    if (risk == null) {
      risk = defaultRisk();
    }
    if (entryBudget == null) {
      entryBudget = defaultEntryBudget();
    }
    if (priceStop == null) {
      priceStop = defaultPriceStop();
    }
    if (gate == null) {
      gate = defaultGate();
    }
    if (limits == null) {
      limits = defaultLimits();
    }
    if (settlement == null) {
      settlement = defaultSettlement();
    }
    if (metrics == null) {
      metrics = defaultMetrics();
    }
    if (paper == null) {
      paper = defaultPaper();
    }
  }

  public static OmsProperties defaults() {
    return new OmsProperties(null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Execution defaultExecution() {
    return new Execution(null, null, null);
  }

  private static Hedge defaultHedge() {
    return new Hedge(null, null, null, null, null, null, null, null, null);
  }

  private static Risk defaultRisk() {
    return new Risk(null, null, null);
  }

  private static EntryBudget defaultEntryBudget() {
    return new EntryBudget(null, null, null, null, null);
  }

  private static PriceStop defaultPriceStop() {
    return new PriceStop(null, null, null, null, null, null, null, null);
  }

  private static Gate defaultGate() {
    return new Gate(null, null, null);
  }

  private static Limits defaultLimits() {
    return new Limits(null, null, null, null);
  }

  private static Settlement defaultSettlement() {
    return new Settlement(null, null);
  }

  private static Metrics defaultMetrics() {
    return new Metrics(null);
  }

  private static Paper defaultPaper() {
    return new Paper(null, null);
  }

  public enum ExecutionMode {
    SEQUENTIAL,
    PARALLEL
  }

  public record Execution(
      /**
       * SEQUENTIAL waits for the entry fill before hedging; PARALLEL submits both legs together.
       */
      @NotNull ExecutionMode mode,
      @NotNull @Min(1) Long sequentialCheckIntervalMillis,
      @NotNull @Min(1) Long sequentialMaxWaitMillis
  ) {
    public Execution {
      if (mode == null) {
        mode = ExecutionMode.SEQUENTIAL;
      }
      if (sequentialCheckIntervalMillis == null) {
        sequentialCheckIntervalMillis = 20L;
      }
      if (sequentialMaxWaitMillis == null) {
        sequentialMaxWaitMillis = 2_000L;
      }
    }
  }

  public record Hedge(
      /**
       * Target locked profit: the ideal hedge price is 100 - entry - offset.
       */
      @NotNull @PositiveOrZero Integer offsetCents,
      /**
       * Seconds a resting hedge may stay unfilled before it is repriced.
       */
      @NotNull @PositiveOrZero Integer reorderTimeoutSeconds,
      /**
       * Seconds after the entry fill at which the hedge is forced through at the ask. 0 disables the deadline.
       */
      @NotNull @PositiveOrZero Integer fakTimeoutSeconds,
      @NotNull Boolean allowNegativeProfitOnReorder,
      @NotNull @PositiveOrZero Integer maxNegativeProfitCents,
      @NotNull @Min(1) Long checkIntervalMillis,
      @NotNull @PositiveOrZero Integer maxReorderAttempts,
      /**
       * Pause after canceling a hedge before the book is read again.
       */
      @NotNull @PositiveOrZero Long cancelSettleMillis,
      @NotNull @PositiveOrZero BigDecimal minOrderUsdc
  ) {
    public Hedge {
      if (offsetCents == null) {
        offsetCents = 1;
      }
      if (reorderTimeoutSeconds == null) {
        reorderTimeoutSeconds = 15;
      }
      if (fakTimeoutSeconds == null) {
        fakTimeoutSeconds = 0;
      }
      if (allowNegativeProfitOnReorder == null) {
        allowNegativeProfitOnReorder = false;
      }
      if (maxNegativeProfitCents == null) {
        maxNegativeProfitCents = 5;
      }
      if (checkIntervalMillis == null) {
        checkIntervalMillis = 1_000L;
      }
      if (maxReorderAttempts == null) {
        maxReorderAttempts = 10;
      }
      if (cancelSettleMillis == null) {
        cancelSettleMillis = 500L;
      }
      if (minOrderUsdc == null) {
        minOrderUsdc = new BigDecimal("1.01");
      }
    }
  }

  public record Risk(
      /**
       * When false, filled entries are not tracked as exposures.
       */
      @NotNull Boolean enabled,
      /**
       * Horizon used for the countdown shown next to each unhedged exposure.
       */
      @NotNull @PositiveOrZero Integer aggressiveHedgeTimeoutSeconds,
      @NotNull @PositiveOrZero Integer maxAcceptableLossCents
  ) {
    public Risk {
      if (enabled == null) {
        enabled = true;
      }
      if (aggressiveHedgeTimeoutSeconds == null) {
        aggressiveHedgeTimeoutSeconds = 60;
      }
      if (maxAcceptableLossCents == null) {
        maxAcceptableLossCents = 5;
      }
    }
  }

  /**
   * Per-entry guard limits. Non-positive values fall back to the built-in defaults.
   */
  public record EntryBudget(
      @NotNull Integer maxReorders,
      @NotNull Integer maxCancels,
      @NotNull Integer maxFak,
      @NotNull Integer maxAgeSeconds,
      @NotNull Integer cooldownSeconds
  ) {
    public EntryBudget {
      if (maxReorders == null) {
        maxReorders = 3;
      }
      if (maxCancels == null) {
        maxCancels = 6;
      }
      if (maxFak == null) {
        maxFak = 1;
      }
      if (maxAgeSeconds == null) {
        maxAgeSeconds = 120;
      }
      if (cooldownSeconds == null) {
        cooldownSeconds = 30;
      }
    }
  }

  public record PriceStop(
      @NotNull Boolean enabled,
      /**
       * Locked profit (cents) at or below which the soft stop counts a hit. Usually negative.
       */
      @NotNull Integer softLossCents,
      /**
       * Locked profit (cents) at or below which the hard stop fires at once.
       */
      @NotNull Integer hardLossCents,
      /**
       * Locked profit (cents) at or above which the hedge is taken immediately. 0 disables take-profit.
       */
      @NotNull Integer takeProfitCents,
      @NotNull Integer takeProfitConfirmTicks,
      /**
       * Minimum spacing between evaluations of one watch. 0 evaluates every price event.
       */
      @NotNull @PositiveOrZero Long checkIntervalMillis,
      @NotNull Integer confirmTicks,
      @NotNull @PositiveOrZero Long cancelSettleMillis
  ) {
    public PriceStop {
      if (enabled == null) {
        enabled = false;
      }
      if (softLossCents == null) {
        softLossCents = -5;
      }
      if (hardLossCents == null) {
        hardLossCents = -10;
      }
      if (takeProfitCents == null) {
        takeProfitCents = 0;
      }
      if (takeProfitConfirmTicks == null) {
        takeProfitConfirmTicks = 2;
      }
      if (checkIntervalMillis == null) {
        checkIntervalMillis = 0L;
      }
      if (confirmTicks == null) {
        confirmTicks = 2;
      }
      if (cancelSettleMillis == null) {
        cancelSettleMillis = 200L;
      }
    }
  }

  public record Gate(
      @NotNull @Min(1) Integer capacity,
      /**
       * Minimum spacing between two consecutive completed writes.
       */
      @NotNull @PositiveOrZero Long minIntervalMillis,
      /**
       * How long a caller waits for admission and completion of one write.
       */
      @NotNull @Min(1) Long timeoutMillis
  ) {
    public Gate {
      if (capacity == null) {
        capacity = 256;
      }
      if (minIntervalMillis == null) {
        minIntervalMillis = 25L;
      }
      if (timeoutMillis == null) {
        timeoutMillis = 10_000L;
      }
    }
  }

  public record Limits(
      @NotNull Double reorderCapacity,
      @NotNull Double reorderRefillPerMinute,
      @NotNull Double fakCapacity,
      @NotNull Double fakRefillPerMinute
  ) {
    public Limits {
      if (reorderCapacity == null) {
        reorderCapacity = 30.0;
      }
      if (reorderRefillPerMinute == null) {
        reorderRefillPerMinute = 30.0;
      }
      if (fakCapacity == null) {
        fakCapacity = 10.0;
      }
      if (fakRefillPerMinute == null) {
        fakRefillPerMinute = 10.0;
      }
    }
  }

  public record Settlement(
      /**
       * Delay between a hedge fill and the merge call, letting position data propagate.
       */
      @NotNull @PositiveOrZero Integer mergeTriggerDelaySeconds,
      @NotNull @PositiveOrZero Long reconcileSettleMillis
  ) {
    public Settlement {
      if (mergeTriggerDelaySeconds == null || mergeTriggerDelaySeconds <= 0) {
        mergeTriggerDelaySeconds = 15;
      }
      if (reconcileSettleMillis == null) {
        reconcileSettleMillis = 500L;
      }
    }
  }

  public record Metrics(@NotNull @Min(1) Integer logIntervalSeconds) {
    public Metrics {
      if (logIntervalSeconds == null) {
        logIntervalSeconds = 30;
      }
    }
  }

  public record Paper(
      /**
       * When enabled, the in-memory paper exchange backs the trading gateway.
       */
      @NotNull Boolean enabled,
      /**
       * FAK orders priced at or above the ask fill in full; otherwise they are canceled.
       */
      @NotNull Boolean fillFakAtOrAboveAsk
  ) {
    public Paper {
      if (enabled == null) {
        enabled = true;
      }
      if (fillFakAtOrAboveAsk == null) {
        fillFakAtOrAboveAsk = true;
      }
    }
  }
}
