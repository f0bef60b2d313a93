package org.colonysim.runtime.rules;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.typesafe.config.Config;

/**
 * The colonist rules engine: the Idle/Foraging state machine plus resource and inventory
 * accounting.
 * <p>
 * All operations are pure transformations of an immutable {@link ColonistRecord}; the only
 * ambient input is the {@link Clock} used to stamp {@link ColonistRecord#lastUpdated()}.
 * Rejections are returned as {@link RuleOutcome} values and never modify the input record.
 * <p>
 * Configuration (path {@code colony.rules}):
 * <pre>
 * foraging-duration = 5
 * initial-resources { food = 100, water = 100, energy = 100 }
 * consumption {
 *   food   { interval = 5,  rate = 1 }
 *   water  { interval = 10, rate = 1 }
 *   energy { interval = 15, rate = 1 }
 * }
 * </pre>
 * <p>
 * <b>Thread safety:</b> stateless apart from its immutable settings; safe to share.
 */
public class ResourceRules {

    /**
     * How often and by how much a resource is consumed.
     *
     * @param interval consumption fires on every tick whose counter is a multiple of this.
     * @param rate     amount removed each time consumption fires.
     */
    public record Consumption(int interval, int rate) {
        public Consumption {
            if (interval <= 0) {
                throw new IllegalArgumentException("Consumption interval must be > 0, got " + interval);
            }
            if (rate < 0) {
                throw new IllegalArgumentException("Consumption rate must be >= 0, got " + rate);
            }
        }
    }

    /**
     * Result of {@link #processTick(ColonistRecord)}.
     *
     * @param record            the advanced record.
     * @param completedForaging the location whose foraging trip finished on this tick, if any.
     *                          Present exactly on the Foraging to Idle edge.
     */
    public record TickResult(ColonistRecord record, Optional<ForagingLocation> completedForaging) {
    }

    private final int foragingDuration;
    private final Resources initialResources;
    private final Map<ResourceKind, Consumption> consumption;
    private final Clock clock;

    /**
     * Creates the rules engine from a {@code colony.rules} config block.
     *
     * @param rulesConfig the rules configuration.
     * @param clock       clock used to stamp record updates.
     */
    public ResourceRules(Config rulesConfig, Clock clock) {
        this(rulesConfig.getInt("foraging-duration"),
                Resources.of(
                        rulesConfig.getInt("initial-resources.food"),
                        rulesConfig.getInt("initial-resources.water"),
                        rulesConfig.getInt("initial-resources.energy")),
                readConsumption(rulesConfig.getConfig("consumption")),
                clock);
    }

    /**
     * Creates the rules engine from explicit settings.
     *
     * @param foragingDuration ticks a foraging trip lasts, must be positive.
     * @param initialResources resources a new colonist starts with.
     * @param consumption      consumption schedule for every resource kind.
     * @param clock            clock used to stamp record updates.
     */
    public ResourceRules(int foragingDuration, Resources initialResources,
                         Map<ResourceKind, Consumption> consumption, Clock clock) {
        if (foragingDuration <= 0) {
            throw new IllegalArgumentException("foraging-duration must be > 0, got " + foragingDuration);
        }
        for (ResourceKind kind : ResourceKind.values()) {
            if (!consumption.containsKey(kind)) {
                throw new IllegalArgumentException("Missing consumption schedule for " + kind.key());
            }
        }
        this.foragingDuration = foragingDuration;
        this.initialResources = Objects.requireNonNull(initialResources, "initialResources");
        this.consumption = new EnumMap<>(consumption);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private static Map<ResourceKind, Consumption> readConsumption(Config config) {
        Map<ResourceKind, Consumption> result = new EnumMap<>(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.values()) {
            Config entry = config.getConfig(kind.key());
            result.put(kind, new Consumption(entry.getInt("interval"), entry.getInt("rate")));
        }
        return result;
    }

    public int getForagingDuration() {
        return foragingDuration;
    }

    /**
     * Creates the record of a freshly spawned colonist: idle, initial resources, empty
     * inventory, tick counter zero.
     *
     * @param colonistId the colonist identifier.
     * @return the new record.
     */
    public ColonistRecord newRecord(String colonistId) {
        return new ColonistRecord(colonistId, ActivityState.IDLE, initialResources,
                Inventory.empty(), 0L, clock.instant());
    }

    /**
     * Starts a foraging trip at the given location key.
     * <p>
     * A foraging colonist is rejected with {@link RuleViolation#ALREADY_FORAGING} whatever
     * the requested location. An idle colonist is rejected with
     * {@link RuleViolation#INVALID_LOCATION} if the key is not a {@link ForagingLocation}.
     *
     * @param record      the current record.
     * @param locationKey the requested location key.
     * @return the record in {@code Foraging{location, foraging-duration}}, or a rejection.
     */
    public RuleOutcome<ColonistRecord> beginForaging(ColonistRecord record, String locationKey) {
        if (record.isForaging()) {
            return RuleOutcome.rejected(RuleViolation.ALREADY_FORAGING);
        }
        Optional<ForagingLocation> location = ForagingLocation.fromKey(locationKey);
        if (location.isEmpty()) {
            return RuleOutcome.rejected(RuleViolation.INVALID_LOCATION);
        }
        return beginForaging(record, location.get());
    }

    /**
     * Typed variant of {@link #beginForaging(ColonistRecord, String)}.
     */
    public RuleOutcome<ColonistRecord> beginForaging(ColonistRecord record, ForagingLocation location) {
        if (record.isForaging()) {
            return RuleOutcome.rejected(RuleViolation.ALREADY_FORAGING);
        }
        if (location == null) {
            return RuleOutcome.rejected(RuleViolation.INVALID_LOCATION);
        }
        return RuleOutcome.ok(record
                .withState(new ActivityState.Foraging(location, foragingDuration))
                .touchedAt(clock.instant()));
    }

    /**
     * Advances a record by one tick.
     * <ol>
     *   <li>Increments the tick counter.</li>
     *   <li>For each resource kind whose consumption interval divides the new counter,
     *       subtracts its rate (clamped at zero). The kinds are independent.</li>
     *   <li>If foraging, decrements the remaining ticks; reaching zero returns the colonist to
     *       Idle and reports the finished location in {@link TickResult#completedForaging()}.</li>
     * </ol>
     *
     * @param record the current record.
     * @return the advanced record and the completed foraging location, if any.
     */
    public TickResult processTick(ColonistRecord record) {
        long tick = record.tickCounter() + 1;

        Map<ResourceKind, Integer> consumed = new EnumMap<>(ResourceKind.class);
        for (Map.Entry<ResourceKind, Consumption> entry : consumption.entrySet()) {
            if (tick % entry.getValue().interval() == 0) {
                consumed.put(entry.getKey(), -entry.getValue().rate());
            }
        }

        ColonistRecord next = record.withTickCounter(tick);
        if (!consumed.isEmpty()) {
            next = next.withResources(next.resources().plus(consumed));
        }

        ForagingLocation completed = null;
        if (next.state() instanceof ActivityState.Foraging foraging) {
            int remaining = foraging.remainingTicks() - 1;
            if (remaining <= 0) {
                completed = foraging.location();
                next = next.withState(ActivityState.IDLE);
            } else {
                next = next.withState(new ActivityState.Foraging(foraging.location(), remaining));
            }
        }

        return new TickResult(next.touchedAt(clock.instant()), Optional.ofNullable(completed));
    }

    /**
     * Applies signed per-kind changes. Results are clamped at zero; this never fails.
     *
     * @param record the current record.
     * @param delta  changes per resource kind.
     * @return the updated record.
     */
    public ColonistRecord updateResources(ColonistRecord record, Map<ResourceKind, Integer> delta) {
        return record.withResources(record.resources().plus(delta)).touchedAt(clock.instant());
    }

    /**
     * Adds items to the inventory. Non-positive amounts are ignored.
     */
    public ColonistRecord addItem(ColonistRecord record, ItemKind kind, int amount) {
        if (kind == null || amount <= 0) {
            return record;
        }
        int current = record.inventory().count(kind);
        int next = (int) Math.min((long) current + amount, Integer.MAX_VALUE);
        return record.withInventory(record.inventory().withCount(kind, next)).touchedAt(clock.instant());
    }

    /**
     * Adds several item kinds at once, with the same rules as {@link #addItem}.
     */
    public ColonistRecord addItems(ColonistRecord record, Map<ItemKind, Integer> items) {
        ColonistRecord result = record;
        for (Map.Entry<ItemKind, Integer> entry : items.entrySet()) {
            if (entry.getValue() != null) {
                result = addItem(result, entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Removes items from the inventory.
     * <p>
     * A non-positive amount is accepted and leaves the record unchanged.
     *
     * @return the updated record, or {@link RuleViolation#INSUFFICIENT_ITEMS} if fewer than
     *         {@code amount} items are carried.
     */
    public RuleOutcome<ColonistRecord> removeItem(ColonistRecord record, ItemKind kind, int amount) {
        if (kind == null || amount <= 0) {
            return RuleOutcome.ok(record);
        }
        int current = record.inventory().count(kind);
        if (current < amount) {
            return RuleOutcome.rejected(RuleViolation.INSUFFICIENT_ITEMS);
        }
        return RuleOutcome.ok(record.withInventory(record.inventory().withCount(kind, current - amount))
                .touchedAt(clock.instant()));
    }

    public boolean hasItem(ColonistRecord record, ItemKind kind) {
        return hasItem(record, kind, 1);
    }

    public boolean hasItem(ColonistRecord record, ItemKind kind, int amount) {
        return record.inventory().count(kind) >= amount;
    }
}
