package org.colonysim.runtime.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-colonist resource levels. Every {@link ResourceKind} is always present and
 * no value is ever negative: all arithmetic clamps at zero.
 */
public final class Resources {

    private final EnumMap<ResourceKind, Integer> levels;

    private Resources(EnumMap<ResourceKind, Integer> levels) {
        this.levels = levels;
    }

    /**
     * Creates a resource set from explicit levels. Negative inputs are clamped to zero.
     *
     * @param food   food level.
     * @param water  water level.
     * @param energy energy level.
     * @return the resource set.
     */
    public static Resources of(int food, int water, int energy) {
        EnumMap<ResourceKind, Integer> levels = new EnumMap<>(ResourceKind.class);
        levels.put(ResourceKind.FOOD, Math.max(0, food));
        levels.put(ResourceKind.WATER, Math.max(0, water));
        levels.put(ResourceKind.ENERGY, Math.max(0, energy));
        return new Resources(levels);
    }

    public int get(ResourceKind kind) {
        return levels.get(kind);
    }

    /**
     * Applies a per-kind delta. Kinds absent from the delta keep their value; every resulting
     * value is clamped into {@code [0, Integer.MAX_VALUE]}.
     *
     * @param delta signed changes per kind.
     * @return a new resource set.
     */
    public Resources plus(Map<ResourceKind, Integer> delta) {
        Objects.requireNonNull(delta, "delta");
        EnumMap<ResourceKind, Integer> next = new EnumMap<>(levels);
        for (Map.Entry<ResourceKind, Integer> entry : delta.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            next.put(entry.getKey(), clampedSum(next.get(entry.getKey()), entry.getValue()));
        }
        return new Resources(next);
    }

    /**
     * Applies a change to a single kind, clamped at zero.
     */
    public Resources plus(ResourceKind kind, int delta) {
        EnumMap<ResourceKind, Integer> next = new EnumMap<>(levels);
        next.put(kind, clampedSum(next.get(kind), delta));
        return new Resources(next);
    }

    public Map<ResourceKind, Integer> asMap() {
        return Collections.unmodifiableMap(levels);
    }

    private static int clampedSum(int current, int delta) {
        long sum = (long) current + delta;
        if (sum < 0) {
            return 0;
        }
        return (int) Math.min(sum, Integer.MAX_VALUE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resources other)) return false;
        return levels.equals(other.levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return "Resources" + levels;
    }
}
