package org.colonysim.runtime.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable item counts. Kinds are opened lazily: a kind never touched is simply absent and
 * reads as zero.
 */
public final class Inventory {

    private static final Inventory EMPTY = new Inventory(new EnumMap<>(ItemKind.class));

    private final EnumMap<ItemKind, Integer> counts;

    private Inventory(EnumMap<ItemKind, Integer> counts) {
        this.counts = counts;
    }

    public static Inventory empty() {
        return EMPTY;
    }

    public int count(ItemKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    Inventory withCount(ItemKind kind, int count) {
        EnumMap<ItemKind, Integer> next = new EnumMap<>(ItemKind.class);
        next.putAll(counts);
        next.put(kind, count);
        return new Inventory(next);
    }

    /**
     * Returns the kinds that have been opened so far with their counts.
     */
    public Map<ItemKind, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Inventory other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "Inventory" + counts;
    }
}
