package org.colonysim.runtime.presence;

/**
 * Aggregate presence counters.
 */
public record PresenceCounts(int totalCount, int idleCount, int foragingCount) {

    public static final PresenceCounts ZERO = new PresenceCounts(0, 0, 0);

    /**
     * Whether the per-activity counters add up to the total.
     */
    public boolean isBalanced() {
        return totalCount == idleCount + foragingCount;
    }
}
