package org.colonysim.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a colony simulation.
 * <p>
 * Implementations are not required to be thread-safe. Components that draw from several
 * threads obtain independent sub-streams via {@link #deriveFor(String, long)} and confine
 * each stream to one lock or one thread.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be &gt; 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a uniformly distributed integer in [{@code minInclusive}, {@code maxInclusive}].
     *
     * @throws IllegalArgumentException if {@code minInclusive > maxInclusive}
     */
    default int nextIntBetween(int minInclusive, int maxInclusive) {
        if (minInclusive > maxInclusive) {
            throw new IllegalArgumentException("min " + minInclusive + " > max " + maxInclusive);
        }
        return minInclusive + nextInt(maxInclusive - minInclusive + 1);
    }

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it.
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., per pool site).
     *
     * @param scope a stable, descriptive scope name (e.g., "harvest", "presence")
     * @param key a stable numeric key (e.g., site ordinal)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
