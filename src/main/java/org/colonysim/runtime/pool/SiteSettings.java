package org.colonysim.runtime.pool;

import java.util.Objects;

import org.colonysim.runtime.rules.ResourceKind;

import com.typesafe.config.Config;

/**
 * Static parameters of one foraging site.
 *
 * @param resource         the resource kind a harvest yields.
 * @param regrowthInterval regrowth ticks between two regrowth events.
 * @param regrowthMin      lower bound of the amount drawn on regrowth (and at seeding).
 * @param regrowthMax      upper bound of the amount drawn on regrowth (and at seeding).
 * @param harvestMin       lower bound of a single harvest draw.
 * @param harvestMax       upper bound of a single harvest draw.
 */
public record SiteSettings(
        ResourceKind resource,
        int regrowthInterval,
        int regrowthMin,
        int regrowthMax,
        int harvestMin,
        int harvestMax) {

    public SiteSettings {
        Objects.requireNonNull(resource, "resource");
        if (regrowthInterval <= 0) {
            throw new IllegalArgumentException("regrowth-interval must be > 0, got " + regrowthInterval);
        }
        checkRange("regrowth", regrowthMin, regrowthMax, 0);
        checkRange("harvest", harvestMin, harvestMax, 1);
    }

    // A harvest draw of zero would be indistinguishable from an empty site.
    private static void checkRange(String name, int min, int max, int lowest) {
        if (min < lowest || max < min) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s range [%d, %d]", name, min, max));
        }
    }

    /**
     * Reads one site block, e.g. {@code colony.pool.sites.forest}.
     */
    public static SiteSettings fromConfig(Config site) {
        return new SiteSettings(
                ResourceKind.fromKey(site.getString("resource")),
                site.getInt("regrowth-interval"),
                site.getInt("regrowth-min"),
                site.getInt("regrowth-max"),
                site.getInt("harvest-min"),
                site.getInt("harvest-max"));
    }
}
