package org.colonysim.runtime.pool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * The shared store of harvestable sites, one per {@link ForagingLocation}.
 * <p>
 * Sites are created and seeded once at construction and live as long as the pool.
 * <p>
 * <b>Thread safety:</b> {@link #harvest(ForagingLocation)} may be called from any number of
 * threads. Mutual exclusion is scoped to a single site, so harvests at different locations
 * never contend. {@link #regrowthTick()} is serialized against itself but not against
 * harvests; a harvest finishing while a regrowth fires may observe either amount. No
 * operation performs I/O or blocks beyond the site update itself.
 * <p>
 * Configuration (path {@code colony.pool}):
 * <pre>
 * sites {
 *   forest { resource = food, regrowth-interval = 15, regrowth-min = 10, regrowth-max = 30,
 *            harvest-min = 1, harvest-max = 5 }
 *   river  { ... }
 *   cave   { ... }
 * }
 * </pre>
 */
public class ResourcePool {

    private static final Logger LOG = LoggerFactory.getLogger(ResourcePool.class);

    private final Map<ForagingLocation, ForagingSite> sites = new EnumMap<>(ForagingLocation.class);
    private final Object regrowthLock = new Object();

    /**
     * Creates the pool and seeds every site with a random amount from its regrowth range.
     *
     * @param settings       settings for every location in the location set.
     * @param randomProvider parent random stream; each site derives its own sub-streams.
     * @throws IllegalArgumentException if a location has no settings.
     */
    public ResourcePool(Map<ForagingLocation, SiteSettings> settings, IRandomProvider randomProvider) {
        Objects.requireNonNull(randomProvider, "randomProvider");
        for (ForagingLocation location : ForagingLocation.values()) {
            SiteSettings site = settings.get(location);
            if (site == null) {
                throw new IllegalArgumentException("No site settings for location " + location.key());
            }
            sites.put(location, new ForagingSite(location, site,
                    randomProvider.deriveFor("harvest", location.ordinal()),
                    randomProvider.deriveFor("regrowth", location.ordinal())));
        }
        LOG.debug("Resource pool seeded: {}", getLocations());
    }

    /**
     * Creates the pool from a {@code colony.pool} config block.
     */
    public static ResourcePool fromConfig(Config poolConfig, IRandomProvider randomProvider) {
        Config sitesConfig = poolConfig.getConfig("sites");
        Map<ForagingLocation, SiteSettings> settings = new EnumMap<>(ForagingLocation.class);
        for (ForagingLocation location : ForagingLocation.values()) {
            if (sitesConfig.hasPath(location.key())) {
                settings.put(location, SiteSettings.fromConfig(sitesConfig.getConfig(location.key())));
            }
        }
        return new ResourcePool(settings, randomProvider);
    }

    /**
     * Takes a random amount from a site.
     * <p>
     * If the site is empty the result {@link HarvestResult#isEmpty() is empty}. Otherwise
     * {@code taken = min(uniform(harvestMin, harvestMax), current)} is removed from the site.
     *
     * @param location the site to harvest.
     * @return the resource kind and amount taken.
     */
    public HarvestResult harvest(ForagingLocation location) {
        HarvestResult result = site(location).harvest();
        LOG.debug("Harvested {} {} at {}", result.amount(), result.resource().key(), location.key());
        return result;
    }

    /**
     * Advances every site's regrowth countdown by one. A site whose countdown reaches its
     * interval has its amount replaced (not increased) by a fresh draw from its regrowth range.
     */
    public void regrowthTick() {
        synchronized (regrowthLock) {
            for (ForagingSite site : sites.values()) {
                if (site.regrowthTick()) {
                    LOG.debug("Site {} regrew to {}", site.location().key(), site.amount());
                }
            }
        }
    }

    /**
     * Returns a point-in-time copy of every site's amount, for diagnostics.
     */
    public Map<ForagingLocation, Integer> getLocations() {
        Map<ForagingLocation, Integer> snapshot = new EnumMap<>(ForagingLocation.class);
        for (ForagingSite site : sites.values()) {
            snapshot.put(site.location(), site.amount());
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public SiteSettings getSettings(ForagingLocation location) {
        return site(location).settings();
    }

    /**
     * Overwrites a site's amount. Intended for tests and for restoring an externally persisted
     * level; negative values are clamped to zero.
     */
    public void setAmount(ForagingLocation location, int amount) {
        site(location).setAmount(amount);
    }

    private ForagingSite site(ForagingLocation location) {
        return sites.get(Objects.requireNonNull(location, "location"));
    }
}
