package org.colonysim.runtime.pool;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.spi.IRandomProvider;

/**
 * One mutable cell of the {@link ResourcePool}.
 * <p>
 * Harvests on the same site are serialized by the site's own lock, so each harvest is an
 * indivisible read-modify-write. Regrowth replaces the amount with a single atomic write and
 * does not take the harvest lock: a harvest racing a regrowth may overwrite the regrown value.
 * <p>
 * Each site owns two random streams, one used only under the harvest lock and one used only
 * by regrowth, so no generator is shared between concurrent callers.
 */
final class ForagingSite {

    private final ForagingLocation location;
    private final SiteSettings settings;
    private final AtomicInteger amount;
    private final ReentrantLock harvestLock = new ReentrantLock();
    private final IRandomProvider harvestRandom;
    private final IRandomProvider regrowthRandom;

    // Guarded by the pool's regrowth lock.
    private int ticksSinceRegrowth;

    ForagingSite(ForagingLocation location, SiteSettings settings,
                 IRandomProvider harvestRandom, IRandomProvider regrowthRandom) {
        this.location = location;
        this.settings = settings;
        this.harvestRandom = harvestRandom;
        this.regrowthRandom = regrowthRandom;
        this.amount = new AtomicInteger(drawRegrowthAmount());
    }

    ForagingLocation location() {
        return location;
    }

    SiteSettings settings() {
        return settings;
    }

    int amount() {
        return amount.get();
    }

    void setAmount(int value) {
        amount.set(Math.max(0, value));
    }

    HarvestResult harvest() {
        harvestLock.lock();
        try {
            int current = amount.get();
            if (current <= 0) {
                return HarvestResult.empty(location, settings.resource());
            }
            int drawn = harvestRandom.nextIntBetween(settings.harvestMin(), settings.harvestMax());
            int taken = Math.min(drawn, current);
            amount.set(current - taken);
            return new HarvestResult(location, settings.resource(), taken);
        } finally {
            harvestLock.unlock();
        }
    }

    /**
     * Advances the regrowth countdown.
     *
     * @return {@code true} if this tick regrew the site.
     */
    boolean regrowthTick() {
        ticksSinceRegrowth++;
        if (ticksSinceRegrowth < settings.regrowthInterval()) {
            return false;
        }
        amount.set(drawRegrowthAmount());
        ticksSinceRegrowth = 0;
        return true;
    }

    private int drawRegrowthAmount() {
        return regrowthRandom.nextIntBetween(settings.regrowthMin(), settings.regrowthMax());
    }
}
