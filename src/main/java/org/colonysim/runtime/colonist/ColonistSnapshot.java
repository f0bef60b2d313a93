package org.colonysim.runtime.colonist;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.colonysim.runtime.presence.Activity;
import org.colonysim.runtime.rules.ActivityState;
import org.colonysim.runtime.rules.ColonistRecord;
import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.rules.ItemKind;
import org.colonysim.runtime.rules.ResourceKind;

/**
 * Read-only view of a colonist, as handed to callers and listeners.
 *
 * @param colonistId        the colonist.
 * @param status            idle or foraging.
 * @param foragingLocation  where the colonist is foraging, {@code null} when idle.
 * @param remainingTicks    ticks left in the current trip, zero when idle.
 * @param resources         resource levels.
 * @param inventory         carried items (opened kinds only).
 * @param tickCounter       ticks processed so far.
 * @param lastUpdated       time of the last mutation.
 */
public record ColonistSnapshot(
        String colonistId,
        Activity status,
        ForagingLocation foragingLocation,
        int remainingTicks,
        Map<ResourceKind, Integer> resources,
        Map<ItemKind, Integer> inventory,
        long tickCounter,
        Instant lastUpdated) {

    public ColonistSnapshot {
        resources = Map.copyOf(resources);
        inventory = Map.copyOf(inventory);
    }

    public static ColonistSnapshot of(ColonistRecord record) {
        ForagingLocation location = null;
        int remaining = 0;
        if (record.state() instanceof ActivityState.Foraging foraging) {
            location = foraging.location();
            remaining = foraging.remainingTicks();
        }
        return new ColonistSnapshot(
                record.id(),
                Activity.of(record.state()),
                location,
                remaining,
                record.resources().asMap(),
                record.inventory().asMap(),
                record.tickCounter(),
                record.lastUpdated());
    }

    public Optional<ForagingLocation> currentLocation() {
        return Optional.ofNullable(foragingLocation);
    }

    public int resource(ResourceKind kind) {
        return resources.getOrDefault(kind, 0);
    }
}
