package org.colonysim.runtime.rules;

import java.time.Instant;
import java.util.Objects;

/**
 * The full ledger of one colonist: state machine, resources, inventory and tick counter.
 * <p>
 * Immutable. All transitions go through {@link ResourceRules}, which returns new records.
 *
 * @param id          the owning colonist's identifier.
 * @param state       current state machine state.
 * @param resources   resource levels.
 * @param inventory   carried items.
 * @param tickCounter number of ticks processed so far, monotonic.
 * @param lastUpdated time of the last mutation.
 */
public record ColonistRecord(
        String id,
        ActivityState state,
        Resources resources,
        Inventory inventory,
        long tickCounter,
        Instant lastUpdated) {

    public ColonistRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        if (tickCounter < 0) {
            throw new IllegalArgumentException("tickCounter must be >= 0, got " + tickCounter);
        }
    }

    public boolean isForaging() {
        return state instanceof ActivityState.Foraging;
    }

    ColonistRecord withState(ActivityState newState) {
        return new ColonistRecord(id, newState, resources, inventory, tickCounter, lastUpdated);
    }

    ColonistRecord withResources(Resources newResources) {
        return new ColonistRecord(id, state, newResources, inventory, tickCounter, lastUpdated);
    }

    ColonistRecord withInventory(Inventory newInventory) {
        return new ColonistRecord(id, state, resources, newInventory, tickCounter, lastUpdated);
    }

    ColonistRecord withTickCounter(long newTickCounter) {
        return new ColonistRecord(id, state, resources, inventory, newTickCounter, lastUpdated);
    }

    ColonistRecord touchedAt(Instant time) {
        return new ColonistRecord(id, state, resources, inventory, tickCounter, time);
    }
}
