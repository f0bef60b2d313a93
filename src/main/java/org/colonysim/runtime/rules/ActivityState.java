package org.colonysim.runtime.rules;

import java.util.Objects;

/**
 * The colonist state machine. A colonist is in exactly one state at any time.
 */
public sealed interface ActivityState permits ActivityState.Idle, ActivityState.Foraging {

    /**
     * The shared idle state.
     */
    ActivityState IDLE = new Idle();

    /**
     * Not doing anything; eligible to accept a foraging command.
     */
    record Idle() implements ActivityState {
    }

    /**
     * Out foraging at a location until {@code remainingTicks} reaches zero.
     *
     * @param location       where the colonist forages.
     * @param remainingTicks ticks left until the trip completes, always positive.
     */
    record Foraging(ForagingLocation location, int remainingTicks) implements ActivityState {
        public Foraging {
            Objects.requireNonNull(location, "location");
            if (remainingTicks <= 0) {
                throw new IllegalArgumentException("remainingTicks must be > 0, got " + remainingTicks);
            }
        }
    }
}
