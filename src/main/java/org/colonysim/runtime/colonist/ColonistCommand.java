package org.colonysim.runtime.colonist;

import org.colonysim.runtime.rules.ForagingLocation;

/**
 * Commands an external caller can submit to a {@link Colonist}.
 */
public sealed interface ColonistCommand permits ColonistCommand.BeginForaging {

    /**
     * Start a foraging trip.
     *
     * @param location the requested location key; validated by the rules engine.
     */
    record BeginForaging(String location) implements ColonistCommand {

        /**
         * Forage at the default location.
         */
        public BeginForaging() {
            this(ForagingLocation.DEFAULT.key());
        }

        public static BeginForaging at(ForagingLocation location) {
            return new BeginForaging(location.key());
        }
    }
}
