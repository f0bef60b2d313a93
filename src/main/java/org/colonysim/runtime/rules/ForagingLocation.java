package org.colonysim.runtime.rules;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of locations a colonist may forage at.
 */
public enum ForagingLocation {
    FOREST,
    RIVER,
    CAVE;

    /**
     * The location used when a foraging command names none.
     */
    public static final ForagingLocation DEFAULT = FOREST;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a location by its exact lower-case key. No trimming or case folding is applied.
     *
     * @param key the requested location key, may be {@code null}.
     * @return the location, or empty if the key is not part of the location set.
     */
    public static Optional<ForagingLocation> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (ForagingLocation location : values()) {
            if (location.key().equals(key)) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }
}
