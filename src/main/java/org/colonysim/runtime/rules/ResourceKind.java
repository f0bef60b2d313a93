package org.colonysim.runtime.rules;

import java.util.Locale;

/**
 * The fixed set of consumable resources every colonist tracks.
 */
public enum ResourceKind {
    FOOD,
    WATER,
    ENERGY;

    /**
     * Returns the lower-case key used for this resource in configuration files.
     *
     * @return the configuration key, e.g. {@code "food"}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configuration key to a resource kind.
     *
     * @param key the key, case-insensitive.
     * @return the matching kind.
     * @throws IllegalArgumentException if the key names no resource.
     */
    public static ResourceKind fromKey(String key) {
        for (ResourceKind kind : values()) {
            if (kind.key().equalsIgnoreCase(key.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resource kind: " + key);
    }
}
