package org.colonysim.runtime.pool;

import java.util.Map;
import java.util.Objects;

import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.rules.ResourceKind;

/**
 * What a single harvest took from a site. An amount of zero is the "empty" result: the site
 * had nothing left. Callers treat it as a zero gain, not as an error.
 *
 * @param location the harvested site.
 * @param resource the resource kind the site yields.
 * @param amount   amount taken, zero when the site was empty.
 */
public record HarvestResult(ForagingLocation location, ResourceKind resource, int amount) {

    public HarvestResult {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(resource, "resource");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
    }

    public static HarvestResult empty(ForagingLocation location, ResourceKind resource) {
        return new HarvestResult(location, resource, 0);
    }

    public boolean isEmpty() {
        return amount == 0;
    }

    /**
     * Returns this harvest as a resource delta suitable for
     * {@link org.colonysim.runtime.rules.ResourceRules#updateResources}.
     */
    public Map<ResourceKind, Integer> asGain() {
        return isEmpty() ? Map.of() : Map.of(resource, amount);
    }
}
