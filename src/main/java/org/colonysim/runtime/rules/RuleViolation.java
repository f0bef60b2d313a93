package org.colonysim.runtime.rules;

/**
 * Recoverable rejections returned by {@link ResourceRules}. A rejected operation never
 * changes the record it was applied to.
 */
public enum RuleViolation {
    /** Foraging was requested while the colonist is already foraging. */
    ALREADY_FORAGING,
    /** Foraging was requested at a location outside the location set. */
    INVALID_LOCATION,
    /** An inventory removal asked for more items than are carried. */
    INSUFFICIENT_ITEMS
}
