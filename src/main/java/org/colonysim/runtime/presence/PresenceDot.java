package org.colonysim.runtime.presence;

/**
 * One anonymous entry of the presence view. Carries no identifier by construction.
 */
public record PresenceDot(AnonymizedPosition position, Activity activity) {
}
