package org.colonysim.runtime.presence;

/**
 * A random display position, unrelated to anything about the colonist it stands for.
 *
 * @param x horizontal coordinate in [0, 1].
 * @param y vertical coordinate in [0, 1].
 */
public record AnonymizedPosition(double x, double y) {
}
