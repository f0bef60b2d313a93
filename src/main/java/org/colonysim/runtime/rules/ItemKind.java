package org.colonysim.runtime.rules;

/**
 * Kinds of items a colonist can carry in its inventory.
 */
public enum ItemKind {
    WOOD,
    STONE,
    FIBER,
    BERRIES
}
