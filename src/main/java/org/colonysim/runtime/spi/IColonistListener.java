package org.colonysim.runtime.spi;

import org.colonysim.runtime.colonist.ColonistSnapshot;

/**
 * Receives the latest snapshot of a colonist after every state-changing operation.
 * <p>
 * Called on the colonist's mailbox thread. Implementations must return quickly and must not
 * call back into the colonist synchronously.
 */
@FunctionalInterface
public interface IColonistListener {

    void onSnapshot(ColonistSnapshot snapshot);
}
