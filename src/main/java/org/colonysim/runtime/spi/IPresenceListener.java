package org.colonysim.runtime.spi;

import org.colonysim.runtime.presence.PresenceSummary;

/**
 * Receives the anonymized presence summary after every change to the presence map.
 * <p>
 * Called while the aggregator's lock is held, often on a dispatcher thread. Implementations
 * must not spawn or despawn colonists or block on a colonist command.
 */
@FunctionalInterface
public interface IPresenceListener {

    void onSummary(PresenceSummary summary);
}
