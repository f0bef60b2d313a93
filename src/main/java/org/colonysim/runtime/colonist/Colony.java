package org.colonysim.runtime.colonist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import org.colonysim.runtime.pool.ResourcePool;
import org.colonysim.runtime.presence.PresenceAggregator;
import org.colonysim.runtime.rules.ResourceRules;
import org.colonysim.runtime.spi.IColonistListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of live colonists. Spawning returns the {@link Colonist} handle the caller holds on
 * to; the colony keeps its own list only so the scheduler can enumerate live colonists.
 * <p>
 * Spawn and despawn keep the {@link PresenceAggregator} in step: a spawned colonist is
 * registered, a despawned one unregistered, both under the same lock as the colonist map so
 * the presence records always match the live colonists. After {@link #terminateAll()} the
 * colony refuses to spawn.
 * <p>
 * <b>Thread safety:</b> all methods are thread-safe. The colony's lock is taken before the
 * aggregator's, never after.
 */
public class Colony {

    private static final Logger LOG = LoggerFactory.getLogger(Colony.class);

    private final ResourceRules rules;
    private final ResourcePool pool;
    private final PresenceAggregator presence;
    private final Executor dispatcher;
    private final Map<String, Colonist> colonists = new LinkedHashMap<>();
    private final List<IColonistListener> colonistListeners = new CopyOnWriteArrayList<>();
    private boolean closed;

    public Colony(ResourceRules rules, ResourcePool pool, PresenceAggregator presence, Executor dispatcher) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Adds a listener to every colonist spawned after this call.
     */
    public void addColonistListener(IColonistListener listener) {
        colonistListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Spawns a colonist, or returns the live one with the same id. Either way the colonist
     * is registered with the presence view.
     *
     * @param colonistId the colonist identifier.
     * @return the live colonist handle.
     * @throws IllegalStateException if the colony has been shut down by {@link #terminateAll()}.
     */
    public Colonist spawn(String colonistId) {
        Objects.requireNonNull(colonistId, "colonistId");
        synchronized (colonists) {
            if (closed) {
                throw new IllegalStateException("Colony is shut down, cannot spawn colonist " + colonistId);
            }
            Colonist colonist = colonists.get(colonistId);
            if (colonist == null || !colonist.isAlive()) {
                colonist = new Colonist(colonistId, rules, pool, presence, dispatcher);
                colonistListeners.forEach(colonist::addListener);
                colonists.put(colonistId, colonist);
                LOG.info("Spawned colonist {}", colonistId);
            }
            presence.register(colonistId);
            return colonist;
        }
    }

    /**
     * Unregisters a colonist from presence and terminates it. Unknown ids are ignored.
     *
     * @return {@code true} if a colonist was removed.
     */
    public boolean despawn(String colonistId) {
        synchronized (colonists) {
            Colonist removed = colonists.remove(colonistId);
            if (removed != null) {
                removed.terminate();
            }
            presence.unregister(colonistId);
            if (removed == null) {
                return false;
            }
        }
        LOG.info("Despawned colonist {}", colonistId);
        return true;
    }

    public Optional<Colonist> find(String colonistId) {
        synchronized (colonists) {
            return Optional.ofNullable(colonists.get(colonistId));
        }
    }

    /**
     * Returns a copy of the live colonists in spawn order.
     */
    public List<Colonist> liveColonists() {
        synchronized (colonists) {
            List<Colonist> live = new ArrayList<>(colonists.size());
            for (Colonist colonist : colonists.values()) {
                if (colonist.isAlive()) {
                    live.add(colonist);
                }
            }
            return live;
        }
    }

    public int size() {
        synchronized (colonists) {
            return colonists.size();
        }
    }

    /**
     * Terminates every colonist without touching presence and refuses later spawns. Used on
     * simulation shutdown. Idempotent.
     */
    public void terminateAll() {
        synchronized (colonists) {
            closed = true;
            colonists.values().forEach(Colonist::terminate);
        }
    }

    public boolean isClosed() {
        synchronized (colonists) {
            return closed;
        }
    }
}
