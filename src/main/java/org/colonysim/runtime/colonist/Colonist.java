package org.colonysim.runtime.colonist;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import org.colonysim.runtime.pool.HarvestResult;
import org.colonysim.runtime.pool.ResourcePool;
import org.colonysim.runtime.presence.Activity;
import org.colonysim.runtime.presence.PresenceAggregator;
import org.colonysim.runtime.rules.ColonistRecord;
import org.colonysim.runtime.rules.ForagingLocation;
import org.colonysim.runtime.rules.ResourceKind;
import org.colonysim.runtime.rules.ResourceRules;
import org.colonysim.runtime.rules.RuleOutcome;
import org.colonysim.runtime.spi.IColonistListener;
import org.colonysim.runtime.spi.ITickTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single colonist: the only writer of one {@link ColonistRecord}.
 * <p>
 * Commands, ticks and resource deltas are queued on the colonist's {@link SerialMailbox}
 * and applied one at a time, so no two operations on the record ever run concurrently.
 * After each operation the new {@link ColonistSnapshot} is published to
 * {@link #getState()} and to every {@link IColonistListener}.
 * <p>
 * When a tick ends a foraging trip, the colonist harvests the finished location in the
 * {@link ResourcePool}, credits the yield (an empty harvest credits nothing) and reports
 * itself idle to the {@link PresenceAggregator}, all before the next queued operation runs.
 * Once terminated, a colonist still applies the operations already queued to its own record
 * but no longer reports activity to presence, so a respawned colonist with the same id is
 * never overwritten by its predecessor.
 * <p>
 * <b>Thread safety:</b> all public methods may be called from any thread.
 * {@link #submitCommand(ColonistCommand)} blocks until a dispatcher thread has applied the
 * command. Every colonist shares that dispatcher, so it must not be called from code that
 * runs on it: any {@link IColonistListener}, any presence listener, or any other mailbox
 * task. Such callers use {@link #submitCommandAsync(ColonistCommand)} instead.
 */
public class Colonist implements ITickTarget {

    private static final Logger LOG = LoggerFactory.getLogger(Colonist.class);

    private final String id;
    private final ResourceRules rules;
    private final ResourcePool pool;
    private final PresenceAggregator presence;
    private final SerialMailbox mailbox;
    private final List<IColonistListener> listeners = new CopyOnWriteArrayList<>();

    // Confined to mailbox tasks.
    private ColonistRecord record;

    private volatile ColonistSnapshot latest;

    /**
     * Creates an idle colonist with the rules engine's initial record.
     *
     * @param id         colonist identifier.
     * @param rules      rules engine.
     * @param pool       shared pool harvested at the end of each foraging trip.
     * @param presence   presence view notified of activity changes.
     * @param dispatcher executor that runs this colonist's mailbox.
     */
    public Colonist(String id, ResourceRules rules, ResourcePool pool,
                    PresenceAggregator presence, Executor dispatcher) {
        this.id = Objects.requireNonNull(id, "id");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.mailbox = new SerialMailbox("colonist-" + id, dispatcher);
        this.record = rules.newRecord(id);
        this.latest = ColonistSnapshot.of(record);
    }

    public String getId() {
        return id;
    }

    public void addListener(IColonistListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(IColonistListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies a command and waits for the outcome. Must not be called from a dispatcher
     * thread; see the class documentation.
     *
     * @param command the command.
     * @return the snapshot after the command, or the rule violation that rejected it.
     * @throws IllegalStateException if the colonist has been terminated.
     */
    public RuleOutcome<ColonistSnapshot> submitCommand(ColonistCommand command) {
        Objects.requireNonNull(command, "command");
        try {
            return submitCommandAsync(command).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Queues a command without waiting for it.
     */
    public CompletableFuture<RuleOutcome<ColonistSnapshot>> submitCommandAsync(ColonistCommand command) {
        Objects.requireNonNull(command, "command");
        return mailbox.ask(() -> handle(command));
    }

    /**
     * Queues a signed resource change. Results are clamped at zero.
     *
     * @return {@code false} if the colonist has been terminated.
     */
    public boolean applyResourceDelta(Map<ResourceKind, Integer> delta) {
        Map<ResourceKind, Integer> copy = new EnumMap<>(ResourceKind.class);
        copy.putAll(delta);
        return mailbox.tell(() -> {
            record = rules.updateResources(record, copy);
            publish();
        });
    }

    @Override
    public boolean deliverTick() {
        return mailbox.tell(this::onTick);
    }

    /**
     * Returns the snapshot published by the most recently applied operation.
     */
    public ColonistSnapshot getState() {
        return latest;
    }

    /**
     * Returns a future completed with the snapshot once every operation queued before this
     * call has been applied.
     */
    public CompletableFuture<ColonistSnapshot> fetchState() {
        return mailbox.ask(() -> latest);
    }

    public boolean isAlive() {
        return !mailbox.isClosed();
    }

    /**
     * Stops accepting work. Operations already queued still run; later ticks are dropped.
     */
    public void terminate() {
        mailbox.close();
    }

    private RuleOutcome<ColonistSnapshot> handle(ColonistCommand command) {
        if (command instanceof ColonistCommand.BeginForaging begin) {
            RuleOutcome<ColonistRecord> outcome = rules.beginForaging(record, begin.location());
            if (!outcome.isOk()) {
                LOG.debug("Colonist {} rejected foraging at '{}': {}",
                        id, begin.location(), outcome.violation().orElseThrow());
                return outcome.map(ColonistSnapshot::of);
            }
            record = outcome.value();
            reportActivity(Activity.FORAGING);
            publish();
            return RuleOutcome.ok(latest);
        }
        throw new IllegalArgumentException("Unsupported command: " + command);
    }

    private void onTick() {
        ResourceRules.TickResult result = rules.processTick(record);
        record = result.record();
        Optional<ForagingLocation> completed = result.completedForaging();
        if (completed.isPresent()) {
            HarvestResult harvest = pool.harvest(completed.get());
            record = rules.updateResources(record, harvest.asGain());
            reportActivity(Activity.IDLE);
            LOG.debug("Colonist {} finished foraging at {} with {} {}",
                    id, completed.get().key(), harvest.amount(), harvest.resource().key());
        }
        publish();
    }

    private void reportActivity(Activity activity) {
        // Presence writes lock the aggregator, so despawn's unregister cannot interleave
        // between the liveness check and the update.
        synchronized (presence) {
            if (isAlive()) {
                presence.updateActivity(id, activity);
            }
        }
    }

    private void publish() {
        ColonistSnapshot snapshot = ColonistSnapshot.of(record);
        latest = snapshot;
        for (IColonistListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException e) {
                LOG.warn("Snapshot listener for colonist {} failed: {}", id, e.getMessage(), e);
            }
        }
    }
}
