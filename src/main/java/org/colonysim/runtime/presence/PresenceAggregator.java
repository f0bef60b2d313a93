package org.colonysim.runtime.presence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.colonysim.runtime.spi.IPresenceListener;
import org.colonysim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Tracks which colonists are present and what they are doing, and publishes an anonymized
 * summary of it.
 * <p>
 * The three counters are maintained incrementally on every write; {@link #recount()} offers
 * the equivalent full-scan computation for verification. Every state-changing call publishes
 * a fresh {@link PresenceSummary} to all {@link IPresenceListener}s; calls that change
 * nothing publish nothing.
 * <p>
 * <b>Thread safety:</b> all writes are serialized on this instance. {@link #getSummary()}
 * does not lock and returns the summary of the most recently completed write.
 */
public class PresenceAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(PresenceAggregator.class);

    private static final class Presence {
        private final AnonymizedPosition position;
        private Activity activity = Activity.IDLE;

        private Presence(AnonymizedPosition position) {
            this.position = position;
        }
    }

    private final Map<String, Presence> presences = new LinkedHashMap<>();
    private final List<IPresenceListener> listeners = new CopyOnWriteArrayList<>();
    private final IRandomProvider random;
    private final double positionMin;
    private final double positionMax;

    private int totalCount;
    private int idleCount;
    private int foragingCount;

    private volatile PresenceSummary latest = PresenceSummary.EMPTY;

    /**
     * @param random      random stream for display positions, used only under this
     *                    aggregator's lock.
     * @param positionMin lower bound of both position coordinates.
     * @param positionMax upper bound of both position coordinates.
     */
    public PresenceAggregator(IRandomProvider random, double positionMin, double positionMax) {
        if (positionMin < 0.0 || positionMax > 1.0 || positionMin > positionMax) {
            throw new IllegalArgumentException(
                    String.format("Invalid position range [%s, %s]", positionMin, positionMax));
        }
        this.random = Objects.requireNonNull(random, "random");
        this.positionMin = positionMin;
        this.positionMax = positionMax;
    }

    /**
     * Creates the aggregator from a {@code colony.presence} config block.
     */
    public static PresenceAggregator fromConfig(Config presenceConfig, IRandomProvider random) {
        return new PresenceAggregator(random,
                presenceConfig.getDouble("position-min"),
                presenceConfig.getDouble("position-max"));
    }

    public void addListener(IPresenceListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(IPresenceListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a colonist as idle at a fresh random position. Registering an already
     * registered colonist does nothing.
     */
    public synchronized void register(String colonistId) {
        Objects.requireNonNull(colonistId, "colonistId");
        if (presences.containsKey(colonistId)) {
            return;
        }
        presences.put(colonistId, new Presence(drawPosition()));
        totalCount++;
        idleCount++;
        publish();
    }

    /**
     * Removes a colonist. Unknown colonists are ignored.
     */
    public synchronized void unregister(String colonistId) {
        Presence removed = presences.remove(colonistId);
        if (removed == null) {
            return;
        }
        totalCount = Math.max(0, totalCount - 1);
        if (removed.activity == Activity.FORAGING) {
            foragingCount = Math.max(0, foragingCount - 1);
        } else {
            idleCount = Math.max(0, idleCount - 1);
        }
        publish();
    }

    /**
     * Changes a registered colonist's activity. Unknown colonists and unchanged activities
     * are ignored.
     */
    public synchronized void updateActivity(String colonistId, Activity activity) {
        Objects.requireNonNull(activity, "activity");
        Presence presence = presences.get(colonistId);
        if (presence == null || presence.activity == activity) {
            return;
        }
        presence.activity = activity;
        if (activity == Activity.FORAGING) {
            idleCount = Math.max(0, idleCount - 1);
            foragingCount++;
        } else {
            foragingCount = Math.max(0, foragingCount - 1);
            idleCount++;
        }
        publish();
    }

    public synchronized boolean isRegistered(String colonistId) {
        return presences.containsKey(colonistId);
    }

    /**
     * Returns the summary published by the most recently completed write.
     */
    public PresenceSummary getSummary() {
        return latest;
    }

    /**
     * Recomputes the counters by scanning every presence record. Always equal to the
     * incrementally maintained counters in {@link #getSummary()}.
     */
    public synchronized PresenceCounts recount() {
        int idle = 0;
        int foraging = 0;
        for (Presence presence : presences.values()) {
            if (presence.activity == Activity.FORAGING) {
                foraging++;
            } else {
                idle++;
            }
        }
        return new PresenceCounts(presences.size(), idle, foraging);
    }

    private AnonymizedPosition drawPosition() {
        double span = positionMax - positionMin;
        return new AnonymizedPosition(
                positionMin + random.nextDouble() * span,
                positionMin + random.nextDouble() * span);
    }

    private void publish() {
        List<PresenceDot> dots = new ArrayList<>(presences.size());
        for (Presence presence : presences.values()) {
            dots.add(new PresenceDot(presence.position, presence.activity));
        }
        PresenceSummary summary = new PresenceSummary(totalCount, idleCount, foragingCount, dots);
        latest = summary;
        for (IPresenceListener listener : listeners) {
            try {
                listener.onSummary(summary);
            } catch (RuntimeException e) {
                LOG.warn("Presence listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
