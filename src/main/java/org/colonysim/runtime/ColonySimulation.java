package org.colonysim.runtime;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.colonysim.runtime.colonist.Colony;
import org.colonysim.runtime.colonist.SerialMailbox;
import org.colonysim.runtime.internal.services.SeededRandomProvider;
import org.colonysim.runtime.pool.ResourcePool;
import org.colonysim.runtime.presence.PresenceAggregator;
import org.colonysim.runtime.rules.ResourceRules;
import org.colonysim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Wires the colony components from configuration and owns their threads.
 * <p>
 * Configuration (path {@code colony}): {@code tick-interval}, {@code seed},
 * {@code dispatch.threads} (0 = auto) and the {@code rules}, {@code pool} and
 * {@code presence} blocks read by the respective components.
 */
public class ColonySimulation implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ColonySimulation.class);

    private final ResourceRules rules;
    private final ResourcePool pool;
    private final PresenceAggregator presence;
    private final Colony colony;
    private final TickScheduler scheduler;
    private final ExecutorService dispatcher;
    private final SerialMailbox regrowthMailbox;

    /**
     * Builds a simulation from a {@code colony} config block.
     *
     * @param colonyConfig the configuration.
     * @param clock        clock for colonist record timestamps.
     */
    public ColonySimulation(Config colonyConfig, Clock clock) {
        IRandomProvider random = new SeededRandomProvider(colonyConfig.getLong("seed"));
        this.rules = new ResourceRules(colonyConfig.getConfig("rules"), clock);
        this.pool = ResourcePool.fromConfig(colonyConfig.getConfig("pool"), random.deriveFor("pool", 0));
        this.presence = PresenceAggregator.fromConfig(colonyConfig.getConfig("presence"), random.deriveFor("presence", 0));

        int threads = resolveThreads(colonyConfig.getInt("dispatch.threads"));
        this.dispatcher = Executors.newFixedThreadPool(threads, new DispatcherThreadFactory());
        this.colony = new Colony(rules, pool, presence, dispatcher);
        this.regrowthMailbox = new SerialMailbox("pool-regrowth", dispatcher);

        Duration interval = colonyConfig.getDuration("tick-interval");
        this.scheduler = new TickScheduler(interval, colony::liveColonists,
                () -> regrowthMailbox.tell(pool::regrowthTick));
        LOG.debug("Colony simulation created with {} dispatcher thread(s)", threads);
    }

    /**
     * Resolves configured parallelism: 0 = auto ({@code max(1, availableProcessors - 1)}).
     */
    static int resolveThreads(int configured) {
        if (configured < 0) {
            throw new IllegalArgumentException("dispatch.threads must be >= 0, got " + configured);
        }
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return configured;
    }

    public void start() {
        scheduler.start();
    }

    public ResourceRules getRules() {
        return rules;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public PresenceAggregator getPresence() {
        return presence;
    }

    public Colony getColony() {
        return colony;
    }

    public TickScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Stops the scheduler, terminates all colonists and shuts the dispatcher down after
     * already queued work has run.
     */
    @Override
    public void close() {
        scheduler.stop();
        colony.terminateAll();
        regrowthMailbox.close();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Dispatcher did not drain within 5 seconds, forcing shutdown");
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }

    private static final class DispatcherThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "colony-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
