package org.colonysim.runtime;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.colonysim.runtime.spi.ITickTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the colony: every {@code interval} it delivers one tick to each live colonist and
 * one regrowth tick to the resource pool.
 * <p>
 * <b>Fan-out:</b> delivery only enqueues ({@link ITickTarget#deliverTick()}); the scheduler
 * never waits for any target to process its tick. A target that refuses the tick (it has
 * been terminated) is skipped without retry.
 * <p>
 * <b>Timing:</b> the next firing is armed after the current fan-out has been issued, so the
 * real period is {@code interval} plus the fan-out time and drift accumulates. Ticks are
 * issued strictly in order; tick N is always issued before tick N+1.
 */
public class TickScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(TickScheduler.class);

    /**
     * Lifecycle of the scheduler.
     */
    public enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final Duration interval;
    private final Supplier<? extends Collection<? extends ITickTarget>> colonists;
    private final ITickTarget regrowth;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final AtomicLong ticksIssued = new AtomicLong();
    private final AtomicLong deliveriesDropped = new AtomicLong();
    private ScheduledExecutorService timer;

    /**
     * @param interval  wall-clock delay between the end of one fan-out and the next firing.
     * @param colonists supplies the current live tick targets on every firing.
     * @param regrowth  target receiving one regrowth tick per firing.
     */
    public TickScheduler(Duration interval,
                         Supplier<? extends Collection<? extends ITickTarget>> colonists,
                         ITickTarget regrowth) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Tick interval must be positive, got " + interval);
        }
        this.interval = interval;
        this.colonists = Objects.requireNonNull(colonists, "colonists");
        this.regrowth = Objects.requireNonNull(regrowth, "regrowth");
    }

    /**
     * Arms the first firing one interval from now.
     *
     * @throws IllegalStateException if the scheduler was already started.
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Cannot start tick scheduler in state " + state.get());
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "colony-tick");
            thread.setDaemon(true);
            return thread;
        });
        armNext();
        LOG.info("Tick scheduler started with interval {} ms", interval.toMillis());
    }

    /**
     * Cancels the next firing. Idempotent.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous != State.RUNNING) {
            return;
        }
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Tick scheduler thread did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Tick scheduler stopped after {} tick(s)", ticksIssued.get());
    }

    /**
     * Issues one fan-out on the calling thread, independent of the timer. Uses the same
     * non-blocking delivery as timed firings.
     *
     * @return the number of the issued tick, starting at 1.
     */
    public long fireOnce() {
        return fanOut();
    }

    public State getState() {
        return state.get();
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Number of fan-outs issued so far.
     */
    public long getTicksIssued() {
        return ticksIssued.get();
    }

    /**
     * Number of tick deliveries refused by terminated targets.
     */
    public long getDeliveriesDropped() {
        return deliveriesDropped.get();
    }

    private void armNext() {
        timer.schedule(this::onTimer, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onTimer() {
        try {
            fanOut();
        } finally {
            if (state.get() == State.RUNNING) {
                armNext();
            }
        }
    }

    private synchronized long fanOut() {
        long tick = ticksIssued.incrementAndGet();
        int delivered = 0;
        for (ITickTarget target : colonists.get()) {
            if (deliver(target)) {
                delivered++;
            }
        }
        deliver(regrowth);
        LOG.debug("Tick {} issued to {} colonist(s)", tick, delivered);
        return tick;
    }

    private boolean deliver(ITickTarget target) {
        try {
            if (target.deliverTick()) {
                return true;
            }
            deliveriesDropped.incrementAndGet();
            LOG.debug("Dropped tick for terminated target {}", target);
            return false;
        } catch (RuntimeException e) {
            deliveriesDropped.incrementAndGet();
            LOG.warn("Tick delivery to {} failed: {}", target, e.getMessage(), e);
            return false;
        }
    }
}
