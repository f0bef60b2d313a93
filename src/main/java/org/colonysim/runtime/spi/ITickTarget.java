package org.colonysim.runtime.spi;

/**
 * Anything the {@link org.colonysim.runtime.TickScheduler} delivers ticks to.
 * <p>
 * Delivery is fire-and-forget: {@link #deliverTick()} only enqueues the tick and must return
 * without waiting for it to be processed.
 */
public interface ITickTarget {

    /**
     * Enqueues one tick for asynchronous processing.
     *
     * @return {@code true} if the tick was accepted, {@code false} if the target is no longer
     *         live and the tick was dropped.
     */
    boolean deliverTick();
}
