package org.colonysim.runtime.colonist;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A non-blocking task queue whose tasks run one at a time, in submission order, on a shared
 * {@link Executor}.
 * <p>
 * Many mailboxes share one dispatcher. At most one drain of a given mailbox is scheduled at
 * any time, so tasks of one mailbox never run concurrently, and every task happens-before
 * the next one. A drain runs at most {@link #BATCH_SIZE} tasks before yielding the dispatcher
 * thread to other mailboxes.
 * <p>
 * <b>Submission contract:</b> {@link #tell(Runnable)} and {@link #ask(Supplier)} only enqueue;
 * they never wait for the task to run. After {@link #close()} new tasks are refused, tasks
 * already queued still run.
 * <p>
 * If the dispatcher rejects a drain, the mailbox closes itself and drops every queued task;
 * futures returned by {@link #ask(Supplier)} for dropped tasks complete exceptionally with an
 * {@link IllegalStateException}.
 * <p>
 * A task that throws is logged at WARN and the mailbox moves on to the next task.
 */
public final class SerialMailbox {

    private static final Logger LOG = LoggerFactory.getLogger(SerialMailbox.class);

    static final int BATCH_SIZE = 64;

    private final String name;
    private final Executor dispatcher;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private volatile boolean closed;

    /**
     * @param name       name used in log messages.
     * @param dispatcher executor that runs the drains.
     */
    public SerialMailbox(String name, Executor dispatcher) {
        this.name = name;
        this.dispatcher = dispatcher;
    }

    /**
     * Enqueues a task without waiting for it.
     *
     * @return {@code false} if the mailbox is closed and the task was dropped.
     */
    public boolean tell(Runnable task) {
        if (closed) {
            return false;
        }
        queue.add(task);
        scheduleDrain();
        return true;
    }

    /**
     * Enqueues a task that produces a value.
     *
     * @return a future completed with the task's value, or completed exceptionally with the
     *         task's exception or with an {@link IllegalStateException} if the mailbox is closed.
     */
    public <T> CompletableFuture<T> ask(Supplier<T> task) {
        AskTask<T> ask = new AskTask<>(task);
        if (!tell(ask)) {
            ask.reject(new IllegalStateException("Mailbox '" + name + "' is closed"));
        }
        return ask.future;
    }

    /**
     * Refuses further tasks. Idempotent.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Number of tasks waiting to run.
     */
    public int pending() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatcher.execute(this::drain);
        } catch (RejectedExecutionException e) {
            closed = true;
            int dropped = dropQueued(e);
            scheduled.set(false);
            LOG.debug("Dispatcher rejected mailbox '{}', closed it and dropped {} task(s)", name, dropped);
            // A tell that passed the closed check before this point may have enqueued late.
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    private int dropQueued(RejectedExecutionException cause) {
        int dropped = 0;
        Runnable task;
        while ((task = queue.poll()) != null) {
            dropped++;
            if (task instanceof AskTask<?> ask) {
                ask.reject(new IllegalStateException(
                        "Mailbox '" + name + "' is closed: dispatcher rejected the drain", cause));
            }
        }
        return dropped;
    }

    private void drain() {
        try {
            for (int i = 0; i < BATCH_SIZE; i++) {
                Runnable task = queue.poll();
                if (task == null) {
                    break;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.warn("Task in mailbox '{}' failed: {}", name, e.getMessage(), e);
                }
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    private static final class AskTask<T> implements Runnable {
        private final Supplier<T> task;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private AskTask(Supplier<T> task) {
            this.task = task;
        }

        @Override
        public void run() {
            try {
                future.complete(task.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }

        private void reject(IllegalStateException cause) {
            future.completeExceptionally(cause);
        }
    }
}
