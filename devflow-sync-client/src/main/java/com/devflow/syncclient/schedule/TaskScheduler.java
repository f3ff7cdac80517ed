package com.devflow.syncclient.schedule;

/**
 * Single-threaded event loop that owns every timer of a sync session.
 *
 * All tasks, immediate or delayed, run one at a time on the loop, so code
 * running on the loop never needs locks. Timer handles are cancellable so that
 * a disconnect can drop all pending work deterministically.
 */
public interface TaskScheduler {

    /**
     * Run a task on the loop as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Run a task once after the given delay.
     */
    Cancellable schedule(Runnable task, long delayMillis);

    /**
     * Run a task repeatedly, first after {@code periodMillis}, then every {@code periodMillis}.
     */
    Cancellable scheduleAtFixedRate(Runnable task, long periodMillis);

    /**
     * Whether the calling thread is the loop thread.
     */
    boolean inEventLoop();

    /**
     * Current time in epoch milliseconds, as seen by the loop.
     */
    long currentTimeMillis();

    /**
     * Stop the loop. Pending timers are dropped.
     */
    void shutdown();
}
