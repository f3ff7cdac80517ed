package com.devflow.syncclient.schedule;

/**
 * Handle to a scheduled task.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancel the task. A task that has not started yet will never run.
     * Cancelling twice is harmless.
     */
    void cancel();
}
