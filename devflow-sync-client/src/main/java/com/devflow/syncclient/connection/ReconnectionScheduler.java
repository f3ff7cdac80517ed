package com.devflow.syncclient.connection;

import com.devflow.syncclient.schedule.Cancellable;
import com.devflow.syncclient.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether and when to retry after an abnormal closure.
 *
 * Owns the attempt counter and at most one pending retry timer. Scheduling a
 * new attempt always cancels the previous timer first.
 */
public class ReconnectionScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(ReconnectionScheduler.class);

    private final TaskScheduler scheduler;
    private final long baseIntervalMillis;
    private final double backoffMultiplier;
    private final long maxIntervalMillis;
    private final int maxAttempts;

    private int attempts;
    private Cancellable pending;

    public ReconnectionScheduler(TaskScheduler scheduler, long baseIntervalMillis, double backoffMultiplier,
                                 long maxIntervalMillis, int maxAttempts) {
        this.scheduler = scheduler;
        this.baseIntervalMillis = baseIntervalMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.maxIntervalMillis = maxIntervalMillis;
        this.maxAttempts = maxAttempts;
    }

    /**
     * True once {@code maxAttempts} retries have been scheduled without a successful open.
     */
    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    /**
     * Schedule the next retry.
     *
     * @return the attempt number, starting at 1
     */
    public int scheduleNext(Runnable attempt) {
        if (isExhausted()) {
            throw new IllegalStateException("Reconnection attempts exhausted (" + maxAttempts + ")");
        }
        cancel();
        attempts++;
        long delay = delayFor(attempts);
        Cancellable[] handle = new Cancellable[1];
        handle[0] = scheduler.schedule(() -> {
            if (pending != handle[0]) {
                return;
            }
            pending = null;
            attempt.run();
        }, delay);
        pending = handle[0];
        LOG.info("Reconnect attempt {}/{} scheduled in {}ms", attempts, maxAttempts, delay);
        return attempts;
    }

    /**
     * Delay before the given attempt: base interval grown by the backoff multiplier, capped.
     */
    public long delayFor(int attempt) {
        double delay = baseIntervalMillis * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return Math.min((long) delay, Math.max(baseIntervalMillis, maxIntervalMillis));
    }

    public void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    /**
     * Cancel any pending retry and zero the attempt counter.
     */
    public void reset() {
        cancel();
        attempts = 0;
    }

    public boolean isPending() {
        return pending != null;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
