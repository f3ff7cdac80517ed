package com.devflow.syncclient.connection;

import com.devflow.syncclient.schedule.Cancellable;
import com.devflow.syncclient.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a ping every heartbeat interval while the connection is up and
 * reports a timeout when no pong arrived within the configured window.
 *
 * Runs on the session loop; started on entering CONNECTED, stopped on leaving it.
 */
public class HeartbeatMonitor {
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final TaskScheduler scheduler;
    private final long intervalMillis;
    private final long timeoutMillis;
    private final Runnable sendPing;
    private final Runnable onTimeout;

    private Cancellable task;
    private long lastPongAt;
    private long pingsSent;

    /**
     * @param sendPing  sends one ping envelope
     * @param onTimeout invoked once when no pong arrived within {@code timeoutMillis}; the monitor is stopped first
     */
    public HeartbeatMonitor(TaskScheduler scheduler, long intervalMillis, long timeoutMillis,
                            Runnable sendPing, Runnable onTimeout) {
        this.scheduler = scheduler;
        this.intervalMillis = intervalMillis;
        this.timeoutMillis = timeoutMillis;
        this.sendPing = sendPing;
        this.onTimeout = onTimeout;
    }

    public void start() {
        stop();
        lastPongAt = scheduler.currentTimeMillis();
        task = scheduler.scheduleAtFixedRate(this::tick, intervalMillis);
        LOG.debug("Heartbeat started (interval: {}ms, timeout: {}ms)", intervalMillis, timeoutMillis);
    }

    public void stop() {
        if (task != null) {
            task.cancel();
            task = null;
            LOG.debug("Heartbeat stopped");
        }
    }

    public boolean isRunning() {
        return task != null;
    }

    /**
     * A pong confirms liveness. It never closes or otherwise alters the connection.
     */
    public void recordPong() {
        lastPongAt = scheduler.currentTimeMillis();
    }

    public long getLastPongAt() {
        return lastPongAt;
    }

    public long getPingsSent() {
        return pingsSent;
    }

    private void tick() {
        if (task == null) {
            return;
        }
        long silence = scheduler.currentTimeMillis() - lastPongAt;
        if (silence > timeoutMillis) {
            LOG.warn("Heartbeat timeout: no pong for {}ms (limit {}ms)", silence, timeoutMillis);
            stop();
            onTimeout.run();
            return;
        }
        sendPing.run();
        pingsSent++;
    }
}
