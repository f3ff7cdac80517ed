package com.devflow.syncclient;

import com.devflow.syncclient.connection.ConnectionManager;
import com.devflow.syncclient.event.EventBus;
import com.devflow.syncclient.schedule.ExecutorTaskScheduler;
import com.devflow.syncclient.schedule.TaskScheduler;
import com.devflow.syncclient.sync.SyncCoordinator;
import com.devflow.syncclient.transport.JavaWebSocketFactory;
import com.devflow.syncclient.transport.SyncSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One logical sync session: an event bus, a connection and its domain layer,
 * all driven by a single event loop. Create one per server target and hand it
 * to the code that needs it.
 */
public class SyncSession implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SyncSession.class);

    private final SyncClientConfig config;
    private final TaskScheduler scheduler;
    private final EventBus events;
    private final ConnectionManager connection;
    private final SyncCoordinator sync;

    public SyncSession(SyncClientConfig config, SyncSocketFactory socketFactory, TaskScheduler scheduler) {
        this.config = config;
        this.scheduler = scheduler;
        this.events = new EventBus();
        this.connection = new ConnectionManager(config, socketFactory, scheduler, events);
        this.sync = new SyncCoordinator(connection, scheduler);
    }

    /**
     * Session over Java-WebSocket with its own loop thread.
     */
    public static SyncSession create(SyncClientConfig config) {
        return new SyncSession(config, new JavaWebSocketFactory(), new ExecutorTaskScheduler("devflow-sync"));
    }

    public CompletableFuture<Void> connect() {
        LOG.info("Opening sync session to {}", config.getUrl());
        return connection.connect();
    }

    public ConnectionManager connection() {
        return connection;
    }

    public SyncCoordinator sync() {
        return sync;
    }

    public EventBus events() {
        return events;
    }

    public SyncClientConfig getConfig() {
        return config;
    }

    /**
     * Disconnect and stop the event loop. The session cannot be reused.
     */
    @Override
    public void close() {
        connection.disconnect();
        scheduler.shutdown();
        LOG.info("Sync session to {} closed", config.getUrl());
    }
}
