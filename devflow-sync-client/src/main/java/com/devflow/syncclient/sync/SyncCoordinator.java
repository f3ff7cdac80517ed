package com.devflow.syncclient.sync;

import com.devflow.syncclient.connection.ConnectionManager;
import com.devflow.syncclient.connection.Envelope;
import com.devflow.syncclient.connection.EnvelopeCodec;
import com.devflow.syncclient.connection.MessageType;
import com.devflow.syncclient.connection.Subscription;
import com.devflow.syncclient.event.EventBus;
import com.devflow.syncclient.event.SyncEvent;
import com.devflow.syncclient.exception.NotConnectedException;
import com.devflow.syncclient.schedule.TaskScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Domain layer on top of a {@link ConnectionManager}.
 *
 * Turns raw topic deliveries into dashboard, widget, task, metric and activity
 * events, keeps a local cache of the latest records, and buffers local changes
 * while the connection is down so they can be replayed once it is back.
 */
public class SyncCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(SyncCoordinator.class);

    /** Local and remote edits closer together than this are treated as conflicting. */
    static final long CONFLICT_WINDOW_MS = 5000;

    private final ConnectionManager connection;
    private final EventBus events;
    private final TaskScheduler scheduler;
    private final EnvelopeCodec codec;
    private final int maxQueueSize;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> pendingSubscribes = new ConcurrentHashMap<>();
    private final Map<String, Object> cache = new ConcurrentHashMap<>();
    private final Deque<QueuedChange> queue = new ArrayDeque<>();

    private volatile boolean online = true;
    private volatile Instant lastSyncTime;
    private volatile ConflictResolver conflictResolver = SyncCoordinator::latestWins;

    public SyncCoordinator(ConnectionManager connection, TaskScheduler scheduler) {
        this.connection = connection;
        this.events = connection.events();
        this.scheduler = scheduler;
        this.codec = connection.getCodec();
        this.maxQueueSize = connection.getConfig().getMaxQueueSize();

        events.on(SyncEvent.Connected.class, e -> onConnected());
        events.on(SyncEvent.Disconnected.class, e -> onDisconnected());
        events.on(SyncEvent.Reconnecting.class, e -> setStatus(SyncStatus.RECONNECTING));
        events.on(SyncEvent.Reconnected.class, e -> onReconnected());
        events.on(SyncEvent.ReconnectionFailed.class, e -> setStatus(SyncStatus.FAILED));
        events.on(SyncEvent.TopicData.class, this::onTopicData);
    }

    // ========== Subscriptions ==========

    /**
     * Follow a data type. Completes immediately when the same type and filters
     * are already followed, and joins the request in flight when one is pending.
     */
    public CompletableFuture<Void> subscribeToDataType(DataType dataType, Map<String, Object> filters) {
        Subscription subscription = Subscription.of(dataType.topic(), filters);
        String key;
        try {
            key = codec.keyOf(subscription);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (subscriptions.containsKey(key)) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> request = new CompletableFuture<>();
        CompletableFuture<Void> inFlight = pendingSubscribes.putIfAbsent(key, request);
        if (inFlight != null) {
            return inFlight.copy();
        }
        // Confirmed between the check above and the claim
        if (subscriptions.containsKey(key)) {
            pendingSubscribes.remove(key, request);
            request.complete(null);
            return request.copy();
        }

        connection.subscribe(subscription).whenComplete((v, error) -> {
            if (error == null) {
                subscriptions.put(key, subscription);
                pendingSubscribes.remove(key, request);
                events.emit(new SyncEvent.SubscriptionAdded(dataType, subscription.filters()));
                request.complete(null);
            } else {
                Throwable cause = unwrap(error);
                pendingSubscribes.remove(key, request);
                LOG.warn("Failed to subscribe to {}: {}", dataType.topic(), cause.getMessage());
                events.emit(new SyncEvent.SubscriptionFailed(dataType, subscription.filters(), cause));
                request.completeExceptionally(cause);
            }
        });
        return request.copy();
    }

    public CompletableFuture<Void> unsubscribeFromDataType(DataType dataType, Map<String, Object> filters) {
        String key = codec.keyOf(Subscription.of(dataType.topic(), filters));
        Subscription subscription = subscriptions.get(key);
        if (subscription == null) {
            return CompletableFuture.completedFuture(null);
        }
        return connection.unsubscribe(subscription).whenComplete((v, error) -> {
            if (error == null) {
                subscriptions.remove(key);
                events.emit(new SyncEvent.SubscriptionRemoved(dataType, subscription.filters()));
            } else {
                events.emit(new SyncEvent.SubscriptionFailed(dataType, subscription.filters(), unwrap(error)));
            }
        });
    }

    public List<Subscription> getSubscriptions() {
        return List.copyOf(subscriptions.values());
    }

    // ========== Offline queue ==========

    /**
     * Buffer a local change. When the queue is full the oldest change is dropped.
     */
    public void queueDataChange(String type, Object data) {
        JsonNode node = codec.toTree(data);
        int size;
        synchronized (queue) {
            queue.addLast(new QueuedChange(type, node, Instant.ofEpochMilli(scheduler.currentTimeMillis())));
            while (queue.size() > maxQueueSize) {
                QueuedChange dropped = queue.removeFirst();
                LOG.warn("Sync queue full, dropping oldest {} change", dropped.type());
            }
            size = queue.size();
        }
        events.emit(new SyncEvent.DataQueued(type, node, size));
    }

    /**
     * Changes waiting to be sent, oldest first.
     */
    public List<QueuedChange> getQueuedChanges() {
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    public int getQueueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    /**
     * Send every queued change as a {@code data_sync} message in FIFO order.
     * Changes that cannot be sent stay queued, ahead of anything queued since.
     */
    void processSyncQueue() {
        List<QueuedChange> pending;
        synchronized (queue) {
            if (queue.isEmpty()) {
                return;
            }
            pending = new ArrayList<>(queue);
            queue.clear();
        }

        List<QueuedChange> failed = new ArrayList<>();
        int processed = 0;
        for (QueuedChange change : pending) {
            try {
                sendDataChange(change);
                processed++;
            } catch (NotConnectedException e) {
                LOG.warn("Failed to sync queued {} change: {}", change.type(), e.getMessage());
                failed.add(change);
            }
        }

        int remaining;
        synchronized (queue) {
            for (int i = failed.size() - 1; i >= 0; i--) {
                queue.addFirst(failed.get(i));
            }
            while (queue.size() > maxQueueSize) {
                queue.removeFirst();
            }
            remaining = queue.size();
        }
        LOG.info("Processed sync queue: {} sent, {} remaining", processed, remaining);
        events.emit(new SyncEvent.SyncQueueProcessed(processed, remaining));
    }

    private void sendDataChange(QueuedChange change) throws NotConnectedException {
        ObjectNode data = codec.getObjectMapper().createObjectNode();
        data.put("changeType", change.type());
        data.set("payload", change.data());
        data.put("timestamp", Instant.ofEpochMilli(scheduler.currentTimeMillis()).toString());
        data.put("clientId", connection.getConnectionId());
        connection.sendMessage(Envelope.of(MessageType.DATA_SYNC, data));
    }

    // ========== Cache ==========

    public Object getCachedData(String key) {
        return cache.get(key);
    }

    /**
     * Store a value; a null value removes the key.
     */
    public void setCachedData(String key, Object value) {
        if (value == null) {
            cache.remove(key);
        } else {
            cache.put(key, value);
        }
    }

    public void clearCache() {
        cache.clear();
        events.emit(new SyncEvent.CacheCleared());
    }

    // ========== Status ==========

    /**
     * External reachability signal. Coming back online while connected asks the
     * server for a full resync.
     */
    public void setOnline(boolean online) {
        if (this.online == online) {
            return;
        }
        this.online = online;
        LOG.info("Network is {}", online ? "online" : "offline");
        events.emit(new SyncEvent.OnlineStatusChanged(online));
        if (online && connection.isConnected()) {
            resyncAllData();
        }
    }

    public boolean isOnline() {
        return online;
    }

    public void updateLastSyncTime() {
        Instant now = Instant.ofEpochMilli(scheduler.currentTimeMillis());
        lastSyncTime = now;
        events.emit(new SyncEvent.SyncTimeUpdated(now.toString()));
    }

    public Instant getLastSyncTime() {
        return lastSyncTime;
    }

    public ConnectionStatus getConnectionStatus() {
        return new ConnectionStatus(online && connection.isConnected(), online, getQueueSize(),
            subscriptions.size(), lastSyncTime);
    }

    /**
     * Replace the strategy used when a dashboard update collides with a recent
     * local change. Null restores the default: the most recent {@code lastModified} wins.
     */
    public void setConflictResolver(ConflictResolver resolver) {
        this.conflictResolver = resolver != null ? resolver : SyncCoordinator::latestWins;
    }

    // ========== Connection events ==========

    private void onConnected() {
        setStatus(SyncStatus.CONNECTED);
        processSyncQueue();
    }

    private void onDisconnected() {
        setStatus(SyncStatus.DISCONNECTED);
        // Follow the connection's bookkeeping: an explicit disconnect forgets subscriptions
        Set<String> kept = connection.getSubscriptions().stream()
            .map(codec::keyOf)
            .collect(Collectors.toSet());
        subscriptions.keySet().removeIf(key -> !kept.contains(key));
    }

    private void onReconnected() {
        setStatus(SyncStatus.RECONNECTED);
        resyncAllData();
    }

    private void setStatus(SyncStatus status) {
        events.emit(new SyncEvent.SyncStatusChanged(status));
    }

    void resyncAllData() {
        events.emit(new SyncEvent.ResyncStarted());
        List<Subscription> followed = getSubscriptions();
        try {
            ObjectNode data = codec.getObjectMapper().createObjectNode();
            data.set("subscriptions", codec.toTree(followed));
            Instant lastSync = lastSyncTime;
            data.put("lastSync", lastSync != null ? lastSync.toString() : null);
            data.put("clientId", connection.getConnectionId());
            connection.sendMessage(Envelope.of(MessageType.REQUEST_FULL_SYNC, data));
            LOG.info("Requested full sync for {} subscription(s)", followed.size());
            events.emit(new SyncEvent.ResyncRequested(followed));
        } catch (NotConnectedException e) {
            LOG.warn("Resync failed: {}", e.getMessage());
            events.emit(new SyncEvent.ResyncFailed(e));
        }
    }

    // ========== Topic deliveries ==========

    private void onTopicData(SyncEvent.TopicData delivery) {
        JsonNode payload = delivery.payload();
        if (payload == null || !payload.isObject()) {
            if (isDomainTopic(delivery.topic())) {
                LOG.warn("Ignoring {} delivery without an object payload", delivery.topic());
            }
            return;
        }
        switch (delivery.topic()) {
            case "dashboard_updated" -> handleDashboardUpdate(payload);
            case "widget_updated" -> handleWidgetUpdate(payload);
            case "task_updated" -> handleTaskUpdate(payload);
            case "metric_updated" -> handleMetricUpdate(payload);
            case "user_activity" -> handleUserActivity(payload);
            default -> LOG.trace("No domain mapping for topic {}", delivery.topic());
        }
    }

    private void handleDashboardUpdate(JsonNode payload) {
        String dashboardId = payload.path("dashboardId").asText(null);
        String key = "dashboard:" + dashboardId;
        if (cache.get(key) instanceof JsonNode local && hasConflict(local, payload)) {
            JsonNode resolved = conflictResolver.resolve(local, payload);
            LOG.info("Resolved conflicting update of dashboard {}", dashboardId);
            cache.put(key, resolved);
            events.emit(new SyncEvent.DashboardUpdated(dashboardId, resolved, true));
        } else {
            cache.put(key, payload);
            events.emit(new SyncEvent.DashboardUpdated(dashboardId, payload, false));
        }
    }

    private void handleWidgetUpdate(JsonNode payload) {
        String widgetId = payload.path("widgetId").asText(null);
        cache.put("widget:" + widgetId, payload);
        events.emit(new SyncEvent.WidgetUpdated(widgetId, payload.path("dashboardId").asText(null), payload));
    }

    private void handleTaskUpdate(JsonNode payload) {
        String taskId = payload.path("taskId").asText(null);
        TaskChangeType changeType = TaskChangeType.fromWire(payload.path("changeType").asText(null));
        events.emit(new SyncEvent.TaskChanged(changeType, taskId, payload));
        cache.put("task:" + taskId, payload);
    }

    private void handleMetricUpdate(JsonNode payload) {
        events.emit(new SyncEvent.MetricUpdated(
            payload.path("metricType").asText(null),
            payload.path("userId").asText(null),
            payload.path("teamId").asText(null),
            payload.get("value"),
            parseInstant(payload.get("timestamp"))));
    }

    private void handleUserActivity(JsonNode payload) {
        events.emit(new SyncEvent.UserActivity(
            payload.path("userId").asText(null),
            payload.get("activity"),
            parseInstant(payload.get("timestamp"))));
    }

    private static boolean isDomainTopic(String topic) {
        for (DataType type : DataType.values()) {
            if (type.topic().equals(topic)) {
                return true;
            }
        }
        return false;
    }

    // ========== Conflicts ==========

    static boolean hasConflict(JsonNode local, JsonNode remote) {
        Instant localTime = parseInstant(local.get("lastModified"));
        Instant remoteTime = parseInstant(remote.get("lastModified"));
        if (localTime == null || remoteTime == null) {
            return false;
        }
        return Math.abs(localTime.toEpochMilli() - remoteTime.toEpochMilli()) < CONFLICT_WINDOW_MS;
    }

    static JsonNode latestWins(JsonNode local, JsonNode remote) {
        Instant localTime = parseInstant(local.get("lastModified"));
        Instant remoteTime = parseInstant(remote.get("lastModified"));
        long localMillis = localTime != null ? localTime.toEpochMilli() : 0;
        long remoteMillis = remoteTime != null ? remoteTime.toEpochMilli() : 0;
        return remoteMillis > localMillis ? remote : local;
    }

    /**
     * Timestamps arrive either as epoch milliseconds or as ISO-8601 strings.
     */
    static Instant parseInstant(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable timestamp: {}", value.asText());
            return null;
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    @Override
    public String toString() {
        return "SyncCoordinator{subscriptions=" + subscriptions.size() + ", queue=" + getQueueSize()
            + ", online=" + online + "}";
    }
}
