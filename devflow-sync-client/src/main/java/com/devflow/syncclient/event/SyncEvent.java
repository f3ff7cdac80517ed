package com.devflow.syncclient.event;

import com.devflow.syncclient.connection.ConnectionState;
import com.devflow.syncclient.connection.Envelope;
import com.devflow.syncclient.connection.Subscription;
import com.devflow.syncclient.sync.DataType;
import com.devflow.syncclient.sync.SyncStatus;
import com.devflow.syncclient.sync.TaskChangeType;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a sync session publishes on its {@link EventBus}.
 *
 * Each event carries a typed payload; {@link #name()} is the wire-style name
 * used by collaborators that subscribe by string.
 */
public sealed interface SyncEvent {

    String name();

    // ========== Connection events ==========

    record StateChanged(ConnectionState from, ConnectionState to) implements SyncEvent {
        @Override
        public String name() {
            return "state_change";
        }
    }

    /** The socket reached the open state. */
    record Connected() implements SyncEvent {
        @Override
        public String name() {
            return "connected";
        }
    }

    record ConnectionEstablished(String connectionId, JsonNode user, JsonNode data) implements SyncEvent {
        @Override
        public String name() {
            return "connection_established";
        }
    }

    record Disconnected(int code, String reason) implements SyncEvent {
        @Override
        public String name() {
            return "disconnected";
        }
    }

    record Reconnecting(int attempt, long delayMillis) implements SyncEvent {
        @Override
        public String name() {
            return "reconnecting";
        }
    }

    /** The socket re-opened after an abnormal closure and subscriptions were replayed. */
    record Reconnected(int resubscribed) implements SyncEvent {
        @Override
        public String name() {
            return "reconnected";
        }
    }

    record ReconnectionFailed(int attempts) implements SyncEvent {
        @Override
        public String name() {
            return "reconnection_failed";
        }
    }

    record ErrorOccurred(String message, Throwable cause) implements SyncEvent {
        @Override
        public String name() {
            return "error";
        }
    }

    /** An envelope whose type has no dedicated handler. */
    record MessageReceived(Envelope envelope) implements SyncEvent {
        @Override
        public String name() {
            return "message";
        }
    }

    record SubscriptionData(String topic, JsonNode payload) implements SyncEvent {
        @Override
        public String name() {
            return "subscription_data";
        }
    }

    /** Same delivery as {@link SubscriptionData}, addressed as {@code topic:<name>}. */
    record TopicData(String topic, JsonNode payload) implements SyncEvent {
        @Override
        public String name() {
            return topicEventName(topic);
        }
    }

    // ========== Synchronization events ==========

    record SyncStatusChanged(SyncStatus status) implements SyncEvent {
        @Override
        public String name() {
            return "sync_status_changed";
        }
    }

    record OnlineStatusChanged(boolean online) implements SyncEvent {
        @Override
        public String name() {
            return "online_status_changed";
        }
    }

    record DashboardUpdated(String dashboardId, JsonNode data, boolean hasConflict) implements SyncEvent {
        @Override
        public String name() {
            return "dashboard_updated";
        }
    }

    record WidgetUpdated(String widgetId, String dashboardId, JsonNode data) implements SyncEvent {
        @Override
        public String name() {
            return "widget_updated";
        }
    }

    record TaskChanged(TaskChangeType changeType, String taskId, JsonNode data) implements SyncEvent {
        @Override
        public String name() {
            return changeType.eventName();
        }
    }

    record MetricUpdated(String metricType, String userId, String teamId, JsonNode value,
                         Instant timestamp) implements SyncEvent {
        @Override
        public String name() {
            return "metric_updated";
        }
    }

    record UserActivity(String userId, JsonNode activity, Instant timestamp) implements SyncEvent {
        @Override
        public String name() {
            return "user_activity";
        }
    }

    record DataQueued(String type, JsonNode data, int queueSize) implements SyncEvent {
        @Override
        public String name() {
            return "data_queued";
        }
    }

    record SyncQueueProcessed(int processedCount, int remaining) implements SyncEvent {
        @Override
        public String name() {
            return "sync_queue_processed";
        }
    }

    record SyncTimeUpdated(String timestamp) implements SyncEvent {
        @Override
        public String name() {
            return "sync_time_updated";
        }
    }

    record CacheCleared() implements SyncEvent {
        @Override
        public String name() {
            return "cache_cleared";
        }
    }

    record SubscriptionAdded(DataType dataType, Map<String, Object> filters) implements SyncEvent {
        @Override
        public String name() {
            return "subscription_added";
        }
    }

    record SubscriptionRemoved(DataType dataType, Map<String, Object> filters) implements SyncEvent {
        @Override
        public String name() {
            return "subscription_removed";
        }
    }

    record SubscriptionFailed(DataType dataType, Map<String, Object> filters, Throwable error) implements SyncEvent {
        @Override
        public String name() {
            return "subscription_error";
        }
    }

    record ResyncStarted() implements SyncEvent {
        @Override
        public String name() {
            return "resync_started";
        }
    }

    record ResyncRequested(List<Subscription> subscriptions) implements SyncEvent {
        @Override
        public String name() {
            return "resync_requested";
        }
    }

    record ResyncFailed(Throwable error) implements SyncEvent {
        @Override
        public String name() {
            return "resync_error";
        }
    }

    static String topicEventName(String topic) {
        return "topic:" + topic;
    }
}
