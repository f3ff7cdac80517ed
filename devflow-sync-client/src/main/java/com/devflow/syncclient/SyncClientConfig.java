package com.devflow.syncclient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a sync session. Immutable; use {@link #builder(String, String)}.
 */
public final class SyncClientConfig {
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 5000;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 10;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 1.5;
    public static final long DEFAULT_MAX_RECONNECT_INTERVAL_MS = 60000;
    public static final long DEFAULT_SUBSCRIPTION_TIMEOUT_MS = 5000;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final String url;
    private final String token;
    private final long reconnectInterval;
    private final int maxReconnectAttempts;
    private final long heartbeatInterval;
    private final long heartbeatTimeout;
    private final double reconnectBackoffMultiplier;
    private final long maxReconnectInterval;
    private final long subscriptionTimeout;
    private final int maxQueueSize;

    private SyncClientConfig(Builder builder) {
        this.url = builder.url;
        this.token = builder.token;
        this.reconnectInterval = builder.reconnectInterval;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTimeout = builder.heartbeatTimeout > 0 ? builder.heartbeatTimeout : 2 * builder.heartbeatInterval;
        this.reconnectBackoffMultiplier = builder.reconnectBackoffMultiplier;
        this.maxReconnectInterval = builder.maxReconnectInterval;
        this.subscriptionTimeout = builder.subscriptionTimeout;
        this.maxQueueSize = builder.maxQueueSize;
    }

    public static Builder builder(String url, String token) {
        return new Builder(url, token);
    }

    /**
     * Load from system properties ({@code devflow.sync.*}), falling back to
     * environment variables ({@code DEVFLOW_SYNC_*}) and then to defaults.
     */
    public static SyncClientConfig load() {
        return load(System.getenv());
    }

    static SyncClientConfig load(Map<String, String> env) {
        Builder builder = builder(
            setting(env, "url", "ws://localhost:3001/ws"),
            setting(env, "token", ""));

        builder.reconnectInterval(Long.parseLong(
            setting(env, "reconnect_interval", String.valueOf(DEFAULT_RECONNECT_INTERVAL_MS))));
        builder.maxReconnectAttempts(Integer.parseInt(
            setting(env, "max_reconnect_attempts", String.valueOf(DEFAULT_MAX_RECONNECT_ATTEMPTS))));
        builder.heartbeatInterval(Long.parseLong(
            setting(env, "heartbeat_interval", String.valueOf(DEFAULT_HEARTBEAT_INTERVAL_MS))));
        builder.heartbeatTimeout(Long.parseLong(setting(env, "heartbeat_timeout", "0")));
        builder.reconnectBackoffMultiplier(Double.parseDouble(
            setting(env, "reconnect_backoff_multiplier", String.valueOf(DEFAULT_BACKOFF_MULTIPLIER))));
        builder.maxReconnectInterval(Long.parseLong(
            setting(env, "max_reconnect_interval", String.valueOf(DEFAULT_MAX_RECONNECT_INTERVAL_MS))));
        builder.subscriptionTimeout(Long.parseLong(
            setting(env, "subscription_timeout", String.valueOf(DEFAULT_SUBSCRIPTION_TIMEOUT_MS))));
        builder.maxQueueSize(Integer.parseInt(
            setting(env, "max_queue_size", String.valueOf(DEFAULT_MAX_QUEUE_SIZE))));

        return builder.build();
    }

    // devflow.sync.max_queue_size / DEVFLOW_SYNC_MAX_QUEUE_SIZE
    private static String setting(Map<String, String> env, String name, String defaultValue) {
        return System.getProperty("devflow.sync." + name,
            env.getOrDefault("DEVFLOW_SYNC_" + name.toUpperCase(), defaultValue));
    }

    /**
     * Read a YAML file with camelCase keys matching the builder methods, e.g.
     * <pre>
     * url: wss://devflow.example.com/ws
     * token: abc
     * reconnectInterval: 2000
     * </pre>
     */
    public static SyncClientConfig fromYaml(Path file) throws IOException {
        JsonNode root = YAML.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Not a YAML mapping: " + file);
        }
        if (!root.hasNonNull("url") || !root.hasNonNull("token")) {
            throw new IOException("Missing url or token in " + file);
        }

        Builder builder = builder(root.get("url").asText(), root.get("token").asText());
        builder.reconnectInterval(root.path("reconnectInterval").asLong(DEFAULT_RECONNECT_INTERVAL_MS));
        builder.maxReconnectAttempts(root.path("maxReconnectAttempts").asInt(DEFAULT_MAX_RECONNECT_ATTEMPTS));
        builder.heartbeatInterval(root.path("heartbeatInterval").asLong(DEFAULT_HEARTBEAT_INTERVAL_MS));
        builder.heartbeatTimeout(root.path("heartbeatTimeout").asLong(0));
        builder.reconnectBackoffMultiplier(
            root.path("reconnectBackoffMultiplier").asDouble(DEFAULT_BACKOFF_MULTIPLIER));
        builder.maxReconnectInterval(root.path("maxReconnectInterval").asLong(DEFAULT_MAX_RECONNECT_INTERVAL_MS));
        builder.subscriptionTimeout(root.path("subscriptionTimeout").asLong(DEFAULT_SUBSCRIPTION_TIMEOUT_MS));
        builder.maxQueueSize(root.path("maxQueueSize").asInt(DEFAULT_MAX_QUEUE_SIZE));
        return builder.build();
    }

    /**
     * Copy of this configuration with a different token.
     */
    public SyncClientConfig withToken(String newToken) {
        return toBuilder().token(newToken).build();
    }

    public Builder toBuilder() {
        return builder(url, token)
            .reconnectInterval(reconnectInterval)
            .maxReconnectAttempts(maxReconnectAttempts)
            .heartbeatInterval(heartbeatInterval)
            .heartbeatTimeout(heartbeatTimeout)
            .reconnectBackoffMultiplier(reconnectBackoffMultiplier)
            .maxReconnectInterval(maxReconnectInterval)
            .subscriptionTimeout(subscriptionTimeout)
            .maxQueueSize(maxQueueSize);
    }

    public String getUrl() {
        return url;
    }

    public String getToken() {
        return token;
    }

    public long getReconnectInterval() {
        return reconnectInterval;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public long getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public long getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public double getReconnectBackoffMultiplier() {
        return reconnectBackoffMultiplier;
    }

    public long getMaxReconnectInterval() {
        return maxReconnectInterval;
    }

    public long getSubscriptionTimeout() {
        return subscriptionTimeout;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    @Override
    public String toString() {
        // Never includes the token
        return "SyncClientConfig{url=" + url
            + ", reconnectInterval=" + reconnectInterval
            + ", maxReconnectAttempts=" + maxReconnectAttempts
            + ", heartbeatInterval=" + heartbeatInterval
            + ", heartbeatTimeout=" + heartbeatTimeout + "}";
    }

    public static final class Builder {
        private String url;
        private String token;
        private long reconnectInterval = DEFAULT_RECONNECT_INTERVAL_MS;
        private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private long heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL_MS;
        private long heartbeatTimeout;
        private double reconnectBackoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private long maxReconnectInterval = DEFAULT_MAX_RECONNECT_INTERVAL_MS;
        private long subscriptionTimeout = DEFAULT_SUBSCRIPTION_TIMEOUT_MS;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;

        private Builder(String url, String token) {
            this.url = url;
            this.token = token;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder reconnectInterval(long millis) {
            this.reconnectInterval = millis;
            return this;
        }

        public Builder maxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder heartbeatInterval(long millis) {
            this.heartbeatInterval = millis;
            return this;
        }

        /**
         * Silence after which the connection is considered dead. 0 means twice the heartbeat interval.
         */
        public Builder heartbeatTimeout(long millis) {
            this.heartbeatTimeout = millis;
            return this;
        }

        public Builder reconnectBackoffMultiplier(double multiplier) {
            this.reconnectBackoffMultiplier = multiplier;
            return this;
        }

        public Builder maxReconnectInterval(long millis) {
            this.maxReconnectInterval = millis;
            return this;
        }

        public Builder subscriptionTimeout(long millis) {
            this.subscriptionTimeout = millis;
            return this;
        }

        public Builder maxQueueSize(int size) {
            this.maxQueueSize = size;
            return this;
        }

        public SyncClientConfig build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(token, "token");
            if (url.isBlank()) {
                throw new IllegalArgumentException("url must not be blank");
            }
            if (reconnectInterval <= 0) {
                throw new IllegalArgumentException("reconnectInterval must be positive: " + reconnectInterval);
            }
            if (maxReconnectAttempts < 0) {
                throw new IllegalArgumentException("maxReconnectAttempts must be >= 0: " + maxReconnectAttempts);
            }
            if (heartbeatInterval <= 0) {
                throw new IllegalArgumentException("heartbeatInterval must be positive: " + heartbeatInterval);
            }
            if (heartbeatTimeout < 0) {
                throw new IllegalArgumentException("heartbeatTimeout must be >= 0: " + heartbeatTimeout);
            }
            if (reconnectBackoffMultiplier < 1.0) {
                throw new IllegalArgumentException(
                    "reconnectBackoffMultiplier must be >= 1: " + reconnectBackoffMultiplier);
            }
            if (subscriptionTimeout <= 0) {
                throw new IllegalArgumentException("subscriptionTimeout must be positive: " + subscriptionTimeout);
            }
            if (maxQueueSize <= 0) {
                throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
            }
            return new SyncClientConfig(this);
        }
    }
}
