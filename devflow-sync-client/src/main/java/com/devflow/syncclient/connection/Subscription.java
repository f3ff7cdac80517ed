package com.devflow.syncclient.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A topic subscription with optional filters. Two subscriptions are the same
 * when topic and filters are structurally equal.
 */
public record Subscription(String topic, Map<String, Object> filters) {

    public Subscription {
        Objects.requireNonNull(topic, "topic");
        filters = filters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static Subscription of(String topic) {
        return new Subscription(topic, Map.of());
    }

    public static Subscription of(String topic, Map<String, Object> filters) {
        return new Subscription(topic, filters);
    }
}
