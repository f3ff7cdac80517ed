package com.devflow.syncclient.sync;

/**
 * Kinds of domain data a client can follow in real time. Each maps to one
 * server topic: {@code <type>_updated}, or {@code user_activity} for activity feeds.
 */
public enum DataType {
    DASHBOARD("dashboard", "dashboard_updated"),
    WIDGET("widget", "widget_updated"),
    TASK("task", "task_updated"),
    METRIC("metric", "metric_updated"),
    USER_ACTIVITY("user_activity", "user_activity");

    private final String wireName;
    private final String topic;

    DataType(String wireName, String topic) {
        this.wireName = wireName;
        this.topic = topic;
    }

    public String wireName() {
        return wireName;
    }

    public String topic() {
        return topic;
    }

    public static DataType fromWire(String name) {
        for (DataType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
