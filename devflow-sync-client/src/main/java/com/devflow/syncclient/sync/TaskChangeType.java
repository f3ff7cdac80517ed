package com.devflow.syncclient.sync;

/**
 * The {@code changeType} field of a task update and the event it is published as.
 */
public enum TaskChangeType {
    CREATED("created", "task_created"),
    UPDATED("updated", "task_updated"),
    DELETED("deleted", "task_deleted"),
    MOVED("moved", "task_moved"),
    STATUS_CHANGED("status_changed", "task_status_changed"),
    CHANGED("", "task_changed");

    private final String wireName;
    private final String eventName;

    TaskChangeType(String wireName, String eventName) {
        this.wireName = wireName;
        this.eventName = eventName;
    }

    public String wireName() {
        return wireName;
    }

    public String eventName() {
        return eventName;
    }

    /**
     * Unknown or missing change types map to {@link #CHANGED}.
     */
    public static TaskChangeType fromWire(String changeType) {
        if (changeType != null && !changeType.isEmpty()) {
            for (TaskChangeType type : values()) {
                if (type.wireName.equals(changeType)) {
                    return type;
                }
            }
        }
        return CHANGED;
    }
}
