package com.devflow.syncclient.sync;

public enum SyncStatus {
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    RECONNECTING("reconnecting"),
    RECONNECTED("reconnected"),
    FAILED("failed");

    private final String wireName;

    SyncStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
