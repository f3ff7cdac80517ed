package com.devflow.syncclient.connection;

import java.util.Optional;

/**
 * Envelope types of the sync protocol.
 */
public enum MessageType {
    // Client -> server
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    PING("ping"),
    DATA_SYNC("data_sync"),
    REQUEST_FULL_SYNC("request_full_sync"),

    // Server -> client
    CONNECTION_ESTABLISHED("connection_established"),
    SUBSCRIPTION_CONFIRMED("subscription_confirmed"),
    UNSUBSCRIPTION_CONFIRMED("unsubscription_confirmed"),
    SUBSCRIPTION_DATA("subscription_data"),
    PONG("pong"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
