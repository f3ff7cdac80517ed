package com.devflow.syncclient.connection;

/**
 * Connection state enum.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    ERROR
}
