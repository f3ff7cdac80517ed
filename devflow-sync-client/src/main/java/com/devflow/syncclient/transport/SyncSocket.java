package com.devflow.syncclient.transport;

/**
 * One persistent bidirectional text connection.
 */
public interface SyncSocket {

    /**
     * Start opening the connection. Returns immediately; the outcome is reported
     * through {@link SocketListener#onOpen()} or {@link SocketListener#onClose}.
     */
    void connect();

    void send(String text);

    void close(int code, String reason);

    boolean isOpen();
}
