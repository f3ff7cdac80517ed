package com.devflow.syncclient.transport;

/**
 * Callbacks from a {@link SyncSocket}. May be invoked on a transport thread.
 */
public interface SocketListener {

    void onOpen();

    void onMessage(String text);

    /**
     * Called once when the connection is gone, including when it never opened.
     *
     * @param remote true when the peer (or the network) initiated the closure
     */
    void onClose(int code, String reason, boolean remote);

    void onError(Exception error);
}
