package com.devflow.syncclient.transport;

import java.net.URI;

@FunctionalInterface
public interface SyncSocketFactory {

    /**
     * Create an unopened socket for the given URI.
     */
    SyncSocket create(URI uri, SocketListener listener);
}
