package com.devflow.syncclient.support;

import com.devflow.syncclient.transport.SocketListener;
import com.devflow.syncclient.transport.SyncSocketFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Hands out {@link FakeSocket}s and remembers every one it created.
 */
public class FakeSocketFactory implements SyncSocketFactory {

    private final List<FakeSocket> sockets = new ArrayList<>();

    @Override
    public FakeSocket create(URI uri, SocketListener listener) {
        FakeSocket socket = new FakeSocket(uri, listener);
        sockets.add(socket);
        return socket;
    }

    public FakeSocket last() {
        if (sockets.isEmpty()) {
            throw new IllegalStateException("No socket created yet");
        }
        return sockets.get(sockets.size() - 1);
    }

    public int createdCount() {
        return sockets.size();
    }

    public List<FakeSocket> all() {
        return List.copyOf(sockets);
    }
}
