package com.devflow.syncclient.transport;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Creates sockets backed by Java-WebSocket's {@link WebSocketClient}.
 */
public class JavaWebSocketFactory implements SyncSocketFactory {
    private static final Logger LOG = LoggerFactory.getLogger(JavaWebSocketFactory.class);

    /** Liveness is tracked by the application-level heartbeat, so the library's own check is off by default. */
    private final int connectionLostTimeoutSeconds;

    public JavaWebSocketFactory() {
        this(0);
    }

    public JavaWebSocketFactory(int connectionLostTimeoutSeconds) {
        this.connectionLostTimeoutSeconds = connectionLostTimeoutSeconds;
    }

    @Override
    public SyncSocket create(URI uri, SocketListener listener) {
        JavaWebSocket socket = new JavaWebSocket(uri, listener);
        socket.setConnectionLostTimeout(connectionLostTimeoutSeconds);
        return socket;
    }

    /**
     * WebSocket client implementation.
     */
    private static class JavaWebSocket extends WebSocketClient implements SyncSocket {
        private final SocketListener listener;

        JavaWebSocket(URI serverUri, SocketListener listener) {
            super(serverUri);
            this.listener = listener;
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            LOG.debug("WebSocket opened: status={}", handshake.getHttpStatus());
            listener.onOpen();
        }

        @Override
        public void onMessage(String message) {
            listener.onMessage(message);
        }

        @Override
        public void onMessage(ByteBuffer bytes) {
            listener.onMessage(StandardCharsets.UTF_8.decode(bytes).toString());
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            LOG.debug("WebSocket closed: code={}, reason={}, remote={}", code, reason, remote);
            listener.onClose(code, reason, remote);
        }

        @Override
        public void onError(Exception ex) {
            LOG.debug("WebSocket error: {}", ex.getMessage());
            listener.onError(ex);
        }
    }
}
