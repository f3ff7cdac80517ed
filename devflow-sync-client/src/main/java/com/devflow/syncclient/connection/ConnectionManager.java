package com.devflow.syncclient.connection;

import com.devflow.syncclient.SyncClientConfig;
import com.devflow.syncclient.event.EventBus;
import com.devflow.syncclient.event.SyncEvent;
import com.devflow.syncclient.exception.ConnectionException;
import com.devflow.syncclient.exception.MalformedEnvelopeException;
import com.devflow.syncclient.exception.NotConnectedException;
import com.devflow.syncclient.schedule.TaskScheduler;
import com.devflow.syncclient.transport.SocketListener;
import com.devflow.syncclient.transport.SyncSocket;
import com.devflow.syncclient.transport.SyncSocketFactory;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Persistent connection to the sync server.
 *
 * Owns the socket and the connection state machine, and drives the heartbeat,
 * reconnection and subscription components:
 * - connect/disconnect lifecycle with state_change events
 * - inbound envelope dispatch onto the {@link EventBus}
 * - automatic reconnection after abnormal closures, bounded by maxReconnectAttempts
 * - replay of confirmed subscriptions once the connection is back
 *
 * All state changes happen on the session's {@link TaskScheduler} loop. Public
 * methods may be called from any thread.
 */
public class ConnectionManager {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    /** Close code for intentional closures; anything else triggers reconnection. */
    public static final int NORMAL_CLOSURE = 1000;
    /** Close code used locally when the heartbeat gives up on a silent connection. */
    public static final int HEARTBEAT_TIMEOUT_CLOSURE = 4000;

    private final SyncSocketFactory socketFactory;
    private final TaskScheduler scheduler;
    private final EventBus events;
    private final EnvelopeCodec codec;
    private final HeartbeatMonitor heartbeat;
    private final ReconnectionScheduler reconnection;
    private final SubscriptionRegistry subscriptions;

    private volatile SyncClientConfig config;
    private volatile ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private volatile String connectionId;

    // Loop-confined
    private SyncSocket socket;
    private long socketGeneration;
    private CompletableFuture<Void> pendingConnect;
    private boolean recovering;

    public ConnectionManager(SyncClientConfig config, SyncSocketFactory socketFactory,
                             TaskScheduler scheduler, EventBus events) {
        this.config = config;
        this.socketFactory = socketFactory;
        this.scheduler = scheduler;
        this.events = events;
        this.codec = new EnvelopeCodec();
        this.heartbeat = new HeartbeatMonitor(scheduler, config.getHeartbeatInterval(),
            config.getHeartbeatTimeout(), this::sendPing, this::onHeartbeatTimeout);
        this.reconnection = new ReconnectionScheduler(scheduler, config.getReconnectInterval(),
            config.getReconnectBackoffMultiplier(), config.getMaxReconnectInterval(),
            config.getMaxReconnectAttempts());
        this.subscriptions = new SubscriptionRegistry(codec, scheduler, this::sendOnLoop,
            config.getSubscriptionTimeout());
    }

    // ========== Lifecycle ==========

    /**
     * Open the connection. Completes when the socket is open; fails with
     * {@link ConnectionException} if it errors or closes first. Returns an
     * already completed future when connected, and joins the attempt in flight
     * when one is opening.
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        submit(result, () -> doConnect(result));
        return result;
    }

    /**
     * Close the connection with a normal closure, cancel all timers and forget
     * subscriptions. Safe in any state. When this returns no timer of this
     * manager is pending any more.
     */
    public void disconnect() {
        runOnLoopAndWait(this::doDisconnect);
    }

    /**
     * Replace the token. When connected, the socket is re-opened with the new
     * token and subscriptions are replayed.
     */
    public void updateToken(String token) {
        runOnLoop(() -> {
            config = config.withToken(token);
            if (connectionState != ConnectionState.CONNECTED) {
                return;
            }
            LOG.info("Token updated, re-opening connection");
            SyncSocket old = detachSocket();
            old.close(NORMAL_CLOSURE, "Token refresh");
            subscriptions.onConnectionLost(NORMAL_CLOSURE);
            connectionId = null;
            recovering = true;
            openSocket();
        });
    }

    private void doConnect(CompletableFuture<Void> result) {
        switch (connectionState) {
            case CONNECTED -> result.complete(null);
            case CONNECTING -> {
                if (pendingConnect == null) {
                    pendingConnect = new CompletableFuture<>();
                }
                relay(pendingConnect, result);
            }
            case RECONNECTING -> {
                // Connect now instead of waiting for the timer; the attempt count carries on
                reconnection.cancel();
                pendingConnect = result;
                openSocket();
            }
            case DISCONNECTED, ERROR -> {
                if (connectionState == ConnectionState.ERROR) {
                    reconnection.reset();
                }
                pendingConnect = result;
                openSocket();
            }
        }
    }

    private void doDisconnect() {
        ConnectionState previous = connectionState;
        reconnection.reset();
        heartbeat.stop();
        recovering = false;

        SyncSocket closing = detachSocket();
        if (closing != null) {
            try {
                closing.close(NORMAL_CLOSURE, "Client disconnect");
            } catch (Exception e) {
                LOG.warn("Error closing socket: {}", e.getMessage());
            }
        }
        connectionId = null;
        failPendingConnect(new ConnectionException("Disconnected before the connection opened", NORMAL_CLOSURE));
        subscriptions.clear();

        setConnectionState(ConnectionState.DISCONNECTED);
        if (previous != ConnectionState.DISCONNECTED) {
            LOG.info("Disconnected from {}", config.getUrl());
            events.emit(new SyncEvent.Disconnected(NORMAL_CLOSURE, "Client disconnect"));
        }
    }

    private void openSocket() {
        setConnectionState(ConnectionState.CONNECTING);

        URI uri;
        try {
            uri = buildConnectionUri();
        } catch (URISyntaxException e) {
            LOG.error("Invalid sync server URL {}: {}", config.getUrl(), e.getMessage());
            reconnection.reset();
            setConnectionState(ConnectionState.ERROR);
            ConnectionException error = new ConnectionException("Invalid server URL: " + config.getUrl(), e);
            failPendingConnect(error);
            events.emit(new SyncEvent.ErrorOccurred(error.getMessage(), error));
            return;
        }

        long generation = ++socketGeneration;
        try {
            socket = socketFactory.create(uri, new SocketHandler(generation));
            socket.connect();
            LOG.debug("Connecting to {}", config.getUrl());
        } catch (Exception e) {
            LOG.error("Failed to connect to {} - {}", config.getUrl(), e.getMessage());
            events.emit(new SyncEvent.ErrorOccurred(e.getMessage(), e));
            handleClose(generation, -1, e.getMessage());
        }
    }

    /**
     * Connection URL: the configured URL with {@code token} appended as a query parameter.
     */
    URI buildConnectionUri() throws URISyntaxException {
        String url = config.getUrl();
        String separator = url.contains("?") ? "&" : "?";
        return new URI(url + separator + "token=" + URLEncoder.encode(config.getToken(), StandardCharsets.UTF_8));
    }

    // ========== Socket events ==========

    private void handleOpen(long generation) {
        if (generation != socketGeneration) {
            return;
        }
        boolean recovered = recovering;
        recovering = false;
        reconnection.reset();
        setConnectionState(ConnectionState.CONNECTED);
        heartbeat.start();
        LOG.info("Connected to {}", config.getUrl());

        events.emit(new SyncEvent.Connected());
        CompletableFuture<Void> waiting = pendingConnect;
        pendingConnect = null;
        if (waiting != null) {
            waiting.complete(null);
        }

        if (!subscriptions.getSubscriptions().isEmpty()) {
            int resubscribed = subscriptions.replayAll();
            if (recovered) {
                events.emit(new SyncEvent.Reconnected(resubscribed));
            }
        } else if (recovered) {
            events.emit(new SyncEvent.Reconnected(0));
        }
    }

    private void handleClose(long generation, int code, String reason) {
        if (generation != socketGeneration) {
            return;
        }
        ConnectionState previous = connectionState;
        detachSocket();
        heartbeat.stop();
        connectionId = null;
        LOG.info("Connection closed: code={}, reason={}", code, reason);

        failPendingConnect(new ConnectionException(
            "Connection closed before open (code " + code + (reason == null || reason.isEmpty() ? "" : ", " + reason) + ")",
            code));
        subscriptions.onConnectionLost(code);

        if (code == NORMAL_CLOSURE) {
            reconnection.reset();
            recovering = false;
            setConnectionState(ConnectionState.DISCONNECTED);
            events.emit(new SyncEvent.Disconnected(code, reason));
            return;
        }

        if (previous != ConnectionState.CONNECTED && previous != ConnectionState.CONNECTING) {
            setConnectionState(ConnectionState.DISCONNECTED);
            events.emit(new SyncEvent.Disconnected(code, reason));
            return;
        }

        // A first connect that never opened is retried, but its success is not a recovery
        recovering = recovering || previous == ConnectionState.CONNECTED;
        if (reconnection.isExhausted()) {
            LOG.error("Giving up on {} after {} reconnect attempt(s)", config.getUrl(), reconnection.getAttempts());
            int attempts = reconnection.getAttempts();
            reconnection.reset();
            setConnectionState(ConnectionState.ERROR);
            if (!emitWhile(ConnectionState.ERROR, new SyncEvent.Disconnected(code, reason))) {
                return;
            }
            emitWhile(ConnectionState.ERROR, new SyncEvent.ReconnectionFailed(attempts));
            return;
        }

        int attempt = reconnection.scheduleNext(this::attemptReconnect);
        setConnectionState(ConnectionState.RECONNECTING);
        if (!emitWhile(ConnectionState.RECONNECTING, new SyncEvent.Disconnected(code, reason))) {
            return;
        }
        emitWhile(ConnectionState.RECONNECTING, new SyncEvent.Reconnecting(attempt, reconnection.delayFor(attempt)));
    }

    /**
     * Emit the event only if no listener has moved the connection on from
     * {@code expected} in the meantime, e.g. by calling {@link #disconnect()}.
     *
     * @return whether the state is still {@code expected} after emitting
     */
    private boolean emitWhile(ConnectionState expected, SyncEvent event) {
        if (connectionState != expected) {
            return false;
        }
        events.emit(event);
        return connectionState == expected;
    }

    private void handleError(long generation, Exception error) {
        if (generation != socketGeneration) {
            return;
        }
        LOG.error("WebSocket error: {}", error.getMessage());
        events.emit(new SyncEvent.ErrorOccurred(error.getMessage(), error));
        if (connectionState == ConnectionState.CONNECTING) {
            failPendingConnect(new ConnectionException("Connection failed: " + error.getMessage(), error));
        }
    }

    private void attemptReconnect() {
        if (connectionState != ConnectionState.RECONNECTING) {
            return;
        }
        LOG.info("Attempting to reconnect to {} (attempt {})", config.getUrl(), reconnection.getAttempts());
        openSocket();
    }

    private void onHeartbeatTimeout() {
        if (connectionState != ConnectionState.CONNECTED || socket == null) {
            return;
        }
        long generation = socketGeneration;
        SyncSocket silent = socket;
        try {
            silent.close(HEARTBEAT_TIMEOUT_CLOSURE, "Heartbeat timeout");
        } catch (Exception e) {
            LOG.debug("Error closing silent socket: {}", e.getMessage());
        }
        handleClose(generation, HEARTBEAT_TIMEOUT_CLOSURE, "Heartbeat timeout");
    }

    // ========== Inbound messages ==========

    private void handleFrame(long generation, String frame) {
        if (generation != socketGeneration) {
            return;
        }
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (MalformedEnvelopeException e) {
            LOG.warn("Failed to parse message: {} - {}", abbreviate(frame), e.getMessage());
            events.emit(new SyncEvent.ErrorOccurred(e.getMessage(), e));
            return;
        }
        LOG.debug("Received {}", envelope.type());

        Optional<MessageType> type = MessageType.fromWire(envelope.type());
        if (type.isEmpty()) {
            events.emit(new SyncEvent.MessageReceived(envelope));
            return;
        }

        JsonNode data = envelope.data();
        switch (type.get()) {
            case CONNECTION_ESTABLISHED -> handleConnectionEstablished(data);
            case PONG -> heartbeat.recordPong();
            case SUBSCRIPTION_CONFIRMED -> subscriptions.onSubscriptionConfirmed(data);
            case UNSUBSCRIPTION_CONFIRMED -> subscriptions.onUnsubscriptionConfirmed(data);
            case SUBSCRIPTION_DATA -> handleSubscriptionData(data);
            case ERROR -> handleServerError(data);
            default -> events.emit(new SyncEvent.MessageReceived(envelope));
        }
    }

    private void handleConnectionEstablished(JsonNode data) {
        connectionId = data.path("connectionId").asText(null);
        LOG.info("Connection established: id={}", connectionId);
        events.emit(new SyncEvent.ConnectionEstablished(connectionId, data.get("user"), data));
    }

    private void handleSubscriptionData(JsonNode data) {
        String topic = data.path("topic").asText(null);
        if (topic == null) {
            LOG.warn("Subscription data without topic: {}", data);
            return;
        }
        JsonNode payload = data.get("payload");
        events.emit(new SyncEvent.SubscriptionData(topic, payload));
        events.emit(new SyncEvent.TopicData(topic, payload));
    }

    private void handleServerError(JsonNode data) {
        String message = data.path("message").asText("Unknown error");
        boolean routed = subscriptions.onServerError(data);
        if (!routed) {
            LOG.warn("Server error: {}", message);
        }
        events.emit(new SyncEvent.ErrorOccurred(message, null));
    }

    // ========== Outbound messages ==========

    /**
     * Send an envelope.
     *
     * @throws NotConnectedException if the connection is not open
     */
    public void sendMessage(Envelope envelope) throws NotConnectedException {
        if (connectionState != ConnectionState.CONNECTED) {
            throw new NotConnectedException("Not connected (state: " + connectionState + ")");
        }
        if (scheduler.inEventLoop()) {
            sendOnLoop(envelope);
        } else {
            scheduler.execute(() -> {
                try {
                    sendOnLoop(envelope);
                } catch (NotConnectedException e) {
                    LOG.warn("Dropped {}: {}", envelope.type(), e.getMessage());
                }
            });
        }
    }

    private void sendOnLoop(Envelope envelope) throws NotConnectedException {
        SyncSocket current = socket;
        if (connectionState != ConnectionState.CONNECTED || current == null) {
            throw new NotConnectedException("Not connected (state: " + connectionState + ")");
        }
        try {
            current.send(codec.encode(envelope));
        } catch (RuntimeException e) {
            throw new NotConnectedException("Send failed: " + e.getMessage());
        }
        LOG.debug("Sent {}", envelope.type());
    }

    private void sendPing() {
        try {
            sendOnLoop(Envelope.of(MessageType.PING,
                codec.toTree(Map.of("timestamp", scheduler.currentTimeMillis()))));
        } catch (NotConnectedException e) {
            LOG.debug("Skipped ping: {}", e.getMessage());
        }
    }

    // ========== Subscriptions ==========

    /**
     * Subscribe to a topic. Fails immediately with {@link NotConnectedException}
     * when not connected.
     */
    public CompletableFuture<Void> subscribe(Subscription subscription) {
        return onLoop(() -> subscriptions.subscribe(subscription));
    }

    public CompletableFuture<Void> unsubscribe(Subscription subscription) {
        return onLoop(() -> subscriptions.unsubscribe(subscription));
    }

    /**
     * Confirmed subscriptions; an unmodifiable snapshot.
     */
    public List<Subscription> getSubscriptions() {
        return subscriptions.getSubscriptions();
    }

    private CompletableFuture<Void> onLoop(Supplier<CompletableFuture<Void>> request) {
        if (connectionState != ConnectionState.CONNECTED) {
            return CompletableFuture.failedFuture(
                new NotConnectedException("Not connected (state: " + connectionState + ")"));
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        submit(result, () -> relay(request.get(), result));
        return result;
    }

    /**
     * Run a request on the loop so that {@code result} settles even when the
     * request throws or the loop has been shut down.
     */
    private void submit(CompletableFuture<Void> result, Runnable request) {
        Runnable guarded = () -> {
            try {
                request.run();
            } catch (RuntimeException e) {
                LOG.warn("Request failed: {}", e.getMessage());
                result.completeExceptionally(e);
            }
        };
        try {
            runOnLoop(guarded);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new ConnectionException("Sync loop is stopped", e));
        }
    }

    // ========== State ==========

    public boolean isConnected() {
        return connectionState == ConnectionState.CONNECTED;
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    /**
     * Id assigned by the server in its {@code connection_established} message, or null.
     */
    public String getConnectionId() {
        return connectionId;
    }

    public int getReconnectAttempts() {
        return reconnection.getAttempts();
    }

    public EventBus events() {
        return events;
    }

    public SyncClientConfig getConfig() {
        return config;
    }

    public EnvelopeCodec getCodec() {
        return codec;
    }

    private void setConnectionState(ConnectionState state) {
        ConnectionState previous = connectionState;
        if (previous == state) {
            return;
        }
        if (previous == ConnectionState.CONNECTED) {
            heartbeat.stop();
        }
        connectionState = state;
        LOG.debug("Connection state {} -> {}", previous, state);
        events.emit(new SyncEvent.StateChanged(previous, state));
    }

    private SyncSocket detachSocket() {
        SyncSocket detached = socket;
        socket = null;
        socketGeneration++;
        return detached;
    }

    private void failPendingConnect(ConnectionException error) {
        CompletableFuture<Void> waiting = pendingConnect;
        pendingConnect = null;
        if (waiting != null) {
            waiting.completeExceptionally(error);
        }
    }

    private static void relay(CompletableFuture<Void> source, CompletableFuture<Void> target) {
        source.whenComplete((v, error) -> {
            if (error != null) {
                target.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error);
            } else {
                target.complete(v);
            }
        });
    }

    private void runOnLoop(Runnable task) {
        if (scheduler.inEventLoop()) {
            task.run();
        } else {
            scheduler.execute(task);
        }
    }

    private void runOnLoopAndWait(Runnable task) {
        if (scheduler.inEventLoop()) {
            task.run();
            return;
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                    done.complete(null);
                } catch (RuntimeException e) {
                    done.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            // Loop already stopped: nothing can race with us any more
            task.run();
            return;
        }
        done.join();
    }

    private static String abbreviate(String frame) {
        return frame.length() > 200 ? frame.substring(0, 200) + "..." : frame;
    }

    /**
     * Socket callbacks, tagged with the socket they belong to. Callbacks from a
     * socket that is no longer current are dropped on the loop.
     */
    private class SocketHandler implements SocketListener {
        private final long generation;

        SocketHandler(long generation) {
            this.generation = generation;
        }

        @Override
        public void onOpen() {
            post(() -> handleOpen(generation));
        }

        @Override
        public void onMessage(String text) {
            post(() -> handleFrame(generation, text));
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            post(() -> handleClose(generation, code, reason));
        }

        @Override
        public void onError(Exception error) {
            post(() -> handleError(generation, error));
        }

        private void post(Runnable callback) {
            try {
                runOnLoop(callback);
            } catch (RejectedExecutionException e) {
                LOG.debug("Sync loop stopped, dropping socket callback");
            }
        }
    }
}
