package com.devflow.syncclient.connection;

import com.devflow.syncclient.exception.ConnectionException;
import com.devflow.syncclient.exception.NotConnectedException;
import com.devflow.syncclient.exception.SubscriptionException;
import com.devflow.syncclient.schedule.Cancellable;
import com.devflow.syncclient.schedule.TaskScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Tracks confirmed topic subscriptions and the subscribe/unsubscribe requests
 * still waiting for the server.
 *
 * Confirmations carry no request id, so they are matched to requests by
 * subscription identity (topic + filters, see {@link EnvelopeCodec#keyOf}).
 * While a request for a key is outstanding, a second request for the same key
 * joins it instead of sending another frame.
 *
 * All mutating methods run on the session loop. {@link #getSubscriptions()} may be
 * called from any thread.
 */
public class SubscriptionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final EnvelopeCodec codec;
    private final TaskScheduler scheduler;
    private final EnvelopeSender sender;
    private final long timeoutMillis;

    private final Map<String, Subscription> confirmed = new LinkedHashMap<>();
    private volatile List<Subscription> snapshot = List.of();

    private final Map<String, PendingRequest> pendingSubscribes = new LinkedHashMap<>();
    private final Map<String, PendingRequest> pendingUnsubscribes = new LinkedHashMap<>();
    private long requestSequence;

    public SubscriptionRegistry(EnvelopeCodec codec, TaskScheduler scheduler, EnvelopeSender sender,
                                long timeoutMillis) {
        this.codec = codec;
        this.scheduler = scheduler;
        this.sender = sender;
        this.timeoutMillis = timeoutMillis;
    }

    // ========== Requests ==========

    /**
     * Send a subscribe request. Completes when the server confirms it, fails
     * with {@link SubscriptionException} on a server error or timeout, and with
     * {@link ConnectionException} if the connection drops first.
     */
    public CompletableFuture<Void> subscribe(Subscription subscription) {
        String key = codec.keyOf(subscription);
        PendingRequest existing = pendingSubscribes.get(key);
        if (existing != null) {
            LOG.debug("Subscribe to {} already pending, joining it", key);
            return existing.future;
        }
        return send(RequestKind.SUBSCRIBE, key, subscription);
    }

    /**
     * Send an unsubscribe request. The subscription leaves the tracked set when
     * the server confirms, or when the confirmation times out.
     */
    public CompletableFuture<Void> unsubscribe(Subscription subscription) {
        String key = codec.keyOf(subscription);
        PendingRequest existing = pendingUnsubscribes.get(key);
        if (existing != null) {
            return existing.future;
        }
        return send(RequestKind.UNSUBSCRIBE, key, subscription);
    }

    /**
     * Resend a subscribe for every confirmed subscription. Does not wait for
     * confirmations; they are processed like any other as they arrive.
     *
     * @return number of subscribe frames sent
     */
    public int replayAll() {
        int sent = 0;
        for (Map.Entry<String, Subscription> entry : new ArrayList<>(confirmed.entrySet())) {
            if (pendingSubscribes.containsKey(entry.getKey())) {
                continue;
            }
            CompletableFuture<Void> future = send(RequestKind.SUBSCRIBE, entry.getKey(), entry.getValue());
            future.whenComplete((v, error) -> {
                if (error != null) {
                    LOG.warn("Failed to resubscribe to {}: {}", entry.getValue().topic(), error.getMessage());
                }
            });
            if (!future.isCompletedExceptionally()) {
                sent++;
            }
        }
        LOG.info("Replayed {} subscription(s)", sent);
        return sent;
    }

    private CompletableFuture<Void> send(RequestKind kind, String key, Subscription subscription) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        PendingRequest request = new PendingRequest(kind, key, subscription, future, ++requestSequence);
        request.timeout = scheduler.schedule(() -> onTimeout(request), timeoutMillis);
        pendingFor(kind).put(key, request);

        try {
            sender.send(Envelope.of(kind.messageType, codec.toTree(subscription)));
        } catch (NotConnectedException e) {
            pendingFor(kind).remove(key);
            request.timeout.cancel();
            future.completeExceptionally(e);
            return future;
        }
        LOG.debug("Sent {} for {}", kind.messageType.wireName(), key);
        return future;
    }

    // ========== Server responses ==========

    public void onSubscriptionConfirmed(JsonNode data) {
        Subscription subscription = codec.toSubscription(data);
        if (subscription == null) {
            LOG.warn("Subscription confirmation without topic: {}", data);
            return;
        }
        String key = codec.keyOf(subscription);
        PendingRequest request = pendingSubscribes.remove(key);
        if (request == null) {
            LOG.debug("Unsolicited subscription confirmation for {}", key);
            return;
        }
        request.timeout.cancel();
        confirmed.put(key, request.subscription);
        publishSnapshot();
        LOG.info("Subscribed to {}", subscription.topic());
        request.future.complete(null);
    }

    public void onUnsubscriptionConfirmed(JsonNode data) {
        Subscription subscription = codec.toSubscription(data);
        if (subscription == null) {
            LOG.warn("Unsubscription confirmation without topic: {}", data);
            return;
        }
        String key = codec.keyOf(subscription);
        PendingRequest request = pendingUnsubscribes.remove(key);
        if (request == null) {
            LOG.debug("Unsolicited unsubscription confirmation for {}", key);
            return;
        }
        request.timeout.cancel();
        removeConfirmed(key);
        LOG.info("Unsubscribed from {}", subscription.topic());
        request.future.complete(null);
    }

    /**
     * Route a server {@code error} envelope to an outstanding request. When the
     * error names a topic, the oldest request for that topic fails; otherwise
     * the oldest outstanding request fails. Other requests are unaffected.
     *
     * @return true if a request was rejected
     */
    public boolean onServerError(JsonNode data) {
        String message = data.path("message").asText("Unknown error");
        String topic = data.path("topic").asText(null);

        Optional<PendingRequest> target = Stream.concat(
                pendingSubscribes.values().stream(), pendingUnsubscribes.values().stream())
            .filter(r -> topic == null || r.subscription.topic().equals(topic))
            .min(Comparator.comparingLong(r -> r.sequence));
        if (target.isEmpty()) {
            return false;
        }

        PendingRequest request = target.get();
        pendingFor(request.kind).remove(request.key);
        request.timeout.cancel();
        LOG.warn("Server rejected {} for {}: {}", request.kind.messageType.wireName(), request.key, message);
        request.future.completeExceptionally(new SubscriptionException(message, request.subscription));
        return true;
    }

    private void onTimeout(PendingRequest request) {
        if (pendingFor(request.kind).get(request.key) != request) {
            return;
        }
        pendingFor(request.kind).remove(request.key);
        if (request.kind == RequestKind.SUBSCRIBE) {
            LOG.warn("Subscription to {} timed out after {}ms", request.key, timeoutMillis);
            request.future.completeExceptionally(
                new SubscriptionException("Subscription timeout", request.subscription));
        } else {
            // No confirmation is not an error for unsubscribe: drop the entry locally
            LOG.warn("Unsubscription from {} not confirmed after {}ms", request.key, timeoutMillis);
            removeConfirmed(request.key);
            request.future.complete(null);
        }
    }

    // ========== Lifecycle ==========

    /**
     * The connection dropped: fail every outstanding request. Confirmed
     * subscriptions are kept for replay.
     */
    public void onConnectionLost(int closeCode) {
        failPending(new ConnectionException("Connection lost before confirmation", closeCode));
    }

    /**
     * Forget everything: fail outstanding requests and drop confirmed subscriptions.
     */
    public void clear() {
        failPending(new ConnectionException("Disconnected"));
        confirmed.clear();
        publishSnapshot();
    }

    private void failPending(ConnectionException cause) {
        List<PendingRequest> requests = new ArrayList<>(pendingSubscribes.values());
        requests.addAll(pendingUnsubscribes.values());
        pendingSubscribes.clear();
        pendingUnsubscribes.clear();
        for (PendingRequest request : requests) {
            request.timeout.cancel();
            request.future.completeExceptionally(cause);
        }
    }

    // ========== Queries ==========

    /**
     * Confirmed subscriptions, in confirmation order. The returned list is an
     * unmodifiable snapshot.
     */
    public List<Subscription> getSubscriptions() {
        return snapshot;
    }

    public boolean isSubscribed(Subscription subscription) {
        return confirmed.containsKey(codec.keyOf(subscription));
    }

    public int getPendingCount() {
        return pendingSubscribes.size() + pendingUnsubscribes.size();
    }

    private void removeConfirmed(String key) {
        if (confirmed.remove(key) != null) {
            publishSnapshot();
        }
    }

    private void publishSnapshot() {
        snapshot = List.copyOf(confirmed.values());
    }

    private Map<String, PendingRequest> pendingFor(RequestKind kind) {
        return kind == RequestKind.SUBSCRIBE ? pendingSubscribes : pendingUnsubscribes;
    }

    private enum RequestKind {
        SUBSCRIBE(MessageType.SUBSCRIBE),
        UNSUBSCRIBE(MessageType.UNSUBSCRIBE);

        final MessageType messageType;

        RequestKind(MessageType messageType) {
            this.messageType = messageType;
        }
    }

    private static final class PendingRequest {
        final RequestKind kind;
        final String key;
        final Subscription subscription;
        final CompletableFuture<Void> future;
        final long sequence;
        Cancellable timeout;

        PendingRequest(RequestKind kind, String key, Subscription subscription,
                       CompletableFuture<Void> future, long sequence) {
            this.kind = kind;
            this.key = key;
            this.subscription = subscription;
            this.future = future;
            this.sequence = sequence;
        }
    }
}
