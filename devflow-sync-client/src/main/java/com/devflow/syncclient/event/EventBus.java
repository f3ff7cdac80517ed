package com.devflow.syncclient.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe register shared by all components of one sync session.
 *
 * Listeners subscribe either by event type (typed payload) or by event name
 * (e.g. {@code "dashboard_updated"} or {@code "topic:tasks"}) for collaborators
 * that only know the string vocabulary. A listener that throws is logged and
 * skipped; the remaining listeners still receive the event.
 */
public class EventBus {
    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends SyncEvent>, List<Consumer<? super SyncEvent>>> typedListeners =
        new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<? super SyncEvent>>> namedListeners = new ConcurrentHashMap<>();

    /**
     * Listen for events of one type.
     */
    public <E extends SyncEvent> void on(Class<E> type, Consumer<? super E> listener) {
        typedListeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
            .add(new TypedListener<>(type, listener));
    }

    /**
     * Stop a listener registered with {@link #on(Class, Consumer)}.
     */
    public <E extends SyncEvent> void off(Class<E> type, Consumer<? super E> listener) {
        List<Consumer<? super SyncEvent>> listeners = typedListeners.get(type);
        if (listeners != null) {
            listeners.removeIf(l -> l instanceof TypedListener<?> typed && typed.delegate == listener);
        }
    }

    /**
     * Listen for events by name.
     */
    public void on(String name, Consumer<? super SyncEvent> listener) {
        namedListeners.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void off(String name, Consumer<? super SyncEvent> listener) {
        List<Consumer<? super SyncEvent>> listeners = namedListeners.get(name);
        if (listeners != null) {
            listeners.remove(listener);
        }
    }

    /**
     * Deliver an event to typed listeners first, then to listeners of its name.
     */
    public void emit(SyncEvent event) {
        LOG.trace("Emitting {}", event.name());
        notifyListeners(typedListeners.get(event.getClass()), event);
        notifyListeners(namedListeners.get(event.name()), event);
    }

    public int listenerCount(String name) {
        List<Consumer<? super SyncEvent>> listeners = namedListeners.get(name);
        return listeners != null ? listeners.size() : 0;
    }

    public int listenerCount(Class<? extends SyncEvent> type) {
        List<Consumer<? super SyncEvent>> listeners = typedListeners.get(type);
        return listeners != null ? listeners.size() : 0;
    }

    public void clear() {
        typedListeners.clear();
        namedListeners.clear();
    }

    private void notifyListeners(List<Consumer<? super SyncEvent>> listeners, SyncEvent event) {
        if (listeners == null) {
            return;
        }
        for (Consumer<? super SyncEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                LOG.warn("Error in {} listener: {}", event.name(), e.getMessage(), e);
            }
        }
    }

    private static final class TypedListener<E extends SyncEvent> implements Consumer<SyncEvent> {
        private final Class<E> type;
        private final Consumer<? super E> delegate;

        TypedListener(Class<E> type, Consumer<? super E> delegate) {
            this.type = type;
            this.delegate = delegate;
        }

        @Override
        public void accept(SyncEvent event) {
            delegate.accept(type.cast(event));
        }
    }
}
