package com.devflow.syncclient.support;

import com.devflow.syncclient.event.EventBus;
import com.devflow.syncclient.event.SyncEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Records every event published on a bus, in order.
 */
public class EventRecorder {

    private final List<SyncEvent> events = new ArrayList<>();

    public EventRecorder(EventBus bus) {
        Consumer<SyncEvent> record = events::add;
        for (Class<?> type : SyncEvent.class.getPermittedSubclasses()) {
            bus.on(type.asSubclass(SyncEvent.class), record);
        }
    }

    public List<SyncEvent> all() {
        return List.copyOf(events);
    }

    public List<String> names() {
        return events.stream().map(SyncEvent::name).collect(Collectors.toList());
    }

    public <E extends SyncEvent> List<E> ofType(Class<E> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public <E extends SyncEvent> E last(Class<E> type) {
        List<E> matching = ofType(type);
        if (matching.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " event recorded");
        }
        return matching.get(matching.size() - 1);
    }

    public int count(String name) {
        return (int) events.stream().filter(e -> e.name().equals(name)).count();
    }

    public void clear() {
        events.clear();
    }
}
