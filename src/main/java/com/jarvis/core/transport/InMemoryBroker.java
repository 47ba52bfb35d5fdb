package com.jarvis.core.transport;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-local channel hub shared by {@link InMemoryTransport} instances.
 * Messages are fire-and-forget: nothing is retained for later subscribers.
 */
public class InMemoryBroker {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<String>>> channels =
            new ConcurrentHashMap<>();

    void publish(String topic, String message) {
        List<Consumer<String>> listeners = channels.get(topic);
        if (listeners == null) {
            return;
        }
        for (Consumer<String> listener : listeners) {
            listener.accept(message);
        }
    }

    void register(String topic, Consumer<String> listener) {
        channels.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).addIfAbsent(listener);
    }

    void remove(String topic, Consumer<String> listener) {
        CopyOnWriteArrayList<Consumer<String>> listeners = channels.get(topic);
        if (listeners != null) {
            listeners.remove(listener);
        }
    }

    public int listenerCount(String topic) {
        List<Consumer<String>> listeners = channels.get(topic);
        return listeners == null ? 0 : listeners.size();
    }
}
