package com.jarvis.core.transport;

import com.jarvis.core.concurrent.DaemonThreadFactory;
import com.jarvis.core.events.EnvelopeCodec;
import com.jarvis.core.events.EventEnvelope;
import com.jarvis.core.events.EventHandler;
import com.jarvis.core.events.MalformedEnvelopeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single-process transport. Envelopes still travel as JSON so that the receiving
 * side verifies exactly what a networked transport would deliver. Each topic
 * subscription delivers on its own single thread, preserving publish order.
 */
public class InMemoryTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransport.class);

    private final InMemoryBroker broker;
    private final EnvelopeCodec codec;
    private final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private volatile boolean connected;

    public InMemoryTransport() {
        this(new InMemoryBroker(), new EnvelopeCodec());
    }

    public InMemoryTransport(InMemoryBroker broker, EnvelopeCodec codec) {
        this.broker = broker;
        this.codec = codec;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public void connect() {
        connected = true;
    }

    @Override
    public void disconnect() {
        connected = false;
        for (String topic : subscriptions.keySet()) {
            Subscription subscription = subscriptions.remove(topic);
            if (subscription != null) {
                subscription.close(true);
            }
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void publish(EventEnvelope envelope) {
        requireConnected();
        broker.publish(envelope.topic(), codec.encode(envelope));
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        requireConnected();
        subscriptions.computeIfAbsent(topic, t -> {
            Subscription subscription = new Subscription(t, handler);
            broker.register(t, subscription.listener);
            return subscription;
        });
    }

    @Override
    public void unsubscribe(String topic) {
        Subscription subscription = subscriptions.remove(topic);
        if (subscription != null) {
            subscription.close(false);
        }
    }

    private void requireConnected() {
        if (!connected) {
            throw new TransportException("In-memory transport is not connected");
        }
    }

    private final class Subscription {
        private final String topic;
        private final ExecutorService executor;
        private final Consumer<String> listener;

        Subscription(String topic, EventHandler handler) {
            this.topic = topic;
            this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("jarvis-memory-" + topic + "-"));
            this.listener = message -> {
                try {
                    executor.execute(() -> deliver(handler, message));
                } catch (RejectedExecutionException e) {
                    log.debug("Dropped message for closed subscription on {}", topic);
                }
            };
        }

        private void deliver(EventHandler handler, String message) {
            EventEnvelope envelope;
            try {
                envelope = codec.decode(message);
            } catch (MalformedEnvelopeException e) {
                log.warn("Dropping undecodable message on {}: {}", topic, e.getMessage());
                return;
            }
            try {
                handler.handle(envelope);
            } catch (Exception e) {
                log.warn("Handler for {} failed on envelope {}: {}", topic, envelope.id(), e.getMessage(), e);
            }
        }

        void close(boolean await) {
            broker.remove(topic, listener);
            executor.shutdown();
            if (await) {
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("Delivery thread for {} did not finish within 5s", topic);
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    executor.shutdownNow();
                }
            }
        }
    }
}
