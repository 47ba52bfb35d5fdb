package com.jarvis.core.transport;

import com.jarvis.core.events.EventEnvelope;
import com.jarvis.core.events.EventHandler;

/**
 * Moves signed envelopes between processes. The event bus holds at most one
 * subscription per topic on its transport.
 */
public interface Transport {

    /** Short identifier used in logs and health output. */
    String name();

    /**
     * Opens the connection.
     *
     * @throws TransportException when the backend cannot be reached
     */
    void connect();

    /** Stops all subscriptions and releases the connection. */
    void disconnect();

    boolean isConnected();

    /**
     * @throws TransportException when the envelope cannot be handed to the backend
     */
    void publish(EventEnvelope envelope);

    /**
     * Starts delivering envelopes published on {@code topic} to {@code handler}.
     * Subscribing again to an already subscribed topic has no effect.
     */
    void subscribe(String topic, EventHandler handler);

    /** Stops delivery for {@code topic}; does not wait for an in-flight delivery. */
    void unsubscribe(String topic);
}
