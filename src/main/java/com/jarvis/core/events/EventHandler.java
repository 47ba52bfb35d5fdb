package com.jarvis.core.events;

/**
 * Callback for envelopes delivered on a subscribed topic. A thrown exception is
 * logged by the bus and does not affect other handlers.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope envelope) throws Exception;
}
