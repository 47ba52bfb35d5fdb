package com.jarvis.core.transport;

import com.jarvis.core.events.EnvelopeCodec;
import com.jarvis.core.events.EventEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransportTest {

    private InMemoryBroker broker;
    private InMemoryTransport publisher;
    private InMemoryTransport subscriber;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        publisher = new InMemoryTransport(broker, new EnvelopeCodec());
        subscriber = new InMemoryTransport(broker, new EnvelopeCodec());
        publisher.connect();
        subscriber.connect();
    }

    @AfterEach
    void tearDown() {
        publisher.disconnect();
        subscriber.disconnect();
    }

    private static EventEnvelope envelope(String id, int n) {
        return new EventEnvelope("t.x", "v1", id, "tr_1", "p", Instant.now(), "ab", Map.of("n", n));
    }

    @Test
    @DisplayName("delivers to every transport subscribed on the broker, in publish order")
    void deliversInOrder() throws Exception {
        List<String> ids = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(20);
        subscriber.subscribe("t.x", e -> {
            ids.add(e.id());
            latch.countDown();
        });

        for (int i = 0; i < 20; i++) {
            publisher.publish(envelope("evt_" + i, i));
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < 20; i++) {
            assertEquals("evt_" + i, ids.get(i));
        }
    }

    @Test
    @DisplayName("undecodable messages are dropped and later ones still arrive")
    void dropsGarbage() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        subscriber.subscribe("t.x", e -> latch.countDown());

        broker.publish("t.x", "{not json");
        publisher.publish(envelope("evt_ok", 1));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("unsubscribe removes the broker listener")
    void unsubscribe() {
        subscriber.subscribe("t.x", e -> { });
        assertEquals(1, broker.listenerCount("t.x"));

        subscriber.unsubscribe("t.x");

        assertEquals(0, broker.listenerCount("t.x"));
    }

    @Test
    @DisplayName("publishing while disconnected fails")
    void requiresConnection() {
        publisher.disconnect();
        assertThrows(TransportException.class, () -> publisher.publish(envelope("evt_1", 1)));
    }
}
