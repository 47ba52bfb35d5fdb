package com.jarvis.core.events;

import com.jarvis.core.events.schema.PayloadSchema;
import com.jarvis.core.events.schema.SchemaRegistry;
import com.jarvis.core.events.schema.ValidationResult;
import com.jarvis.core.logging.MdcContext;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.Maps;
import com.jarvis.core.transport.Transport;
import com.jarvis.core.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Signed, schema-validated publish/subscribe over a pluggable {@link Transport}.
 * <p>
 * Handlers are kept per topic in registration order, without duplicates, and the
 * bus holds exactly one transport subscription per topic that has handlers.
 * Deliveries for one topic are serialized. A handler that throws is logged and
 * skipped; the remaining handlers still run. Every envelope is delivered locally
 * at most once: the copy of a local publish that comes back over the wire, and
 * transport redeliveries, are recognised by id and dropped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Transport transport;
    private final SchemaRegistry schemas;
    private final EnvelopeSigner signer;
    private final String producer;
    private final boolean verifyInbound;
    private final JarvisMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, TopicHandlers> handlers = new ConcurrentHashMap<>();
    /** Topics with an open transport subscription. */
    private final Set<String> attached = ConcurrentHashMap.newKeySet();
    private final RecentIds dispatched;
    private final Object registryLock = new Object();

    public EventBus(Transport transport, SchemaRegistry schemas, EnvelopeSigner signer,
                    EventBusProperties properties, JarvisMetrics metrics) {
        this(transport, schemas, signer, properties, metrics, Clock.systemUTC());
    }

    public EventBus(Transport transport, SchemaRegistry schemas, EnvelopeSigner signer,
                    EventBusProperties properties, JarvisMetrics metrics, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.producer = properties.getAgentName();
        this.verifyInbound = properties.isVerifyInbound();
        this.dispatched = new RecentIds(properties.getDedupeCapacity());
        this.metrics = metrics;
        this.clock = clock;
    }

    // -- Connection ----------------------------------------------------------

    /**
     * Connects the transport and opens one subscription per topic that already has handlers.
     *
     * @throws TransportException when the transport cannot connect
     */
    public void connect() {
        synchronized (registryLock) {
            if (!transport.isConnected()) {
                transport.connect();
            }
            for (String topic : handlers.keySet()) {
                attach(topic);
            }
        }
        log.info("Event bus connected via {} transport as '{}'", transport.name(), producer);
    }

    /**
     * Closes all transport subscriptions, disconnects the transport and then forgets
     * every handler. Handlers stay registered until the transport has stopped, so
     * envelopes already taken off the wire are still handled before they are acknowledged.
     */
    public void disconnect() {
        List<String> topics;
        synchronized (registryLock) {
            topics = List.copyOf(attached);
        }
        // outside the lock: an in-flight handler may itself subscribe or unsubscribe
        for (String topic : topics) {
            try {
                transport.unsubscribe(topic);
            } catch (TransportException e) {
                log.warn("Failed to unsubscribe {} during disconnect: {}", topic, e.getMessage());
            }
        }
        transport.disconnect();
        synchronized (registryLock) {
            attached.clear();
            handlers.clear();
        }
        log.info("Event bus disconnected");
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public String transportName() {
        return transport.name();
    }

    // -- Publishing ----------------------------------------------------------

    public PublishResult publish(String topic, Map<String, ?> payload) {
        return publish(topic, payload, PublishOptions.defaults());
    }

    /**
     * Validates, signs and sends a payload, then runs this process's handlers for
     * the topic. Never throws: validation problems give {@code REJECTED}, a failed
     * transport call gives {@code FAILED}.
     * <p>
     * Local handlers run on the calling thread before this method returns, so a slow
     * handler delays the publisher. Handlers that do lengthy work should hand it off
     * to their own executor.
     */
    public PublishResult publish(String topic, Map<String, ?> payload, PublishOptions options) {
        Map<String, Object> body = Maps.frozenCopy(payload);
        String version = PayloadSchema.DEFAULT_VERSION;
        if (!options.skipValidation()) {
            ValidationResult validation = schemas.validate(topic, body);
            if (!validation.valid()) {
                log.warn("Rejected publish to {}: {}", topic, validation.errors());
                recordPublish(topic, "rejected");
                return PublishResult.rejected(topic, validation.errors());
            }
            version = schemas.find(topic).map(PayloadSchema::version).orElse(version);
        } else if (topic == null || topic.isBlank()) {
            recordPublish(String.valueOf(topic), "rejected");
            return PublishResult.rejected(String.valueOf(topic), List.of("topic must not be blank"));
        }

        String signature;
        try {
            signature = signer.sign(body);
        } catch (IllegalArgumentException e) {
            recordPublish(topic, "rejected");
            return PublishResult.rejected(topic, List.of(e.getMessage()));
        }
        String traceId = options.traceId() != null ? options.traceId() : EventIds.newTraceId();
        EventEnvelope envelope = new EventEnvelope(topic, version, EventIds.newEventId(), traceId,
                producer, clock.instant(), signature, body);

        dispatched.add(envelope.id());
        try {
            transport.publish(envelope);
        } catch (RuntimeException e) {
            dispatched.remove(envelope.id());
            log.error("Transport {} failed to publish {} on {}: {}",
                    transport.name(), envelope.id(), topic, e.getMessage());
            recordPublish(topic, "failed");
            return PublishResult.failed(envelope, e.getMessage());
        }
        recordPublish(topic, "published");
        log.debug("Published {} on {} (trace {})", envelope.id(), topic, traceId);

        dispatch(envelope);
        return PublishResult.published(envelope);
    }

    // -- Subscriptions -------------------------------------------------------

    /**
     * Registers a handler for a topic. Registering the same handler twice has no
     * effect. The first handler of a topic opens the transport subscription, or
     * defers it to {@link #connect()} while disconnected.
     */
    public void subscribe(String topic, EventHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        synchronized (registryLock) {
            TopicHandlers topicHandlers = handlers.computeIfAbsent(topic, TopicHandlers::new);
            if (!topicHandlers.add(handler)) {
                log.debug("Handler already subscribed to {}", topic);
                return;
            }
            if (transport.isConnected()) {
                attach(topic);
            }
        }
        log.debug("Subscribed handler to {}", topic);
    }

    /** Removes every handler for the topic and closes its transport subscription. */
    public void unsubscribe(String topic) {
        synchronized (registryLock) {
            handlers.remove(topic);
            detach(topic);
        }
    }

    /** Removes one handler; the transport subscription closes with the last one. */
    public void unsubscribe(String topic, EventHandler handler) {
        synchronized (registryLock) {
            TopicHandlers topicHandlers = handlers.get(topic);
            if (topicHandlers == null) {
                return;
            }
            topicHandlers.remove(handler);
            if (topicHandlers.isEmpty()) {
                handlers.remove(topic);
                detach(topic);
            }
        }
    }

    public int handlerCount(String topic) {
        TopicHandlers topicHandlers = handlers.get(topic);
        return topicHandlers == null ? 0 : topicHandlers.size();
    }

    /**
     * Completes with the next envelope delivered on {@code topic}, or exceptionally
     * with {@link java.util.concurrent.TimeoutException}. The temporary handler is
     * removed either way.
     */
    public CompletableFuture<EventEnvelope> waitForEvent(String topic, Duration timeout) {
        CompletableFuture<EventEnvelope> future = new CompletableFuture<>();
        EventHandler waiter = future::complete;
        subscribe(topic, waiter);
        // the returned stage completes only once the waiter is gone
        return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((envelope, error) -> unsubscribe(topic, waiter));
    }

    public CompletableFuture<EventEnvelope> waitForEvent(String topic, long timeoutMs) {
        return waitForEvent(topic, Duration.ofMillis(timeoutMs));
    }

    // -- Signatures ----------------------------------------------------------

    public boolean verifySignature(Map<String, ?> payload, String signature) {
        return signer.verify(payload, signature);
    }

    public boolean verify(EventEnvelope envelope) {
        return envelope != null && signer.verify(envelope.payload(), envelope.signature());
    }

    // -- Internals -----------------------------------------------------------

    private void attach(String topic) {
        if (!attached.add(topic)) {
            return;
        }
        try {
            transport.subscribe(topic, envelope -> receive(topic, envelope));
        } catch (RuntimeException e) {
            attached.remove(topic);
            throw e;
        }
    }

    private void detach(String topic) {
        if (attached.remove(topic)) {
            try {
                transport.unsubscribe(topic);
            } catch (TransportException e) {
                log.warn("Failed to close transport subscription for {}: {}", topic, e.getMessage());
            }
        }
    }

    /** Entry point for envelopes arriving from the transport. */
    void receive(String topic, EventEnvelope envelope) {
        if (verifyInbound && !verify(envelope)) {
            log.warn("Dropping envelope {} on {} from {}: signature does not verify",
                    envelope.id(), topic, envelope.producer());
            if (metrics != null) {
                metrics.recordDropped(topic, "signature");
            }
            return;
        }
        if (!dispatched.add(envelope.id())) {
            log.debug("Skipping already delivered envelope {} on {}", envelope.id(), topic);
            return;
        }
        dispatch(envelope);
    }

    private void dispatch(EventEnvelope envelope) {
        TopicHandlers topicHandlers = handlers.get(envelope.topic());
        if (topicHandlers == null) {
            return;
        }
        synchronized (topicHandlers) {
            String previousTrace = MdcContext.swapTrace(envelope.traceId());
            try {
                for (EventHandler handler : topicHandlers.list) {
                    deliverSafely(handler, envelope);
                }
            } finally {
                MdcContext.restoreTrace(previousTrace);
            }
        }
        if (metrics != null) {
            metrics.recordDelivery(envelope.topic());
        }
    }

    private void deliverSafely(EventHandler handler, EventEnvelope envelope) {
        try {
            handler.handle(envelope);
        } catch (Exception e) {
            log.warn("Handler threw processing {} on {}: {}", envelope.id(), envelope.topic(), e.getMessage(), e);
            if (metrics != null) {
                metrics.recordHandlerError(envelope.topic());
            }
        }
    }

    private void recordPublish(String topic, String status) {
        if (metrics != null) {
            metrics.recordPublish(topic, status);
        }
    }

    private static final class TopicHandlers {
        private final String topic;
        private final CopyOnWriteArrayList<EventHandler> list = new CopyOnWriteArrayList<>();

        TopicHandlers(String topic) {
            this.topic = topic;
        }

        boolean add(EventHandler handler) {
            return list.addIfAbsent(handler);
        }

        void remove(EventHandler handler) {
            list.remove(handler);
        }

        boolean isEmpty() {
            return list.isEmpty();
        }

        int size() {
            return list.size();
        }

        @Override
        public String toString() {
            return "TopicHandlers[" + topic + ", " + list.size() + "]";
        }
    }
}
