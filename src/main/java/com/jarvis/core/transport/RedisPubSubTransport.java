package com.jarvis.core.transport;

import com.jarvis.core.concurrent.DaemonThreadFactory;
import com.jarvis.core.events.EnvelopeCodec;
import com.jarvis.core.events.EventEnvelope;
import com.jarvis.core.events.EventHandler;
import com.jarvis.core.events.MalformedEnvelopeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Lightweight fire-and-forget transport over Redis PUBLISH/SUBSCRIBE. No
 * acknowledgement and no replay: envelopes published while nobody listens are lost.
 */
public class RedisPubSubTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(RedisPubSubTransport.class);

    private final StringRedisTemplate redis;
    private final EnvelopeCodec codec;
    private final Supplier<RedisMessageListenerContainer> containerFactory;
    private final ConcurrentHashMap<String, MessageListener> listeners = new ConcurrentHashMap<>();
    private volatile RedisMessageListenerContainer container;

    public RedisPubSubTransport(StringRedisTemplate redis, EnvelopeCodec codec) {
        this(redis, codec, () -> singleThreadedContainer(redis.getConnectionFactory()));
    }

    public RedisPubSubTransport(StringRedisTemplate redis, EnvelopeCodec codec,
                                Supplier<RedisMessageListenerContainer> containerFactory) {
        this.redis = redis;
        this.codec = codec;
        this.containerFactory = containerFactory;
    }

    /** One delivery thread keeps messages of a channel in publish order. */
    static RedisMessageListenerContainer singleThreadedContainer(RedisConnectionFactory connectionFactory) {
        var container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(Executors.newSingleThreadExecutor(new DaemonThreadFactory("jarvis-pubsub-")));
        return container;
    }

    @Override
    public String name() {
        return "pubsub";
    }

    @Override
    public synchronized void connect() {
        if (isConnected()) {
            return;
        }
        try {
            redis.execute((RedisCallback<String>) connection -> connection.ping());
            var created = containerFactory.get();
            created.afterPropertiesSet();
            created.start();
            container = created;
            log.info("Redis pub/sub transport connected");
        } catch (DataAccessException e) {
            throw new TransportException("Cannot connect to Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void disconnect() {
        RedisMessageListenerContainer current = container;
        container = null;
        listeners.clear();
        if (current == null) {
            return;
        }
        try {
            current.stop();
            current.destroy();
        } catch (Exception e) {
            log.warn("Error while stopping Redis listener container: {}", e.getMessage(), e);
        }
        log.info("Redis pub/sub transport disconnected");
    }

    @Override
    public boolean isConnected() {
        RedisMessageListenerContainer current = container;
        return current != null && current.isRunning();
    }

    @Override
    public void publish(EventEnvelope envelope) {
        try {
            Long receivers = redis.convertAndSend(envelope.topic(), codec.encode(envelope));
            log.debug("Published {} on {} to {} receiver(s)", envelope.id(), envelope.topic(), receivers);
        } catch (DataAccessException e) {
            throw new TransportException("PUBLISH to " + envelope.topic() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topic, EventHandler handler) {
        RedisMessageListenerContainer current = container;
        if (current == null) {
            throw new TransportException("Redis pub/sub transport is not connected");
        }
        listeners.computeIfAbsent(topic, t -> {
            MessageListener listener = (message, pattern) -> deliver(t, message.getBody(), handler);
            current.addMessageListener(listener, new ChannelTopic(t));
            log.debug("Subscribed to channel {}", t);
            return listener;
        });
    }

    @Override
    public void unsubscribe(String topic) {
        MessageListener listener = listeners.remove(topic);
        RedisMessageListenerContainer current = container;
        if (listener != null && current != null) {
            current.removeMessageListener(listener, new ChannelTopic(topic));
        }
    }

    private void deliver(String topic, byte[] body, EventHandler handler) {
        EventEnvelope envelope;
        try {
            envelope = codec.decode(new String(body, StandardCharsets.UTF_8));
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
}
