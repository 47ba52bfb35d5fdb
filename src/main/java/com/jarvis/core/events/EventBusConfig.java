package com.jarvis.core.events;

import com.jarvis.core.events.schema.SchemaRegistry;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.transport.InMemoryBroker;
import com.jarvis.core.transport.InMemoryTransport;
import com.jarvis.core.transport.RedisPubSubTransport;
import com.jarvis.core.transport.RedisStreamTransport;
import com.jarvis.core.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Wires the process-wide {@link EventBus}. The transport is chosen once, here,
 * from {@code jarvis.bus.transport}.
 */
@Configuration
public class EventBusConfig {

    private static final Logger log = LoggerFactory.getLogger(EventBusConfig.class);

    @Bean
    public SchemaRegistry schemaRegistry() {
        return CoreTopics.registerAll(new SchemaRegistry());
    }

    @Bean
    public EnvelopeCodec envelopeCodec() {
        return new EnvelopeCodec();
    }

    @Bean
    @ConditionalOnProperty(prefix = "jarvis.bus", name = "transport", havingValue = "memory", matchIfMissing = true)
    public Transport inMemoryTransport(EnvelopeCodec codec) {
        log.info("Using in-memory event transport (single process only)");
        return new InMemoryTransport(new InMemoryBroker(), codec);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jarvis.bus", name = "transport", havingValue = "pubsub")
    public Transport redisPubSubTransport(ObjectProvider<StringRedisTemplate> redis, EnvelopeCodec codec) {
        log.info("Using Redis pub/sub event transport");
        return new RedisPubSubTransport(requireRedis(redis, "pubsub"), codec);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jarvis.bus", name = "transport", havingValue = "stream")
    public Transport redisStreamTransport(ObjectProvider<StringRedisTemplate> redis, EnvelopeCodec codec,
                                          EventBusProperties props) {
        log.info("Using Redis stream event transport (group={}, consumer={})",
                props.getConsumerGroup(), props.getConsumerId());
        var settings = new RedisStreamTransport.Settings(
                props.getStreamKeyPrefix(), props.getConsumerGroup(), props.getConsumerId(),
                props.getBatchSize(), props.getBlockTimeout(),
                props.getBackoff().getBase(), props.getBackoff().getMax());
        return new RedisStreamTransport(requireRedis(redis, "stream"), codec, settings);
    }

    @Bean
    public EnvelopeSigner envelopeSigner(EventBusProperties props, Transport transport) {
        String secret = props.getSigningSecret();
        if (secret == null || secret.isBlank()) {
            if (!"memory".equals(transport.name())) {
                throw new IllegalStateException(
                        "jarvis.bus.signing-secret is required for the " + transport.name() + " transport");
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            secret = HexFormat.of().formatHex(random);
            log.warn("No signing secret configured; using a random per-process secret");
        }
        return new EnvelopeSigner(secret);
    }

    @Bean(destroyMethod = "disconnect")
    public EventBus eventBus(Transport transport, SchemaRegistry schemaRegistry, EnvelopeSigner signer,
                             EventBusProperties props, JarvisMetrics metrics) {
        var bus = new EventBus(transport, schemaRegistry, signer, props, metrics);
        bus.connect();
        return bus;
    }

    private static StringRedisTemplate requireRedis(ObjectProvider<StringRedisTemplate> redis, String transport) {
        StringRedisTemplate template = redis.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("jarvis.bus.transport=" + transport
                    + " requires a Redis connection (spring.data.redis.*)");
        }
        return template;
    }
}
