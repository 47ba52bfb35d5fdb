package com.jarvis.core.events.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps topics to their payload schemas. Publishing to a topic without a schema
 * fails validation.
 */
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final ConcurrentHashMap<String, PayloadSchema> schemas = new ConcurrentHashMap<>();

    public void register(PayloadSchema schema) {
        PayloadSchema previous = schemas.put(schema.topic(), schema);
        if (previous != null) {
            log.info("Replaced schema for topic {} ({} -> {})", schema.topic(), previous.version(), schema.version());
        } else {
            log.debug("Registered schema for topic {} ({})", schema.topic(), schema.version());
        }
    }

    public Optional<PayloadSchema> find(String topic) {
        return Optional.ofNullable(schemas.get(topic));
    }

    public boolean isRegistered(String topic) {
        return schemas.containsKey(topic);
    }

    public Set<String> topics() {
        return Set.copyOf(schemas.keySet());
    }

    public ValidationResult validate(String topic, Map<String, ?> payload) {
        if (topic == null || topic.isBlank()) {
            return ValidationResult.fail("topic must not be blank");
        }
        PayloadSchema schema = schemas.get(topic);
        if (schema == null) {
            return ValidationResult.fail("no schema registered for topic '" + topic + "'");
        }
        return schema.validate(payload);
    }
}
