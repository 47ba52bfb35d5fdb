package com.jarvis.core.events.schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned payload shape for one topic. Fields not listed are allowed.
 */
public final class PayloadSchema {

    public static final String DEFAULT_VERSION = "v1";

    private final String topic;
    private final String version;
    private final List<FieldSpec> fields;

    private PayloadSchema(String topic, String version, List<FieldSpec> fields) {
        this.topic = topic;
        this.version = version;
        this.fields = List.copyOf(fields);
    }

    public static Builder forTopic(String topic) {
        return new Builder(topic);
    }

    public String topic() {
        return topic;
    }

    public String version() {
        return version;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public ValidationResult validate(Map<String, ?> payload) {
        if (payload == null) {
            return ValidationResult.fail("payload must not be null");
        }
        List<String> errors = new ArrayList<>();
        for (FieldSpec field : fields) {
            String problem = field.check(payload.get(field.name()));
            if (problem != null) {
                errors.add(problem);
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public static final class Builder {
        private final String topic;
        private String version = DEFAULT_VERSION;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(String topic) {
            this.topic = topic;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder required(String name, FieldType type) {
            fields.add(new FieldSpec(name, type, true, Set.of(), null, null));
            return this;
        }

        public Builder optional(String name, FieldType type) {
            fields.add(new FieldSpec(name, type, false, Set.of(), null, null));
            return this;
        }

        public Builder requiredEnum(String name, String... values) {
            fields.add(new FieldSpec(name, FieldType.STRING, true, new LinkedHashSet<>(List.of(values)), null, null));
            return this;
        }

        public Builder requiredRange(String name, FieldType type, double min, double max) {
            fields.add(new FieldSpec(name, type, true, Set.of(), min, max));
            return this;
        }

        public Builder field(FieldSpec spec) {
            fields.add(spec);
            return this;
        }

        public PayloadSchema build() {
            if (topic == null || topic.isBlank()) {
                throw new IllegalArgumentException("Schema topic must not be blank");
            }
            return new PayloadSchema(topic, version, fields);
        }
    }
}
