package com.jarvis.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON wire format for {@link EventEnvelope}.
 */
public class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(EventEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope " + envelope.id() + " is not serializable", e);
        }
    }

    /**
     * @throws MalformedEnvelopeException when the text is not a valid envelope
     */
    public EventEnvelope decode(String json) {
        try {
            EventEnvelope envelope = mapper.readValue(json, EventEnvelope.class);
            if (envelope == null || envelope.topic() == null || envelope.id() == null) {
                throw new MalformedEnvelopeException("Envelope is missing topic or id");
            }
            return envelope;
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Cannot decode envelope: " + e.getOriginalMessage(), e);
        }
    }
}
