package com.jarvis.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jarvis.core.model.Maps;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable wire envelope around every published payload.
 *
 * @param topic     dotted topic name
 * @param version   payload schema version tag
 * @param id        unique per publish call
 * @param traceId   shared by causally related envelopes
 * @param producer  name of the publishing component
 * @param timestamp publish time
 * @param signature hex HMAC-SHA256 over the canonical payload JSON
 * @param payload   topic-specific body
 */
public record EventEnvelope(
    String topic,
    String version,
    String id,
    @JsonProperty("trace_id") String traceId,
    String producer,
    Instant timestamp,
    String signature,
    Map<String, Object> payload
) {

    public EventEnvelope {
        payload = Maps.frozenCopy(payload);
    }
}
