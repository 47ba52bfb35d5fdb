package com.jarvis.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();

    @Test
    @DisplayName("wire form uses trace_id and an ISO timestamp")
    void wireForm() {
        var envelope = new EventEnvelope("tasks.created", "v1", "evt_1", "tr_1", "jarvis",
                Instant.parse("2026-01-02T03:04:05Z"), "ab", Map.of("task_id", "task_1"));

        String json = codec.encode(envelope);

        assertTrue(json.contains("\"trace_id\":\"tr_1\""), json);
        assertTrue(json.contains("\"timestamp\":\"2026-01-02T03:04:05Z\""), json);
        assertEquals(envelope, codec.decode(json));
    }

    @Test
    @DisplayName("unknown fields from newer producers are ignored")
    void unknownFields() {
        String json = "{\"topic\":\"t.x\",\"version\":\"v1\",\"id\":\"evt_2\",\"trace_id\":\"tr_2\","
                + "\"producer\":\"p\",\"timestamp\":\"2026-01-02T03:04:05Z\",\"signature\":\"ab\","
                + "\"payload\":{},\"extra\":true}";

        assertEquals("evt_2", codec.decode(json).id());
    }

    @Test
    @DisplayName("garbage and envelopes without id are malformed")
    void malformed() {
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode("not json"));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode("{\"topic\":\"t.x\"}"));
    }
}
