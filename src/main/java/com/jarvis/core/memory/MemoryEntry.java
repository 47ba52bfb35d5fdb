package com.jarvis.core.memory;

import com.jarvis.core.model.Maps;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One remembered fact: an execution trace, a decision outcome, user feedback.
 *
 * @param importance weight in [0, 1]
 */
public record MemoryEntry(
    String id,
    MemoryType type,
    Map<String, Object> content,
    String agentId,
    String taskId,
    List<String> tags,
    double importance,
    Instant createdAt
) {

    public MemoryEntry {
        content = Maps.frozenCopy(content);
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("importance must be within [0, 1], got " + importance);
        }
    }

    public static MemoryEntry of(MemoryType type, Map<String, ?> content, String agentId, String taskId,
                                 List<String> tags, double importance) {
        return new MemoryEntry("mem_" + UUID.randomUUID(), type, Maps.frozenCopy(content), agentId, taskId,
                tags, importance, Instant.now());
    }
}
