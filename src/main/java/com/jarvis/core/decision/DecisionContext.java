package com.jarvis.core.decision;

import com.jarvis.core.memory.MemoryEntry;
import com.jarvis.core.model.Maps;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Inputs to a decision beyond the task itself.
 *
 * @param history         past decision outcomes for the task type, newest first
 * @param userPreferences requester preferences, opaque to the built-in rules
 * @param evaluatedAt     the instant time-based conditions compare against
 */
public record DecisionContext(List<MemoryEntry> history, Map<String, Object> userPreferences, Instant evaluatedAt) {

    public DecisionContext {
        history = history == null ? List.of() : List.copyOf(history);
        userPreferences = Maps.frozenCopy(userPreferences);
        evaluatedAt = evaluatedAt == null ? Instant.now() : evaluatedAt;
    }

    public static DecisionContext at(Instant evaluatedAt) {
        return new DecisionContext(List.of(), Map.of(), evaluatedAt);
    }
}
