package com.jarvis.core.memory;

import java.util.List;

/**
 * Append-only store of {@link MemoryEntry} records used for audit and as
 * historical context for decisions.
 */
public interface MemoryStore {

    void store(MemoryEntry entry);

    /** Newest first, at most {@code limit} entries of the given type carrying {@code tag}. */
    List<MemoryEntry> recent(MemoryType type, String tag, int limit);

    /** All entries for one task, oldest first. */
    List<MemoryEntry> forTask(String taskId);
}
