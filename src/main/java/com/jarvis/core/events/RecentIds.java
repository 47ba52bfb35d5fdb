package com.jarvis.core.events;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded set remembering the most recently seen envelope ids.
 */
final class RecentIds {

    private final Map<String, Boolean> ids;

    RecentIds(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.ids = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /** Returns true if the id was not seen before. */
    synchronized boolean add(String id) {
        return ids.put(id, Boolean.TRUE) == null;
    }

    synchronized void remove(String id) {
        ids.remove(id);
    }

    synchronized int size() {
        return ids.size();
    }
}
