package com.jarvis.core.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-process memory; the oldest entries are evicted first.
 */
@Component
public class InMemoryMemoryStore implements MemoryStore {

    static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Deque<MemoryEntry> entries = new ArrayDeque<>();

    public InMemoryMemoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryMemoryStore(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public synchronized void store(MemoryEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    @Override
    public synchronized List<MemoryEntry> recent(MemoryType type, String tag, int limit) {
        List<MemoryEntry> matches = new ArrayList<>();
        Iterator<MemoryEntry> newestFirst = entries.descendingIterator();
        while (newestFirst.hasNext() && matches.size() < limit) {
            MemoryEntry entry = newestFirst.next();
            if (entry.type() == type && (tag == null || entry.tags().contains(tag))) {
                matches.add(entry);
            }
        }
        return matches;
    }

    @Override
    public synchronized List<MemoryEntry> forTask(String taskId) {
        return entries.stream().filter(e -> taskId.equals(e.taskId())).toList();
    }

    public synchronized int size() {
        return entries.size();
    }
}
