package com.jarvis.core.task;

import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local task store; every update is an atomic per-task compute.
 */
@Component
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task save(Task task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalArgumentException("Task " + task.id() + " already exists");
        }
        return task;
    }

    @Override
    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Task transition(String taskId, TaskStatus next) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use complete() for terminal status " + next);
        }
        return tasks.compute(taskId, (id, current) -> {
            Task existing = require(id, current);
            if (existing.status() == next) {
                return existing;
            }
            checkTransition(existing, next);
            return existing.withStatus(next, clock.instant());
        });
    }

    @Override
    public Task assign(String taskId, String agentId) {
        return tasks.compute(taskId, (id, current) -> require(id, current).withAgent(agentId));
    }

    @Override
    public Task updateData(String taskId, Map<String, Object> data) {
        return tasks.compute(taskId, (id, current) -> require(id, current).withData(data));
    }

    @Override
    public Task complete(String taskId, TaskStatus terminal, Map<String, Object> result, String error) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        return tasks.compute(taskId, (id, current) -> {
            Task existing = require(id, current);
            if (existing.status().isTerminal()) {
                throw new IllegalStateException("Task " + id + " already finished as " + existing.status());
            }
            checkTransition(existing, terminal);
            return existing.withOutcome(terminal, result, error, clock.instant());
        });
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .sorted(Comparator.comparing(Task::createdAt))
                .toList();
    }

    private static Task require(String id, Task current) {
        if (current == null) {
            throw new IllegalArgumentException("Unknown task " + id);
        }
        return current;
    }

    private static void checkTransition(Task existing, TaskStatus next) {
        if (!existing.status().canTransitionTo(next)) {
            throw new IllegalStateException("Task " + existing.id() + " cannot move from "
                    + existing.status() + " to " + next);
        }
    }
}
