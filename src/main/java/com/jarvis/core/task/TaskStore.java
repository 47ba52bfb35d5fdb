package com.jarvis.core.task;

import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds tasks and enforces their status lifecycle. A terminal status is set exactly once.
 */
public interface TaskStore {

    /**
     * Stores a new task.
     *
     * @throws IllegalArgumentException if a task with the same id is already stored
     */
    Task save(Task task);

    Optional<Task> get(String taskId);

    /**
     * Moves a task to a non-terminal status.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    Task transition(String taskId, TaskStatus next);

    Task assign(String taskId, String agentId);

    /** Replaces the task's data, e.g. with approved modifications. */
    Task updateData(String taskId, Map<String, Object> data);

    /**
     * Records the terminal outcome.
     *
     * @throws IllegalStateException if the task is already terminal or the move is not allowed
     */
    Task complete(String taskId, TaskStatus terminal, Map<String, Object> result, String error);

    List<Task> findByStatus(TaskStatus status);
}
