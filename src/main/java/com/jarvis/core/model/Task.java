package com.jarvis.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A unit of requested work flowing through decision, approval and agent execution.
 *
 * @param id          unique task id
 * @param type        dotted task type, e.g. {@code marketing.social.post}
 * @param priority    0 (critical) to 3 (low)
 * @param data        task input, opaque to the core except for rule conditions
 * @param status      lifecycle status
 * @param result      output of the executing agent, once terminal
 * @param error       failure message, once failed
 * @param agentId     agent the task was assigned to
 * @param requestedBy user or system that requested the work
 * @param createdAt   creation time
 * @param updatedAt   last status change
 * @param metadata    routing hints such as {@code steps}, {@code workflow} or {@code parallel}
 */
public record Task(
    String id,
    String type,
    Priority priority,
    Map<String, Object> data,
    TaskStatus status,
    Map<String, Object> result,
    String error,
    String agentId,
    String requestedBy,
    Instant createdAt,
    Instant updatedAt,
    Map<String, Object> metadata
) implements Serializable {

    public static final Pattern TYPE_PATTERN = Pattern.compile("^[a-z]+\\.[a-z_]+(\\.[a-z_]+)?$");

    public Task {
        data = Maps.frozenCopy(data);
        metadata = Maps.frozenCopy(metadata);
        result = result == null ? null : Maps.frozenCopy(result);
        status = status == null ? TaskStatus.PENDING : status;
    }

    public static Task create(String type, Priority priority, Map<String, ?> data, String requestedBy) {
        return create(type, priority, data, requestedBy, Map.of());
    }

    public static Task create(String type, Priority priority, Map<String, ?> data,
                              String requestedBy, Map<String, ?> metadata) {
        Instant now = Instant.now();
        return new Task("task_" + UUID.randomUUID(), type, priority, Maps.frozenCopy(data),
                TaskStatus.PENDING, null, null, null, requestedBy, now, now, Maps.frozenCopy(metadata));
    }

    public boolean hasValidType() {
        return type != null && TYPE_PATTERN.matcher(type).matches();
    }

    public Task withStatus(TaskStatus next, Instant at) {
        return new Task(id, type, priority, data, next, result, error, agentId, requestedBy, createdAt, at, metadata);
    }

    public Task withAgent(String assignedAgentId) {
        return new Task(id, type, priority, data, status, result, error, assignedAgentId, requestedBy,
                createdAt, updatedAt, metadata);
    }

    public Task withData(Map<String, ?> newData) {
        return new Task(id, type, priority, Maps.frozenCopy(newData), status, result, error, agentId, requestedBy,
                createdAt, updatedAt, metadata);
    }

    public Task withMetadata(Map<String, ?> newMetadata) {
        return new Task(id, type, priority, data, status, result, error, agentId, requestedBy,
                createdAt, updatedAt, Maps.frozenCopy(newMetadata));
    }

    public Task withOutcome(TaskStatus terminal, Map<String, ?> output, String failure, Instant at) {
        return new Task(id, type, priority, data, terminal, Maps.frozenCopy(output), failure, agentId, requestedBy,
                createdAt, at, metadata);
    }
}
