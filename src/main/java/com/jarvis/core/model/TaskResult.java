package com.jarvis.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of executing (or refusing to execute) a task. Never thrown, always returned.
 *
 * @param taskId        the task this result belongs to
 * @param success       whether the work was carried out successfully
 * @param status        task status after this result
 * @param data          agent output
 * @param error         failure message, null on success
 * @param failureReason failure category, null on success
 * @param agentId       the agent that ran the task, if any
 * @param timestamp     when the result was produced
 * @param message       human readable summary
 */
public record TaskResult(
    String taskId,
    boolean success,
    TaskStatus status,
    Map<String, Object> data,
    String error,
    FailureReason failureReason,
    String agentId,
    Instant timestamp,
    String message
) implements Serializable {

    public TaskResult {
        data = Maps.frozenCopy(data);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static TaskResult success(String taskId, String agentId, Map<String, ?> data) {
        return new TaskResult(taskId, true, TaskStatus.COMPLETED, Maps.frozenCopy(data), null, null,
                agentId, Instant.now(), "completed");
    }

    public static TaskResult failure(String taskId, String agentId, FailureReason reason, String error) {
        return new TaskResult(taskId, false, TaskStatus.FAILED, Map.of(), error, reason,
                agentId, Instant.now(), error);
    }

    public static TaskResult unassigned(String taskId, String taskType) {
        return failure(taskId, null, FailureReason.UNASSIGNED, "No agent available for task type " + taskType);
    }

    public static TaskResult pendingApproval(String taskId, String approvalId) {
        return new TaskResult(taskId, false, TaskStatus.PENDING_APPROVAL, Map.of("approvalId", approvalId),
                null, null, null, Instant.now(), "awaiting approval " + approvalId);
    }

    /** Returns a copy stamped with the agent that produced it, unless one is already set. */
    public TaskResult withAgent(String executingAgentId) {
        if (agentId != null) {
            return this;
        }
        return new TaskResult(taskId, success, status, data, error, failureReason, executingAgentId,
                timestamp, message);
    }
}
