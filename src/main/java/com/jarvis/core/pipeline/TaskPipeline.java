package com.jarvis.core.pipeline;

import com.jarvis.core.approval.ApprovalExpirySweeper;
import com.jarvis.core.approval.ApprovalQueue;
import com.jarvis.core.decision.DecisionEngine;
import com.jarvis.core.events.CoreTopics;
import com.jarvis.core.events.EventBus;
import com.jarvis.core.events.EventIds;
import com.jarvis.core.events.PublishOptions;
import com.jarvis.core.events.PublishResult;
import com.jarvis.core.logging.MdcContext;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import com.jarvis.core.model.Decision;
import com.jarvis.core.model.FailureReason;
import com.jarvis.core.model.Maps;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.model.TaskStatus;
import com.jarvis.core.orchestrator.Orchestrator;
import com.jarvis.core.task.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a task from submission to its result event:
 * {@code tasks.created -> decisions.made -> (auto | approvals.requested ... approvals.decided)
 * -> orchestrator -> tasks.completed | tasks.failed}.
 * <p>
 * Every event of one task carries the trace id of its {@code tasks.created} envelope.
 */
@Service
public class TaskPipeline {

    private static final Logger log = LoggerFactory.getLogger(TaskPipeline.class);

    private final EventBus eventBus;
    private final TaskStore taskStore;
    private final DecisionEngine decisionEngine;
    private final ApprovalQueue approvalQueue;
    private final ApprovalExpirySweeper expirySweeper;
    private final Orchestrator orchestrator;
    private final JarvisMetrics metrics;
    private final Clock clock;

    /** Trace id per task that has not finished yet. */
    private final ConcurrentHashMap<String, String> traces = new ConcurrentHashMap<>();

    public TaskPipeline(EventBus eventBus, TaskStore taskStore, DecisionEngine decisionEngine,
                        ApprovalQueue approvalQueue, ApprovalExpirySweeper expirySweeper,
                        Orchestrator orchestrator, JarvisMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.taskStore = taskStore;
        this.decisionEngine = decisionEngine;
        this.approvalQueue = approvalQueue;
        this.expirySweeper = expirySweeper;
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records a new task and runs it, parks it for approval or refuses it.
     *
     * @return the execution result, a failure for a refused task, or a
     *         {@link TaskStatus#PENDING_APPROVAL} result carrying the approval id
     */
    public TaskResult submit(Task task) {
        if (task == null || task.id() == null || task.id().isBlank()) {
            log.warn("Refusing task without an id");
            return TaskResult.failure(task == null ? null : task.id(), null, FailureReason.INVALID_TASK,
                    "Invalid task: missing id");
        }
        try {
            taskStore.save(task);
        } catch (IllegalArgumentException e) {
            log.warn("Refusing resubmitted task {}: {}", task.id(), e.getMessage());
            return TaskResult.failure(task.id(), null, FailureReason.INVALID_TASK, e.getMessage());
        }
        String traceId = startTrace(task);
        traces.put(task.id(), traceId);
        MdcContext.setTask(task.id(), task.type());
        MdcContext.setTrace(traceId);
        try {
            Decision decision = decisionEngine.evaluate(task, orchestrator.capabilities());
            publishDecision(task, decision, traceId);

            switch (decision.action()) {
                case REJECT -> {
                    FailureReason reason = DecisionEngine.validate(task).isEmpty()
                            ? FailureReason.REJECTED
                            : FailureReason.INVALID_TASK;
                    return fail(task.id(), reason, decision.reasoning(), traceId);
                }
                case REQUEST_APPROVAL -> {
                    taskStore.transition(task.id(), TaskStatus.PENDING_APPROVAL);
                    publishApprovalRequested(decision.approvalId(), traceId);
                    log.info("Task {} awaits approval {}", task.id(), decision.approvalId());
                    return TaskResult.pendingApproval(task.id(), decision.approvalId());
                }
                default -> {
                    return executeAndReport(task, traceId);
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a human verdict and acts on it: approved and modified tasks run, a
     * rejected task fails.
     *
     * @throws com.jarvis.core.approval.ApprovalNotFoundException if the id is unknown
     * @throws com.jarvis.core.approval.ApprovalConflictException if the approval was already decided
     */
    public TaskResult decide(String approvalId, ApprovalDecision decision, String respondedBy,
                             String feedback, Map<String, Object> modifications) {
        ApprovalRecord record = approvalQueue.decide(approvalId, decision, respondedBy, feedback, modifications);
        String traceId = traces.getOrDefault(record.taskId(), EventIds.newTraceId());
        MdcContext.setTask(record.taskId(), record.taskType());
        MdcContext.setTrace(traceId);
        try {
            publishApprovalDecided(record, traceId);
            if (metrics != null) {
                metrics.recordApprovalDecided(decision.wireName());
            }
            decisionEngine.learnFromFeedback(record);

            Optional<Task> stored = taskStore.get(record.taskId());
            if (stored.isEmpty()) {
                log.warn("Approval {} refers to unknown task {}", approvalId, record.taskId());
                return TaskResult.failure(record.taskId(), null, FailureReason.INVALID_TASK,
                        "Unknown task " + record.taskId());
            }
            Task task = stored.get();
            switch (decision) {
                case REJECTED -> {
                    String reason = "Rejected by " + respondedBy
                            + (feedback == null || feedback.isBlank() ? "" : ": " + feedback);
                    return fail(task.id(), FailureReason.REJECTED, reason, traceId);
                }
                case MODIFIED -> {
                    if (modifications != null && !modifications.isEmpty()) {
                        task = taskStore.updateData(task.id(), Maps.merged(task.data(), modifications));
                    }
                    return executeAndReport(task, traceId);
                }
                default -> {
                    return executeAndReport(task, traceId);
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies the expiry policy to overdue approvals. Tasks whose approval the sweep
     * rejected fail with {@link FailureReason#EXPIRED}. Every expired approval drops its
     * remembered trace, so a verdict that still arrives later starts a new one.
     */
    public ApprovalExpirySweeper.SweepReport sweepExpired() {
        ApprovalExpirySweeper.SweepReport report = expirySweeper.sweep(clock.instant());
        for (ApprovalRecord record : report.autoRejected()) {
            String traceId = traces.getOrDefault(record.taskId(), EventIds.newTraceId());
            Optional<Task> task = taskStore.get(record.taskId());
            if (task.isPresent() && !task.get().status().isTerminal()) {
                fail(record.taskId(), FailureReason.EXPIRED,
                        "Approval " + record.id() + " expired at " + record.expiresAt(), traceId);
            }
        }
        for (ApprovalRecord record : report.expired()) {
            traces.remove(record.taskId());
        }
        return report;
    }

    /** Number of tasks whose trace id is still remembered. */
    int openTraces() {
        return traces.size();
    }

    // -- Internals -----------------------------------------------------------

    private String startTrace(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.id());
        payload.put("type", task.type());
        payload.put("priority", task.priority() == null ? null : task.priority().level());
        payload.put("requested_by", task.requestedBy());
        payload.put("data", task.data());
        PublishResult created = eventBus.publish(CoreTopics.TASK_CREATED, payload);
        return created.envelope() != null ? created.envelope().traceId() : EventIds.newTraceId();
    }

    private TaskResult executeAndReport(Task task, String traceId) {
        TaskResult result = orchestrator.execute(task, traceId);
        if (result.success()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("task_id", task.id());
            if (result.agentId() != null) {
                payload.put("agent_id", result.agentId());
            }
            payload.put("result", result.data());
            eventBus.publish(CoreTopics.TASK_COMPLETED, payload, PublishOptions.withTrace(traceId));
        } else {
            publishFailed(task.id(), result.failureReason(), result.error(), result.agentId(), traceId);
        }
        traces.remove(task.id());
        return result;
    }

    private TaskResult fail(String taskId, FailureReason reason, String error, String traceId) {
        try {
            taskStore.complete(taskId, TaskStatus.FAILED, null, error);
        } catch (IllegalStateException e) {
            log.warn("Could not fail task {}: {}", taskId, e.getMessage());
        }
        publishFailed(taskId, reason, error, null, traceId);
        traces.remove(taskId);
        return TaskResult.failure(taskId, null, reason, error);
    }

    private void publishFailed(String taskId, FailureReason reason, String error, String agentId, String traceId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", taskId);
        payload.put("error", error == null ? "unknown error" : error);
        if (reason != null) {
            payload.put("failure_reason", reason.name());
        }
        if (agentId != null) {
            payload.put("agent_id", agentId);
        }
        eventBus.publish(CoreTopics.TASK_FAILED, payload, PublishOptions.withTrace(traceId));
    }

    private void publishDecision(Task task, Decision decision, String traceId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.id());
        payload.put("action", decision.action().wireName());
        payload.put("risk_level", decision.riskLevel().wireName());
        payload.put("confidence", decision.confidence());
        if (decision.ruleId() != null) {
            payload.put("rule_id", decision.ruleId());
        }
        payload.put("reasoning", decision.reasoning());
        eventBus.publish(CoreTopics.DECISION_MADE, payload, PublishOptions.withTrace(traceId));
    }

    private void publishApprovalRequested(String approvalId, String traceId) {
        approvalQueue.get(approvalId).ifPresent(record -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("approval_id", record.id());
            payload.put("task_id", record.taskId());
            payload.put("task_type", record.taskType());
            payload.put("risk_level", record.riskLevel().wireName());
            payload.put("reasoning", record.reasoning());
            if (record.expiresAt() != null) {
                payload.put("expires_at", record.expiresAt().toString());
            }
            eventBus.publish(CoreTopics.APPROVAL_REQUESTED, payload, PublishOptions.withTrace(traceId));
        });
    }

    private void publishApprovalDecided(ApprovalRecord record, String traceId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approval_id", record.id());
        payload.put("task_id", record.taskId());
        payload.put("decision", record.decision().wireName());
        payload.put("responded_by", record.respondedBy());
        if (record.feedback() != null) {
            payload.put("feedback", record.feedback());
        }
        eventBus.publish(CoreTopics.APPROVAL_DECIDED, payload, PublishOptions.withTrace(traceId));
    }
}
