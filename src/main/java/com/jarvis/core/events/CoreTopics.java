package com.jarvis.core.events;

import com.jarvis.core.events.schema.FieldType;
import com.jarvis.core.events.schema.PayloadSchema;
import com.jarvis.core.events.schema.SchemaRegistry;

/**
 * Topics the orchestration core itself publishes, with their payload schemas.
 */
public final class CoreTopics {

    public static final String TASK_CREATED = "tasks.created";
    public static final String TASK_ASSIGNED = "tasks.assigned";
    public static final String TASK_COMPLETED = "tasks.completed";
    public static final String TASK_FAILED = "tasks.failed";
    public static final String TASK_UPDATED = "tasks.updated";
    public static final String DECISION_MADE = "decisions.made";
    public static final String APPROVAL_REQUESTED = "approvals.requested";
    public static final String APPROVAL_DECIDED = "approvals.decided";
    public static final String APPROVAL_EXPIRED = "approvals.expired";
    public static final String APPROVAL_ESCALATED = "approvals.escalated";
    public static final String AGENT_HEARTBEAT = "agent.heartbeat";

    private CoreTopics() {}

    public static SchemaRegistry registerAll(SchemaRegistry registry) {
        registry.register(PayloadSchema.forTopic(TASK_CREATED)
                .required("task_id", FieldType.STRING)
                .required("type", FieldType.STRING)
                .requiredRange("priority", FieldType.INTEGER, 0, 3)
                .required("requested_by", FieldType.STRING)
                .optional("data", FieldType.OBJECT)
                .build());
        registry.register(PayloadSchema.forTopic(TASK_ASSIGNED)
                .required("task_id", FieldType.STRING)
                .required("agent_id", FieldType.STRING)
                .required("type", FieldType.STRING)
                .build());
        registry.register(PayloadSchema.forTopic(TASK_COMPLETED)
                .required("task_id", FieldType.STRING)
                .optional("agent_id", FieldType.STRING)
                .optional("result", FieldType.OBJECT)
                .build());
        registry.register(PayloadSchema.forTopic(TASK_FAILED)
                .required("task_id", FieldType.STRING)
                .required("error", FieldType.STRING)
                .optional("failure_reason", FieldType.STRING)
                .optional("agent_id", FieldType.STRING)
                .build());
        registry.register(PayloadSchema.forTopic(TASK_UPDATED)
                .required("task_id", FieldType.STRING)
                .requiredEnum("status", "PENDING", "PENDING_APPROVAL", "IN_PROGRESS", "COMPLETED", "FAILED")
                .build());
        registry.register(PayloadSchema.forTopic(DECISION_MADE)
                .required("task_id", FieldType.STRING)
                .requiredEnum("action", "auto_approve", "request_approval", "reject")
                .requiredEnum("risk_level", "low", "medium", "high", "critical")
                .requiredRange("confidence", FieldType.NUMBER, 0.0, 1.0)
                .optional("rule_id", FieldType.STRING)
                .optional("reasoning", FieldType.STRING)
                .build());
        registry.register(PayloadSchema.forTopic(APPROVAL_REQUESTED)
                .required("approval_id", FieldType.STRING)
                .required("task_id", FieldType.STRING)
                .required("task_type", FieldType.STRING)
                .requiredEnum("risk_level", "low", "medium", "high", "critical")
                .optional("reasoning", FieldType.STRING)
                .optional("expires_at", FieldType.TIMESTAMP)
                .build());
        registry.register(PayloadSchema.forTopic(APPROVAL_DECIDED)
                .required("approval_id", FieldType.STRING)
                .required("task_id", FieldType.STRING)
                .requiredEnum("decision", "approved", "rejected", "modified")
                .required("responded_by", FieldType.STRING)
                .optional("feedback", FieldType.STRING)
                .build());
        registry.register(PayloadSchema.forTopic(APPROVAL_EXPIRED)
                .required("approval_id", FieldType.STRING)
                .required("task_id", FieldType.STRING)
                .required("policy", FieldType.STRING)
                .optional("expires_at", FieldType.TIMESTAMP)
                .build());
        registry.register(PayloadSchema.forTopic(APPROVAL_ESCALATED)
                .required("approval_id", FieldType.STRING)
                .required("task_id", FieldType.STRING)
                .requiredEnum("risk_level", "low", "medium", "high", "critical")
                .build());
        registry.register(PayloadSchema.forTopic(AGENT_HEARTBEAT)
                .required("agent_id", FieldType.STRING)
                .optional("status", FieldType.STRING)
                .optional("task_types", FieldType.LIST)
                .build());
        return registry;
    }
}
