package com.jarvis.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A human approval request and, once decided, its verdict.
 * The decision fields are written at most once.
 */
public record ApprovalRecord(
    String id,
    String taskId,
    String taskType,
    String requestedAction,
    String reasoning,
    RiskLevel riskLevel,
    Map<String, Object> estimatedImpact,
    List<Map<String, Object>> alternatives,
    ApprovalDecision decision,
    String respondedBy,
    String feedback,
    Map<String, Object> modifications,
    Instant requestedAt,
    Instant respondedAt,
    Instant expiresAt,
    Map<String, Object> metadata
) {

    public static final String META_CONFIDENCE = "confidence";
    public static final String META_RULE_ID = "ruleId";

    public ApprovalRecord {
        estimatedImpact = Maps.frozenCopy(estimatedImpact);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        modifications = modifications == null ? null : Maps.frozenCopy(modifications);
        metadata = Maps.frozenCopy(metadata);
    }

    public static ApprovalRecord pending(String taskId, String taskType, String requestedAction, String reasoning,
                                         RiskLevel riskLevel, Instant requestedAt, Instant expiresAt,
                                         Map<String, ?> metadata) {
        return new ApprovalRecord(null, taskId, taskType, requestedAction, reasoning, riskLevel, Map.of(), List.of(),
                null, null, null, null, requestedAt, null, expiresAt, Maps.frozenCopy(metadata));
    }

    public boolean isPending() {
        return decision == null;
    }

    public boolean isExpired(Instant now) {
        return isPending() && expiresAt != null && expiresAt.isBefore(now);
    }

    public double confidence() {
        Object raw = metadata.get(META_CONFIDENCE);
        return raw instanceof Number n ? n.doubleValue() : 0.0;
    }

    public ApprovalRecord withId(String newId, Instant at) {
        return new ApprovalRecord(newId, taskId, taskType, requestedAction, reasoning, riskLevel, estimatedImpact,
                alternatives, decision, respondedBy, feedback, modifications,
                requestedAt == null ? at : requestedAt, respondedAt, expiresAt, metadata);
    }

    public ApprovalRecord withDecision(ApprovalDecision verdict, String by, String note,
                                       Map<String, ?> changes, Instant at) {
        return new ApprovalRecord(id, taskId, taskType, requestedAction, reasoning, riskLevel, estimatedImpact,
                alternatives, verdict, by, note, changes == null ? null : Maps.frozenCopy(changes),
                requestedAt, at, expiresAt, metadata);
    }
}
