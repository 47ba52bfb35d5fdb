package com.jarvis.core.approval;

import com.jarvis.core.model.ApprovalDecision;

/**
 * The record was already decided; the first decision stands.
 */
public class ApprovalConflictException extends ApprovalException {

    private final ApprovalDecision existingDecision;

    public ApprovalConflictException(String approvalId, ApprovalDecision existingDecision) {
        super("Approval " + approvalId + " was already decided: " + existingDecision);
        this.existingDecision = existingDecision;
    }

    public ApprovalDecision getExistingDecision() {
        return existingDecision;
    }
}
