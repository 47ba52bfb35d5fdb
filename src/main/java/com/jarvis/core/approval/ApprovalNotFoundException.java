package com.jarvis.core.approval;

public class ApprovalNotFoundException extends ApprovalException {

    public ApprovalNotFoundException(String approvalId) {
        super("No approval record with id " + approvalId);
    }
}
