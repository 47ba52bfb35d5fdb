package com.jarvis.core.model;

/**
 * Verdict of the decision engine for one task.
 *
 * @param action           what happens next
 * @param riskLevel        risk of the matched rule, MEDIUM when no rule matched
 * @param confidence       score in [0, 1]
 * @param requiresApproval true when a human has to approve before execution
 * @param reasoning        explanation recorded with the decision
 * @param ruleId           matched rule, null when none
 * @param approvalId       approval record created for REQUEST_APPROVAL, null otherwise
 */
public record Decision(
    DecisionAction action,
    RiskLevel riskLevel,
    double confidence,
    boolean requiresApproval,
    String reasoning,
    String ruleId,
    String approvalId
) {

    public static Decision reject(RiskLevel riskLevel, String reasoning, String ruleId) {
        return new Decision(DecisionAction.REJECT, riskLevel, 0.0, false, reasoning, ruleId, null);
    }

    public Decision withApprovalId(String id) {
        return new Decision(action, riskLevel, confidence, requiresApproval, reasoning, ruleId, id);
    }
}
