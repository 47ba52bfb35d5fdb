package com.jarvis.core.model;

/**
 * Why a {@link TaskResult} reports failure.
 */
public enum FailureReason {
    /** The agent threw or returned nothing. */
    AGENT_ERROR,
    /** No registered agent can handle the task type. */
    UNASSIGNED,
    /** Rejected by a rule or by a human reviewer. */
    REJECTED,
    INVALID_TASK,
    /** At least one step of a planned multi-step execution failed. */
    STEP_FAILURE,
    SHUTDOWN,
    EXPIRED
}
