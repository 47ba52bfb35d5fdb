package com.jarvis.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a {@link Task}. COMPLETED and FAILED are terminal.
 */
public enum TaskStatus {
    PENDING,
    PENDING_APPROVAL,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    private Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(PENDING_APPROVAL, IN_PROGRESS, FAILED);
            case PENDING_APPROVAL -> EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
