package com.jarvis.core.orchestrator;

import com.jarvis.core.model.Task;

import java.util.Collection;

/**
 * Flags tasks that need more than one agent.
 */
public class ComplexityDetector {

    static final int MAX_SIMPLE_ACTIONS = 3;

    private final PlannerMode mode;

    public ComplexityDetector(PlannerMode mode) {
        this.mode = mode == null ? PlannerMode.COMPLEX : mode;
    }

    public PlannerMode mode() {
        return mode;
    }

    /** Whether the task should go through the execution planner. */
    public boolean usePlanner(Task task) {
        return switch (mode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case COMPLEX -> isComplex(task);
        };
    }

    public static boolean isComplex(Task task) {
        var metadata = task.metadata();
        var data = task.data();
        if (Boolean.TRUE.equals(metadata.get("complex"))
                || metadata.get("workflow") != null
                || Boolean.TRUE.equals(metadata.get("requiresCollaboration"))
                || Boolean.TRUE.equals(data.get("multiAgent"))) {
            return true;
        }
        if (metadata.get("steps") instanceof Collection<?> steps && steps.size() > 1) {
            return true;
        }
        return data.get("actions") instanceof Collection<?> actions && actions.size() > MAX_SIMPLE_ACTIONS;
    }
}
