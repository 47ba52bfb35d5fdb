package com.jarvis.core.nodes;

import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;

import java.util.List;

/**
 * The planner's view of the agent pool.
 */
public interface StepRunner {

    /** Ids of registered agents able to handle the task, in registration order. */
    List<String> eligibleAgents(Task task);

    /**
     * Runs one sub-task. Never throws; failures come back as a failed result.
     *
     * @param agentId agent to use, or null to route by capability
     */
    TaskResult run(Task subTask, String agentId);
}
