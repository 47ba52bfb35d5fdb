package com.jarvis.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One step of a multi-agent execution plan.
 *
 * @param index    zero-based position in the plan
 * @param taskType task type the step's sub-task carries
 * @param agentId  agent pinned to the step, or null to route by capability
 * @param data     step-specific data merged over the parent task's data
 */
public record PlanStep(int index, String taskType, String agentId, Map<String, Object> data) implements Serializable {

    public PlanStep {
        data = Maps.frozenCopy(data);
    }
}
