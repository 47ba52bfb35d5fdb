package com.jarvis.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one plan step.
 */
public record StepResult(
    int index,
    String taskType,
    String agentId,
    boolean success,
    Map<String, Object> data,
    String error,
    FailureReason failureReason
) implements Serializable {

    public StepResult {
        data = Maps.frozenCopy(data);
    }

    public static StepResult of(PlanStep step, TaskResult result) {
        return new StepResult(step.index(), step.taskType(), result.agentId(), result.success(),
                result.data(), result.error(), result.failureReason());
    }

    /** Plain map view, as handed to later steps and placed in the aggregated result. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step", index + 1);
        map.put("taskType", taskType);
        map.put("agentId", agentId);
        map.put("success", success);
        map.put("data", data);
        if (error != null) {
            map.put("error", error);
            map.put("failureReason", failureReason == null ? null : failureReason.name());
        }
        return map;
    }
}
