package com.jarvis.core.nodes;

import com.jarvis.core.model.FailureReason;
import com.jarvis.core.model.StepResult;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.model.TaskStatus;
import com.jarvis.core.state.PlanState;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that folds the step results into the task's final result.
 * The task succeeds only if every step succeeded.
 */
public class AggregateResultsNode {

    static final String PLANNER_AGENT = "planner";

    public Map<String, Object> apply(PlanState state) {
        Task task = state.task();
        if (!state.planError().isEmpty()) {
            return Map.of("result", TaskResult.failure(task.id(), PLANNER_AGENT, FailureReason.INVALID_TASK,
                    state.planError()));
        }
        List<StepResult> results = state.stepResults().stream()
                .sorted(Comparator.comparingInt(StepResult::index))
                .toList();
        if (results.isEmpty()) {
            return Map.of("result", TaskResult.unassigned(task.id(), task.type()));
        }

        long succeeded = results.stream().filter(StepResult::success).count();
        boolean allSucceeded = succeeded == results.size();
        String summary = succeeded + "/" + results.size() + " steps succeeded";

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("steps", results.stream().map(StepResult::toMap).toList());
        data.put("summary", summary);

        TaskResult result = new TaskResult(task.id(), allSucceeded,
                allSucceeded ? TaskStatus.COMPLETED : TaskStatus.FAILED, data,
                allSucceeded ? null : summary,
                allSucceeded ? null : FailureReason.STEP_FAILURE,
                PLANNER_AGENT, Instant.now(), summary);
        return Map.of("result", result);
    }
}
