package com.jarvis.core.nodes;

import com.jarvis.core.model.Maps;
import com.jarvis.core.model.PlanStep;
import com.jarvis.core.model.StepResult;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.state.PlanState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * LangGraph4j node that executes plan steps. Sequential plans run one step per
 * invocation, handing earlier results to the next sub-task as
 * {@code metadata.previousResults}; parallel plans run every step in one
 * invocation on the worker pool.
 */
public class DispatchStepNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchStepNode.class);

    /** Metadata keys that steer planning and must not leak into sub-tasks. */
    static final Set<String> ROUTING_KEYS =
            Set.of("steps", "agents", "parallel", "workflow", "complex", "requiresCollaboration");

    private final StepRunner runner;
    private final Executor workers;

    public DispatchStepNode(StepRunner runner, Executor workers) {
        this.runner = runner;
        this.workers = workers;
    }

    public Map<String, Object> apply(PlanState state) {
        Task parent = state.task();
        List<PlanStep> steps = state.steps();
        int next = state.nextStep();

        if (state.parallel()) {
            List<CompletableFuture<StepResult>> futures = new ArrayList<>();
            for (PlanStep step : steps.subList(next, steps.size())) {
                Task subTask = subTask(parent, step, List.of());
                futures.add(CompletableFuture.supplyAsync(() -> runStep(step, subTask), workers));
            }
            List<StepResult> results = futures.stream().map(CompletableFuture::join).toList();
            log.info("Ran {} step(s) of task {} in parallel", results.size(), parent.id());
            return Map.of("stepResults", results, "nextStep", steps.size());
        }

        PlanStep step = steps.get(next);
        Task subTask = subTask(parent, step, state.stepResults());
        StepResult result = runStep(step, subTask);
        log.info("Step {}/{} of task {} ({}) {}", next + 1, steps.size(), parent.id(), step.taskType(),
                result.success() ? "succeeded" : "failed: " + result.error());
        return Map.of("stepResults", List.of(result), "nextStep", next + 1);
    }

    private StepResult runStep(PlanStep step, Task subTask) {
        TaskResult result = runner.run(subTask, step.agentId());
        return StepResult.of(step, result);
    }

    static Task subTask(Task parent, PlanStep step, List<StepResult> previous) {
        Map<String, Object> metadata = new LinkedHashMap<>(parent.metadata());
        metadata.keySet().removeAll(ROUTING_KEYS);
        metadata.put("parentTaskId", parent.id());
        metadata.put("step", step.index() + 1);
        if (!previous.isEmpty()) {
            metadata.put("previousResults", previous.stream().map(StepResult::toMap).toList());
        }
        return new Task(parent.id() + "#" + (step.index() + 1), step.taskType(), parent.priority(),
                Maps.merged(parent.data(), step.data()), parent.status(), null, null, step.agentId(),
                parent.requestedBy(), parent.createdAt(), parent.updatedAt(), metadata);
    }
}
