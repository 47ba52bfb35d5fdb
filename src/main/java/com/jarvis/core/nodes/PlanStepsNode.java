package com.jarvis.core.nodes;

import com.jarvis.core.model.PlanStep;
import com.jarvis.core.model.Task;
import com.jarvis.core.state.PlanState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that turns a complex task into an ordered list of steps.
 * <p>
 * Explicit {@code metadata.steps} (task types, or objects with {@code type},
 * optional {@code agent} and {@code data}) win; otherwise {@code metadata.agents}
 * pins one step per listed agent; otherwise every agent able to handle the task
 * gets a step. {@code metadata.parallel=true} runs the steps concurrently.
 */
public class PlanStepsNode {

    private static final Logger log = LoggerFactory.getLogger(PlanStepsNode.class);

    /** Upper bound keeping a plan within the graph's iteration limit. */
    public static final int MAX_STEPS = 20;

    private final StepRunner runner;

    public PlanStepsNode(StepRunner runner) {
        this.runner = runner;
    }

    public Map<String, Object> apply(PlanState state) {
        Task task = state.task();
        List<PlanStep> steps;
        try {
            steps = plan(task);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot plan task {}: {}", task.id(), e.getMessage());
            return Map.of("steps", List.of(), "planError", e.getMessage());
        }
        if (steps.size() > MAX_STEPS) {
            String error = "Plan has " + steps.size() + " steps, more than the maximum of " + MAX_STEPS;
            log.warn("Cannot plan task {}: {}", task.id(), error);
            return Map.of("steps", List.of(), "planError", error);
        }
        boolean parallel = Boolean.TRUE.equals(task.metadata().get("parallel"));
        log.info("Planned {} step(s) for task {} ({})", steps.size(), task.id(), parallel ? "parallel" : "sequential");
        return Map.of("steps", steps, "parallel", parallel, "nextStep", 0);
    }

    List<PlanStep> plan(Task task) {
        List<PlanStep> steps = new ArrayList<>();
        Object explicit = task.metadata().get("steps");
        Object agents = task.metadata().get("agents");
        if (explicit instanceof List<?> entries && !entries.isEmpty()) {
            for (Object entry : entries) {
                steps.add(toStep(steps.size(), entry));
            }
        } else if (agents instanceof List<?> ids && !ids.isEmpty()) {
            for (Object id : ids) {
                steps.add(new PlanStep(steps.size(), task.type(), String.valueOf(id), Map.of()));
            }
        } else {
            for (String agentId : runner.eligibleAgents(task)) {
                steps.add(new PlanStep(steps.size(), task.type(), agentId, Map.of()));
            }
        }
        return steps;
    }

    @SuppressWarnings("unchecked")
    private static PlanStep toStep(int index, Object entry) {
        if (entry instanceof String type) {
            return new PlanStep(index, type, null, Map.of());
        }
        if (entry instanceof Map<?, ?> map && map.get("type") instanceof String type) {
            Object agent = map.get("agent");
            Object data = map.get("data");
            return new PlanStep(index, type, agent == null ? null : String.valueOf(agent),
                    data instanceof Map<?, ?> ? (Map<String, Object>) data : Map.of());
        }
        throw new IllegalArgumentException("step " + (index + 1) + " must be a task type or an object with 'type'");
    }
}
