package com.jarvis.core.graph;

import com.jarvis.core.model.FailureReason;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.nodes.AggregateResultsNode;
import com.jarvis.core.nodes.DispatchStepNode;
import com.jarvis.core.nodes.PlanStepsNode;
import com.jarvis.core.nodes.StepRunner;
import com.jarvis.core.state.PlanState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Executor;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs a
 * complex task as a plan of steps:
 *
 * <pre>
 * START -> plan_steps -> dispatch_step (loops until every step ran) -> aggregate_results -> END
 * </pre>
 *
 * An empty or invalid plan skips straight to aggregation.
 */
public class ExecutionPlanGraph {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanGraph.class);

    private final CompiledGraph<PlanState> compiledGraph;

    public ExecutionPlanGraph(StepRunner runner, Executor workers) {
        this(new PlanStepsNode(runner), new DispatchStepNode(runner, workers), new AggregateResultsNode());
    }

    public ExecutionPlanGraph(PlanStepsNode planNode, DispatchStepNode dispatchNode,
                              AggregateResultsNode aggregateNode) {
        try {
            var graph = new StateGraph<>(PlanState.SCHEMA, PlanState::new)
                    .addNode("plan_steps", node_async(planNode::apply))
                    .addNode("dispatch_step", node_async(dispatchNode::apply))
                    .addNode("aggregate_results", node_async(aggregateNode::apply))
                    .addEdge(START, "plan_steps")
                    .addConditionalEdges("plan_steps",
                            edge_async(this::routeAfterPlan),
                            Map.of("dispatch_step", "dispatch_step",
                                    "aggregate_results", "aggregate_results"))
                    .addConditionalEdges("dispatch_step",
                            edge_async(this::routeAfterDispatch),
                            Map.of("dispatch_step", "dispatch_step",
                                    "aggregate_results", "aggregate_results"))
                    .addEdge("aggregate_results", END);
            this.compiledGraph = graph.compile(CompileConfig.builder().build());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compile execution plan graph", e);
        }
        log.debug("Execution plan graph compiled");
    }

    String routeAfterPlan(PlanState state) {
        if (!state.planError().isEmpty() || state.steps().isEmpty()) {
            return "aggregate_results";
        }
        return "dispatch_step";
    }

    String routeAfterDispatch(PlanState state) {
        if (state.nextStep() >= state.steps().size()) {
            return "aggregate_results";
        }
        return "dispatch_step";
    }

    /**
     * Plans and runs the task. Graph failures come back as a failed result.
     */
    public TaskResult run(Task task) {
        var config = RunnableConfig.builder()
                .threadId(task.id())
                .build();
        try {
            return compiledGraph.invoke(Map.of("task", task), config)
                    .flatMap(PlanState::result)
                    .orElseGet(() -> TaskResult.failure(task.id(), "planner", FailureReason.AGENT_ERROR,
                            "Plan execution produced no result"));
        } catch (RuntimeException e) {
            log.error("Plan execution failed for task {}: {}", task.id(), e.getMessage(), e);
            return TaskResult.failure(task.id(), "planner", FailureReason.AGENT_ERROR,
                    "Plan execution failed: " + e.getMessage());
        }
    }

    public CompiledGraph<PlanState> getCompiledGraph() {
        return compiledGraph;
    }
}
