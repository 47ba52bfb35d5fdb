package com.jarvis.core.nodes;

import com.jarvis.core.model.PlanStep;
import com.jarvis.core.model.Priority;
import com.jarvis.core.model.StepResult;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.state.PlanState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DispatchStepNodeTest {

    private StepRunner runner;
    private DispatchStepNode node;
    private Task parent;

    @BeforeEach
    void setUp() {
        runner = mock(StepRunner.class);
        when(runner.run(any(), any())).thenAnswer(invocation -> {
            Task sub = invocation.getArgument(0);
            return TaskResult.success(sub.id(), "worker", Map.of("echo", sub.type()));
        });
        // direct executor keeps the node deterministic
        node = new DispatchStepNode(runner, Runnable::run);
        parent = Task.create("marketing.campaign.launch", Priority.HIGH, Map.of("campaign", "spring", "tone", "dry"),
                "user-1", Map.of("steps", List.of("a.b", "c.d"), "parallel", false, "owner", "team-x"));
    }

    @Test
    @DisplayName("a sequential dispatch runs one step and advances the cursor")
    void sequential() {
        var steps = List.of(new PlanStep(0, "marketing.copy.write", null, Map.of()),
                new PlanStep(1, "marketing.copy.review", "reviewer", Map.of()));

        Map<String, Object> update = node.apply(new PlanState(Map.of(
                "task", parent, "steps", steps, "nextStep", 1,
                "stepResults", List.of(new StepResult(0, "marketing.copy.write", "writer", true,
                        Map.of("draft", "hello"), null, null)))));

        assertEquals(2, update.get("nextStep"));
        assertEquals(1, ((List<?>) update.get("stepResults")).size());
        verify(runner).run(argThat(t -> t.type().equals("marketing.copy.review")), eq("reviewer"));
        verifyNoMoreInteractions(runner);
    }

    @Test
    @DisplayName("a parallel dispatch runs every remaining step at once")
    void parallel() {
        var steps = List.of(new PlanStep(0, "ops.step.one", null, Map.of()),
                new PlanStep(1, "ops.step.two", null, Map.of()),
                new PlanStep(2, "ops.step.three", null, Map.of()));

        Map<String, Object> update = node.apply(new PlanState(Map.of(
                "task", parent, "steps", steps, "parallel", true, "nextStep", 0)));

        assertEquals(3, update.get("nextStep"));
        @SuppressWarnings("unchecked")
        var results = (List<StepResult>) update.get("stepResults");
        assertEquals(List.of(0, 1, 2), results.stream().map(StepResult::index).toList());
        verify(runner, times(3)).run(any(), isNull());
    }

    @Test
    @DisplayName("a sub-task inherits data and metadata minus the routing keys")
    void subTaskShape() {
        var step = new PlanStep(1, "marketing.copy.review", "reviewer", Map.of("tone", "warm"));
        var previous = List.of(new StepResult(0, "marketing.copy.write", "writer", true, Map.of(), null, null));

        Task sub = DispatchStepNode.subTask(parent, step, previous);

        assertEquals(parent.id() + "#2", sub.id());
        assertEquals("marketing.copy.review", sub.type());
        assertEquals("reviewer", sub.agentId());
        assertEquals(Map.of("campaign", "spring", "tone", "warm"), sub.data());
        assertEquals("team-x", sub.metadata().get("owner"));
        assertEquals(parent.id(), sub.metadata().get("parentTaskId"));
        assertEquals(2, sub.metadata().get("step"));
        assertEquals(1, ((List<?>) sub.metadata().get("previousResults")).size());
        assertFalse(sub.metadata().containsKey("steps"));
        assertFalse(sub.metadata().containsKey("parallel"));
        assertEquals(parent.priority(), sub.priority());
        assertEquals(parent.requestedBy(), sub.requestedBy());
    }
}
