package com.jarvis.core.state;

import com.jarvis.core.model.PlanStep;
import com.jarvis.core.model.StepResult;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for planning and running a complex task across several agents.
 * Step results use an appender channel so each dispatch adds to earlier ones.
 */
public class PlanState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("task",        Channels.base((Reducer<Task>) null)),
        Map.entry("steps",       Channels.base((Supplier<List<PlanStep>>) List::of)),
        Map.entry("parallel",    Channels.base(() -> false)),
        Map.entry("nextStep",    Channels.base(() -> 0)),
        Map.entry("planError",   Channels.base(() -> "")),
        Map.entry("result",      Channels.base((Reducer<TaskResult>) null)),
        Map.entry("stepResults", Channels.appender(ArrayList::new))
    );

    public PlanState(Map<String, Object> initData) {
        super(initData);
    }

    public Task task() {
        return this.<Task>value("task")
                .orElseThrow(() -> new IllegalStateException("Plan state has no task"));
    }

    public List<PlanStep> steps() {
        return this.<List<PlanStep>>value("steps").orElse(List.of());
    }

    public boolean parallel() {
        return this.<Boolean>value("parallel").orElse(false);
    }

    public int nextStep() {
        return this.<Integer>value("nextStep").orElse(0);
    }

    public String planError() {
        return this.<String>value("planError").orElse("");
    }

    public List<StepResult> stepResults() {
        return this.<List<StepResult>>value("stepResults").orElse(List.of());
    }

    public Optional<TaskResult> result() {
        return this.value("result");
    }
}
