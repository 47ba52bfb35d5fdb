package com.jarvis.core.orchestrator;

import com.jarvis.core.decision.TaskTypePatterns;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;

import java.util.Set;

/**
 * A worker able to execute tasks of certain types. Concrete business agents live
 * outside the core and register with the {@link Orchestrator}.
 */
public interface Agent {

    /** Unique id within one orchestrator. */
    String id();

    /** Exact task types or prefix patterns such as {@code marketing.*}. */
    Set<String> getSupportedTaskTypes();

    default boolean canHandle(Task task) {
        return task != null && getSupportedTaskTypes().stream()
                .anyMatch(pattern -> TaskTypePatterns.matches(pattern, task.type()));
    }

    /**
     * Executes the task. A thrown exception or a null result is reported as an agent error.
     */
    TaskResult executeTask(Task task) throws Exception;

    default void shutdown() {
    }
}
