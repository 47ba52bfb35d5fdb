package com.jarvis.core.orchestrator;

import com.jarvis.core.concurrent.DaemonThreadFactory;
import com.jarvis.core.events.CoreTopics;
import com.jarvis.core.events.EventBus;
import com.jarvis.core.events.PublishOptions;
import com.jarvis.core.graph.ExecutionPlanGraph;
import com.jarvis.core.logging.MdcContext;
import com.jarvis.core.memory.MemoryEntry;
import com.jarvis.core.memory.MemoryStore;
import com.jarvis.core.memory.MemoryType;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.FailureReason;
import com.jarvis.core.model.Task;
import com.jarvis.core.model.TaskResult;
import com.jarvis.core.model.TaskStatus;
import com.jarvis.core.nodes.StepRunner;
import com.jarvis.core.task.TaskStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes tasks to registered agents and runs them.
 * <p>
 * A simple task goes to the first registered agent that can handle it. A complex
 * task, as judged by the {@link ComplexityDetector}, runs through the
 * {@link ExecutionPlanGraph}, which splits it into steps executed by several agents.
 * Every executed task ends in exactly one terminal status in the {@link TaskStore}.
 */
@Service
public class Orchestrator implements StepRunner {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String PLANNER_AGENT = "planner";
    private static final Set<TaskStatus> STARTABLE = EnumSet.of(TaskStatus.PENDING, TaskStatus.PENDING_APPROVAL);

    private final EventBus eventBus;
    private final TaskStore taskStore;
    private final MemoryStore memory;
    private final JarvisMetrics metrics;
    private final ComplexityDetector complexity;
    private final Duration shutdownGrace;
    private final ExecutorService workers;
    /** Separate from {@link #workers} so a submitted plan never waits on its own pool. */
    private final ExecutorService stepWorkers;
    private final ExecutionPlanGraph planGraph;

    private final CopyOnWriteArrayList<Agent> agents = new CopyOnWriteArrayList<>();
    /** One party for the shutdown caller plus one per in-flight execution. */
    private final Phaser inFlight = new Phaser(1);
    private final Object admission = new Object();
    private volatile boolean accepting = true;

    public Orchestrator(EventBus eventBus, TaskStore taskStore, MemoryStore memory,
                        OrchestratorProperties properties, JarvisMetrics metrics) {
        this.eventBus = eventBus;
        this.taskStore = taskStore;
        this.memory = memory;
        this.metrics = metrics;
        this.complexity = new ComplexityDetector(properties.getPlannerMode());
        this.shutdownGrace = properties.getShutdownGrace();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
                new DaemonThreadFactory("jarvis-worker-"));
        this.stepWorkers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
                new DaemonThreadFactory("jarvis-step-"));
        this.planGraph = new ExecutionPlanGraph(this, stepWorkers);
    }

    // -- Agents --------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if an agent with the same id is registered
     */
    public void registerAgent(Agent agent) {
        synchronized (agents) {
            if (findAgent(agent.id()).isPresent()) {
                throw new IllegalArgumentException("Agent " + agent.id() + " is already registered");
            }
            agents.add(agent);
        }
        log.info("Registered agent {} for {}", agent.id(), agent.getSupportedTaskTypes());
    }

    /** The first registered agent able to handle the task. */
    public Optional<Agent> assignAgent(Task task) {
        return agents.stream().filter(agent -> agent.canHandle(task)).findFirst();
    }

    /** Union of the task type patterns supported by the registered agents. */
    public Set<String> capabilities() {
        Set<String> patterns = new LinkedHashSet<>();
        agents.forEach(agent -> patterns.addAll(agent.getSupportedTaskTypes()));
        return patterns;
    }

    public List<Agent> agents() {
        return List.copyOf(agents);
    }

    // -- Execution -----------------------------------------------------------

    public TaskResult execute(Task task) {
        return execute(task, null);
    }

    /**
     * Runs the task on the calling thread and records its terminal status.
     *
     * @param traceId trace continued by the {@code tasks.assigned} event, or null for a new one
     */
    public TaskResult execute(Task task, String traceId) {
        if (!admit()) {
            log.warn("Rejecting task {}: orchestrator is shutting down", task.id());
            return TaskResult.failure(task.id(), null, FailureReason.SHUTDOWN, "Orchestrator is shutting down");
        }
        MdcContext.setTask(task.id(), task.type());
        try {
            TaskStatus current = storedStatus(task);
            if (!STARTABLE.contains(current)) {
                log.warn("Refusing to execute task {}: it is already {}", task.id(), current);
                return notStartable(task, current);
            }
            TaskResult result;
            try {
                result = complexity.usePlanner(task)
                        ? executePlanned(task, traceId)
                        : executeSimple(task, traceId);
            } catch (NotStartableException e) {
                log.warn("Task {} moved to {} before it could start", task.id(), e.status);
                return notStartable(task, e.status);
            }
            finish(task, result);
            return result;
        } finally {
            MdcContext.clear();
            inFlight.arriveAndDeregister();
        }
    }

    /** Runs {@link #execute(Task)} on the worker pool. */
    public CompletableFuture<TaskResult> submit(Task task) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(task), workers);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    TaskResult.failure(task.id(), null, FailureReason.SHUTDOWN, "Orchestrator is shutting down"));
        }
    }

    private TaskResult executeSimple(Task task, String traceId) {
        Optional<Agent> assigned = assignAgent(task);
        if (assigned.isEmpty()) {
            log.warn("No agent available for task {} of type {}", task.id(), task.type());
            if (metrics != null) {
                metrics.recordUnassigned(task.type());
            }
            return TaskResult.unassigned(task.id(), task.type());
        }
        Agent agent = assigned.get();
        markInProgress(task, agent.id(), traceId);
        return runAgent(agent, task, true);
    }

    private TaskResult executePlanned(Task task, String traceId) {
        log.info("Task {} runs through the execution planner", task.id());
        markInProgress(task, PLANNER_AGENT, traceId);
        TaskResult result = planGraph.run(task);
        if (metrics != null) {
            Object steps = result.data().get("steps");
            metrics.recordPlannerRun(steps instanceof List<?> list ? list.size() : 0, result.success());
        }
        return result;
    }

    /** Status of the stored task, saving it first when the store does not know it yet. */
    private TaskStatus storedStatus(Task task) {
        Optional<Task> stored = taskStore.get(task.id());
        if (stored.isPresent()) {
            return stored.get().status();
        }
        try {
            return taskStore.save(task).status();
        } catch (IllegalArgumentException e) {
            // saved concurrently by another caller
            return taskStore.get(task.id()).map(Task::status).orElseThrow(() -> e);
        }
    }

    private static TaskResult notStartable(Task task, TaskStatus status) {
        return TaskResult.failure(task.id(), null, FailureReason.INVALID_TASK,
                "Task " + task.id() + " cannot be executed: it is already " + status);
    }

    private void markInProgress(Task task, String agentId, String traceId) {
        try {
            taskStore.transition(task.id(), TaskStatus.IN_PROGRESS);
        } catch (IllegalStateException e) {
            throw new NotStartableException(taskStore.get(task.id()).map(Task::status).orElse(null));
        }
        taskStore.assign(task.id(), agentId);
        MdcContext.setAgent(agentId);
        eventBus.publish(CoreTopics.TASK_ASSIGNED,
                Map.of("task_id", task.id(), "agent_id", agentId, "type", task.type()),
                PublishOptions.withTrace(traceId));
    }

    private TaskResult runAgent(Agent agent, Task task, boolean remember) {
        if (remember) {
            remember(task, agent.id(), "before", null, 0);
        }
        long start = System.currentTimeMillis();
        TaskResult result;
        try {
            result = agent.executeTask(task);
            if (result == null) {
                result = TaskResult.failure(task.id(), agent.id(), FailureReason.AGENT_ERROR,
                        "Agent " + agent.id() + " returned no result");
            }
        } catch (Exception e) {
            log.error("Agent {} failed on task {}: {}", agent.id(), task.id(), e.getMessage(), e);
            result = TaskResult.failure(task.id(), agent.id(), FailureReason.AGENT_ERROR,
                    "Agent " + agent.id() + " failed: " + e.getMessage());
        }
        result = result.withAgent(agent.id());
        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordTaskExecution(agent.id(), elapsed, result.success());
        }
        if (remember) {
            remember(task, agent.id(), "after", result, elapsed);
        }
        return result;
    }

    private void finish(Task task, TaskResult result) {
        TaskStatus terminal = result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        try {
            taskStore.complete(task.id(), terminal, result.data(), result.error());
        } catch (IllegalStateException e) {
            log.warn("Could not record {} for task {}: {}", terminal, task.id(), e.getMessage());
        }
        log.info("Task {} finished as {}{}", task.id(), terminal,
                result.success() ? "" : " (" + result.failureReason() + ")");
    }

    private void remember(Task task, String agentId, String phase, TaskResult result, long elapsedMs) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("phase", phase);
        content.put("taskType", task.type());
        if (result == null) {
            content.put("data", task.data());
        } else {
            content.put("success", result.success());
            content.put("durationMs", elapsedMs);
            if (result.error() != null) {
                content.put("error", result.error());
            }
        }
        MemoryType type = result != null && !result.success() ? MemoryType.ERROR : MemoryType.TASK_EXECUTION;
        try {
            memory.store(MemoryEntry.of(type, content, agentId, task.id(), List.of(task.type(), phase), 0.5));
        } catch (RuntimeException e) {
            log.warn("Could not record {} memory for task {}: {}", phase, task.id(), e.getMessage());
        }
    }

    // -- Planner steps -------------------------------------------------------

    @Override
    public List<String> eligibleAgents(Task task) {
        return agents.stream().filter(agent -> agent.canHandle(task)).map(Agent::id).toList();
    }

    @Override
    public TaskResult run(Task subTask, String agentId) {
        Optional<Agent> agent = agentId != null ? findAgent(agentId) : assignAgent(subTask);
        if (agent.isEmpty()) {
            if (metrics != null) {
                metrics.recordUnassigned(subTask.type());
            }
            return agentId != null
                    ? TaskResult.failure(subTask.id(), agentId, FailureReason.UNASSIGNED,
                            "Agent " + agentId + " is not registered")
                    : TaskResult.unassigned(subTask.id(), subTask.type());
        }
        return runAgent(agent.get(), subTask, false);
    }

    private Optional<Agent> findAgent(String agentId) {
        return agents.stream().filter(agent -> agent.id().equals(agentId)).findFirst();
    }

    // -- Shutdown ------------------------------------------------------------

    private boolean admit() {
        synchronized (admission) {
            if (!accepting) {
                return false;
            }
            inFlight.register();
            return true;
        }
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Stops accepting tasks, waits up to the configured grace period for in-flight
     * executions, stops the worker pool and shuts every agent down. Idempotent.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (admission) {
            if (!accepting) {
                return;
            }
            accepting = false;
        }
        log.info("Orchestrator shutting down, waiting up to {} for in-flight tasks", shutdownGrace);
        int phase = inFlight.arrive();
        try {
            inFlight.awaitAdvanceInterruptibly(phase, shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("In-flight tasks still running after {}; stopping anyway", shutdownGrace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight tasks");
        }
        workers.shutdownNow();
        stepWorkers.shutdownNow();
        for (Agent agent : agents) {
            try {
                agent.shutdown();
            } catch (RuntimeException e) {
                log.warn("Agent {} failed to shut down: {}", agent.id(), e.getMessage());
            }
        }
        log.info("Orchestrator stopped");
    }

    /** Raised when another caller moved the task on between the status check and the start. */
    private static final class NotStartableException extends RuntimeException {
        private final TaskStatus status;

        NotStartableException(TaskStatus status) {
            super(null, null, false, false);
            this.status = status;
        }
    }
}
