package com.jarvis.core.orchestrator;

/**
 * When the orchestrator hands a task to the execution planner instead of a single agent.
 */
public enum PlannerMode {
    /** Every task goes through the planner. */
    ALWAYS,
    /** Only tasks the {@link ComplexityDetector} flags. */
    COMPLEX,
    /** Never; every task goes to one agent. */
    NEVER
}
