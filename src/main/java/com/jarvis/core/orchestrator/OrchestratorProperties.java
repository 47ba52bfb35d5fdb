package com.jarvis.core.orchestrator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "jarvis.orchestrator")
public class OrchestratorProperties {

    private PlannerMode plannerMode = PlannerMode.COMPLEX;
    private int workerThreads = 4;
    /** How long shutdown waits for in-flight executions. */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public PlannerMode getPlannerMode() { return plannerMode; }
    public void setPlannerMode(PlannerMode plannerMode) { this.plannerMode = plannerMode; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
}
