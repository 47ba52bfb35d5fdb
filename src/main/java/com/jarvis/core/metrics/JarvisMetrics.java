package com.jarvis.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for the event bus, decisions, approvals and task execution.
 */
@Service
public class JarvisMetrics {

    private final MeterRegistry registry;

    public JarvisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Event bus ---

    public void recordPublish(String topic, String status) {
        Counter.builder("jarvis.events.published")
                .tag("topic", topic)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDelivery(String topic) {
        Counter.builder("jarvis.events.delivered")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void recordHandlerError(String topic) {
        Counter.builder("jarvis.events.handler_errors")
                .description("Handler invocations that threw and were isolated")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void recordDropped(String topic, String reason) {
        Counter.builder("jarvis.events.dropped")
                .tag("topic", topic)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // --- Decisions and approvals ---

    public void recordDecision(String action, String riskLevel) {
        Counter.builder("jarvis.decisions.total")
                .tag("action", action)
                .tag("risk", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordConfidence(double confidence) {
        DistributionSummary.builder("jarvis.decisions.confidence")
                .register(registry)
                .record(confidence);
    }

    public void recordApprovalDecided(String decision) {
        Counter.builder("jarvis.approvals.decided")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordApprovalExpired(String policy) {
        Counter.builder("jarvis.approvals.expired")
                .tag("policy", policy)
                .register(registry)
                .increment();
    }

    /** Samples the number of undecided approvals whenever the registry is read. */
    public void gaugePendingApprovals(Supplier<Number> pending) {
        Gauge.builder("jarvis.approvals.pending", pending)
                .description("Approval requests awaiting a verdict")
                .register(registry);
    }

    // --- Task execution ---

    public void recordTaskExecution(String agentId, long ms, boolean success) {
        Timer.builder("jarvis.task.duration")
                .tag("agent", agentId)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordUnassigned(String taskType) {
        Counter.builder("jarvis.task.unassigned")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordPlannerRun(int steps, boolean success) {
        DistributionSummary.builder("jarvis.planner.steps")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(steps);
    }
}
