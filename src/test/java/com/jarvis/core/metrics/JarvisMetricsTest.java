package com.jarvis.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class JarvisMetricsTest {

    private SimpleMeterRegistry registry;
    private JarvisMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new JarvisMetrics(registry);
    }

    @Test
    @DisplayName("recordPublish counts by topic and status")
    void recordPublish() {
        metrics.recordPublish("tasks.created", "ok");
        metrics.recordPublish("tasks.created", "ok");
        metrics.recordPublish("tasks.created", "rejected");

        var ok = registry.find("jarvis.events.published")
                .tag("topic", "tasks.created").tag("status", "ok").counter();
        var rejected = registry.find("jarvis.events.published")
                .tag("status", "rejected").counter();

        assertNotNull(ok);
        assertNotNull(rejected);
        assertEquals(2.0, ok.count());
        assertEquals(1.0, rejected.count());
    }

    @Test
    @DisplayName("delivery, handler errors and drops are separate counters")
    void deliveryCounters() {
        metrics.recordDelivery("tasks.completed");
        metrics.recordHandlerError("tasks.completed");
        metrics.recordDropped("tasks.completed", "bad_signature");

        assertEquals(1.0, registry.find("jarvis.events.delivered").counter().count());
        assertEquals(1.0, registry.find("jarvis.events.handler_errors").tag("topic", "tasks.completed")
                .counter().count());
        assertEquals(1.0, registry.find("jarvis.events.dropped").tag("reason", "bad_signature")
                .counter().count());
    }

    @Test
    @DisplayName("recordDecision tags action and risk")
    void recordDecision() {
        metrics.recordDecision("request_approval", "high");
        metrics.recordConfidence(0.4);
        metrics.recordConfidence(0.8);

        var counter = registry.find("jarvis.decisions.total")
                .tag("action", "request_approval").tag("risk", "high").counter();
        var summary = registry.find("jarvis.decisions.confidence").summary();

        assertNotNull(counter);
        assertEquals(1.0, counter.count());
        assertEquals(2, summary.count());
        assertEquals(0.6, summary.mean(), 1e-9);
    }

    @Test
    @DisplayName("approval verdicts and expiries are counted")
    void approvals() {
        metrics.recordApprovalDecided("approved");
        metrics.recordApprovalExpired("auto_reject");

        assertEquals(1.0, registry.find("jarvis.approvals.decided").tag("decision", "approved")
                .counter().count());
        assertEquals(1.0, registry.find("jarvis.approvals.expired").tag("policy", "auto_reject")
                .counter().count());
    }

    @Test
    @DisplayName("recordTaskExecution records by agent and result")
    void recordTaskExecution() {
        metrics.recordTaskExecution("mailer", 200, true);
        metrics.recordTaskExecution("mailer", 100, false);

        var success = registry.find("jarvis.task.duration")
                .tag("agent", "mailer").tag("result", "success").timer();
        var failure = registry.find("jarvis.task.duration")
                .tag("agent", "mailer").tag("result", "failure").timer();

        assertNotNull(success);
        assertNotNull(failure);
        assertEquals(1, success.count());
        assertEquals(200.0, success.totalTime(TimeUnit.MILLISECONDS), 1e-6);
    }

    @Test
    @DisplayName("unassigned tasks and planner runs are recorded")
    void orchestration() {
        metrics.recordUnassigned("sales.lead.import");
        metrics.recordPlannerRun(3, true);

        assertEquals(1.0, registry.find("jarvis.task.unassigned").tag("type", "sales.lead.import")
                .counter().count());
        var steps = registry.find("jarvis.planner.steps").tag("result", "success").summary();
        assertNotNull(steps);
        assertEquals(3.0, steps.totalAmount());
    }

    @Test
    @DisplayName("the pending approvals gauge reads the current count on every sample")
    void pendingApprovalsGauge() {
        var pending = new AtomicLong(3);
        metrics.gaugePendingApprovals(pending::get);

        assertEquals(3.0, registry.find("jarvis.approvals.pending").gauge().value());
        pending.set(1);
        assertEquals(1.0, registry.find("jarvis.approvals.pending").gauge().value());
    }
}
