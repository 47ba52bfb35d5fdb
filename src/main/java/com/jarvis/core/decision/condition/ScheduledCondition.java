package com.jarvis.core.decision.condition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

import java.time.Duration;
import java.time.Instant;

/**
 * Matches work scheduled at least {@code minDelayHours} after evaluation time
 * ({@code data.scheduledAt}, else {@code data.scheduledTime}).
 */
public record ScheduledCondition(@JsonProperty("minDelayHours") double minDelayHours) implements RuleCondition {

    @Override
    public boolean matches(Task task, DecisionContext context) {
        Instant scheduled = TaskData.instant(task.data(), "scheduledAt");
        if (scheduled == null) {
            scheduled = TaskData.instant(task.data(), "scheduledTime");
        }
        if (scheduled == null) {
            return false;
        }
        long minDelaySeconds = Math.round(minDelayHours * 3600);
        return !Duration.between(context.evaluatedAt(), scheduled).minusSeconds(minDelaySeconds).isNegative();
    }
}
