package com.jarvis.core.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jarvis.core.decision.condition.AlwaysCondition;
import com.jarvis.core.decision.condition.RuleCondition;
import com.jarvis.core.model.RiskLevel;

import java.util.List;

/**
 * A configurable gate: when a task of a covered type satisfies the condition, the
 * rule fixes its risk level and whether a human has to approve it. The JSON form
 * mirrors a {@code decision_rules} row.
 *
 * @param deny turns a match into an outright rejection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionRule(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("task_types") List<String> taskTypes,
    @JsonProperty("condition") RuleCondition condition,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("requires_approval") boolean requiresApproval,
    @JsonProperty("description") String description,
    @JsonProperty("active") Boolean active,
    @JsonProperty("deny") boolean deny
) {

    public DecisionRule {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("rule_id must not be blank");
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("risk_level is required for rule " + ruleId);
        }
        taskTypes = taskTypes == null || taskTypes.isEmpty() ? List.of("*") : List.copyOf(taskTypes);
        condition = condition == null ? new AlwaysCondition() : condition;
        description = description == null ? "" : description;
        active = active == null ? Boolean.TRUE : active;
    }

    public static DecisionRule of(String ruleId, List<String> taskTypes, RuleCondition condition,
                                  RiskLevel riskLevel, boolean requiresApproval, String description) {
        return new DecisionRule(ruleId, taskTypes, condition, riskLevel, requiresApproval, description, true, false);
    }

    public boolean enabled() {
        return active;
    }

    /** Best specificity of this rule's patterns for the given type. */
    public int specificityFor(String taskType) {
        int best = TaskTypePatterns.NO_MATCH;
        for (String pattern : taskTypes) {
            best = Math.max(best, TaskTypePatterns.specificity(pattern, taskType));
        }
        return best;
    }

    public DecisionRule withActive(boolean enabled) {
        return new DecisionRule(ruleId, taskTypes, condition, riskLevel, requiresApproval, description, enabled, deny);
    }
}
