package com.jarvis.core.decision.condition;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

/**
 * Predicate over a task's data, stored as JSON with a {@code type} discriminator,
 * e.g. {@code {"type": "recipient_threshold", "minRecipients": 1000}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RecipientThresholdCondition.class, name = "recipient_threshold"),
    @JsonSubTypes.Type(value = FinancialThresholdCondition.class, name = "financial_threshold"),
    @JsonSubTypes.Type(value = ScheduledCondition.class, name = "scheduled"),
    @JsonSubTypes.Type(value = FieldThresholdCondition.class, name = "field_threshold"),
    @JsonSubTypes.Type(value = AlwaysCondition.class, name = "always")
})
public interface RuleCondition {

    /**
     * @throws IllegalArgumentException when the task data cannot be evaluated
     */
    boolean matches(Task task, DecisionContext context);
}
