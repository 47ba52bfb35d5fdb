package com.jarvis.core.decision.condition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

/**
 * Matches when {@code data.recipientCount >= minRecipients}.
 */
public record RecipientThresholdCondition(@JsonProperty("minRecipients") int minRecipients) implements RuleCondition {

    @Override
    public boolean matches(Task task, DecisionContext context) {
        Double count = TaskData.number(task.data(), "recipientCount");
        return count != null && count >= minRecipients;
    }
}
