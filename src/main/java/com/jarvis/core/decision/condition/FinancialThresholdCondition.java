package com.jarvis.core.decision.condition;

import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

/**
 * Matches when the task's amount ({@code data.estimatedCost}, else {@code data.amount})
 * is present, at least {@code minAmount} and below {@code maxAmount}. Either bound may be null.
 */
public record FinancialThresholdCondition(Double minAmount, Double maxAmount) implements RuleCondition {

    @Override
    public boolean matches(Task task, DecisionContext context) {
        Double amount = TaskData.number(task.data(), "estimatedCost");
        if (amount == null) {
            amount = TaskData.number(task.data(), "amount");
        }
        if (amount == null) {
            return false;
        }
        return (minAmount == null || amount >= minAmount) && (maxAmount == null || amount < maxAmount);
    }
}
