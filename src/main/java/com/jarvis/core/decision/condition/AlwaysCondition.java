package com.jarvis.core.decision.condition;

import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

public record AlwaysCondition() implements RuleCondition {

    @Override
    public boolean matches(Task task, DecisionContext context) {
        return true;
    }
}
