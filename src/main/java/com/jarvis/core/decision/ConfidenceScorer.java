package com.jarvis.core.decision;

import com.jarvis.core.model.Task;

/**
 * Estimates how safe it is to act on a task without a human, in [0, 1].
 * Implementations must be deterministic for equal inputs.
 */
@FunctionalInterface
public interface ConfidenceScorer {

    /**
     * @param matchedRule the winning rule, or null when none matched
     */
    double score(Task task, DecisionRule matchedRule, DecisionContext context);
}
