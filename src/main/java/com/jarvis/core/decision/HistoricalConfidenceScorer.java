package com.jarvis.core.decision;

import com.jarvis.core.memory.MemoryEntry;
import com.jarvis.core.memory.MemoryType;
import com.jarvis.core.model.Task;

/**
 * Starts from full confidence when a rule covers the task and from a prior
 * otherwise, then blends in how often humans approved this task type before.
 * A modified approval counts half.
 */
public class HistoricalConfidenceScorer implements ConfidenceScorer {

    static final double PRIOR_WEIGHT = 5.0;

    private final double priorConfidence;

    public HistoricalConfidenceScorer(double priorConfidence) {
        this.priorConfidence = priorConfidence;
    }

    @Override
    public double score(Task task, DecisionRule matchedRule, DecisionContext context) {
        double base = matchedRule != null ? 1.0 : priorConfidence;
        double approvals = 0.0;
        int outcomes = 0;
        for (MemoryEntry entry : context.history()) {
            if (entry.type() != MemoryType.DECISION_OUTCOME || !task.type().equals(entry.content().get("taskType"))) {
                continue;
            }
            Object outcome = entry.content().get("outcome");
            if ("approved".equals(outcome)) {
                approvals += 1.0;
            } else if ("modified".equals(outcome)) {
                approvals += 0.5;
            } else if (!"rejected".equals(outcome)) {
                continue;
            }
            outcomes++;
        }
        double blended = (base * PRIOR_WEIGHT + approvals) / (PRIOR_WEIGHT + outcomes);
        return Math.max(0.0, Math.min(1.0, blended));
    }
}
