package com.jarvis.core.decision;

import com.jarvis.core.model.RiskLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Minimum confidence per risk level for acting without approval. Thresholds stay
 * strictly increasing with risk at all times, including after feedback adjustments.
 */
public class ConfidenceThresholds {

    private final EnumMap<RiskLevel, Double> values = new EnumMap<>(RiskLevel.class);

    public ConfidenceThresholds(double low, double medium, double high, double critical) {
        values.put(RiskLevel.LOW, low);
        values.put(RiskLevel.MEDIUM, medium);
        values.put(RiskLevel.HIGH, high);
        values.put(RiskLevel.CRITICAL, critical);
        double previous = -1.0;
        for (RiskLevel level : RiskLevel.values()) {
            double value = values.get(level);
            if (value < 0.0 || value > 1.0) {
                throw new IllegalStateException("Confidence threshold for " + level + " must be within [0, 1], got " + value);
            }
            if (value <= previous) {
                throw new IllegalStateException("Confidence thresholds must be strictly increasing with risk: " + values);
            }
            previous = value;
        }
    }

    public static ConfidenceThresholds defaults() {
        return new ConfidenceThresholds(0.7, 0.8, 0.9, 1.0);
    }

    public synchronized double get(RiskLevel level) {
        return values.get(level);
    }

    /**
     * Raises one level's threshold by {@code step}, capped at {@code ceiling}. Refused
     * when it would not increase or would reach the next level's threshold.
     *
     * @return whether the threshold changed
     */
    public synchronized boolean raise(RiskLevel level, double step, double ceiling) {
        double current = values.get(level);
        double raised = Math.min(current + step, ceiling);
        if (raised <= current) {
            return false;
        }
        if (level.ordinal() + 1 < RiskLevel.values().length) {
            RiskLevel next = RiskLevel.values()[level.ordinal() + 1];
            if (raised >= values.get(next)) {
                return false;
            }
        }
        values.put(level, raised);
        return true;
    }

    public synchronized Map<RiskLevel, Double> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }
}
