package com.jarvis.core.decision.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jarvis.core.decision.DecisionContext;
import com.jarvis.core.model.Task;

import java.util.Locale;

/**
 * Compares a numeric data field, addressed by dotted path, with a constant.
 */
public record FieldThresholdCondition(String field, Operator operator, double value) implements RuleCondition {

    public enum Operator {
        GT, GTE, LT, LTE, EQ;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Operator fromWire(String raw) {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }

        boolean test(double actual, double expected) {
            return switch (this) {
                case GT -> actual > expected;
                case GTE -> actual >= expected;
                case LT -> actual < expected;
                case LTE -> actual <= expected;
                case EQ -> Double.compare(actual, expected) == 0;
            };
        }
    }

    @Override
    public boolean matches(Task task, DecisionContext context) {
        if (field == null || operator == null) {
            throw new IllegalArgumentException("field_threshold needs 'field' and 'operator'");
        }
        Double actual = TaskData.number(task.data(), field);
        return actual != null && operator.test(actual, value);
    }
}
