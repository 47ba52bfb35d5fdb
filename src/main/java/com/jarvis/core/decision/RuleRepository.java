package com.jarvis.core.decision;

import java.util.List;
import java.util.Optional;

/**
 * Source of decision rules, in declaration order.
 */
public interface RuleRepository {

    List<DecisionRule> findAll();

    Optional<DecisionRule> find(String ruleId);

    /**
     * Appends a rule.
     *
     * @throws IllegalArgumentException if the rule id already exists
     */
    void add(DecisionRule rule);

    /**
     * Replaces a rule, keeping its declaration position.
     *
     * @throws IllegalArgumentException if the rule id is unknown
     */
    void update(DecisionRule rule);
}
