package com.jarvis.core.decision;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rules held in memory, typically loaded from a JSON export of the
 * {@code decision_rules} table.
 */
public class InMemoryRuleRepository implements RuleRepository {

    private final List<DecisionRule> rules = new ArrayList<>();

    public InMemoryRuleRepository() {
    }

    public InMemoryRuleRepository(List<DecisionRule> initial) {
        initial.forEach(this::add);
    }

    public static InMemoryRuleRepository fromJson(InputStream json, ObjectMapper mapper) throws IOException {
        List<DecisionRule> loaded = mapper.readValue(json, new TypeReference<List<DecisionRule>>() {});
        return new InMemoryRuleRepository(loaded);
    }

    @Override
    public synchronized List<DecisionRule> findAll() {
        return List.copyOf(rules);
    }

    @Override
    public synchronized Optional<DecisionRule> find(String ruleId) {
        return rules.stream().filter(r -> r.ruleId().equals(ruleId)).findFirst();
    }

    @Override
    public synchronized void add(DecisionRule rule) {
        if (indexOf(rule.ruleId()) >= 0) {
            throw new IllegalArgumentException("Rule " + rule.ruleId() + " already exists");
        }
        rules.add(rule);
    }

    @Override
    public synchronized void update(DecisionRule rule) {
        int index = indexOf(rule.ruleId());
        if (index < 0) {
            throw new IllegalArgumentException("Unknown rule " + rule.ruleId());
        }
        rules.set(index, rule);
    }

    private int indexOf(String ruleId) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).ruleId().equals(ruleId)) {
                return i;
            }
        }
        return -1;
    }
}
