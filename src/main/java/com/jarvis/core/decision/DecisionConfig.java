package com.jarvis.core.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decision engine collaborators: thresholds, scorer and rule source.
 */
@Configuration
public class DecisionConfig {

    private static final Logger log = LoggerFactory.getLogger(DecisionConfig.class);

    @Bean
    public ConfidenceThresholds confidenceThresholds(DecisionProperties props) {
        var t = props.getThresholds();
        return new ConfidenceThresholds(t.getLow(), t.getMedium(), t.getHigh(), t.getCritical());
    }

    @Bean
    @ConditionalOnMissingBean(ConfidenceScorer.class)
    public ConfidenceScorer historicalConfidenceScorer(DecisionProperties props) {
        return new HistoricalConfidenceScorer(props.getPriorConfidence());
    }

    @Bean
    @ConditionalOnMissingBean(RuleRepository.class)
    public RuleRepository ruleRepository(DecisionProperties props, ResourceLoader resourceLoader,
                                         ObjectMapper objectMapper) throws IOException {
        Resource resource = resourceLoader.getResource(props.getRulesLocation());
        if (!resource.exists()) {
            log.warn("No decision rules found at {}; starting with an empty rule set", props.getRulesLocation());
            return new InMemoryRuleRepository();
        }
        try (InputStream in = resource.getInputStream()) {
            var repository = InMemoryRuleRepository.fromJson(in, objectMapper);
            log.info("Loaded {} decision rule(s) from {}", repository.findAll().size(), props.getRulesLocation());
            return repository;
        }
    }
}
