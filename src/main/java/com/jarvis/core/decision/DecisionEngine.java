package com.jarvis.core.decision;

import com.jarvis.core.approval.ApprovalProperties;
import com.jarvis.core.approval.ApprovalQueue;
import com.jarvis.core.memory.MemoryEntry;
import com.jarvis.core.memory.MemoryStore;
import com.jarvis.core.memory.MemoryType;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import com.jarvis.core.model.Decision;
import com.jarvis.core.model.DecisionAction;
import com.jarvis.core.model.RiskLevel;
import com.jarvis.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a task may run autonomously, needs a human, or is refused.
 * <p>
 * Active rules covering the task type are tried most specific pattern first, ties
 * in declaration order; the first rule whose condition holds wins and sets the risk
 * level. Without a match the risk is {@link RiskLevel#MEDIUM}. A confidence below
 * the risk level's threshold always forces approval. Whenever the verdict is
 * {@link DecisionAction#REQUEST_APPROVAL} the approval record exists before this
 * class returns.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final int HISTORY_LIMIT = 50;

    private final ApprovalQueue approvalQueue;
    private final RuleRepository ruleRepository;
    private final ConfidenceScorer scorer;
    private final ConfidenceThresholds thresholds;
    private final MemoryStore memory;
    private final DecisionProperties properties;
    private final Duration approvalExpiration;
    private final JarvisMetrics metrics;
    private final Clock clock;

    public DecisionEngine(ApprovalQueue approvalQueue, RuleRepository ruleRepository, ConfidenceScorer scorer,
                          ConfidenceThresholds thresholds, MemoryStore memory, DecisionProperties properties,
                          ApprovalProperties approvalProperties, JarvisMetrics metrics, Clock clock) {
        this.approvalQueue = approvalQueue;
        this.ruleRepository = ruleRepository;
        this.scorer = scorer;
        this.thresholds = thresholds;
        this.memory = memory;
        this.properties = properties;
        this.approvalExpiration = approvalProperties.getDefaultExpiration();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Evaluates against the configured rules and the recorded outcomes for the task type.
     */
    public Decision evaluate(Task task) {
        return evaluate(task, Set.of());
    }

    /**
     * As {@link #evaluate(Task)}, also rejecting a task none of {@code agentCapabilities} covers.
     */
    public Decision evaluate(Task task, Set<String> agentCapabilities) {
        if (task == null) {
            return record(null, Decision.reject(RiskLevel.MEDIUM, "Invalid task: task is null", null));
        }
        List<MemoryEntry> history = task.type() == null
                ? List.of()
                : memory.recent(MemoryType.DECISION_OUTCOME, task.type(), HISTORY_LIMIT);
        var context = new DecisionContext(history, Map.of(), clock.instant());
        return evaluate(task, context, ruleRepository.findAll(), agentCapabilities);
    }

    /**
     * @param agentCapabilities task type patterns the registered agents support; when
     *                          non-empty, a task none of them covers is rejected
     */
    public Decision evaluate(Task task, DecisionContext context, List<DecisionRule> rules,
                             Set<String> agentCapabilities) {
        List<String> problems = validate(task);
        if (!problems.isEmpty()) {
            return record(task, Decision.reject(RiskLevel.MEDIUM, "Invalid task: " + String.join("; ", problems), null));
        }
        if (agentCapabilities != null && !agentCapabilities.isEmpty()
                && agentCapabilities.stream().noneMatch(p -> TaskTypePatterns.matches(p, task.type()))) {
            return record(task, Decision.reject(RiskLevel.MEDIUM,
                    "No registered agent supports task type " + task.type(), null));
        }

        DecisionRule matched = firstMatch(task, context, rules);
        if (matched != null && matched.deny()) {
            return record(task, Decision.reject(matched.riskLevel(),
                    "Denied by rule " + matched.ruleId() + ": " + matched.description(), matched.ruleId()));
        }

        RiskLevel risk = matched != null ? matched.riskLevel() : RiskLevel.MEDIUM;
        double confidence = clamp(scorer.score(task, matched, context));
        double threshold = thresholds.get(risk);

        DecisionAction action;
        String reasoning;
        if (confidence < threshold) {
            action = DecisionAction.REQUEST_APPROVAL;
            reasoning = String.format(Locale.ROOT, "Confidence %.2f is below the %s threshold %.2f%s",
                    confidence, risk.wireName(), threshold, describe(matched));
        } else if (matched != null && matched.requiresApproval()) {
            action = DecisionAction.REQUEST_APPROVAL;
            reasoning = "Rule " + matched.ruleId() + " requires approval: " + matched.description();
        } else {
            action = DecisionAction.AUTO_APPROVE;
            reasoning = matched != null
                    ? "Rule " + matched.ruleId() + " allows autonomous execution: " + matched.description()
                    : String.format(Locale.ROOT, "No rule matched; confidence %.2f meets the %s threshold %.2f",
                            confidence, risk.wireName(), threshold);
        }

        Decision decision = new Decision(action, risk, confidence, action == DecisionAction.REQUEST_APPROVAL,
                reasoning, matched != null ? matched.ruleId() : null, null);
        if (action == DecisionAction.REQUEST_APPROVAL) {
            decision = decision.withApprovalId(requestApproval(task, decision));
        }
        return record(task, decision);
    }

    /**
     * Active rules covering {@code taskType}, most specific first, stable on declaration order.
     */
    public static List<DecisionRule> orderCandidates(String taskType, List<DecisionRule> rules) {
        List<DecisionRule> candidates = new ArrayList<>();
        for (DecisionRule rule : rules) {
            if (rule.enabled() && rule.specificityFor(taskType) != TaskTypePatterns.NO_MATCH) {
                candidates.add(rule);
            }
        }
        candidates.sort(Comparator.comparingInt((DecisionRule r) -> r.specificityFor(taskType)).reversed());
        return candidates;
    }

    public double getConfidenceThreshold(RiskLevel level) {
        return thresholds.get(level);
    }

    public ConfidenceThresholds thresholds() {
        return thresholds;
    }

    /**
     * Records a human verdict as a decision outcome. A request that was rejected
     * although it scored above the configured confidence floor tightens the
     * threshold for its risk level.
     */
    public void learnFromFeedback(ApprovalRecord decided) {
        if (decided.isPending()) {
            throw new IllegalArgumentException("Approval " + decided.id() + " has not been decided yet");
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("taskType", decided.taskType());
        content.put("outcome", decided.decision().wireName());
        content.put("confidence", decided.confidence());
        content.put("riskLevel", decided.riskLevel().wireName());
        content.put("approvalId", decided.id());
        if (decided.feedback() != null) {
            content.put("feedback", decided.feedback());
        }
        memory.store(MemoryEntry.of(MemoryType.DECISION_OUTCOME, content, null, decided.taskId(),
                List.of(decided.taskType()), 0.7));

        if (decided.decision() == ApprovalDecision.REJECTED
                && decided.confidence() > properties.getFeedbackConfidenceFloor()) {
            double before = thresholds.get(decided.riskLevel());
            if (thresholds.raise(decided.riskLevel(), properties.getFeedbackStep(), properties.getFeedbackCeiling())) {
                log.info("Raised {} confidence threshold {} -> {} after rejection of {}",
                        decided.riskLevel().wireName(), before, thresholds.get(decided.riskLevel()), decided.id());
            }
        }
    }

    public void addRule(DecisionRule rule) {
        ruleRepository.add(rule);
        log.info("Added decision rule {}", rule.ruleId());
    }

    public void updateRule(DecisionRule rule) {
        ruleRepository.update(rule);
        log.info("Updated decision rule {}", rule.ruleId());
    }

    private DecisionRule firstMatch(Task task, DecisionContext context, List<DecisionRule> rules) {
        for (DecisionRule rule : orderCandidates(task.type(), rules)) {
            try {
                if (rule.condition().matches(task, context)) {
                    return rule;
                }
            } catch (RuntimeException e) {
                log.warn("Rule {} could not be evaluated for task {}: {}", rule.ruleId(), task.id(), e.getMessage());
            }
        }
        return null;
    }

    private String requestApproval(Task task, Decision decision) {
        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ApprovalRecord.META_CONFIDENCE, decision.confidence());
        if (decision.ruleId() != null) {
            metadata.put(ApprovalRecord.META_RULE_ID, decision.ruleId());
        }
        Map<String, Object> impact = new LinkedHashMap<>();
        impact.put("priority", task.priority().level());
        impact.put("requestedBy", task.requestedBy());
        var record = new ApprovalRecord(null, task.id(), task.type(), "Execute " + task.type(),
                decision.reasoning(), decision.riskLevel(), impact, List.of(), null, null, null, null,
                now, null, now.plus(approvalExpiration), metadata);
        return approvalQueue.create(record);
    }

    private Decision record(Task task, Decision decision) {
        log.info("Task {} ({}): {} at risk {} with confidence {} - {}",
                task == null ? null : task.id(), task == null ? null : task.type(),
                decision.action().wireName(), decision.riskLevel().wireName(),
                String.format(Locale.ROOT, "%.2f", decision.confidence()), decision.reasoning());
        if (metrics != null) {
            metrics.recordDecision(decision.action().wireName(), decision.riskLevel().wireName());
            metrics.recordConfidence(decision.confidence());
        }
        return decision;
    }

    /** Structural problems that make a task invalid; empty when it is well formed. */
    public static List<String> validate(Task task) {
        List<String> problems = new ArrayList<>();
        if (task == null) {
            problems.add("task is null");
            return problems;
        }
        if (task.id() == null || task.id().isBlank()) {
            problems.add("missing id");
        }
        if (!task.hasValidType()) {
            problems.add("malformed type '" + task.type() + "'");
        }
        if (task.priority() == null) {
            problems.add("missing priority");
        }
        if (task.requestedBy() == null || task.requestedBy().isBlank()) {
            problems.add("missing requestedBy");
        }
        return problems;
    }

    private static String describe(DecisionRule matched) {
        return matched == null ? " (no rule matched)" : " (rule " + matched.ruleId() + ")";
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
