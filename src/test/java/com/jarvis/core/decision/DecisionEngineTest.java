package com.jarvis.core.decision;

import com.jarvis.core.approval.ApprovalProperties;
import com.jarvis.core.approval.InMemoryApprovalQueue;
import com.jarvis.core.decision.condition.AlwaysCondition;
import com.jarvis.core.decision.condition.RecipientThresholdCondition;
import com.jarvis.core.memory.InMemoryMemoryStore;
import com.jarvis.core.memory.MemoryType;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import com.jarvis.core.model.Decision;
import com.jarvis.core.model.DecisionAction;
import com.jarvis.core.model.Priority;
import com.jarvis.core.model.RiskLevel;
import com.jarvis.core.model.Task;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryApprovalQueue approvals;
    private InMemoryRuleRepository rules;
    private InMemoryMemoryStore memory;
    private ConfidenceThresholds thresholds;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        approvals = new InMemoryApprovalQueue(clock);
        rules = new InMemoryRuleRepository();
        memory = new InMemoryMemoryStore();
        thresholds = ConfidenceThresholds.defaults();
        meterRegistry = new SimpleMeterRegistry();
    }

    private DecisionEngine engine(ConfidenceScorer scorer) {
        return new DecisionEngine(approvals, rules, scorer, thresholds, memory, new DecisionProperties(),
                new ApprovalProperties(), new JarvisMetrics(meterRegistry), clock);
    }

    private DecisionEngine engine() {
        return engine(new HistoricalConfidenceScorer(0.5));
    }

    private static Task task(String type, Map<String, Object> data) {
        return Task.create(type, Priority.MEDIUM, data, "user-1");
    }

    private static DecisionRule bulkEmailRule() {
        return DecisionRule.of("bulk-email", List.of("marketing.email.campaign"),
                new RecipientThresholdCondition(300), RiskLevel.HIGH, true,
                "Bulk email above 300 recipients");
    }

    @Nested
    @DisplayName("approval gating")
    class ApprovalGating {

        @Test
        @DisplayName("a campaign to 500 recipients against a 300 recipient rule creates exactly one approval")
        void bulkEmailNeedsApproval() {
            rules.add(bulkEmailRule());
            Task campaign = task("marketing.email.campaign", Map.of("recipientCount", 500));

            Decision decision = engine().evaluate(campaign);

            assertEquals(DecisionAction.REQUEST_APPROVAL, decision.action());
            assertEquals(RiskLevel.HIGH, decision.riskLevel());
            assertTrue(decision.requiresApproval());
            assertEquals("bulk-email", decision.ruleId());

            List<ApprovalRecord> pending = approvals.listPending();
            assertEquals(1, pending.size());
            ApprovalRecord record = pending.get(0);
            assertEquals(decision.approvalId(), record.id());
            assertEquals("marketing.email.campaign", record.taskType());
            assertEquals(campaign.id(), record.taskId());
            assertEquals(RiskLevel.HIGH, record.riskLevel());
            assertEquals(NOW.plus(Duration.ofHours(24)), record.expiresAt());
            assertEquals("bulk-email", record.metadata().get(ApprovalRecord.META_RULE_ID));
        }

        @Test
        @DisplayName("below the recipient threshold the rule does not match")
        void smallCampaign() {
            rules.add(bulkEmailRule());

            Decision decision = engine(stub(0.95)).evaluate(
                    task("marketing.email.campaign", Map.of("recipientCount", 120)));

            assertEquals(DecisionAction.AUTO_APPROVE, decision.action());
            assertNull(decision.ruleId());
            assertTrue(approvals.listPending().isEmpty());
        }

        @Test
        @DisplayName("no matching rule with confidence 0.95 auto-approves at medium risk")
        void noRuleHighConfidence() {
            Decision decision = engine(stub(0.95)).evaluate(task("ops.report.weekly", Map.of()));

            assertEquals(DecisionAction.AUTO_APPROVE, decision.action());
            assertEquals(RiskLevel.MEDIUM, decision.riskLevel());
            assertEquals(0.95, decision.confidence(), 1e-9);
            assertFalse(decision.requiresApproval());
            assertNull(decision.approvalId());
        }

        @Test
        @DisplayName("no matching rule and the prior confidence asks for approval")
        void noRuleLowConfidence() {
            Decision decision = engine().evaluate(task("ops.report.weekly", Map.of()));

            assertEquals(DecisionAction.REQUEST_APPROVAL, decision.action());
            assertEquals(0.5, decision.confidence(), 1e-9);
            assertNotNull(decision.approvalId());
        }

        @Test
        @DisplayName("confidence below the rule's risk threshold forces approval even when the rule allows autonomy")
        void lowConfidenceOverridesRule() {
            rules.add(DecisionRule.of("any-social", List.of("marketing.social.*"), new AlwaysCondition(),
                    RiskLevel.LOW, false, "Social posts"));

            Decision decision = engine(stub(0.6)).evaluate(task("marketing.social.post", Map.of()));

            assertEquals(DecisionAction.REQUEST_APPROVAL, decision.action());
            assertEquals(RiskLevel.LOW, decision.riskLevel());
            assertTrue(decision.reasoning().contains("below"));
        }

        @Test
        @DisplayName("the same inputs always give the same action")
        void deterministic() {
            rules.add(DecisionRule.of("any-social", List.of("marketing.social.*"), new AlwaysCondition(),
                    RiskLevel.LOW, false, "Social posts"));
            DecisionEngine engine = engine(stub(0.85));
            Task post = task("marketing.social.post", Map.of("text", "hi"));
            var context = DecisionContext.at(NOW);

            for (int i = 0; i < 20; i++) {
                Decision decision = engine.evaluate(post, context, rules.findAll(), Set.of());
                assertEquals(DecisionAction.AUTO_APPROVE, decision.action());
                assertEquals("any-social", decision.ruleId());
            }
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("a deny rule rejects the task")
        void denyRule() {
            rules.add(new DecisionRule("no-crypto", List.of("finance.*"), new AlwaysCondition(),
                    RiskLevel.CRITICAL, false, "No trading", true, true));

            Decision decision = engine(stub(1.0)).evaluate(task("finance.crypto.trade", Map.of()));

            assertEquals(DecisionAction.REJECT, decision.action());
            assertEquals("no-crypto", decision.ruleId());
            assertTrue(approvals.listPending().isEmpty());
        }

        @Test
        @DisplayName("a malformed task type is rejected as invalid")
        void invalidType() {
            Decision decision = engine(stub(1.0)).evaluate(task("Not A Type", Map.of()));

            assertEquals(DecisionAction.REJECT, decision.action());
            assertTrue(decision.reasoning().startsWith("Invalid task"));
        }

        @Test
        @DisplayName("a task no registered agent supports is rejected")
        void unsupportedType() {
            Decision decision = engine(stub(1.0)).evaluate(task("marketing.social.post", Map.of()),
                    Set.of("sales.*", "ops.report.weekly"));

            assertEquals(DecisionAction.REJECT, decision.action());
            assertTrue(decision.reasoning().contains("No registered agent"));
        }

        @Test
        @DisplayName("decisions are counted by action and risk")
        void metrics() {
            engine(stub(1.0)).evaluate(task("Not A Type", Map.of()));

            assertEquals(1.0, meterRegistry.counter("jarvis.decisions.total",
                    "action", "reject", "risk", "medium").count());
        }
    }

    @Nested
    @DisplayName("rule selection")
    class RuleSelection {

        @Test
        @DisplayName("most specific pattern first, declaration order on ties")
        void specificityOrder() {
            var wildcard = DecisionRule.of("wildcard", List.of("*"), null, RiskLevel.LOW, false, "");
            var broad = DecisionRule.of("broad", List.of("marketing.*"), null, RiskLevel.LOW, false, "");
            var broadToo = DecisionRule.of("broad-too", List.of("marketing.*"), null, RiskLevel.LOW, false, "");
            var narrow = DecisionRule.of("narrow", List.of("marketing.email.*"), null, RiskLevel.LOW, false, "");
            var exact = DecisionRule.of("exact", List.of("marketing.email.campaign"), null, RiskLevel.LOW, false, "");
            var other = DecisionRule.of("other", List.of("sales.*"), null, RiskLevel.LOW, false, "");

            List<DecisionRule> ordered = DecisionEngine.orderCandidates("marketing.email.campaign",
                    List.of(wildcard, broad, other, broadToo, narrow, exact));

            assertEquals(List.of("exact", "narrow", "broad", "broad-too", "wildcard"),
                    ordered.stream().map(DecisionRule::ruleId).toList());
        }

        @Test
        @DisplayName("inactive rules are ignored")
        void inactiveIgnored() {
            rules.add(bulkEmailRule().withActive(false));

            Decision decision = engine(stub(0.95)).evaluate(
                    task("marketing.email.campaign", Map.of("recipientCount", 5_000)));

            assertEquals(DecisionAction.AUTO_APPROVE, decision.action());
        }

        @Test
        @DisplayName("a rule whose condition cannot read the data is skipped")
        void brokenConditionSkipped() {
            rules.add(bulkEmailRule());

            Decision decision = engine(stub(0.95)).evaluate(
                    task("marketing.email.campaign", Map.of("recipientCount", "lots")));

            assertEquals(DecisionAction.AUTO_APPROVE, decision.action());
            assertNull(decision.ruleId());
        }

        @Test
        @DisplayName("rules can be added and updated at runtime")
        void ruleManagement() {
            DecisionEngine engine = engine(stub(0.95));
            engine.addRule(bulkEmailRule());
            assertThrows(IllegalArgumentException.class, () -> engine.addRule(bulkEmailRule()));

            engine.updateRule(bulkEmailRule().withActive(false));

            assertFalse(rules.find("bulk-email").orElseThrow().enabled());
        }
    }

    @Nested
    @DisplayName("learning from feedback")
    class Feedback {

        private ApprovalRecord decided(ApprovalDecision verdict, double confidence) {
            String id = approvals.create(ApprovalRecord.pending("task_1", "ops.report.weekly", "Execute",
                    "check", RiskLevel.MEDIUM, NOW, NOW.plusSeconds(60),
                    Map.of(ApprovalRecord.META_CONFIDENCE, confidence)));
            return approvals.decide(id, verdict, "reviewer", "noted", null);
        }

        @Test
        @DisplayName("a rejection despite high confidence raises that risk level's threshold")
        void rejectionRaisesThreshold() {
            DecisionEngine engine = engine();

            engine.learnFromFeedback(decided(ApprovalDecision.REJECTED, 0.9));

            assertEquals(0.82, engine.getConfidenceThreshold(RiskLevel.MEDIUM), 1e-9);
            assertEquals(0.7, engine.getConfidenceThreshold(RiskLevel.LOW), 1e-9);
        }

        @Test
        @DisplayName("approvals and low-confidence rejections leave thresholds alone")
        void noChange() {
            DecisionEngine engine = engine();

            engine.learnFromFeedback(decided(ApprovalDecision.APPROVED, 0.9));
            engine.learnFromFeedback(decided(ApprovalDecision.REJECTED, 0.5));

            assertEquals(0.8, engine.getConfidenceThreshold(RiskLevel.MEDIUM), 1e-9);
        }

        @Test
        @DisplayName("every verdict is remembered as a decision outcome for its task type")
        void remembersOutcome() {
            engine().learnFromFeedback(decided(ApprovalDecision.APPROVED, 0.6));

            var outcomes = memory.recent(MemoryType.DECISION_OUTCOME, "ops.report.weekly", 10);
            assertEquals(1, outcomes.size());
            assertEquals("approved", outcomes.get(0).content().get("outcome"));
        }

        @Test
        @DisplayName("remembered approvals lift the confidence of later tasks of the same type")
        void historyFeedsConfidence() {
            DecisionEngine engine = engine();
            for (int i = 0; i < 5; i++) {
                engine.learnFromFeedback(decided(ApprovalDecision.APPROVED, 0.6));
            }

            Decision decision = engine.evaluate(task("ops.report.weekly", Map.of()));

            assertEquals(0.75, decision.confidence(), 1e-9);
        }

        @Test
        @DisplayName("an undecided record cannot be learned from")
        void pendingRefused() {
            String id = approvals.create(ApprovalRecord.pending("task_1", "ops.report.weekly", "Execute",
                    "check", RiskLevel.MEDIUM, NOW, NOW.plusSeconds(60), Map.of()));

            assertThrows(IllegalArgumentException.class,
                    () -> engine().learnFromFeedback(approvals.get(id).orElseThrow()));
        }
    }

    @Test
    @DisplayName("thresholds are monotonic in risk")
    void monotonicThresholds() {
        DecisionEngine engine = engine();
        assertTrue(engine.getConfidenceThreshold(RiskLevel.CRITICAL) >= engine.getConfidenceThreshold(RiskLevel.HIGH));
        assertTrue(engine.getConfidenceThreshold(RiskLevel.HIGH) >= engine.getConfidenceThreshold(RiskLevel.MEDIUM));
        assertTrue(engine.getConfidenceThreshold(RiskLevel.MEDIUM) >= engine.getConfidenceThreshold(RiskLevel.LOW));
    }

    private static ConfidenceScorer stub(double confidence) {
        return (task, rule, context) -> confidence;
    }
}
