package com.jarvis.core.approval;

import com.jarvis.core.events.CoreTopics;
import com.jarvis.core.events.EventBus;
import com.jarvis.core.metrics.JarvisMetrics;
import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the configured {@link ExpiryPolicy} to undecided approvals past their
 * expiry. Caller driven: nothing here runs on a schedule of its own.
 */
public class ApprovalExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalExpirySweeper.class);

    static final String SYSTEM_RESPONDER = "system";

    /**
     * @param expired      every expired record found by the sweep
     * @param autoRejected records this sweep decided as rejected
     */
    public record SweepReport(List<ApprovalRecord> expired, List<ApprovalRecord> autoRejected) {
    }

    private final ApprovalQueue queue;
    private final EventBus eventBus;
    private final ExpiryPolicy policy;
    private final JarvisMetrics metrics;

    public ApprovalExpirySweeper(ApprovalQueue queue, EventBus eventBus, ExpiryPolicy policy, JarvisMetrics metrics) {
        this.queue = queue;
        this.eventBus = eventBus;
        this.policy = policy;
        this.metrics = metrics;
    }

    public ExpiryPolicy policy() {
        return policy;
    }

    public SweepReport sweep(Instant now) {
        List<ApprovalRecord> expired = queue.getExpired(now);
        List<ApprovalRecord> autoRejected = new ArrayList<>();
        for (ApprovalRecord record : expired) {
            publishExpired(record);
            switch (policy) {
                case AUTO_REJECT -> {
                    try {
                        autoRejected.add(queue.decide(record.id(), ApprovalDecision.REJECTED, SYSTEM_RESPONDER,
                                "expired at " + record.expiresAt(), null));
                    } catch (ApprovalConflictException e) {
                        log.info("Approval {} was decided while sweeping; leaving it", record.id());
                    }
                }
                case ESCALATE -> eventBus.publish(CoreTopics.APPROVAL_ESCALATED, Map.of(
                        "approval_id", record.id(),
                        "task_id", record.taskId(),
                        "risk_level", record.riskLevel().wireName()));
                case LEAVE_PENDING -> { }
            }
            if (metrics != null) {
                metrics.recordApprovalExpired(policy.name());
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expiry sweep found {} expired approval(s), policy {}", expired.size(), policy);
        }
        return new SweepReport(expired, autoRejected);
    }

    private void publishExpired(ApprovalRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approval_id", record.id());
        payload.put("task_id", record.taskId());
        payload.put("policy", policy.name());
        payload.put("expires_at", String.valueOf(record.expiresAt()));
        eventBus.publish(CoreTopics.APPROVAL_EXPIRED, payload);
    }
}
