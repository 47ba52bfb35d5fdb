package com.jarvis.core.approval;

import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local approval queue. Decisions are applied inside
 * {@link ConcurrentHashMap#compute}, which makes check-and-set atomic per id.
 */
public class InMemoryApprovalQueue implements ApprovalQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryApprovalQueue.class);

    private final ConcurrentHashMap<String, ApprovalRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryApprovalQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryApprovalQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(ApprovalRecord record) {
        String id = record.id() != null ? record.id() : "apr_" + UUID.randomUUID();
        ApprovalRecord stored = record.withId(id, clock.instant());
        if (records.putIfAbsent(id, stored) != null) {
            throw new IllegalArgumentException("Approval " + id + " already exists");
        }
        log.info("Approval {} requested for task {} ({}, risk {})",
                id, stored.taskId(), stored.taskType(), stored.riskLevel());
        return id;
    }

    @Override
    public Optional<ApprovalRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public ApprovalRecord decide(String id, ApprovalDecision decision, String respondedBy,
                                 String feedback, Map<String, Object> modifications) {
        ApprovalQueue.validateDecision(decision, respondedBy);
        Instant now = clock.instant();
        ApprovalRecord decided = records.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new ApprovalNotFoundException(id);
            }
            if (!existing.isPending()) {
                throw new ApprovalConflictException(id, existing.decision());
            }
            return existing.withDecision(decision, respondedBy, feedback, modifications, now);
        });
        log.info("Approval {} {} by {}", id, decision.wireName(), respondedBy);
        return decided;
    }

    @Override
    public List<ApprovalRecord> getExpired(Instant now) {
        return records.values().stream()
                .filter(r -> r.isExpired(now))
                .sorted(Comparator.comparing(ApprovalRecord::expiresAt))
                .toList();
    }

    @Override
    public List<ApprovalRecord> listPending() {
        return records.values().stream()
                .filter(ApprovalRecord::isPending)
                .sorted(Comparator.comparing(ApprovalRecord::requestedAt))
                .toList();
    }

    @Override
    public List<ApprovalRecord> listDecided(int limit) {
        return records.values().stream()
                .filter(r -> !r.isPending())
                .sorted(Comparator.comparing(ApprovalRecord::respondedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public ApprovalStats stats() {
        Map<ApprovalDecision, Long> counts = new HashMap<>();
        for (ApprovalRecord record : records.values()) {
            counts.merge(record.decision(), 1L, Long::sum);
        }
        return ApprovalStats.fromCounts(counts);
    }
}
