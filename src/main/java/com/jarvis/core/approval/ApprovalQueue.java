package com.jarvis.core.approval;

import com.jarvis.core.model.ApprovalDecision;
import com.jarvis.core.model.ApprovalRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable set of approval requests awaiting a human verdict.
 */
public interface ApprovalQueue {

    /**
     * Stores a new pending record. An id is generated when the record has none.
     *
     * @return the record id
     */
    String create(ApprovalRecord record);

    Optional<ApprovalRecord> get(String id);

    /**
     * Records the verdict atomically. Of two concurrent calls on the same id exactly
     * one succeeds.
     *
     * @throws ApprovalNotFoundException if the id is unknown
     * @throws ApprovalConflictException if the record was already decided
     */
    ApprovalRecord decide(String id, ApprovalDecision decision, String respondedBy,
                          String feedback, Map<String, Object> modifications);

    /** Undecided records whose expiry lies before {@code now}, earliest expiry first. */
    List<ApprovalRecord> getExpired(Instant now);

    /** Undecided records, oldest request first. */
    List<ApprovalRecord> listPending();

    /** Decided records, most recent response first. */
    List<ApprovalRecord> listDecided(int limit);

    /** Record counts by outcome, for status pages and health details. */
    ApprovalStats stats();

    static void validateDecision(ApprovalDecision decision, String respondedBy) {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        if (respondedBy == null || respondedBy.isBlank()) {
            throw new IllegalArgumentException("respondedBy must not be blank");
        }
    }
}
