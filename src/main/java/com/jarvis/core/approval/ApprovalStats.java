package com.jarvis.core.approval;

import com.jarvis.core.model.ApprovalDecision;

import java.util.Map;

/**
 * Counts of approval records by outcome.
 */
public record ApprovalStats(long pending, long approved, long rejected, long modified) {

    public static final ApprovalStats EMPTY = new ApprovalStats(0, 0, 0, 0);

    /** Builds the counts from a per-decision tally; the {@code null} key counts undecided records. */
    static ApprovalStats fromCounts(Map<ApprovalDecision, Long> counts) {
        return new ApprovalStats(
                counts.getOrDefault(null, 0L),
                counts.getOrDefault(ApprovalDecision.APPROVED, 0L),
                counts.getOrDefault(ApprovalDecision.REJECTED, 0L),
                counts.getOrDefault(ApprovalDecision.MODIFIED, 0L));
    }

    public long total() {
        return pending + approved + rejected + modified;
    }

    public long decided() {
        return approved + rejected + modified;
    }
}
