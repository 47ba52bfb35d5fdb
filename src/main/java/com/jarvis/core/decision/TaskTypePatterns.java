package com.jarvis.core.decision;

/**
 * Matching of task types against patterns: an exact type, a prefix pattern such as
 * {@code marketing.*} or {@code marketing.email.*}, or the wildcard {@code *}.
 */
public final class TaskTypePatterns {

    static final int NO_MATCH = -1;
    private static final int EXACT = 1_000;

    private TaskTypePatterns() {}

    public static boolean matches(String pattern, String taskType) {
        return specificity(pattern, taskType) != NO_MATCH;
    }

    /**
     * Higher means more specific: exact beats any prefix pattern, a longer prefix
     * beats a shorter one, and {@code *} ranks last. {@link #NO_MATCH} when the
     * pattern does not match.
     */
    public static int specificity(String pattern, String taskType) {
        if (pattern == null || taskType == null) {
            return NO_MATCH;
        }
        if (pattern.equals("*")) {
            return 0;
        }
        if (pattern.endsWith(".*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return taskType.startsWith(prefix) ? prefix.split("\\.").length : NO_MATCH;
        }
        return pattern.equals(taskType) ? EXACT : NO_MATCH;
    }
}
