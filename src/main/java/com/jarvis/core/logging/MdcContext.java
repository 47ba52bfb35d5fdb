package com.jarvis.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Jarvis-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String taskType) {
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setTrace(String traceId) {
        MDC.put("traceId", traceId);
    }

    /** Sets the trace id and returns the previous one for {@link #restoreTrace}. */
    public static String swapTrace(String traceId) {
        String previous = MDC.get("traceId");
        MDC.put("traceId", traceId);
        return previous;
    }

    public static void restoreTrace(String previous) {
        if (previous == null) {
            MDC.remove("traceId");
        } else {
            MDC.put("traceId", previous);
        }
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("taskType");
        MDC.remove("agentId");
        MDC.remove("traceId");
    }
}
