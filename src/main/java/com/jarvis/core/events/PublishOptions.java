package com.jarvis.core.events;

/**
 * Per-call publish options.
 *
 * @param traceId        trace to continue, or null to start a new one
 * @param skipValidation publish without a schema check
 */
public record PublishOptions(String traceId, boolean skipValidation) {

    private static final PublishOptions DEFAULTS = new PublishOptions(null, false);

    public static PublishOptions defaults() {
        return DEFAULTS;
    }

    public static PublishOptions withTrace(String traceId) {
        return new PublishOptions(traceId, false);
    }

    /** Continues the causal chain of the given envelope. */
    public static PublishOptions continuing(EventEnvelope cause) {
        return new PublishOptions(cause == null ? null : cause.traceId(), false);
    }

    public PublishOptions skippingValidation() {
        return new PublishOptions(traceId, true);
    }
}
