package com.jarvis.core.events;

import java.util.List;

/**
 * Outcome of {@link EventBus#publish}. Publishing never throws.
 *
 * @param status   what happened
 * @param topic    the target topic
 * @param envelope the envelope built, null when rejected before construction
 * @param errors   validation or transport errors
 */
public record PublishResult(Status status, String topic, EventEnvelope envelope, List<String> errors) {

    public enum Status {
        PUBLISHED,
        /** Payload failed validation; nothing was sent. */
        REJECTED,
        /** The transport call failed; not retried. */
        FAILED
    }

    public static PublishResult published(EventEnvelope envelope) {
        return new PublishResult(Status.PUBLISHED, envelope.topic(), envelope, List.of());
    }

    public static PublishResult rejected(String topic, List<String> errors) {
        return new PublishResult(Status.REJECTED, topic, null, List.copyOf(errors));
    }

    public static PublishResult failed(EventEnvelope envelope, String error) {
        return new PublishResult(Status.FAILED, envelope.topic(), envelope,
                List.of(error == null ? "transport error" : error));
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }
}
