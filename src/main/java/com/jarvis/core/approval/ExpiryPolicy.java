package com.jarvis.core.approval;

/**
 * What the expiry sweep does with an undecided record past its expiry time.
 */
public enum ExpiryPolicy {
    /** Report it; the record stays pending and can still be decided. */
    LEAVE_PENDING,
    /** Decide it as rejected on behalf of the system. */
    AUTO_REJECT,
    /** Publish an escalation event; the record stays pending. */
    ESCALATE
}
