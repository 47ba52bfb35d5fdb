package com.jarvis.core.approval;

/**
 * Base class for approval queue errors.
 */
public class ApprovalException extends RuntimeException {

    public ApprovalException(String message) {
        super(message);
    }

    public ApprovalException(String message, Throwable cause) {
        super(message, cause);
    }
}
