package com.jarvis.core.events;

/**
 * Raised when bytes received from a transport cannot be decoded into an envelope.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
