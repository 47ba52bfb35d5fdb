package com.jarvis.core.transport;

/**
 * Failure talking to the underlying message transport.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
