package com.overseer.core;

/**
 * Base class for errors raised by the orchestration core.
 */
public class OverseerException extends RuntimeException {
    public OverseerException(String message) {
        super(message);
    }

    public OverseerException(String message, Throwable cause) {
        super(message, cause);
    }
}
