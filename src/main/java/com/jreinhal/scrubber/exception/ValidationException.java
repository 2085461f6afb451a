package com.jreinhal.scrubber.exception;

/**
 * Malformed scrub or de-scrub input. Raised before detection; never audited.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
